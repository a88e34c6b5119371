package com.questrail.voice.registry;

import com.questrail.voice.api.CommandHandler;
import com.questrail.voice.api.ParsedCommand;
import com.questrail.voice.grammar.Grammar;
import com.questrail.voice.grammar.GrammarException;
import com.questrail.voice.grammar.GrammarMatch;
import com.questrail.voice.grammar.RuleConverter;
import com.questrail.voice.grammar.RuleDefinition;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * CommandRegistry
 * =============================================================================
 * Immutable mapping from command pattern to handler, together with the
 * compiled grammar that recognizes those patterns.
 *
 * <h2>Assembly</h2>
 * <pre>
 *   CommandRegistry.builder("basic")
 *       .define("key", "/[a-z]+/")
 *       .register("\"say\" key", handler)
 *       .build();
 *
 *   CommandRegistry.combine(basic, editor, ...)
 * </pre>
 *
 * <h2>Collision policy</h2>
 * <ul>
 *   <li>The same command pattern from two sources is rejected.</li>
 *   <li>A rule name defined by two sources is accepted only when both
 *       definitions have the same expression and the same converter
 *       instance; otherwise it is rejected.</li>
 * </ul>
 * <p>Both rejections raise {@link DuplicateDefinitionException} at assembly
 * time, before the server accepts a connection.</p>
 *
 * <h2>Thread Safety</h2>
 * <p>Instances are deeply immutable once built and are shared by all
 * connections and tasks without locking.</p>
 */
public final class CommandRegistry
{
    private final Set<String> sources;
    private final Map<String, RuleDefinition> rules;
    private final Map<String, CommandRegistration> commands;
    private final Grammar grammar;

    private CommandRegistry(Set<String> sources,
                            Map<String, RuleDefinition> rules,
                            Map<String, CommandRegistration> commands)
    {
        this.sources = Collections.unmodifiableSet(new LinkedHashSet<>(sources));
        this.rules = Collections.unmodifiableMap(new LinkedHashMap<>(rules));
        this.commands = Collections.unmodifiableMap(new LinkedHashMap<>(commands));
        this.grammar = Grammar.compile(this.rules.values(), new ArrayList<>(this.commands.keySet()));
    }

    public static Builder builder(String source)
    {
        return new Builder(source);
    }

    /**
     * Merge independently built registries into one grammar and one lookup
     * table. Command priority follows argument order, then each registry's
     * own registration order.
     *
     * @throws DuplicateDefinitionException on a pattern or rule collision
     */
    public static CommandRegistry combine(CommandRegistry... registries)
    {
        return combine(Arrays.asList(registries));
    }

    public static CommandRegistry combine(Collection<CommandRegistry> registries)
    {
        Set<String> sources = new LinkedHashSet<>();
        Map<String, RuleDefinition> rules = new LinkedHashMap<>();
        Map<String, CommandRegistration> commands = new LinkedHashMap<>();

        for (CommandRegistry registry : registries) {
            sources.addAll(registry.sources);
            for (RuleDefinition rule : registry.rules.values()) {
                putRule(rules, rule);
            }
            for (CommandRegistration command : registry.commands.values()) {
                putCommand(commands, command);
            }
        }
        return new CommandRegistry(sources, rules, commands);
    }

    /**
     * Parse one line against the combined grammar.
     *
     * @throws UnrecognizedCommandException if no pattern matches the whole line
     */
    public ParsedCommand parse(String text) throws UnrecognizedCommandException
    {
        Objects.requireNonNull(text, "text");
        final Optional<GrammarMatch> match;
        try {
            match = grammar.match(text);
        }
        catch (RuntimeException e) {
            // A rule converter rejected the matched values.
            throw new UnrecognizedCommandException(text, "rule conversion failed: " + e.getMessage(), e);
        }
        catch (StackOverflowError e) {
            throw new UnrecognizedCommandException(text, "input nests too deeply", e);
        }
        if (match.isEmpty()) {
            throw new UnrecognizedCommandException(text, "no pattern matches");
        }
        return new ParsedCommand(match.get().pattern(), match.get().values());
    }

    /**
     * Handler registered for {@code pattern}. Always present for a pattern
     * returned by {@link #parse(String)}.
     */
    public Optional<CommandHandler> handlerFor(String pattern)
    {
        CommandRegistration registration = commands.get(pattern);
        return registration == null ? Optional.empty() : Optional.of(registration.handler());
    }

    /** Command patterns in priority order. */
    public List<String> patterns()
    {
        return grammar.commandPatterns();
    }

    public Collection<CommandRegistration> registrations()
    {
        return commands.values();
    }

    public Set<String> ruleNames()
    {
        return rules.keySet();
    }

    /** Names of the plugins or builders that contributed to this registry. */
    public Set<String> sources()
    {
        return sources;
    }

    private static void putRule(Map<String, RuleDefinition> rules, RuleDefinition rule)
    {
        RuleDefinition existing = rules.get(rule.name());
        if (existing == null) {
            rules.put(rule.name(), rule);
        }
        else if (!existing.isCompatibleWith(rule)) {
            throw new DuplicateDefinitionException("rule '" + rule.name() + "' defined differently by "
                    + existing.source() + " and " + rule.source());
        }
    }

    private static void putCommand(Map<String, CommandRegistration> commands, CommandRegistration command)
    {
        CommandRegistration existing = commands.putIfAbsent(command.pattern(), command);
        if (existing != null) {
            throw new DuplicateDefinitionException("pattern " + command.pattern() + " registered by both "
                    + existing.source() + " and " + command.source());
        }
    }

    public static final class Builder
    {
        private final String source;
        private final Map<String, RuleDefinition> rules = new LinkedHashMap<>();
        private final Map<String, CommandRegistration> commands = new LinkedHashMap<>();

        private Builder(String source)
        {
            this.source = Objects.requireNonNull(source, "source");
        }

        /** Define a named rule whose value is its single collected value (or the list of them). */
        public Builder define(String name, String expression)
        {
            return define(name, expression, null);
        }

        public Builder define(String name, String expression, RuleConverter converter)
        {
            putRule(rules, new RuleDefinition(name, expression, converter, source));
            return this;
        }

        /** Define several plain rules at once, in iteration order. */
        public Builder defineAll(Map<String, String> expressions)
        {
            expressions.forEach(this::define);
            return this;
        }

        public Builder register(String pattern, CommandHandler handler)
        {
            putCommand(commands, new CommandRegistration(pattern, handler, source));
            return this;
        }

        /**
         * @throws GrammarException if a pattern or rule is malformed or
         *         references an undefined rule
         */
        public CommandRegistry build()
        {
            return new CommandRegistry(Set.of(source), rules, commands);
        }
    }
}
