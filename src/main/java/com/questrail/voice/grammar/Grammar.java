package com.questrail.voice.grammar;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;

/**
 * Grammar
 * =============================================================================
 * Compiled, immutable combination of named rules and command patterns.
 *
 * <h2>Matching model</h2>
 * <ul>
 *   <li>Whitespace between elements is ignored.</li>
 *   <li>Literals must end on a word boundary, so {@code "say"} does not match
 *       the start of {@code "saying"}.</li>
 *   <li>Regex terminals match greedily from the current position and must
 *       consume at least one character. A terminal never gives back part of
 *       its match, so {@code "alert" any_text "now"} cannot match when
 *       {@code any_text} also accepts {@code now}.</li>
 *   <li>Alternatives and repetitions backtrack; the whole line must be
 *       consumed.</li>
 *   <li>A match attempt holds at most {@link #MAX_DEPTH} elements open at
 *       once, counting every repetition and sequence step. Inputs that need
 *       more are unrecognized.</li>
 *   <li>Command patterns are tried in registration order; the first one that
 *       matches wins.</li>
 * </ul>
 *
 * <h2>Thread Safety</h2>
 * <p>A compiled grammar holds no mutable state. {@link #match(String)} may be
 * called concurrently from any number of threads.</p>
 */
public final class Grammar
{
    /** Open elements allowed in one match attempt; each costs a few stack frames. */
    static final int MAX_DEPTH = 384;

    private final Map<String, CompiledRule> rules;
    private final List<CompiledCommand> commands;

    private Grammar(Map<String, CompiledRule> rules, List<CompiledCommand> commands)
    {
        this.rules = rules;
        this.commands = commands;
    }

    /**
     * Parses and links every rule and command pattern.
     *
     * @param ruleDefinitions named rules, unique by name
     * @param commandPatterns command patterns in priority order
     * @throws GrammarException if an expression is malformed, references an
     *         undefined rule, or a rule is left-recursive
     */
    public static Grammar compile(Iterable<RuleDefinition> ruleDefinitions, List<String> commandPatterns)
    {
        Map<String, CompiledRule> rules = new LinkedHashMap<>();
        for (RuleDefinition def : ruleDefinitions) {
            PatternElement element = PatternParser.parse(def.expression());
            if (rules.put(def.name(), new CompiledRule(def.name(), element, def.converter())) != null) {
                throw new GrammarException("rule '" + def.name() + "' defined twice");
            }
        }

        List<CompiledCommand> commands = new ArrayList<>();
        for (String pattern : commandPatterns) {
            commands.add(new CompiledCommand(pattern, PatternParser.parse(pattern)));
        }

        for (CompiledRule rule : rules.values()) {
            checkReferences(rule.element, rules, "rule '" + rule.name + "'");
        }
        for (CompiledCommand command : commands) {
            checkReferences(command.element, rules, "pattern " + command.pattern);
        }
        checkLeftRecursion(rules);

        return new Grammar(Collections.unmodifiableMap(rules), List.copyOf(commands));
    }

    /**
     * Match a complete line.
     *
     * @return the first command pattern that consumes the whole line, if any
     */
    public Optional<GrammarMatch> match(String text)
    {
        for (CompiledCommand command : commands) {
            Attempt attempt = new Attempt(text);
            List<Object> values;
            try {
                values = attempt.run(command.element);
            }
            catch (TooDeepException | StackOverflowError e) {
                values = null;
            }
            if (values != null) {
                return Optional.of(new GrammarMatch(command.pattern, values));
            }
        }
        return Optional.empty();
    }

    /** Command patterns in priority order. */
    public List<String> commandPatterns()
    {
        List<String> patterns = new ArrayList<>(commands.size());
        for (CompiledCommand command : commands) {
            patterns.add(command.pattern);
        }
        return patterns;
    }

    public Set<String> ruleNames()
    {
        return rules.keySet();
    }

    // -------------------------------------------------------------------------
    // Matching
    // -------------------------------------------------------------------------

    @FunctionalInterface
    private interface Continuation
    {
        boolean apply(int pos, Values values);
    }

    /** Persistent, prepend-only value list; cheap to share across backtracking branches. */
    private static final class Values
    {
        static final Values EMPTY = new Values(null, null);

        private final Object head;
        private final Values tail;

        private Values(Object head, Values tail)
        {
            this.head = head;
            this.tail = tail;
        }

        Values prepend(Object value)
        {
            return new Values(value, this);
        }

        List<Object> toList()
        {
            List<Object> out = new ArrayList<>();
            for (Values v = this; v != EMPTY; v = v.tail) {
                out.add(v.head);
            }
            Collections.reverse(out);
            return out;
        }
    }

    private static final class TooDeepException extends RuntimeException
    {
        TooDeepException()
        {
            super(null, null, false, false);
        }
    }

    private final class Attempt
    {
        private final String text;
        private List<Object> result;
        private int open;

        Attempt(String text)
        {
            this.text = text;
        }

        List<Object> run(PatternElement root)
        {
            boolean matched = match(root, 0, Values.EMPTY, (pos, values) -> {
                if (skipWhitespace(pos) == text.length()) {
                    result = values.toList();
                    return true;
                }
                return false;
            });
            return matched ? result : null;
        }

        private boolean match(PatternElement element, int pos, Values values, Continuation k)
        {
            if (++open > MAX_DEPTH) {
                throw new TooDeepException();
            }
            try {
                return matchElement(element, pos, values, k);
            }
            finally {
                open--;
            }
        }

        private boolean matchElement(PatternElement element, int pos, Values values, Continuation k)
        {
            if (element instanceof PatternElement.Literal literal) {
                return matchLiteral(literal.text(), pos, values, k);
            }
            if (element instanceof PatternElement.Terminal terminal) {
                int start = skipWhitespace(pos);
                Matcher m = terminal.regex().matcher(text).region(start, text.length());
                if (m.lookingAt() && m.end() > start) {
                    return k.apply(m.end(), values.prepend(m.group()));
                }
                return false;
            }
            if (element instanceof PatternElement.RuleRef ref) {
                CompiledRule rule = rules.get(ref.name());
                return match(rule.element, pos, Values.EMPTY,
                        (end, inner) -> k.apply(end, values.prepend(rule.value(inner.toList()))));
            }
            if (element instanceof PatternElement.Sequence sequence) {
                return matchSequence(sequence.items(), 0, pos, values, k);
            }
            if (element instanceof PatternElement.Choice choice) {
                for (PatternElement alternative : choice.alternatives()) {
                    if (match(alternative, pos, values, k)) {
                        return true;
                    }
                }
                return false;
            }
            if (element instanceof PatternElement.Repeat repeat) {
                return matchRepeat(repeat, 0, pos, values, k);
            }
            throw new IllegalStateException("unknown element " + element);
        }

        private boolean matchLiteral(String literal, int pos, Values values, Continuation k)
        {
            int start = skipWhitespace(pos);
            if (!text.startsWith(literal, start)) {
                return false;
            }
            int end = start + literal.length();
            boolean wordEnd = Character.isLetterOrDigit(literal.charAt(literal.length() - 1));
            if (wordEnd && end < text.length() && Character.isLetterOrDigit(text.charAt(end))) {
                return false;
            }
            return k.apply(end, values);
        }

        private boolean matchSequence(List<PatternElement> items, int index, int pos, Values values,
                                      Continuation k)
        {
            if (index == items.size()) {
                return k.apply(pos, values);
            }
            return match(items.get(index), pos, values,
                    (next, v) -> matchSequence(items, index + 1, next, v, k));
        }

        private boolean matchRepeat(PatternElement.Repeat repeat, int count, int pos, Values values,
                                    Continuation k)
        {
            boolean mayContinue = repeat.max() == PatternElement.Repeat.UNBOUNDED || count < repeat.max();
            if (mayContinue && match(repeat.element(), pos, values,
                    // An iteration that consumes nothing cannot make progress.
                    (next, v) -> next > pos && matchRepeat(repeat, count + 1, next, v, k))) {
                return true;
            }
            return count >= repeat.min() && k.apply(pos, values);
        }

        private int skipWhitespace(int pos)
        {
            while (pos < text.length() && Character.isWhitespace(text.charAt(pos))) {
                pos++;
            }
            return pos;
        }
    }

    // -------------------------------------------------------------------------
    // Linking
    // -------------------------------------------------------------------------

    private static void checkReferences(PatternElement element, Map<String, CompiledRule> rules, String where)
    {
        if (element instanceof PatternElement.RuleRef ref) {
            if (!rules.containsKey(ref.name())) {
                throw new GrammarException(where + " references undefined rule '" + ref.name() + "'");
            }
        }
        else if (element instanceof PatternElement.Sequence sequence) {
            sequence.items().forEach(e -> checkReferences(e, rules, where));
        }
        else if (element instanceof PatternElement.Choice choice) {
            choice.alternatives().forEach(e -> checkReferences(e, rules, where));
        }
        else if (element instanceof PatternElement.Repeat repeat) {
            checkReferences(repeat.element(), rules, where);
        }
    }

    private static void checkLeftRecursion(Map<String, CompiledRule> rules)
    {
        Set<String> nullable = nullableRules(rules);

        Map<String, Set<String>> leftEdges = new HashMap<>();
        for (CompiledRule rule : rules.values()) {
            Set<String> edges = new HashSet<>();
            collectLeftRefs(rule.element, nullable, edges);
            leftEdges.put(rule.name, edges);
        }

        for (String start : rules.keySet()) {
            Deque<String> pending = new ArrayDeque<>(leftEdges.get(start));
            Set<String> seen = new HashSet<>();
            while (!pending.isEmpty()) {
                String next = pending.pop();
                if (next.equals(start)) {
                    throw new GrammarException("rule '" + start + "' is left-recursive");
                }
                if (seen.add(next)) {
                    pending.addAll(leftEdges.get(next));
                }
            }
        }
    }

    private static Set<String> nullableRules(Map<String, CompiledRule> rules)
    {
        Set<String> nullable = new HashSet<>();
        boolean changed = true;
        while (changed) {
            changed = false;
            for (CompiledRule rule : rules.values()) {
                if (!nullable.contains(rule.name) && isNullable(rule.element, nullable)) {
                    nullable.add(rule.name);
                    changed = true;
                }
            }
        }
        return nullable;
    }

    private static boolean isNullable(PatternElement element, Set<String> nullableRules)
    {
        if (element instanceof PatternElement.RuleRef ref) {
            return nullableRules.contains(ref.name());
        }
        if (element instanceof PatternElement.Sequence sequence) {
            return sequence.items().stream().allMatch(e -> isNullable(e, nullableRules));
        }
        if (element instanceof PatternElement.Choice choice) {
            return choice.alternatives().stream().anyMatch(e -> isNullable(e, nullableRules));
        }
        if (element instanceof PatternElement.Repeat repeat) {
            return repeat.min() == 0 || isNullable(repeat.element(), nullableRules);
        }
        // Literals are non-empty; terminals must consume at least one character.
        return false;
    }

    private static void collectLeftRefs(PatternElement element, Set<String> nullable, Set<String> out)
    {
        if (element instanceof PatternElement.RuleRef ref) {
            out.add(ref.name());
        }
        else if (element instanceof PatternElement.Sequence sequence) {
            for (PatternElement item : sequence.items()) {
                collectLeftRefs(item, nullable, out);
                if (!isNullable(item, nullable)) {
                    break;
                }
            }
        }
        else if (element instanceof PatternElement.Choice choice) {
            choice.alternatives().forEach(e -> collectLeftRefs(e, nullable, out));
        }
        else if (element instanceof PatternElement.Repeat repeat) {
            collectLeftRefs(repeat.element(), nullable, out);
        }
    }

    private static final class CompiledRule
    {
        private final String name;
        private final PatternElement element;
        private final RuleConverter converter;

        CompiledRule(String name, PatternElement element, RuleConverter converter)
        {
            this.name = name;
            this.element = element;
            this.converter = converter;
        }

        Object value(List<Object> collected)
        {
            if (converter != null) {
                return converter.convert(Collections.unmodifiableList(collected));
            }
            return collected.size() == 1 ? collected.get(0) : Collections.unmodifiableList(collected);
        }
    }

    private static final class CompiledCommand
    {
        private final String pattern;
        private final PatternElement element;

        CompiledCommand(String pattern, PatternElement element)
        {
            this.pattern = pattern;
            this.element = element;
        }
    }
}
