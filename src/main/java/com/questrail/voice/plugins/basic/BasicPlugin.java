package com.questrail.voice.plugins.basic;

import com.questrail.voice.api.CommandPlugin;
import com.questrail.voice.api.ParsedCommand;
import com.questrail.voice.grammar.RuleConverter;
import com.questrail.voice.plugins.Chord;
import com.questrail.voice.plugins.InputAutomation;
import com.questrail.voice.registry.CommandRegistry;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * BasicPlugin
 * =============================================================================
 * Keyboard and notification commands available on every installation.
 *
 * <h2>Rules</h2>
 * <pre>
 *   any_text := /\w.+/
 *   key      := one spoken key name (alpha, zero, enter, control, ...)
 *   chord    := key ("+" key)*          e.g. "control + shift + tango"
 * </pre>
 *
 * <h2>Commands</h2>
 * <pre>
 *   "alert" any_text    show a message
 *   "type" any_text     type text literally
 *   "say" chord         press a chord
 *   "switch" chord      press a chord with the super modifier held
 *   "monitor"           press m
 *   "mouse"             press o
 *   "div0"              always fails
 * </pre>
 */
public final class BasicPlugin implements CommandPlugin
{
    public static final String ID = "basic";

    /** Every key but the last is held as a modifier. */
    static final RuleConverter CHORD = values -> {
        List<String> keys = new ArrayList<>(values.size());
        for (Object spoken : values) {
            keys.add(KeyPronunciations.keyFor((String) spoken));
        }
        return new Chord(keys.get(keys.size() - 1), keys.subList(0, keys.size() - 1));
    };

    private final InputAutomation automation;

    public BasicPlugin(InputAutomation automation)
    {
        this.automation = Objects.requireNonNull(automation, "automation");
    }

    @Override
    public String id()
    {
        return ID;
    }

    @Override
    public CommandRegistry registry()
    {
        return CommandRegistry.builder(ID)
                .define("any_text", "/\\w.+/")
                .define("key", KeyPronunciations.expression())
                .define("chord", "key (\"+\" key)*", CHORD)
                .register("\"alert\" any_text", cmd -> automation.alert(cmd.argument(0, String.class)))
                .register("\"type\" any_text", cmd -> automation.type(cmd.argument(0, String.class)))
                .register("\"say\" chord", cmd -> automation.press(chord(cmd)))
                .register("\"switch\" chord", cmd -> automation.press(chord(cmd).withModifier("super")))
                .register("\"monitor\"", cmd -> automation.press(Chord.of("m")))
                .register("\"mouse\"", cmd -> automation.press(Chord.of("o")))
                .register("\"div0\"", cmd -> {
                    throw new ArithmeticException("/ by zero");
                })
                .build();
    }

    private static Chord chord(ParsedCommand command)
    {
        return command.argument(0, Chord.class);
    }
}
