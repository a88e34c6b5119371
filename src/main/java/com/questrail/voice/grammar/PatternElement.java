package com.questrail.voice.grammar;

import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * PatternElement
 * -----------------------------------------------------------------------------
 * Node of a parsed command pattern or rule expression.
 *
 * <p>Elements are immutable and carry no matching state; a compiled
 * {@link Grammar} may be shared by any number of threads.</p>
 */
public sealed interface PatternElement
        permits PatternElement.Literal,
                PatternElement.RuleRef,
                PatternElement.Terminal,
                PatternElement.Sequence,
                PatternElement.Choice,
                PatternElement.Repeat
{
    /** Quoted keyword. Matches verbatim and contributes no value. */
    record Literal(String text) implements PatternElement {
        public Literal {
            Objects.requireNonNull(text, "text");
            if (text.isEmpty()) {
                throw new GrammarException("empty literal");
            }
        }
    }

    /** Reference to a named rule. Contributes the rule's value. */
    record RuleRef(String name) implements PatternElement {
        public RuleRef {
            Objects.requireNonNull(name, "name");
        }
    }

    /** Regular expression terminal. Contributes the matched text. */
    record Terminal(Pattern regex) implements PatternElement {
        public Terminal {
            Objects.requireNonNull(regex, "regex");
        }

        // Pattern has identity equality; compare by source instead.
        @Override
        public boolean equals(Object o) {
            return o instanceof Terminal t
                    && t.regex.pattern().equals(regex.pattern())
                    && t.regex.flags() == regex.flags();
        }

        @Override
        public int hashCode() {
            return regex.pattern().hashCode();
        }
    }

    record Sequence(List<PatternElement> items) implements PatternElement {
        public Sequence {
            items = List.copyOf(items);
        }
    }

    /** Ordered alternation; earlier alternatives are tried first. */
    record Choice(List<PatternElement> alternatives) implements PatternElement {
        public Choice {
            alternatives = List.copyOf(alternatives);
        }
    }

    /**
     * Greedy repetition.
     *
     * @param max upper bound, or {@link #UNBOUNDED}
     */
    record Repeat(PatternElement element, int min, int max) implements PatternElement {
        public static final int UNBOUNDED = -1;

        public Repeat {
            Objects.requireNonNull(element, "element");
            if (min < 0 || (max != UNBOUNDED && max < min)) {
                throw new GrammarException("invalid repetition bounds " + min + ".." + max);
            }
        }
    }
}
