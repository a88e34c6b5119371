package com.questrail.voice.grammar;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * PatternParser
 * -----------------------------------------------------------------------------
 * Recursive-descent parser for the pattern notation used by command sources.
 *
 * <pre>
 *   expression := sequence ( "|" sequence )*
 *   sequence   := term+
 *   term       := atom ( "*" | "+" | "?" )?
 *   atom       := "\"" literal "\""
 *               | "/" regex "/" [ "i" ]
 *               | rule-name
 *               | "(" expression ")"
 * </pre>
 *
 * <p>Examples: {@code "say" chord}, {@code key ("+" key)*},
 * {@code /\w.+/}.</p>
 */
final class PatternParser
{
    private final String src;
    private int pos;

    private PatternParser(String src)
    {
        this.src = src;
    }

    static PatternElement parse(String expression)
    {
        PatternParser parser = new PatternParser(expression);
        PatternElement element = parser.expression();
        parser.skipWhitespace();
        if (parser.pos < expression.length()) {
            throw parser.error("unexpected '" + expression.charAt(parser.pos) + "'");
        }
        return element;
    }

    private PatternElement expression()
    {
        List<PatternElement> alternatives = new ArrayList<>();
        alternatives.add(sequence());
        while (consume('|')) {
            alternatives.add(sequence());
        }
        return alternatives.size() == 1 ? alternatives.get(0) : new PatternElement.Choice(alternatives);
    }

    private PatternElement sequence()
    {
        List<PatternElement> items = new ArrayList<>();
        while (true) {
            skipWhitespace();
            if (pos >= src.length() || src.charAt(pos) == '|' || src.charAt(pos) == ')') {
                break;
            }
            items.add(term());
        }
        if (items.isEmpty()) {
            throw error("empty alternative");
        }
        return items.size() == 1 ? items.get(0) : new PatternElement.Sequence(items);
    }

    private PatternElement term()
    {
        PatternElement atom = atom();
        if (pos < src.length()) {
            switch (src.charAt(pos)) {
                case '*':
                    pos++;
                    return new PatternElement.Repeat(atom, 0, PatternElement.Repeat.UNBOUNDED);
                case '+':
                    pos++;
                    return new PatternElement.Repeat(atom, 1, PatternElement.Repeat.UNBOUNDED);
                case '?':
                    pos++;
                    return new PatternElement.Repeat(atom, 0, 1);
                default:
                    break;
            }
        }
        return atom;
    }

    private PatternElement atom()
    {
        skipWhitespace();
        char c = src.charAt(pos);
        if (c == '"') {
            return new PatternElement.Literal(quoted());
        }
        if (c == '/') {
            return regex();
        }
        if (c == '(') {
            pos++;
            PatternElement inner = expression();
            if (!consume(')')) {
                throw error("missing ')'");
            }
            return inner;
        }
        if (Character.isLetter(c) || c == '_') {
            int start = pos;
            while (pos < src.length() && (Character.isLetterOrDigit(src.charAt(pos)) || src.charAt(pos) == '_')) {
                pos++;
            }
            return new PatternElement.RuleRef(src.substring(start, pos));
        }
        throw error("unexpected '" + c + "'");
    }

    private String quoted()
    {
        StringBuilder sb = new StringBuilder();
        pos++; // opening quote
        while (pos < src.length()) {
            char c = src.charAt(pos++);
            if (c == '"') {
                return sb.toString();
            }
            if (c == '\\' && pos < src.length()) {
                c = src.charAt(pos++);
            }
            sb.append(c);
        }
        throw error("unterminated literal");
    }

    private PatternElement regex()
    {
        StringBuilder sb = new StringBuilder();
        pos++; // opening slash
        while (pos < src.length()) {
            char c = src.charAt(pos++);
            if (c == '/') {
                int flags = 0;
                if (pos < src.length() && src.charAt(pos) == 'i') {
                    flags |= Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE;
                    pos++;
                }
                try {
                    return new PatternElement.Terminal(Pattern.compile(sb.toString(), flags));
                }
                catch (PatternSyntaxException e) {
                    throw new GrammarException("invalid regex in '" + src + "'", e);
                }
            }
            if (c == '\\' && pos < src.length() && src.charAt(pos) == '/') {
                c = src.charAt(pos++);
            }
            else if (c == '\\' && pos < src.length()) {
                sb.append(c);
                c = src.charAt(pos++);
            }
            sb.append(c);
        }
        throw error("unterminated regex");
    }

    private boolean consume(char expected)
    {
        skipWhitespace();
        if (pos < src.length() && src.charAt(pos) == expected) {
            pos++;
            return true;
        }
        return false;
    }

    private void skipWhitespace()
    {
        while (pos < src.length() && Character.isWhitespace(src.charAt(pos))) {
            pos++;
        }
    }

    private GrammarException error(String what)
    {
        return new GrammarException(what + " at offset " + pos + " in '" + src + "'");
    }
}
