package com.questrail.voice.plugins.basic;

import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Spoken names of keys and the key names {@link com.questrail.voice.plugins.InputAutomation}
 * understands: the NATO alphabet for letters, number words for digits, and
 * a few named keys and modifiers spoken as themselves.
 */
final class KeyPronunciations
{
    private static final String[] NATO = {
            "alpha", "bravo", "charlie", "delta", "echo", "foxtrot", "golf", "hotel", "india",
            "juliet", "kilo", "lima", "mike", "november", "oscar", "papa", "quebec", "romeo",
            "sierra", "tango", "uniform", "victor", "whiskey", "xray", "yankee", "zulu"
    };

    private static final String[] DIGITS = {
            "zero", "one", "two", "three", "four", "five", "six", "seven", "eight", "nine"
    };

    private static final String[] SPOKEN_AS_IS = {
            "enter", "tab", "escape", "space", "backspace", "control", "shift", "alt", "super"
    };

    static final Map<String, String> KEYS;

    static {
        Map<String, String> keys = new LinkedHashMap<>();
        for (int i = 0; i < NATO.length; i++) {
            keys.put(NATO[i], String.valueOf((char) ('a' + i)));
        }
        for (int i = 0; i < DIGITS.length; i++) {
            keys.put(DIGITS[i], String.valueOf(i));
        }
        for (String name : SPOKEN_AS_IS) {
            keys.put(name, name);
        }
        KEYS = Collections.unmodifiableMap(keys);
    }

    private KeyPronunciations()
    {
    }

    /**
     * Pattern expression matching exactly one pronunciation. Longer names are
     * tried first so that no name is cut short by one of its prefixes.
     */
    static String expression()
    {
        String alternation = KEYS.keySet().stream()
                .sorted(Comparator.comparingInt(String::length).reversed().thenComparing(Comparator.naturalOrder()))
                .collect(Collectors.joining("|"));
        return "/(?:" + alternation + ")\\b/";
    }

    /**
     * @throws IllegalArgumentException if {@code spoken} is not a known pronunciation
     */
    static String keyFor(String spoken)
    {
        String key = KEYS.get(spoken);
        if (key == null) {
            throw new IllegalArgumentException("unknown key '" + spoken + "'");
        }
        return key;
    }
}
