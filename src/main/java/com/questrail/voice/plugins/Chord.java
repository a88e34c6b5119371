package com.questrail.voice.plugins;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * A key press with zero or more held modifiers, e.g. {@code control+shift+t}.
 *
 * @param key       key name as understood by {@link InputAutomation}
 *                  (a letter, a digit, or a named key such as {@code enter})
 * @param modifiers modifier names in the order they are held down
 */
public record Chord(String key, List<String> modifiers) {

    /** Modifier names an automation backend must support. */
    public static final Set<String> MODIFIERS = Set.of("control", "shift", "alt", "super");

    public Chord {
        Objects.requireNonNull(key, "key");
        modifiers = List.copyOf(modifiers);
        for (String modifier : modifiers) {
            if (!MODIFIERS.contains(modifier)) {
                throw new IllegalArgumentException("not a modifier: " + modifier);
            }
        }
    }

    public static Chord of(String key) {
        return new Chord(key, List.of());
    }

    /** This chord with {@code modifier} held first, unless it is already held. */
    public Chord withModifier(String modifier) {
        if (modifiers.contains(modifier)) {
            return this;
        }
        List<String> held = new ArrayList<>(modifiers.size() + 1);
        held.add(modifier);
        held.addAll(modifiers);
        return new Chord(key, held);
    }

    @Override
    public String toString() {
        return modifiers.isEmpty() ? key : String.join("+", modifiers) + "+" + key;
    }
}
