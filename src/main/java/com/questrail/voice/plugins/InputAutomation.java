package com.questrail.voice.plugins;

/**
 * Port through which command handlers act on the desktop.
 *
 * <p>Implementations may block; callers are task threads, never event loop
 * threads.</p>
 */
public interface InputAutomation
{
    /** Hold the chord's modifiers, press and release its key, release the modifiers. */
    void press(Chord chord) throws Exception;

    /** Type literal text as keystrokes. */
    void type(String text) throws Exception;

    /** Show a message to the user and wait until it is dismissed. */
    void alert(String message) throws Exception;
}
