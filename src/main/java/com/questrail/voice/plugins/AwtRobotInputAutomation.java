package com.questrail.voice.plugins;

import java.awt.AWTException;
import java.awt.GraphicsEnvironment;
import java.awt.Robot;
import java.awt.event.KeyEvent;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Map;
import java.util.Objects;

import javax.swing.JOptionPane;
import javax.swing.SwingUtilities;

/**
 * AwtRobotInputAutomation
 * -----------------------------------------------------------------------------
 * {@link InputAutomation} backed by {@link java.awt.Robot}.
 *
 * <p>Every call blocks until the native events are delivered
 * ({@code autoWaitForIdle}); alerts block until the dialog is dismissed.
 * A robot instance is shared by all task threads, so key sequences are
 * serialized on the instance monitor to keep chords from interleaving.</p>
 */
public final class AwtRobotInputAutomation implements InputAutomation
{
    private static final Map<String, Integer> NAMED_KEYS = Map.of(
            "enter", KeyEvent.VK_ENTER,
            "tab", KeyEvent.VK_TAB,
            "escape", KeyEvent.VK_ESCAPE,
            "space", KeyEvent.VK_SPACE,
            "backspace", KeyEvent.VK_BACK_SPACE,
            "control", KeyEvent.VK_CONTROL,
            "shift", KeyEvent.VK_SHIFT,
            "alt", KeyEvent.VK_ALT,
            "super", KeyEvent.VK_WINDOWS
    );

    private final Robot robot;

    private AwtRobotInputAutomation(Robot robot)
    {
        this.robot = robot;
        this.robot.setAutoWaitForIdle(true);
    }

    /**
     * @throws AWTException if the platform does not allow synthetic input,
     *         including every headless environment
     */
    public static AwtRobotInputAutomation create() throws AWTException
    {
        if (GraphicsEnvironment.isHeadless()) {
            throw new AWTException("no display available for input automation");
        }
        return new AwtRobotInputAutomation(new Robot());
    }

    @Override
    public synchronized void press(Chord chord)
    {
        Objects.requireNonNull(chord, "chord");
        int key = keyCode(chord.key());
        Deque<Integer> held = new ArrayDeque<>();
        try {
            for (String modifier : chord.modifiers()) {
                int code = keyCode(modifier);
                robot.keyPress(code);
                held.push(code);
            }
            robot.keyPress(key);
            robot.keyRelease(key);
        }
        finally {
            while (!held.isEmpty()) {
                robot.keyRelease(held.pop());
            }
        }
    }

    @Override
    public synchronized void type(String text)
    {
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            int code = KeyEvent.getExtendedKeyCodeForChar(c);
            if (code == KeyEvent.VK_UNDEFINED) {
                throw new IllegalArgumentException("cannot type character U+" + Integer.toHexString(c));
            }
            boolean shifted = Character.isUpperCase(c);
            if (shifted) {
                robot.keyPress(KeyEvent.VK_SHIFT);
            }
            try {
                robot.keyPress(code);
                robot.keyRelease(code);
            }
            finally {
                if (shifted) {
                    robot.keyRelease(KeyEvent.VK_SHIFT);
                }
            }
        }
    }

    @Override
    public void alert(String message) throws Exception
    {
        SwingUtilities.invokeAndWait(() -> JOptionPane.showMessageDialog(null, message));
    }

    static int keyCode(String name)
    {
        Integer named = NAMED_KEYS.get(name);
        if (named != null) {
            return named;
        }
        if (name.length() == 1) {
            char c = name.charAt(0);
            if (c >= 'a' && c <= 'z') {
                return KeyEvent.VK_A + (c - 'a');
            }
            if (c >= '0' && c <= '9') {
                return KeyEvent.VK_0 + (c - '0');
            }
        }
        throw new IllegalArgumentException("no key code for '" + name + "'");
    }
}
