package com.questrail.voice.plugins;

import java.util.ArrayList;
import java.util.List;

/**
 * Test automation that records every action as a string.
 */
public final class RecordingInputAutomation implements InputAutomation
{
    private final List<String> actions = new ArrayList<>();

    @Override
    public synchronized void press(Chord chord)
    {
        actions.add("press " + chord);
    }

    @Override
    public synchronized void type(String text)
    {
        actions.add("type " + text);
    }

    @Override
    public synchronized void alert(String message)
    {
        actions.add("alert " + message);
    }

    public synchronized List<String> actions()
    {
        return new ArrayList<>(actions);
    }
}
