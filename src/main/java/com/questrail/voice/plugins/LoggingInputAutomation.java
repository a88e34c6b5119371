package com.questrail.voice.plugins;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link InputAutomation} for hosts without a display: every action is logged
 * and otherwise ignored.
 */
public final class LoggingInputAutomation implements InputAutomation
{
    private static final Logger log = LoggerFactory.getLogger(LoggingInputAutomation.class);

    @Override
    public void press(Chord chord)
    {
        log.info("press {}", chord);
    }

    @Override
    public void type(String text)
    {
        log.info("type '{}'", text);
    }

    @Override
    public void alert(String message)
    {
        log.info("alert '{}'", message);
    }
}
