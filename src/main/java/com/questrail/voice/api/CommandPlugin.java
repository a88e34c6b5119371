package com.questrail.voice.api;

import com.questrail.voice.registry.CommandRegistry;

/**
 * A named, statically known source of command registrations.
 *
 * <p>Plugins are assembled once at startup; nothing can be registered after
 * the combined grammar is compiled.</p>
 */
public interface CommandPlugin
{
    /** Identifier used to select the plugin on the command line. */
    String id();

    /** Builds this plugin's rules and command patterns. Called once. */
    CommandRegistry registry();
}
