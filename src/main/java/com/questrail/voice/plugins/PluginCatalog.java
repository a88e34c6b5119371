package com.questrail.voice.plugins;

import com.questrail.voice.api.CommandPlugin;
import com.questrail.voice.plugins.basic.BasicPlugin;
import com.questrail.voice.registry.CommandRegistry;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Explicit, statically assembled set of available plugins, keyed by id.
 */
public final class PluginCatalog
{
    private final Map<String, CommandPlugin> plugins;

    private PluginCatalog(Map<String, CommandPlugin> plugins)
    {
        this.plugins = plugins;
    }

    public static PluginCatalog of(CommandPlugin... plugins)
    {
        Map<String, CommandPlugin> byId = new LinkedHashMap<>();
        for (CommandPlugin plugin : plugins) {
            Objects.requireNonNull(plugin, "plugin");
            if (byId.putIfAbsent(plugin.id(), plugin) != null) {
                throw new IllegalArgumentException("duplicate plugin id '" + plugin.id() + "'");
            }
        }
        return new PluginCatalog(byId);
    }

    /** Every plugin shipped with the server, acting through {@code automation}. */
    public static PluginCatalog standard(InputAutomation automation)
    {
        return of(new BasicPlugin(automation));
    }

    public Set<String> ids()
    {
        return plugins.keySet();
    }

    /**
     * @throws IllegalArgumentException if an id names no plugin in this catalog
     */
    public List<CommandPlugin> resolve(Collection<String> ids)
    {
        List<CommandPlugin> selected = new ArrayList<>(ids.size());
        for (String id : ids) {
            CommandPlugin plugin = plugins.get(id);
            if (plugin == null) {
                throw new IllegalArgumentException("unknown plugin '" + id + "'; available: " + plugins.keySet());
            }
            if (!selected.contains(plugin)) {
                selected.add(plugin);
            }
        }
        return selected;
    }

    /** Combined registry of the selected plugins, in selection order. */
    public CommandRegistry registryFor(Collection<String> ids)
    {
        List<CommandRegistry> registries = new ArrayList<>();
        for (CommandPlugin plugin : resolve(ids)) {
            registries.add(plugin.registry());
        }
        return CommandRegistry.combine(registries);
    }
}
