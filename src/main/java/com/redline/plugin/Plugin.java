package com.redline.plugin;

import com.redline.core.Manager;
import com.redline.core.Redline;

/**
 * Interface for plugins that can be registered with a Redline application.
 * Plugins contribute routes, interceptors, error handlers, parameter providers and response
 * processors through the {@link Manager} they receive.
 */
public interface Plugin {

    /**
     * Registers the plugin's contributions.
     * Called once, when the plugin is added to the application.
     *
     * @param manager the registration API
     */
    void register(Manager manager);

    /**
     * Gets the name of the plugin.
     *
     * @return the plugin name
     */
    String getName();

    /**
     * Gets the version of the plugin.
     *
     * @return the plugin version
     */
    String getVersion();

    /**
     * Called when the application is starting.
     *
     * @param app the application
     */
    default void onStart(Redline app) {
        // Default implementation does nothing
    }

    /**
     * Called when the application is stopping.
     *
     * @param app the application
     */
    default void onStop(Redline app) {
        // Default implementation does nothing
    }
}
