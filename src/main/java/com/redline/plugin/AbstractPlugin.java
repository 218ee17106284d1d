package com.redline.plugin;

import com.redline.core.Manager;
import com.redline.core.Redline;
import com.redline.util.LogUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Base class for plugins: holds the name and version and logs the lifecycle.
 * Subclasses contribute their registrations in {@link #configure(Manager)}.
 */
public abstract class AbstractPlugin implements Plugin {
    protected final Logger logger = LoggerFactory.getLogger(getClass());
    protected final String name;
    protected final String version;

    /**
     * Creates a new plugin with the specified name and version.
     *
     * @param name the plugin name
     * @param version the plugin version
     */
    protected AbstractPlugin(String name, String version) {
        this.name = name;
        this.version = version;
    }

    @Override
    public final void register(Manager manager) {
        logger.debug("Configuring plugin {} v{}", name, version);
        configure(manager);
    }

    /**
     * Registers the plugin's routes, interceptors, error handlers, providers and processors.
     *
     * @param manager the registration API
     */
    protected abstract void configure(Manager manager);

    @Override
    public String getName() {
        return name;
    }

    @Override
    public String getVersion() {
        return version;
    }

    @Override
    public void onStart(Redline app) {
        logger.info(LogUtil.info("Plugin " + name + " v" + version + " started"));
    }

    @Override
    public void onStop(Redline app) {
        logger.debug("Plugin {} v{} stopping", name, version);
    }

    @Override
    public String toString() {
        return name + " v" + version;
    }
}
