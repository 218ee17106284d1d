package com.redline.core;

import java.time.Duration;

/**
 * Server settings. Setters return this instance for method chaining.
 *
 * <p>{@link #fromSystemProperties()} reads the same settings from {@code redline.*} system
 * properties, for example {@code -Dredline.port=9000}.</p>
 */
public class ServerConfig {
    public static final String PREFIX = "redline.";

    private String host = "0.0.0.0";
    private int port = 8080;
    private Duration requestTimeout = Duration.ofSeconds(30);
    private boolean showStackTraces = true;
    private String sessionCookie = "REDLINE_SESSION";
    private int ioThreads = Math.max(2, Runtime.getRuntime().availableProcessors());
    private int workerThreads = Runtime.getRuntime().availableProcessors() * 8;

    /**
     * Creates a configuration from system properties, falling back to the defaults.
     *
     * <ul>
     *   <li>{@code redline.host}</li>
     *   <li>{@code redline.port}</li>
     *   <li>{@code redline.requestTimeoutMs}</li>
     *   <li>{@code redline.showStackTraces}</li>
     *   <li>{@code redline.sessionCookie}</li>
     *   <li>{@code redline.ioThreads} and {@code redline.workerThreads}</li>
     * </ul>
     *
     * @return the configuration
     */
    public static ServerConfig fromSystemProperties() {
        ServerConfig config = new ServerConfig();
        config.host = System.getProperty(PREFIX + "host", config.host);
        config.port = Integer.getInteger(PREFIX + "port", config.port);
        config.requestTimeout = Duration.ofMillis(
            Long.getLong(PREFIX + "requestTimeoutMs", config.requestTimeout.toMillis()));
        config.showStackTraces = Boolean.parseBoolean(
            System.getProperty(PREFIX + "showStackTraces", String.valueOf(config.showStackTraces)));
        config.sessionCookie = System.getProperty(PREFIX + "sessionCookie", config.sessionCookie);
        config.ioThreads = Integer.getInteger(PREFIX + "ioThreads", config.ioThreads);
        config.workerThreads = Integer.getInteger(PREFIX + "workerThreads", config.workerThreads);
        return config;
    }

    public String getHost() {
        return host;
    }

    public ServerConfig setHost(String host) {
        this.host = host;
        return this;
    }

    public int getPort() {
        return port;
    }

    /**
     * Sets the port. Port 0 binds a free port; {@link Redline#getPort()} returns it once listening.
     *
     * @param port the port
     * @return this configuration
     */
    public ServerConfig setPort(int port) {
        this.port = port;
        return this;
    }

    public Duration getRequestTimeout() {
        return requestTimeout;
    }

    /**
     * Sets how long a dispatch may take before the request is answered with a 500 for a stalled
     * chain.
     *
     * @param requestTimeout the deadline
     * @return this configuration
     */
    public ServerConfig setRequestTimeout(Duration requestTimeout) {
        this.requestTimeout = requestTimeout;
        return this;
    }

    public boolean isShowStackTraces() {
        return showStackTraces;
    }

    /**
     * Sets whether the built-in error page prints stack traces.
     *
     * @param showStackTraces true to print them
     * @return this configuration
     */
    public ServerConfig setShowStackTraces(boolean showStackTraces) {
        this.showStackTraces = showStackTraces;
        return this;
    }

    public String getSessionCookie() {
        return sessionCookie;
    }

    public ServerConfig setSessionCookie(String sessionCookie) {
        this.sessionCookie = sessionCookie;
        return this;
    }

    public int getIoThreads() {
        return ioThreads;
    }

    public ServerConfig setIoThreads(int ioThreads) {
        this.ioThreads = ioThreads;
        return this;
    }

    public int getWorkerThreads() {
        return workerThreads;
    }

    public ServerConfig setWorkerThreads(int workerThreads) {
        this.workerThreads = workerThreads;
        return this;
    }
}
