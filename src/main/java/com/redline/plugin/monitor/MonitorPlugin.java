package com.redline.plugin.monitor;

import com.redline.chain.Interceptor;
import com.redline.core.Manager;
import com.redline.core.Redline;
import com.redline.plugin.AbstractPlugin;
import com.redline.response.Response;
import com.redline.routing.Route;

import java.lang.management.ManagementFactory;
import java.lang.management.MemoryMXBean;
import java.lang.management.OperatingSystemMXBean;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Plugin that provides application monitoring capabilities.
 * Tracks request counts, response times and error rates, and serves them on
 * {@code GET /monitor/stats}.
 */
public class MonitorPlugin extends AbstractPlugin {
    public static final String STATS_PATH = "/monitor/stats";

    private static final long SLOW_REQUEST_MS = 1000;

    // Global counters
    private final AtomicInteger totalRequests = new AtomicInteger(0);
    private final AtomicInteger activeRequests = new AtomicInteger(0);
    private final AtomicInteger errorCount = new AtomicInteger(0);
    private final AtomicLong totalResponseTime = new AtomicLong(0);

    // Path-specific metrics
    private final Map<String, PathMetrics> pathMetrics = new ConcurrentHashMap<>();

    // JVM metrics
    private final MemoryMXBean memoryBean = ManagementFactory.getMemoryMXBean();
    private final OperatingSystemMXBean osBean = ManagementFactory.getOperatingSystemMXBean();

    private final long startTime = System.currentTimeMillis();

    public MonitorPlugin() {
        super("monitor", "1.0.0");
    }

    @Override
    protected void configure(Manager manager) {
        manager.addInterceptor(monitoringInterceptor());
        manager.addRoute(new Route("GET", STATS_PATH, args -> getMonitoringData()));
    }

    /**
     * Creates an interceptor that measures every request. It runs first and unwinds last, so
     * the recorded status is the one sent to the client.
     *
     * @return the interceptor
     */
    public Interceptor monitoringInterceptor() {
        return new Interceptor("/.*", args -> {
            long requestStartTime = System.currentTimeMillis();
            String method = args.request().getMethod();
            String path = normalizePath(args.request().getPath());

            totalRequests.incrementAndGet();
            activeRequests.incrementAndGet();
            PathMetrics metrics = pathMetrics.computeIfAbsent(path, PathMetrics::new);
            metrics.incrementRequests();

            args.chain().next(() -> {
                long duration = System.currentTimeMillis() - requestStartTime;
                Response response = Redline.response();
                int statusCode = response != null ? response.getStatus() : 200;

                activeRequests.decrementAndGet();
                totalResponseTime.addAndGet(duration);
                if (statusCode >= 400) {
                    errorCount.incrementAndGet();
                    metrics.incrementErrors();
                }
                metrics.recordResponseTime(duration);

                if (duration > SLOW_REQUEST_MS) {
                    logger.warn("Slow request: {} {} completed in {}ms", method, path, duration);
                }
                return null;
            });
            return null;
        }).name("monitor").group(Integer.MIN_VALUE);
    }

    /**
     * Gets the monitoring data.
     *
     * @return the monitoring data
     */
    public Map<String, Object> getMonitoringData() {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("uptime", System.currentTimeMillis() - startTime);
        data.put("startTime", startTime);

        Map<String, Object> requestStats = new LinkedHashMap<>();
        int total = totalRequests.get();
        requestStats.put("total", total);
        requestStats.put("active", activeRequests.get());
        requestStats.put("errors", errorCount.get());
        requestStats.put("avgResponseTime", total > 0 ? (double) totalResponseTime.get() / total : 0);
        data.put("requests", requestStats);

        Map<String, Object> jvmStats = new LinkedHashMap<>();
        jvmStats.put("heapUsed", memoryBean.getHeapMemoryUsage().getUsed());
        jvmStats.put("heapMax", memoryBean.getHeapMemoryUsage().getMax());
        jvmStats.put("nonHeapUsed", memoryBean.getNonHeapMemoryUsage().getUsed());
        jvmStats.put("threadCount", Thread.activeCount());
        jvmStats.put("cpuLoad", osBean.getSystemLoadAverage());
        data.put("jvm", jvmStats);

        Map<String, Object> pathData = new TreeMap<>();
        for (PathMetrics metric : pathMetrics.values()) {
            pathData.put(metric.getPath(), metric.toMap());
        }
        data.put("paths", pathData);
        return data;
    }

    /**
     * Replaces numeric segments with {@code :id} so one route's requests share an entry.
     *
     * @param path the request path
     * @return the normalized path
     */
    static String normalizePath(String path) {
        StringBuilder normalized = new StringBuilder();
        for (String segment : path.split("/")) {
            if (segment.isEmpty()) {
                continue;
            }
            normalized.append('/').append(segment.matches("\\d+") ? ":id" : segment);
        }
        return normalized.length() == 0 ? "/" : normalized.toString();
    }

    /** Metrics for one normalized path. */
    private static class PathMetrics {
        private final String path;
        private final AtomicInteger requestCount = new AtomicInteger(0);
        private final AtomicInteger errorCount = new AtomicInteger(0);
        private final AtomicLong totalResponseTime = new AtomicLong(0);
        private final AtomicLong minResponseTime = new AtomicLong(Long.MAX_VALUE);
        private final AtomicLong maxResponseTime = new AtomicLong(0);

        PathMetrics(String path) {
            this.path = path;
        }

        void incrementRequests() {
            requestCount.incrementAndGet();
        }

        void incrementErrors() {
            errorCount.incrementAndGet();
        }

        void recordResponseTime(long time) {
            totalResponseTime.addAndGet(time);
            minResponseTime.accumulateAndGet(time, Math::min);
            maxResponseTime.accumulateAndGet(time, Math::max);
        }

        String getPath() {
            return path;
        }

        Map<String, Object> toMap() {
            Map<String, Object> data = new LinkedHashMap<>();
            int requests = requestCount.get();
            data.put("requests", requests);
            data.put("errors", errorCount.get());
            data.put("avgResponseTime", requests > 0 ? (double) totalResponseTime.get() / requests : 0);
            data.put("minResponseTime", minResponseTime.get() == Long.MAX_VALUE ? 0 : minResponseTime.get());
            data.put("maxResponseTime", maxResponseTime.get());
            return data;
        }
    }
}
