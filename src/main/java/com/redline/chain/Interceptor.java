package com.redline.chain;

import com.redline.core.Handler;
import com.redline.core.HandlerEntry;
import com.redline.core.HandlerKind;
import com.redline.error.ConfigurationException;

import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Code wrapped around the routes whose path matches a URL pattern.
 *
 * <p>The pattern is a regular expression matched against the whole request path, so
 * {@code /api/.*} covers everything under {@code /api/}. Interceptors run in ascending group
 * order; within a group, in registration order.</p>
 *
 * <pre>
 * app.addInterceptor(new Interceptor("/.*", args -&gt; {
 *     long start = System.nanoTime();
 *     args.chain().next(() -&gt; {
 *         logger.info("took {}ns", System.nanoTime() - start);
 *         return null;
 *     });
 *     return null;
 * }).group(-10));
 * </pre>
 */
public class Interceptor extends HandlerEntry<Interceptor> {
    private final String urlPattern;
    private final Pattern pattern;
    private int group;

    public Interceptor(String urlPattern, Handler handler) {
        super(urlPattern, handler);
        this.urlPattern = urlPattern;
        try {
            this.pattern = Pattern.compile(urlPattern);
        } catch (PatternSyntaxException e) {
            throw new ConfigurationException("Invalid interceptor pattern " + urlPattern + ": " + e.getDescription());
        }
    }

    /**
     * Sets the ordering group. Lower groups run earlier and unwind later.
     *
     * @param group the group
     * @return this interceptor for method chaining
     */
    public Interceptor group(int group) {
        checkMutable();
        this.group = group;
        return this;
    }

    /**
     * Checks whether this interceptor applies to a path.
     *
     * @param path the request path
     * @return true if the whole path matches the pattern
     */
    public boolean matches(String path) {
        return pattern.matcher(path).matches();
    }

    public String getUrlPattern() {
        return urlPattern;
    }

    public int getGroup() {
        return group;
    }

    @Override
    public HandlerKind getKind() {
        return HandlerKind.INTERCEPTOR;
    }

    @Override
    protected Interceptor self() {
        return this;
    }
}
