package com.redline.error;

import com.redline.core.Handler;
import com.redline.core.HandlerEntry;
import com.redline.core.HandlerKind;

import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Custom rendering for an error status, optionally limited to paths matching a URL pattern.
 *
 * <p>The handler runs as a one-element chain. Its return value goes through the response writer
 * with the handled status as default, so returning a map yields a JSON error body. The failure
 * being handled, if any, is available from {@code args.chain().getError()}.</p>
 */
public class ErrorHandler extends HandlerEntry<ErrorHandler> {
    private final int statusCode;
    private final String urlPattern;
    private final Pattern pattern;

    public ErrorHandler(int statusCode, Handler handler) {
        this(statusCode, null, handler);
    }

    /**
     * Creates an error handler for the paths matching a pattern.
     *
     * @param statusCode the handled status
     * @param urlPattern regular expression matched against the whole path, or null for all paths
     * @param handler the handler body
     */
    public ErrorHandler(int statusCode, String urlPattern, Handler handler) {
        super("error " + statusCode + (urlPattern != null ? " " + urlPattern : ""), handler);
        this.statusCode = statusCode;
        this.urlPattern = urlPattern;
        try {
            this.pattern = urlPattern != null ? Pattern.compile(urlPattern) : null;
        } catch (PatternSyntaxException e) {
            throw new ConfigurationException("Invalid error handler pattern " + urlPattern + ": " + e.getDescription());
        }
    }

    /**
     * Checks whether this handler renders a status for a path.
     *
     * @param status the status
     * @param path the request path
     * @return true if the status matches and the pattern, when present, matches the whole path
     */
    public boolean matches(int status, String path) {
        return statusCode == status && (pattern == null || pattern.matcher(path).matches());
    }

    public int getStatusCode() {
        return statusCode;
    }

    public String getUrlPattern() {
        return urlPattern;
    }

    @Override
    public HandlerKind getKind() {
        return HandlerKind.ERROR_HANDLER;
    }

    @Override
    protected ErrorHandler self() {
        return this;
    }
}
