package com.redline.http;

import java.util.Locale;

/** Body type tag detected from a request's Content-Type. */
public enum BodyType {
    JSON,
    FORM,
    TEXT,
    BINARY;

    /**
     * Detects the body type of a Content-Type header value.
     *
     * <ul>
     *   <li>{@code text/*} is TEXT</li>
     *   <li>{@code application/json} is JSON</li>
     *   <li>{@code application/x-www-form-urlencoded} and {@code multipart/form-data} are FORM</li>
     *   <li>any other {@code application/*} or {@code multipart/*} subtype, and every other
     *       primary type, is BINARY</li>
     * </ul>
     *
     * @param contentType the header value, may be null
     * @return the body type, or null when the request has no Content-Type
     */
    public static BodyType detect(String contentType) {
        String mediaType = mediaType(contentType);
        if (mediaType == null) {
            return null;
        }
        int slash = mediaType.indexOf('/');
        String primary = slash < 0 ? mediaType : mediaType.substring(0, slash);
        String sub = slash < 0 ? "" : mediaType.substring(slash + 1);
        switch (primary) {
            case "text":
                return TEXT;
            case "application":
                if ("json".equals(sub) || sub.endsWith("+json")) {
                    return JSON;
                }
                return "x-www-form-urlencoded".equals(sub) ? FORM : BINARY;
            case "multipart":
                return "form-data".equals(sub) ? FORM : BINARY;
            default:
                return BINARY;
        }
    }

    /**
     * Checks whether a Content-Type denotes a multipart body.
     *
     * @param contentType the header value, may be null
     * @return true for {@code multipart/*}
     */
    public static boolean isMultipart(String contentType) {
        String mediaType = mediaType(contentType);
        return mediaType != null && mediaType.startsWith("multipart/");
    }

    private static String mediaType(String contentType) {
        if (contentType == null || contentType.isBlank()) {
            return null;
        }
        int semicolon = contentType.indexOf(';');
        String mediaType = semicolon < 0 ? contentType : contentType.substring(0, semicolon);
        return mediaType.trim().toLowerCase(Locale.ROOT);
    }
}
