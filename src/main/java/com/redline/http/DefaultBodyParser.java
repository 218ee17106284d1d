package com.redline.http;

import com.redline.util.JsonUtil;

import java.io.IOException;
import java.io.InputStream;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Default body parser: JSON through Jackson, url-encoded and multipart forms, text and raw
 * bytes.
 */
public class DefaultBodyParser implements BodyParser {

    @Override
    public ParsedBody parse(String contentType, InputStream body) throws IOException {
        BodyType type = BodyType.detect(contentType);
        boolean multipart = BodyType.isMultipart(contentType);
        if (type == null) {
            return new ParsedBody(null, false, null);
        }

        switch (type) {
            case JSON:
                return new ParsedBody(type, false, JsonUtil.parse(body));
            case FORM:
                byte[] bytes = body.readAllBytes();
                Map<String, Object> form = multipart
                    ? parseMultipart(contentType, bytes)
                    : parseUrlEncoded(new String(bytes, StandardCharsets.UTF_8));
                return new ParsedBody(type, multipart, form);
            case TEXT:
                return new ParsedBody(type, false,
                    new String(body.readAllBytes(), StandardCharsets.UTF_8));
            default:
                return new ParsedBody(type, multipart, body.readAllBytes());
        }
    }

    /**
     * Decodes an {@code application/x-www-form-urlencoded} body. Repeated keys keep the last value.
     *
     * @param text the raw body
     * @return the fields in arrival order
     */
    static Map<String, Object> parseUrlEncoded(String text) {
        Map<String, Object> fields = new LinkedHashMap<>();
        if (text == null || text.isEmpty()) {
            return fields;
        }
        for (String pair : text.split("&")) {
            if (pair.isEmpty()) {
                continue;
            }
            int eq = pair.indexOf('=');
            String name = eq < 0 ? pair : pair.substring(0, eq);
            String value = eq < 0 ? "" : pair.substring(eq + 1);
            fields.put(URLDecoder.decode(name, StandardCharsets.UTF_8),
                URLDecoder.decode(value, StandardCharsets.UTF_8));
        }
        return fields;
    }

    /**
     * Splits a {@code multipart/form-data} body. Plain parts become strings, parts carrying a
     * filename become {@link FileUpload}s.
     *
     * @param contentType the Content-Type carrying the boundary
     * @param bytes the raw body
     * @return the parts in arrival order
     * @throws IOException if the boundary is missing or a part is malformed
     */
    static Map<String, Object> parseMultipart(String contentType, byte[] bytes) throws IOException {
        String boundary = extractBoundary(contentType);
        if (boundary == null) {
            throw new IOException("Multipart body without boundary");
        }

        Map<String, Object> parts = new LinkedHashMap<>();
        String startBoundary = "--" + boundary;
        String endBoundary = startBoundary + "--";
        // ISO-8859-1 maps bytes to chars one to one, so offsets stay valid for binary parts
        String bodyStr = new String(bytes, StandardCharsets.ISO_8859_1);

        int pos = 0;
        while (pos < bodyStr.length()) {
            int boundaryPos = bodyStr.indexOf(startBoundary, pos);
            if (boundaryPos == -1 || bodyStr.startsWith(endBoundary, boundaryPos)) {
                break;
            }

            int headerStart = boundaryPos + startBoundary.length();
            if (bodyStr.startsWith("\r\n", headerStart)) {
                headerStart += 2;
            }
            int headerEnd = bodyStr.indexOf("\r\n\r\n", headerStart);
            if (headerEnd == -1) {
                throw new IOException("Malformed multipart part");
            }

            String name = null;
            String filename = null;
            String partContentType = null;
            for (String headerLine : bodyStr.substring(headerStart, headerEnd).split("\r\n")) {
                String lower = headerLine.toLowerCase();
                if (lower.startsWith("content-disposition:")) {
                    for (String part : headerLine.split(";")) {
                        part = part.trim();
                        if (part.startsWith("name=")) {
                            name = unquote(part.substring(5));
                        } else if (part.startsWith("filename=")) {
                            filename = unquote(part.substring(9));
                        }
                    }
                } else if (lower.startsWith("content-type:")) {
                    partContentType = headerLine.substring(13).trim();
                }
            }

            int contentStart = headerEnd + 4;
            int nextBoundaryPos = bodyStr.indexOf(startBoundary, contentStart);
            if (nextBoundaryPos == -1) {
                nextBoundaryPos = bodyStr.length();
            }
            int contentEnd = nextBoundaryPos;
            if (contentEnd - 2 >= contentStart && bodyStr.startsWith("\r\n", contentEnd - 2)) {
                contentEnd -= 2;
            }
            byte[] content = bodyStr.substring(contentStart, contentEnd)
                .getBytes(StandardCharsets.ISO_8859_1);

            if (name != null) {
                if (filename != null) {
                    parts.put(name, new FileUpload(name, filename, partContentType, content));
                } else {
                    parts.put(name, new String(content, StandardCharsets.UTF_8));
                }
            }
            pos = nextBoundaryPos;
        }
        return parts;
    }

    private static String extractBoundary(String contentType) {
        int idx = contentType.indexOf("boundary=");
        if (idx < 0) {
            return null;
        }
        String boundary = contentType.substring(idx + 9);
        int semicolon = boundary.indexOf(';');
        if (semicolon >= 0) {
            boundary = boundary.substring(0, semicolon);
        }
        boundary = unquote(boundary);
        return boundary.isEmpty() ? null : boundary;
    }

    private static String unquote(String value) {
        value = value.trim();
        if (value.length() >= 2 && value.startsWith("\"") && value.endsWith("\"")) {
            return value.substring(1, value.length() - 1);
        }
        return value;
    }
}
