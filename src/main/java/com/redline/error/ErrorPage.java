package com.redline.error;

import com.redline.response.Response;

import java.io.PrintWriter;
import java.io.StringWriter;

/**
 * Built-in diagnostic page used when no error handler is registered for a status, and as the
 * unconditional fallback when a custom error handler itself fails.
 *
 * <p>Rendering never throws: a missing error or stack trace only removes the info block.</p>
 */
public final class ErrorPage {

    private ErrorPage() {
    }

    /**
     * Renders the page as an HTML response.
     *
     * @param statusCode the status to respond with
     * @param resource the requested resource path
     * @param error the failure being reported, may be null
     * @param includeStackTrace whether the stack trace of {@code error} is printed
     * @return the response
     */
    public static Response render(int statusCode, String resource, Throwable error,
                                  boolean includeStackTrace) {
        String phrase = HttpStatus.phrase(statusCode);
        String title = phrase != null ? statusCode + " - " + phrase : String.valueOf(statusCode);

        StringBuilder html = new StringBuilder(1024);
        html.append("<!DOCTYPE html>\n<html>\n<head>\n")
            .append("  <meta charset=\"utf-8\">\n")
            .append("  <title>Redline - ").append(escape(title)).append("</title>\n")
            .append("  <style>\n")
            .append("    body { margin: 0; font-family: Helvetica, Arial, sans-serif; }\n")
            .append("    .header { background-color: #cc3100; color: #f8f8f8; padding: 10px 20px; }\n")
            .append("    .header h1 { font-size: 32px; margin: 20px 0; }\n")
            .append("    .content { padding: 10px 20px; font-size: 18px; }\n")
            .append("    .info { border: 1px solid #c3c3c3; padding: 0 10px; font-size: 14px; }\n")
            .append("  </style>\n</head>\n<body>\n")
            .append("  <div class=\"header\"><h1>").append(escape(title)).append("</h1></div>\n")
            .append("  <div class=\"content\">\n")
            .append("    <p><b>Resource: </b>").append(escape(resource != null ? resource : ""))
            .append("</p>\n");

        if (error != null) {
            html.append("    <div class=\"info\"><pre>").append(escape(String.valueOf(error)));
            if (includeStackTrace) {
                html.append("\n\n").append(escape(formatStackTrace(error)));
            }
            html.append("</pre></div>\n");
        }

        html.append("  </div>\n</body>\n</html>\n");

        return new Response(statusCode)
            .type("text/html; charset=utf-8")
            .body(html.toString());
    }

    private static String formatStackTrace(Throwable error) {
        StringWriter out = new StringWriter();
        error.printStackTrace(new PrintWriter(out));
        return out.toString();
    }

    private static String escape(String text) {
        StringBuilder sb = new StringBuilder(text.length());
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            switch (c) {
                case '<':
                    sb.append("&lt;");
                    break;
                case '>':
                    sb.append("&gt;");
                    break;
                case '&':
                    sb.append("&amp;");
                    break;
                case '"':
                    sb.append("&quot;");
                    break;
                default:
                    sb.append(c);
            }
        }
        return sb.toString();
    }
}
