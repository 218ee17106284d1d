package com.redline.response;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

/**
 * Low-level response handed to the transport: status code, headers and a body that is either
 * a byte array or a stream.
 *
 * <p>A handler may return a {@code Response} directly, in which case it is written verbatim.
 * Interceptor continuations can read and decorate the current response through
 * {@code Redline.response()}.</p>
 */
public class Response {
  private static final byte[] EMPTY = new byte[0];

  private int status;
  private final Map<String, String> headers = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
  private byte[] body = EMPTY;
  private InputStream bodyStream;

  /**
   * Creates an empty response.
   *
   * @param status the status code
   */
  public Response(int status) {
    this.status = status;
  }

  /**
   * Creates a {@code text/plain} response.
   *
   * @param status the status code
   * @param text the body
   * @return the response
   */
  public static Response text(int status, String text) {
    return new Response(status).type("text/plain; charset=utf-8").body(text);
  }

  /**
   * Creates a 302 redirect.
   *
   * @param location the redirect target
   * @return the response
   */
  public static Response found(URI location) {
    return new Response(302).header("Location", location.toString());
  }

  /**
   * Creates a bodiless 500, used when even error rendering cannot complete.
   *
   * @return the response
   */
  public static Response internalServerError() {
    return new Response(500);
  }

  /**
   * Sets the response status code.
   *
   * @param status the status code
   * @return this response for method chaining
   */
  public Response status(int status) {
    this.status = status;
    return this;
  }

  /**
   * Sets a response header, replacing any previous value.
   *
   * @param name the header name
   * @param value the header value
   * @return this response for method chaining
   */
  public Response header(String name, String value) {
    headers.put(name, value);
    return this;
  }

  /**
   * Sets the Content-Type header.
   *
   * @param contentType the content type
   * @return this response for method chaining
   */
  public Response type(String contentType) {
    return header("Content-Type", contentType);
  }

  /**
   * Sets a UTF-8 text body.
   *
   * @param text the text
   * @return this response for method chaining
   */
  public Response body(String text) {
    return body(text.getBytes(StandardCharsets.UTF_8));
  }

  /**
   * Sets a byte body.
   *
   * @param bytes the body
   * @return this response for method chaining
   */
  public Response body(byte[] bytes) {
    this.body = bytes != null ? bytes : EMPTY;
    this.bodyStream = null;
    return this;
  }

  /**
   * Sets a streamed body, for example the contents of a file.
   *
   * @param stream the stream, closed by the transport once written
   * @return this response for method chaining
   */
  public Response body(InputStream stream) {
    this.bodyStream = stream;
    this.body = EMPTY;
    return this;
  }

  public int getStatus() {
    return status;
  }

  public String getHeader(String name) {
    return headers.get(name);
  }

  public Map<String, String> getHeaders() {
    return Collections.unmodifiableMap(headers);
  }

  public String getContentType() {
    return headers.get("Content-Type");
  }

  /**
   * Checks whether the body is streamed.
   *
   * @return true if the body is an {@link InputStream}
   */
  public boolean isStreamed() {
    return bodyStream != null;
  }

  /**
   * Opens the body for writing.
   *
   * @return the body stream
   */
  public InputStream openBody() {
    return bodyStream != null ? bodyStream : new ByteArrayInputStream(body);
  }

  /**
   * Gets the byte body. For a streamed body the stream is drained and the bytes kept.
   *
   * @return the body bytes
   * @throws IOException if the stream cannot be read
   */
  public byte[] getBodyBytes() throws IOException {
    if (bodyStream != null) {
      try (InputStream in = bodyStream) {
        body = in.readAllBytes();
      }
      bodyStream = null;
    }
    return body;
  }

  /**
   * Gets the body decoded as UTF-8.
   *
   * @return the body text
   * @throws IOException if the stream cannot be read
   */
  public String getBodyAsString() throws IOException {
    return new String(getBodyBytes(), StandardCharsets.UTF_8);
  }

  @Override
  public String toString() {
    return "Response{status=" + status + ", headers=" + headers + "}";
  }
}
