package com.redline.http;

/** Result of the body-parsing collaborator: the parsed value plus its type tag. */
public class ParsedBody {
    private final BodyType type;
    private final boolean multipart;
    private final Object value;

    public ParsedBody(BodyType type, boolean multipart, Object value) {
        this.type = type;
        this.multipart = multipart;
        this.value = value;
    }

    public BodyType getType() {
        return type;
    }

    public boolean isMultipart() {
        return multipart;
    }

    /**
     * Gets the parsed body: a {@code Map} or {@code List} for JSON, a {@code Map} for forms,
     * a {@code String} for text and a {@code byte[]} for binary bodies.
     *
     * @return the body, may be null
     */
    public Object getValue() {
        return value;
    }
}
