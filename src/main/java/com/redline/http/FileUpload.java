package com.redline.http;

import java.nio.charset.StandardCharsets;

/** A file part of a {@code multipart/form-data} body. */
public class FileUpload {
    private final String fieldName;
    private final String filename;
    private final String contentType;
    private final byte[] content;

    public FileUpload(String fieldName, String filename, String contentType, byte[] content) {
        this.fieldName = fieldName;
        this.filename = filename;
        this.contentType = contentType;
        this.content = content;
    }

    public String getFieldName() {
        return fieldName;
    }

    public String getFilename() {
        return filename;
    }

    public String getContentType() {
        return contentType;
    }

    public byte[] getContent() {
        return content;
    }

    public String getContentAsString() {
        return new String(content, StandardCharsets.UTF_8);
    }

    @Override
    public String toString() {
        return "FileUpload{" + fieldName + "=" + filename + ", " + content.length + " bytes}";
    }
}
