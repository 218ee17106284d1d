package com.redline.response;

import io.undertow.util.MimeMappings;

import java.util.Locale;

/** {@link MimeTypes} backed by Undertow's default extension table. */
public class UndertowMimeTypes implements MimeTypes {
    static final String DEFAULT_TYPE = "application/octet-stream";

    private final MimeMappings mappings;

    public UndertowMimeTypes() {
        this(MimeMappings.DEFAULT);
    }

    public UndertowMimeTypes(MimeMappings mappings) {
        this.mappings = mappings;
    }

    @Override
    public String lookup(String filename) {
        int dot = filename.lastIndexOf('.');
        if (dot < 0 || dot == filename.length() - 1) {
            return DEFAULT_TYPE;
        }
        String type = mappings.getMimeType(filename.substring(dot + 1).toLowerCase(Locale.ROOT));
        return type != null ? type : DEFAULT_TYPE;
    }
}
