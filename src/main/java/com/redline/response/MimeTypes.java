package com.redline.response;

/** Maps file names to content types for file responses. */
@FunctionalInterface
public interface MimeTypes {

    /**
     * Looks up the content type of a file.
     *
     * @param filename the file name
     * @return the content type, never null
     */
    String lookup(String filename);
}
