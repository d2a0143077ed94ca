package io.github.yok.flexrecords.parser;

import java.io.IOException;

/**
 * Thrown when a content file is valid JSON but does not describe a content batch.
 *
 * @author Yasuharu.Okawauchi
 */
public class ContentFormatException extends IOException {

    private static final long serialVersionUID = 1L;

    /**
     * Creates an exception.
     *
     * @param message detail message, including the JSON path of the offending node
     */
    public ContentFormatException(String message) {
        super(message);
    }
}
