package com.goerdes.textguard.exception;

/**
 * Unchecked exception raised when a submitted text or document cannot be processed.
 */
public class TextProcessingException extends RuntimeException {

    public TextProcessingException(String message, Throwable cause) {
        super(message, cause);
    }

}
