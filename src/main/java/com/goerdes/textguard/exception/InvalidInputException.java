package com.goerdes.textguard.exception;

/**
 * Rejects a request before any processing happens: blank or oversized text,
 * or a file whose text could not be extracted.
 */
public class InvalidInputException extends TextProcessingException {

    public InvalidInputException(String message) {
        super(message, null);
    }

}
