package com.astrobg.service;

/**
 * Image or settings supplied to an entry point cannot be processed.
 */
public class InvalidImageException extends ExtractionException {

    public InvalidImageException(String message) {
        super(message);
    }
}
