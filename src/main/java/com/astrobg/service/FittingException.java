package com.astrobg.service;

public class FittingException extends ExtractionException {

    public FittingException(String message) {
        super(message);
    }
}
