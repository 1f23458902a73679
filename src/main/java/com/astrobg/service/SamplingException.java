package com.astrobg.service;

public class SamplingException extends ExtractionException {

    private final int generated;
    private final int required;

    public SamplingException(int generated, int required) {
        super(String.format("Insufficient samples generated: %d (minimum: %d)", generated, required));
        this.generated = generated;
        this.required = required;
    }

    public int getGenerated() {
        return generated;
    }

    public int getRequired() {
        return required;
    }
}
