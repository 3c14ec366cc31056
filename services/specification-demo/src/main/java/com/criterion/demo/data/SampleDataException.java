package com.criterion.demo.data;

/** Thrown when the sample dataset cannot be read, parsed or validated. */
public class SampleDataException extends RuntimeException {

    public SampleDataException(String message) {
        super(message);
    }

    public SampleDataException(String message, Throwable cause) {
        super(message, cause);
    }
}
