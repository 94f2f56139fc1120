package com.astrochart.engine.exception;

public class InvalidChartException extends RuntimeException {

    public InvalidChartException(String message) {
        super(message);
    }
}
