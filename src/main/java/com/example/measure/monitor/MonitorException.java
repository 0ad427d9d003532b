package com.example.measure.monitor;

/**
 * Thrown when a monitor cannot start or cannot take another sample.
 */
public class MonitorException extends RuntimeException {

    public MonitorException(String message) {
        super(message);
    }
}
