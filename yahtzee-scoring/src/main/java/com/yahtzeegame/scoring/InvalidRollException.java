package com.yahtzeegame.scoring;

/**
 * Thrown when dice input is not exactly five faces in 1..6.
 */
public class InvalidRollException extends IllegalArgumentException {

    public InvalidRollException(String message) {
        super(message);
    }
}
