package com.sandy.aiot.vision.baseline.exception;

/**
 * Raised by a forecast model that cannot fit or forecast one series.
 */
public class ForecastException extends RuntimeException {

    public ForecastException(String message) {
        super(message);
    }

    public ForecastException(String message, Throwable cause) {
        super(message, cause);
    }

}
