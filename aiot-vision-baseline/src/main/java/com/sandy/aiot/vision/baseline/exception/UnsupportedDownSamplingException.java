package com.sandy.aiot.vision.baseline.exception;

public class UnsupportedDownSamplingException extends RuntimeException {

    public UnsupportedDownSamplingException(String downSampling) {
        super("Unsupported down sampling: " + downSampling);
    }

}
