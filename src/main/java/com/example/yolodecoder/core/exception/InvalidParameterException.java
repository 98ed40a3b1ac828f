package com.example.yolodecoder.core.exception;

public class InvalidParameterException extends DetectionException {

    public InvalidParameterException(String message) {
        super(ErrorKind.INVALID_PARAMETER, message);
    }
}
