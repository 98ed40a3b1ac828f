package com.example.yolodecoder.core.exception;

public class DegenerateBoxException extends DetectionException {

    public DegenerateBoxException(String message) {
        super(ErrorKind.DEGENERATE_BOX, message);
    }
}
