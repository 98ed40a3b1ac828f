package com.example.yolodecoder.core.exception;

public class InvalidImageSizeException extends DetectionException {

    public InvalidImageSizeException(String message) {
        super(ErrorKind.INVALID_IMAGE_SIZE, message);
    }
}
