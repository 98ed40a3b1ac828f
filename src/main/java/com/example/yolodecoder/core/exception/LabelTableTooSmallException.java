package com.example.yolodecoder.core.exception;

public class LabelTableTooSmallException extends DetectionException {

    public LabelTableTooSmallException(int classCount, int labelCount) {
        super(ErrorKind.LABEL_TABLE_TOO_SMALL,
                "Label table has " + labelCount + " entries but " + classCount + " classes can be detected");
    }
}
