package ru.nsu.fanout.common;

import java.io.IOException;

public class MultipartParseException extends IOException {
    public MultipartParseException(String message) {
        super(message);
    }
}
