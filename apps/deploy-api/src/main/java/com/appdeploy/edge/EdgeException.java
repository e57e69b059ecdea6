package com.appdeploy.edge;

public class EdgeException extends RuntimeException {

    public EdgeException(String message) {
        super(message);
    }

    public EdgeException(String message, Throwable cause) {
        super(message, cause);
    }
}
