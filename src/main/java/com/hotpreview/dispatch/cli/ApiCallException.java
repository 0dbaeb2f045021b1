package com.hotpreview.dispatch.cli;

/**
 * The server answered a CLI request with a non-success status.
 */
public class ApiCallException extends RuntimeException {

    private final int statusCode;

    public ApiCallException(int statusCode, String message) {
        super(message);
        this.statusCode = statusCode;
    }

    public int statusCode() {
        return statusCode;
    }
}
