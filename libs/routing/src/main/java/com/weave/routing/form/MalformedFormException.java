package com.weave.routing.form;

/**
 * Thrown when a request body cannot be read as a form.
 */
public class MalformedFormException extends RuntimeException {

    public MalformedFormException(String message) {
        super(message);
    }

    public MalformedFormException(String message, Throwable cause) {
        super(message, cause);
    }
}
