package com.yhy.slitting.slit.exception;

/**
 * Base type of errors raised by the slit planner.
 */
public class SlittingException extends RuntimeException {

    public SlittingException(String message) {
        super(message);
    }

    public SlittingException(String message, Throwable cause) {
        super(message, cause);
    }
}
