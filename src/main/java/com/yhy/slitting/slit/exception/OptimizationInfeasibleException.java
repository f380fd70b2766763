package com.yhy.slitting.slit.exception;

/**
 * The solver could not certify any pattern for a coil.
 */
public class OptimizationInfeasibleException extends SlittingException {

    public OptimizationInfeasibleException(String message) {
        super(message);
    }

    public OptimizationInfeasibleException(String message, Throwable cause) {
        super(message, cause);
    }
}
