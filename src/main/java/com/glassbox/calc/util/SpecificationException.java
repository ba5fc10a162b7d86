package com.glassbox.calc.util;

/**
 * A structural problem in a model specification that stops compilation, such
 * as an unknown module template or a duplicate calculation id.
 */
public class SpecificationException extends RuntimeException {

    public SpecificationException(String message) {
        super(message);
    }

    public SpecificationException(String message, Throwable cause) {
        super(message, cause);
    }
}
