package com.hkmatrix.core.engine;

/** Shape mismatch detected before any work starts; no partial trace exists. */
public class ValidationError extends RuntimeException {

    public ValidationError(String message) {
        super(message);
    }
}
