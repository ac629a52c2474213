package com.github.crusty.error;

/**
 * Thrown by the code generator when it meets a tree it cannot render. An analyzed tree never
 * triggers this; if one does, the analyzer let something through that it should have rejected.
 */
public class CodeGenException extends RuntimeException {

    public CodeGenException(String message) {
        super(message);
    }
}
