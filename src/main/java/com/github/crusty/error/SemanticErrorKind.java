package com.github.crusty.error;

public enum SemanticErrorKind {
    UNDEFINED_VARIABLE,
    TYPE_MISMATCH,
    DUPLICATE_DEFINITION,
    INVALID_OPERATION,
    UNSUPPORTED_FEATURE,
    MACRO_DELIMITER_MISMATCH
}
