package com.github.crusty.codegen;

public enum TargetLanguage {
    /** The target language with ownership and borrowing. */
    RUST,
    /** The C-dialect. */
    CRUSTY
}
