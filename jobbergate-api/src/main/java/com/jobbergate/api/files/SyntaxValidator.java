package com.jobbergate.api.files;

/**
 * A single-purpose syntax check for one kind of uploaded text file.
 */
@FunctionalInterface
public interface SyntaxValidator {

    /** True when {@code content} parses as this kind of file. */
    boolean isValid(String content);
}
