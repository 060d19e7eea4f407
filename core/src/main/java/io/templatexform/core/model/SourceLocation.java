package io.templatexform.core.model;

/**
 * Position of the markup tag an element was built from.
 *
 * @param file   source identifier
 * @param line   1-based line
 * @param column 0-based column
 */
public record SourceLocation(String file, int line, int column) {}
