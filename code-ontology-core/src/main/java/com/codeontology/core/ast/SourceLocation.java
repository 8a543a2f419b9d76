package com.codeontology.core.ast;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Line range of a node in its source file.
 *
 * <p>An absent or invalid end line collapses to the start line.
 *
 * @param startLine first line (1-indexed)
 * @param endLine last line (1-indexed, never before {@code startLine})
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record SourceLocation(int startLine, int endLine) {

    @JsonCreator
    public SourceLocation(
        @JsonProperty("startLine") int startLine,
        @JsonProperty("endLine") int endLine
    ) {
        if (startLine < 1) {
            throw new IllegalArgumentException("startLine must be positive, got " + startLine);
        }
        this.startLine = startLine;
        this.endLine = endLine < startLine ? startLine : endLine;
    }

    /**
     * Creates a single-line location.
     *
     * @param line the line
     * @return location spanning one line
     */
    public static SourceLocation line(int line) {
        return new SourceLocation(line, line);
    }

    public static SourceLocation of(int startLine, int endLine) {
        return new SourceLocation(startLine, endLine);
    }
}
