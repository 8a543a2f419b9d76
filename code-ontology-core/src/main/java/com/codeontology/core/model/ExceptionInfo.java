package com.codeontology.core.model;

import com.codeontology.core.ast.SourceLocation;

import java.util.List;
import java.util.Objects;

/**
 * A {@code defexception} declaration.
 *
 * @param module defining module
 * @param fields fields in declaration order
 * @param defaultMessage default of the {@code message} field, or null
 * @param customMessage true when the module defines {@code message/1}
 * @param location source lines, or null
 */
public record ExceptionInfo(
    String module,
    List<StructField> fields,
    String defaultMessage,
    boolean customMessage,
    SourceLocation location
) {
    public ExceptionInfo {
        Objects.requireNonNull(module, "module must not be null");
        fields = fields != null ? List.copyOf(fields) : List.of();
    }
}
