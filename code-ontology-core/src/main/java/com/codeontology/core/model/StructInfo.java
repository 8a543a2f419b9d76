package com.codeontology.core.model;

import com.codeontology.core.ast.SourceLocation;

import java.util.List;
import java.util.Objects;

/**
 * A {@code defstruct} declaration.
 *
 * @param module defining module
 * @param fields fields in declaration order
 * @param derivedProtocols protocols from {@code @derive}
 * @param location source lines, or null
 */
public record StructInfo(
    String module,
    List<StructField> fields,
    List<String> derivedProtocols,
    SourceLocation location
) {
    public StructInfo {
        Objects.requireNonNull(module, "module must not be null");
        fields = fields != null ? List.copyOf(fields) : List.of();
        derivedProtocols = derivedProtocols != null ? List.copyOf(derivedProtocols) : List.of();
    }

    public List<String> enforcedKeys() {
        return fields.stream().filter(StructField::enforced).map(StructField::name).toList();
    }
}
