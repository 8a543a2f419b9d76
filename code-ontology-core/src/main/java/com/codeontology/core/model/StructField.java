package com.codeontology.core.model;

import java.util.Objects;

/**
 * One field of a struct or exception.
 *
 * @param name field name
 * @param defaultValue rendered default, or null
 * @param hasDefault true when the field was declared with a default (even {@code nil})
 * @param enforced true when listed in {@code @enforce_keys}
 */
public record StructField(String name, String defaultValue, boolean hasDefault, boolean enforced) {

    public StructField {
        Objects.requireNonNull(name, "name must not be null");
    }
}
