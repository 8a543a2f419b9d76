package com.codeontology.core.model;

/**
 * Well-known module attributes; everything else is {@link #CUSTOM}.
 */
public enum AttributeKind {
    DOC("doc"),
    MODULEDOC("moduledoc"),
    TYPEDOC("typedoc"),
    DEPRECATED("deprecated"),
    SINCE("since"),
    EXTERNAL_RESOURCE("external_resource"),
    COMPILE("compile"),
    ON_DEFINITION("on_definition"),
    BEFORE_COMPILE("before_compile"),
    AFTER_COMPILE("after_compile"),
    DERIVE("derive"),
    BEHAVIOUR("behaviour"),
    CUSTOM(null);

    private final String attributeName;

    AttributeKind(String attributeName) {
        this.attributeName = attributeName;
    }

    public String attributeName() {
        return attributeName;
    }

    /**
     * Classifies an attribute by name.
     *
     * @param name attribute name without {@code @}
     * @return matching kind, or {@link #CUSTOM}
     */
    public static AttributeKind fromName(String name) {
        for (AttributeKind kind : values()) {
            if (kind.attributeName != null && kind.attributeName.equals(name)) {
                return kind;
            }
        }
        return CUSTOM;
    }

    public boolean isDocumentation() {
        return this == DOC || this == MODULEDOC || this == TYPEDOC;
    }
}
