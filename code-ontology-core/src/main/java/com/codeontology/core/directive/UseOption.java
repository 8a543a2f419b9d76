package com.codeontology.core.directive;

/**
 * One option passed to {@code use}.
 *
 * @param key option key, or null for a positional argument such as {@code use Web, :controller}
 * @param value rendered value
 * @param dynamic true when the value is not a literal and cannot be known statically
 */
public record UseOption(String key, String value, boolean dynamic) {

    /**
     * Renders the option as {@code key: value}, or just the value for positional arguments.
     *
     * @return rendered option
     */
    public String render() {
        return key == null ? value : key + ": " + value;
    }
}
