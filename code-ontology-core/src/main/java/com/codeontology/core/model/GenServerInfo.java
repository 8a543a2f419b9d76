package com.codeontology.core.model;

import com.codeontology.core.ast.SourceLocation;

import java.util.List;
import java.util.Objects;

/**
 * A module implementing GenServer.
 *
 * @param module implementing module
 * @param detection how the implementation was recognised
 * @param useOptions rendered {@code use GenServer} options
 * @param callbacks implemented callbacks in source order
 * @param location lines of the detecting directive, or null
 */
public record GenServerInfo(
    String module,
    DetectionMethod detection,
    List<String> useOptions,
    List<GenServerCallbackInfo> callbacks,
    SourceLocation location
) {
    public GenServerInfo {
        Objects.requireNonNull(module, "module must not be null");
        Objects.requireNonNull(detection, "detection must not be null");
        useOptions = useOptions != null ? List.copyOf(useOptions) : List.of();
        callbacks = callbacks != null ? List.copyOf(callbacks) : List.of();
    }
}
