package com.codeontology.core.directive;

import com.codeontology.core.ast.SourceLocation;

import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

/**
 * Value-or-error result of a directive extraction.
 *
 * <p>Exactly one of {@code value} and {@code error} is non-null.
 *
 * @param value extracted value, or null on failure
 * @param error failure, or null on success
 * @param <T> value type
 */
public record DirectiveResult<T>(T value, DirectiveError error) {

    public DirectiveResult {
        if ((value == null) == (error == null)) {
            throw new IllegalArgumentException("Exactly one of value and error must be set");
        }
    }

    public static <T> DirectiveResult<T> ok(T value) {
        return new DirectiveResult<>(Objects.requireNonNull(value, "value must not be null"), null);
    }

    public static <T> DirectiveResult<T> error(DirectiveError error) {
        return new DirectiveResult<>(null, Objects.requireNonNull(error, "error must not be null"));
    }

    public static <T> DirectiveResult<T> notADirective(String message, SourceLocation location) {
        return error(DirectiveError.notADirective(message, location));
    }

    public boolean isOk() {
        return error == null;
    }

    public Optional<T> toOptional() {
        return Optional.ofNullable(value);
    }

    public <R> DirectiveResult<R> map(Function<? super T, ? extends R> mapper) {
        if (!isOk()) {
            return DirectiveResult.error(error);
        }
        return DirectiveResult.ok(mapper.apply(value));
    }

    /**
     * Returns the value or throws.
     *
     * @return the value
     * @throws IllegalStateException if this is an error result
     */
    public T orElseThrow() {
        if (!isOk()) {
            throw new IllegalStateException(error.kind() + ": " + error.message());
        }
        return value;
    }
}
