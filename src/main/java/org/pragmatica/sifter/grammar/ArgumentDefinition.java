package org.pragmatica.sifter.grammar;

import org.pragmatica.sifter.types.TypeResolver;

/**
 * A positional or option argument: identifier, type and optional default.
 */
public record ArgumentDefinition<T>(
 String id,
 TypeResolver<T> type,
 boolean optional,
 T defaultValue) {

    public static <T> ArgumentDefinition<T> required(String id, TypeResolver<T> type) {
        return new ArgumentDefinition<>(id, type, false, null);
    }

    public static <T> ArgumentDefinition<T> optional(String id, TypeResolver<T> type, T defaultValue) {
        return new ArgumentDefinition<>(id, type, true, defaultValue);
    }

    public boolean isRequired() {
        return !optional;
    }
}
