package org.pragmatica.sifter.types;

import org.junit.jupiter.api.Test;
import org.pragmatica.sifter.error.CommandError;
import org.pragmatica.sifter.parser.ParseResult;
import org.pragmatica.sifter.parser.TokenStream;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ResolversTest {

    @Test
    void string_takesTokenVerbatim() {
        var stream = TokenStream.of("--not-an-option", "next");

        assertEquals("--not-an-option", Resolvers.string().resolve(stream).unwrap());
        assertEquals("next", stream.peek());
    }

    @Test
    void string_atEnd_fails() {
        var result = Resolvers.string().resolve(TokenStream.of());

        assertInstanceOf(CommandError.InsufficientArguments.class, result.error().orElseThrow());
    }

    @Test
    void integer_parsesSignedValues() {
        assertEquals(5, resolve(Resolvers.integer(), "5"));
        assertEquals(-12, resolve(Resolvers.integer(), "-12"));
        assertEquals(7, resolve(Resolvers.integer(), "+7"));
    }

    @Test
    void integer_rejectsGarbage() {
        assertEquals("invalid integer: 5x", failure(Resolvers.integer(), "5x"));
        assertEquals("invalid integer: 1.5", failure(Resolvers.integer(), "1.5"));
        assertEquals("invalid integer: 99999999999, out of range", failure(Resolvers.integer(), "99999999999"));
    }

    @Test
    void floating_parsesDecimals() {
        assertEquals(3.14, resolve(Resolvers.floating(), "3.14"));
        assertEquals(-0.5, resolve(Resolvers.floating(), "-.5"));
        assertEquals(2.0, resolve(Resolvers.floating(), "+2"));
    }

    @Test
    void floating_acceptsInfinityAndNan() {
        assertEquals(Double.POSITIVE_INFINITY, resolve(Resolvers.floating(), "inf"));
        assertEquals(Double.NEGATIVE_INFINITY, resolve(Resolvers.floating(), "-inf"));
        assertTrue(Double.isNaN(resolve(Resolvers.floating(), "nan")));
    }

    @Test
    void floating_rejectsGarbage() {
        assertEquals("invalid float: nope", failure(Resolvers.floating(), "nope"));
        assertEquals("invalid float: 1e5", failure(Resolvers.floating(), "1e5"));
        assertEquals("invalid float: -", failure(Resolvers.floating(), "-"));
        assertEquals("invalid float: 1.", failure(Resolvers.floating(), "1."));
    }

    @Test
    void bool_acceptsOnlyLiterals() {
        assertEquals(true, resolve(Resolvers.bool(), "true"));
        assertEquals(false, resolve(Resolvers.bool(), "false"));
        assertEquals("invalid boolean: yes", failure(Resolvers.bool(), "yes"));
        assertEquals("invalid boolean: TRUE", failure(Resolvers.bool(), "TRUE"));
    }

    @Test
    void oneOf_acceptsListedChoice() {
        var resolver = Resolvers.oneOf("red", "green");

        assertEquals("green", resolve(resolver, "green"));
        assertEquals("invalid choice: blue, expected one of: red, green", failure(resolver, "blue"));
    }

    @Test
    void variadic_consumesUntilEnd() {
        var stream = TokenStream.of("1", "2", "3");
        var values = Resolvers.variadic(Resolvers.integer()).resolve(stream).unwrap();

        assertEquals(List.of(1, 2, 3), values);
        assertTrue(stream.isEnd());
    }

    @Test
    void variadic_onEmptyStream_returnsEmptyList() {
        assertEquals(List.of(), Resolvers.variadic(Resolvers.string()).resolve(TokenStream.of()).unwrap());
    }

    @Test
    void variadic_failsOnFirstBadElement() {
        var result = Resolvers.variadic(Resolvers.integer()).resolve(TokenStream.of("1", "x", "3"));

        assertEquals("invalid integer: x", result.error().orElseThrow().message());
    }

    @Test
    void customResolver_canBeLambda() {
        TypeResolver<Integer> length = stream -> stream.consume()
                                                       .map(token -> ParseResult.success(token.length()))
                                                       .orElseGet(() -> ParseResult.failure(
                                                           new CommandError.InsufficientArguments("length")));

        assertEquals(5, resolve(length, "hello"));
    }

    private static <T> T resolve(TypeResolver<T> resolver, String token) {
        return resolver.resolve(TokenStream.of(token)).unwrap();
    }

    private static String failure(TypeResolver<?> resolver, String token) {
        var error = resolver.resolve(TokenStream.of(token)).error().orElseThrow();
        assertEquals(CommandError.Kind.USER_INPUT, error.kind());
        return error.message();
    }
}
