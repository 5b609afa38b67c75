package org.pragmatica.sifter.types;

import org.pragmatica.sifter.error.CommandError;
import org.pragmatica.sifter.parser.ParseResult;
import org.pragmatica.sifter.parser.TokenStream;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Built-in type resolvers.
 */
public final class Resolvers {
    private static final Pattern INTEGER = Pattern.compile("[+-]?[0-9]+");
    private static final Pattern UNSIGNED_FLOAT = Pattern.compile("[0-9]*(\\.[0-9]+)?");

    private Resolvers() {}

    /**
     * One token, verbatim.
     */
    public static TypeResolver<String> string() {
        return stream -> token(stream, "string");
    }

    /**
     * Decimal integer with optional sign.
     */
    public static TypeResolver<Integer> integer() {
        return stream -> token(stream, "integer").flatMap(Resolvers::parseInteger);
    }

    /**
     * Decimal floating point number with optional sign. Accepts {@code inf} and {@code nan}.
     */
    public static TypeResolver<Double> floating() {
        return stream -> token(stream, "float").flatMap(Resolvers::parseFloat);
    }

    /**
     * {@code true} or {@code false}, nothing else.
     */
    public static TypeResolver<Boolean> bool() {
        return stream -> token(stream, "boolean").flatMap(Resolvers::parseBoolean);
    }

    /**
     * One of a fixed set of words.
     */
    public static TypeResolver<String> oneOf(String... choices) {
        var allowed = Set.of(choices);
        var expected = "expected one of: " + String.join(", ", choices);
        return stream -> token(stream, "choice")
            .flatMap(token -> allowed.contains(token)
                              ? ParseResult.<String>success(token)
                              : ParseResult.<String>failure(new CommandError.InvalidValue("choice", token, expected)));
    }

    /**
     * Applies {@code element} until the stream ends. The first rejected token fails the whole list.
     */
    public static <T> TypeResolver<List<T>> variadic(TypeResolver<T> element) {
        return stream -> {
            var values = new ArrayList<T>();
            while (!stream.isEnd()) {
                var result = element.resolve(stream);
                if (result instanceof ParseResult.Failure<T> failure) {
                    return ParseResult.failure(failure.cause());
                }
                values.add(result.unwrap());
            }
            return ParseResult.success(Collections.unmodifiableList(values));
        };
    }

    private static ParseResult<String> token(TokenStream stream, String type) {
        return stream.consume()
                     .map(ParseResult::success)
                     .orElseGet(() -> ParseResult.failure(new CommandError.InsufficientArguments(type)));
    }

    private static ParseResult<Integer> parseInteger(String token) {
        if (!INTEGER.matcher(token).matches()) {
            return ParseResult.failure(CommandError.InvalidValue.of("integer", token));
        }
        try {
            return ParseResult.success(Integer.parseInt(token));
        } catch (NumberFormatException e) {
            return ParseResult.failure(new CommandError.InvalidValue("integer", token, "out of range"));
        }
    }

    private static ParseResult<Double> parseFloat(String token) {
        var sign = token.startsWith("-") ? -1.0 : 1.0;
        var body = token.startsWith("-") || token.startsWith("+")
                   ? token.substring(1)
                   : token;

        if (body.equals("inf")) {
            return ParseResult.success(sign * Double.POSITIVE_INFINITY);
        }
        if (body.equals("nan")) {
            return ParseResult.success(Double.NaN);
        }
        if (body.isEmpty() || body.equals(".") || !UNSIGNED_FLOAT.matcher(body).matches()) {
            return ParseResult.failure(CommandError.InvalidValue.of("float", token));
        }
        return ParseResult.success(sign * Double.parseDouble(body));
    }

    private static ParseResult<Boolean> parseBoolean(String token) {
        return switch (token) {
            case "true" -> ParseResult.success(true);
            case "false" -> ParseResult.success(false);
            default -> ParseResult.failure(CommandError.InvalidValue.of("boolean", token));
        };
    }
}
