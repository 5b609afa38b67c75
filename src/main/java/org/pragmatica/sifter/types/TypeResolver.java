package org.pragmatica.sifter.types;

import org.pragmatica.sifter.parser.ParseResult;
import org.pragmatica.sifter.parser.TokenStream;

/**
 * Converts token(s) at the cursor into a typed value.
 *
 * <p>A resolver consumes what it needs starting at the cursor. On failure the stream
 * position is unspecified; callers that may recover must snapshot the stream first.
 * Host applications add their own types by implementing this interface.
 */
@FunctionalInterface
public interface TypeResolver<T> {

    ParseResult<T> resolve(TokenStream stream);
}
