package org.pragmatica.sifter.parser;

import org.pragmatica.sifter.grammar.VerbDefinition;

import java.util.List;

/**
 * Parses tokenized command input according to a validated verb grammar.
 * Implementations hold no per-call state and may be shared between threads.
 */
public interface CommandParser {

    /**
     * Parse the arguments following the command name.
     */
    ParseResult<ResultRecord> parse(List<String> arguments);

    default ParseResult<ResultRecord> parse(String... arguments) {
        return parse(List.of(arguments));
    }

    /**
     * Parse a full command line. The first token must be the root verb's name or one of its aliases.
     */
    ParseResult<ResultRecord> parseCommandLine(List<String> tokens);

    VerbDefinition grammar();

    ParserConfig config();
}
