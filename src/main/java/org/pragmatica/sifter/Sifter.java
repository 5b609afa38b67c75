package org.pragmatica.sifter;

import org.pragmatica.sifter.grammar.VerbDefinition;
import org.pragmatica.sifter.parser.CommandParser;
import org.pragmatica.sifter.parser.ParseResult;
import org.pragmatica.sifter.parser.ParserConfig;
import org.pragmatica.sifter.parser.ResultRecord;
import org.pragmatica.sifter.parser.SifterEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Entry point for creating command parsers.
 *
 * <p>Example usage:
 * <pre>{@code
 * var mv = VerbDefinition.builder("mv")
 *                        .name("mv")
 *                        .positional(ArgumentDefinition.required("src", Resolvers.string()))
 *                        .positional(ArgumentDefinition.required("dst", Resolvers.string()))
 *                        .build();
 *
 * var parser = Sifter.fromGrammar(mv).unwrap();
 * var result = parser.parseCommandLine(List.of("mv", "a.txt", "b.txt"));
 * }</pre>
 */
public final class Sifter {
    private static final Logger log = LoggerFactory.getLogger(Sifter.class);

    private Sifter() {}

    /**
     * Validate the grammar and create a parser for it.
     */
    public static ParseResult<CommandParser> fromGrammar(VerbDefinition grammar) {
        return fromGrammar(grammar, ParserConfig.DEFAULT);
    }

    /**
     * Validate the grammar and create a parser with custom configuration.
     */
    public static ParseResult<CommandParser> fromGrammar(VerbDefinition grammar, ParserConfig config) {
        return grammar.validate()
                      .onFailure(error -> log.debug("Grammar '{}' rejected: {}", grammar.id(), error.message()))
                      .map(verb -> (CommandParser) SifterEngine.create(verb, config));
    }

    /**
     * Validate the grammar and parse the arguments following the command name in one go.
     * Grammar defects are reported before any token is looked at.
     */
    public static ParseResult<ResultRecord> parse(VerbDefinition grammar, List<String> arguments) {
        return fromGrammar(grammar).flatMap(parser -> parser.parse(arguments));
    }

    /**
     * Create a builder for more complex parser configuration.
     */
    public static Builder builder(VerbDefinition grammar) {
        return new Builder(grammar);
    }

    public static final class Builder {
        private final VerbDefinition grammar;
        private int maxTrialParses = ParserConfig.DEFAULT.maxTrialParses();
        private boolean inheritOptions = ParserConfig.DEFAULT.inheritOptions();

        private Builder(VerbDefinition grammar) {
            this.grammar = grammar;
        }

        public Builder maxTrialParses(int limit) {
            this.maxTrialParses = limit;
            return this;
        }

        public Builder inheritOptions(boolean inherit) {
            this.inheritOptions = inherit;
            return this;
        }

        public ParseResult<CommandParser> build() {
            var config = new ParserConfig(maxTrialParses, inheritOptions);
            return fromGrammar(grammar, config);
        }
    }
}
