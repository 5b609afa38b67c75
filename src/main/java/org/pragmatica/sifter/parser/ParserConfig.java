package org.pragmatica.sifter.parser;

/**
 * Parser configuration options.
 *
 * @param maxTrialParses upper bound on unnamed subcommand trials within one parse
 * @param inheritOptions whether unnamed subcommands also accept their parent's options
 */
public record ParserConfig(
    int maxTrialParses,
    boolean inheritOptions
) {
    public static final ParserConfig DEFAULT = new ParserConfig(
        256,
        true
    );

    public ParserConfig {
        if (maxTrialParses < 1) {
            throw new IllegalArgumentException("maxTrialParses must be positive, got " + maxTrialParses);
        }
    }
}
