package org.pragmatica.sifter.parser;

import org.pragmatica.sifter.error.CommandError;
import org.pragmatica.sifter.grammar.ArgumentDefinition;
import org.pragmatica.sifter.grammar.OptionDefinition;
import org.pragmatica.sifter.grammar.VerbDefinition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Recursive-descent command parsing engine - interprets a verb grammar over a token stream.
 *
 * <p>Trailing optional option arguments and unnamed subcommands are parsed speculatively:
 * the stream is snapshotted, the attempt runs, and the snapshot is committed or rolled back
 * depending on the returned {@link ParseResult}.
 */
public final class SifterEngine implements CommandParser {
    private static final Logger log = LoggerFactory.getLogger(SifterEngine.class);

    private static final String END_OF_OPTIONS = "--";

    private final VerbDefinition grammar;
    private final ParserConfig config;

    private SifterEngine(VerbDefinition grammar, ParserConfig config) {
        this.grammar = grammar;
        this.config = config;
    }

    /**
     * Create an engine for an already validated grammar.
     */
    public static SifterEngine create(VerbDefinition grammar, ParserConfig config) {
        return new SifterEngine(grammar, config);
    }

    @Override
    public VerbDefinition grammar() {
        return grammar;
    }

    @Override
    public ParserConfig config() {
        return config;
    }

    @Override
    public ParseResult<ResultRecord> parse(List<String> arguments) {
        var session = new Session(TokenStream.of(arguments), config);
        var result = parseVerb(session, grammar, List.of());

        if (session.stream().depth() != 0) {
            throw new IllegalStateException("Unbalanced token stream snapshots: " + session.stream().depth());
        }
        return result;
    }

    @Override
    public ParseResult<ResultRecord> parseCommandLine(List<String> tokens) {
        if (tokens.isEmpty() || !grammar.matches(tokens.get(0))) {
            var names = new ArrayList<String>();
            names.add(grammar.name());
            names.addAll(grammar.aliases());
            var found = tokens.isEmpty() ? "" : tokens.get(0);
            return ParseResult.failure(new CommandError.UnknownCommand(found, names));
        }
        return parse(tokens.subList(1, tokens.size()));
    }

    // === Verbs ===

    private ParseResult<ResultRecord> parseVerb(Session session,
                                                VerbDefinition verb,
                                                List<OptionDefinition> inheritedOptions) {
        var stream = session.stream();
        var record = ResultRecord.create();
        var options = visibleOptions(verb, inheritedOptions);
        var positionals = verb.positionals();
        var positionalIndex = 0;
        var optionsEnabled = true;
        var subverbParsed = false;

        while (!stream.isEnd()) {
            var token = stream.peek();

            if (optionsEnabled && isOptionToken(token)) {
                if (token.equals(END_OF_OPTIONS)) {
                    stream.consume();
                    optionsEnabled = false;
                    continue;
                }
                var result = token.startsWith("--")
                             ? parseLongOption(session, record, options, token)
                             : parseShortOption(session, record, options, token);
                if (result.isFailure()) {
                    return result;
                }
                continue;
            }

            if (positionalIndex < positionals.size()) {
                var argument = positionals.get(positionalIndex++);
                var result = parseArgument(stream, record, argument, argument.isRequired());
                if (result.isFailure()) {
                    return result;
                }
                continue;
            }

            if (!verb.subverbs().isEmpty()) {
                var result = parseSubverb(session, record, verb, options);
                if (result.isFailure()) {
                    return result;
                }
                subverbParsed = true;
                break;
            }

            return ParseResult.failure(new CommandError.TooManyArguments(token));
        }

        Set<VerbDefinition> visited = Collections.newSetFromMap(new IdentityHashMap<>());
        return fillDefaults(record, verb, positionalIndex, !subverbParsed, visited);
    }

    private static List<OptionDefinition> visibleOptions(VerbDefinition verb, List<OptionDefinition> inherited) {
        if (inherited.isEmpty()) {
            return verb.options();
        }
        var options = new ArrayList<OptionDefinition>(inherited);
        options.addAll(verb.options());
        return options;
    }

    private static boolean isOptionToken(String token) {
        return token.length() > 1 && token.charAt(0) == '-';
    }

    // === Subverbs ===

    private ParseResult<ResultRecord> parseSubverb(Session session,
                                                   ResultRecord record,
                                                   VerbDefinition verb,
                                                   List<OptionDefinition> options) {
        var stream = session.stream();
        var token = stream.peek();

        for (var subverb : verb.subverbs()) {
            if (subverb.matches(token)) {
                stream.consume();
                return parseVerb(session, subverb, List.of())
                    .map(nested -> record.set(subverb.id(), nested));
            }
        }

        var unnamed = verb.subverbs()
                          .stream()
                          .filter(VerbDefinition::isUnnamed)
                          .toList();
        if (unnamed.isEmpty()) {
            return ParseResult.failure(new CommandError.UnknownSubcommand(token));
        }

        var inherited = config.inheritOptions() ? options : List.<OptionDefinition>of();
        CommandError firstError = null;

        for (var candidate : unnamed) {
            var attempt = trySubverb(session, candidate, inherited);

            if (attempt.isSuccess()) {
                return attempt.map(nested -> {
                    countInheritedOptions(record, nested, inherited);
                    return record.set(candidate.id(), nested);
                });
            }

            var error = attempt.error().orElseThrow();
            if (error instanceof CommandError.TrialLimitExceeded) {
                return ParseResult.failure(error);
            }
            if (firstError == null) {
                firstError = error;
            }
        }
        return ParseResult.failure(firstError);
    }

    /**
     * Options an unnamed subcommand consumed on behalf of its parent are also bound in the parent
     * record, adding to occurrences the parent counted itself.
     */
    private static void countInheritedOptions(ResultRecord record,
                                              ResultRecord nested,
                                              List<OptionDefinition> inherited) {
        for (var option : inherited) {
            if (!nested.has(option.id())) {
                continue;
            }
            if (!sharesIdWithArgument(option)) {
                record.set(option.id(), record.count(option.id()) + nested.count(option.id()));
            }
            for (var argument : option.arguments()) {
                nested.get(argument.id())
                      .ifPresent(value -> record.set(argument.id(), value));
            }
        }
    }

    private static boolean sharesIdWithArgument(OptionDefinition option) {
        return option.arguments()
                     .stream()
                     .anyMatch(argument -> argument.id().equals(option.id()));
    }

    private ParseResult<ResultRecord> trySubverb(Session session,
                                                 VerbDefinition candidate,
                                                 List<OptionDefinition> inherited) {
        var stream = session.stream();

        if (!session.countTrial()) {
            return ParseResult.failure(new CommandError.TrialLimitExceeded(config.maxTrialParses()));
        }
        if (session.isActive(candidate, stream.pos())) {
            return ParseResult.failure(new CommandError.RecursiveSubcommand(candidate.id()));
        }

        log.debug("Trying unnamed subcommand '{}' at token {}", candidate.id(), stream.pos());

        var depth = stream.depth();
        stream.snapshot();
        session.enter(candidate, stream.pos());

        var result = parseVerb(session, candidate, inherited);

        session.leave();
        if (stream.depth() != depth + 1) {
            throw new IllegalStateException("Unbalanced token stream snapshots in subcommand '" + candidate.id() + "'");
        }

        if (result.isSuccess()) {
            stream.commit();
            log.debug("Unnamed subcommand '{}' matched", candidate.id());
        } else {
            stream.rollback();
            log.debug("Unnamed subcommand '{}' rejected: {}",
                      candidate.id(),
                      result.error().map(CommandError::message).orElse(""));
        }
        return result;
    }

    // === Options ===

    private ParseResult<ResultRecord> parseLongOption(Session session,
                                                      ResultRecord record,
                                                      List<OptionDefinition> options,
                                                      String token) {
        var stream = session.stream();
        stream.consume();

        var separator = token.indexOf('=');
        var name = separator < 0 ? token : token.substring(0, separator);
        var option = findOption(options, name);

        if (option.isEmpty()) {
            return ParseResult.failure(new CommandError.UnknownOption(name));
        }

        var adjacent = separator >= 0;
        if (adjacent) {
            stream.insert(token.substring(separator + 1));
        }

        record.increment(option.get().id());
        return parseOptionArguments(stream, record, option.get(), adjacent, name);
    }

    private ParseResult<ResultRecord> parseShortOption(Session session,
                                                       ResultRecord record,
                                                       List<OptionDefinition> options,
                                                       String token) {
        var stream = session.stream();
        stream.consume();

        for (int i = 1; i < token.length(); i++) {
            var name = "-" + token.charAt(i);
            var option = findOption(options, name);

            if (option.isEmpty()) {
                return ParseResult.failure(new CommandError.UnknownOption(name));
            }

            record.increment(option.get().id());
            if (!option.get().hasArguments()) {
                continue;
            }

            // -oVALUE: the rest of the cluster is the first argument
            var attached = token.substring(i + 1);
            if (!attached.isEmpty()) {
                stream.insert(attached);
            }
            return parseOptionArguments(stream, record, option.get(), !attached.isEmpty(), name);
        }
        return ParseResult.success(record);
    }

    private static Optional<OptionDefinition> findOption(List<OptionDefinition> options, String name) {
        return options.stream()
                      .filter(option -> option.matches(name))
                      .findFirst();
    }

    /**
     * Parse the arguments of one option occurrence. Required arguments must parse. Optional ones
     * are attempted in order until one fails; it and everything after it get their defaults.
     * An attached value makes the first argument mandatory.
     */
    private static ParseResult<ResultRecord> parseOptionArguments(TokenStream stream,
                                                                  ResultRecord record,
                                                                  OptionDefinition option,
                                                                  boolean adjacent,
                                                                  String name) {
        var arguments = option.arguments();

        if (adjacent && arguments.isEmpty()) {
            return ParseResult.failure(new CommandError.UnexpectedOptionValue(name));
        }

        for (int i = 0; i < arguments.size(); i++) {
            var argument = arguments.get(i);

            if (argument.isRequired() || (adjacent && i == 0)) {
                var result = parseArgument(stream, record, argument, true);
                if (result.isFailure()) {
                    return result;
                }
                continue;
            }

            stream.snapshot();
            var result = parseArgument(stream, record, argument, false);
            if (result.isSuccess()) {
                stream.commit();
                continue;
            }

            stream.rollback();
            log.debug("Option {} falls back to defaults from argument '{}'", name, argument.id());
            for (var remaining : arguments.subList(i, arguments.size())) {
                record.set(remaining.id(), remaining.defaultValue());
            }
            break;
        }
        return ParseResult.success(record);
    }

    // === Arguments ===

    private static ParseResult<ResultRecord> parseArgument(TokenStream stream,
                                                           ResultRecord record,
                                                           ArgumentDefinition<?> argument,
                                                           boolean required) {
        if (required && stream.isEnd()) {
            return ParseResult.failure(new CommandError.InsufficientArguments(argument.id()));
        }
        return argument.type()
                       .resolve(stream)
                       .map(value -> record.set(argument.id(), value));
    }

    // === Defaults ===

    /**
     * Complete a verb once its tokens are exhausted: remaining positionals take their defaults,
     * and if no subcommand was given the first unnamed subcommand with only optional positionals
     * contributes its defaults to the same record.
     */
    private static ParseResult<ResultRecord> fillDefaults(ResultRecord record,
                                                          VerbDefinition verb,
                                                          int positionalIndex,
                                                          boolean searchUnnamed,
                                                          Set<VerbDefinition> visited) {
        visited.add(verb);

        var positionals = verb.positionals();
        for (var argument : positionals.subList(positionalIndex, positionals.size())) {
            if (argument.isRequired()) {
                return ParseResult.failure(new CommandError.InsufficientArguments(argument.id()));
            }
            record.set(argument.id(), argument.defaultValue());
        }

        if (searchUnnamed) {
            var candidate = verb.subverbs()
                                .stream()
                                .filter(subverb -> subverb.isUnnamed() && subverb.allPositionalsOptional())
                                .findFirst();

            if (candidate.isPresent() && !visited.contains(candidate.get())) {
                var subverb = candidate.get();
                log.debug("Filling defaults of unnamed subcommand '{}'", subverb.id());

                var filled = fillDefaults(record, subverb, 0, true, visited);
                if (filled.isFailure()) {
                    return filled;
                }
            }
        }

        fillAbsentOptions(record, verb.options());
        record.set(verb.id(), true);
        return ParseResult.success(record);
    }

    private static void fillAbsentOptions(ResultRecord record, List<OptionDefinition> options) {
        for (var option : options) {
            if (record.has(option.id())) {
                continue;
            }
            for (var argument : option.arguments()) {
                if (argument.optional() && !record.has(argument.id())) {
                    record.set(argument.id(), argument.defaultValue());
                }
            }
            // an argument sharing the option id keeps its default
            if (!record.has(option.id())) {
                record.set(option.id(), 0);
            }
        }
    }

    // === Per-invocation state ===

    private static final class Session {
        private final TokenStream stream;
        private final int maxTrials;
        private final Deque<ActiveTrial> active = new ArrayDeque<>();
        private int trials;

        private Session(TokenStream stream, ParserConfig config) {
            this.stream = stream;
            this.maxTrials = config.maxTrialParses();
        }

        TokenStream stream() {
            return stream;
        }

        boolean countTrial() {
            return ++trials <= maxTrials;
        }

        // Identity comparison: verb records may form cycles, structural equality would not terminate
        boolean isActive(VerbDefinition verb, int pos) {
            for (var trial : active) {
                if (trial.verb() == verb && trial.pos() == pos) {
                    return true;
                }
            }
            return false;
        }

        void enter(VerbDefinition verb, int pos) {
            active.push(new ActiveTrial(verb, pos));
        }

        void leave() {
            active.pop();
        }
    }

    private record ActiveTrial(VerbDefinition verb, int pos) {}
}
