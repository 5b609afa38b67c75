package org.pragmatica.sifter.error;

import java.util.List;

/**
 * Command parsing error with its kind and a human-readable message.
 */
public sealed interface CommandError {

    /**
     * Error category.
     */
    enum Kind {
        /**
         * Defect in the grammar itself. Reported when the grammar is registered.
         */
        GRAMMAR_DEFINITION,

        /**
         * Bad input from the user invoking the command.
         */
        USER_INPUT
    }

    Kind kind();

    String message();

    // === Grammar definition errors ===

    /**
     * Required argument declared after an optional one.
     */
    record ArgumentOrder(String owner, String argumentId) implements CommandError {
        @Override
        public Kind kind() {
            return Kind.GRAMMAR_DEFINITION;
        }

        @Override
        public String message() {
            return "required argument '" + argumentId + "' of '" + owner + "' follows an optional one";
        }
    }

    /**
     * Two options of the same verb share a name.
     */
    record DuplicateOptionName(String verbId, String name) implements CommandError {
        @Override
        public Kind kind() {
            return Kind.GRAMMAR_DEFINITION;
        }

        @Override
        public String message() {
            return "duplicate option name " + name + " in verb '" + verbId + "'";
        }
    }

    /**
     * Option name which is neither {@code --long} nor {@code -c}.
     */
    record InvalidOptionName(String optionId, String name) implements CommandError {
        @Override
        public Kind kind() {
            return Kind.GRAMMAR_DEFINITION;
        }

        @Override
        public String message() {
            return "invalid name '" + name + "' for option '" + optionId + "'";
        }
    }

    /**
     * Optional argument without a default value.
     */
    record MissingDefault(String owner, String argumentId) implements CommandError {
        @Override
        public Kind kind() {
            return Kind.GRAMMAR_DEFINITION;
        }

        @Override
        public String message() {
            return "optional argument '" + argumentId + "' of '" + owner + "' has no default value";
        }
    }

    // === User input errors ===

    record UnknownOption(String name) implements CommandError {
        @Override
        public Kind kind() {
            return Kind.USER_INPUT;
        }

        @Override
        public String message() {
            return "unknown option: " + name;
        }
    }

    /**
     * Token rejected by a type resolver.
     */
    record InvalidValue(String type, String token, String detail) implements CommandError {
        public static InvalidValue of(String type, String token) {
            return new InvalidValue(type, token, "");
        }

        @Override
        public Kind kind() {
            return Kind.USER_INPUT;
        }

        @Override
        public String message() {
            return detail.isEmpty()
                   ? "invalid " + type + ": " + token
                   : "invalid " + type + ": " + token + ", " + detail;
        }
    }

    record TooManyArguments(String token) implements CommandError {
        @Override
        public Kind kind() {
            return Kind.USER_INPUT;
        }

        @Override
        public String message() {
            return "too many arguments: " + token;
        }
    }

    record InsufficientArguments(String argumentId) implements CommandError {
        @Override
        public Kind kind() {
            return Kind.USER_INPUT;
        }

        @Override
        public String message() {
            return "insufficient arguments: missing '" + argumentId + "'";
        }
    }

    record UnknownSubcommand(String token) implements CommandError {
        @Override
        public Kind kind() {
            return Kind.USER_INPUT;
        }

        @Override
        public String message() {
            return "unknown subcommand: " + token;
        }
    }

    /**
     * Attached value ({@code --flag=value}) given to an option without arguments.
     */
    record UnexpectedOptionValue(String option) implements CommandError {
        @Override
        public Kind kind() {
            return Kind.USER_INPUT;
        }

        @Override
        public String message() {
            return "option " + option + " does not need any argument";
        }
    }

    /**
     * Leading token of a command line does not name the command.
     */
    record UnknownCommand(String token, List<String> expected) implements CommandError {
        @Override
        public Kind kind() {
            return Kind.USER_INPUT;
        }

        @Override
        public String message() {
            return "unknown command: " + token + ", expected one of: " + String.join(", ", expected);
        }
    }

    /**
     * Too many unnamed subcommand trials within one parse.
     */
    record TrialLimitExceeded(int limit) implements CommandError {
        @Override
        public Kind kind() {
            return Kind.USER_INPUT;
        }

        @Override
        public String message() {
            return "ambiguous input: more than " + limit + " subcommand trials";
        }
    }

    /**
     * Cyclic grammar: an unnamed subcommand chain re-enters a verb without consuming input.
     */
    record RecursiveSubcommand(String verbId) implements CommandError {
        @Override
        public Kind kind() {
            return Kind.GRAMMAR_DEFINITION;
        }

        @Override
        public String message() {
            return "grammar cycle: unnamed subcommand '" + verbId + "' re-entered without consuming input";
        }
    }
}
