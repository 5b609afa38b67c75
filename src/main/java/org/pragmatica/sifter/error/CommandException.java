package org.pragmatica.sifter.error;

/**
 * Unchecked carrier for a {@link CommandError}, thrown when a failed result is unwrapped.
 */
public final class CommandException extends RuntimeException {
    private final CommandError error;

    public CommandException(CommandError error) {
        super(error.message());
        this.error = error;
    }

    public CommandError error() {
        return error;
    }

    public CommandError.Kind kind() {
        return error.kind();
    }
}
