package org.pragmatica.sifter.grammar;

import org.pragmatica.sifter.error.CommandError;
import org.pragmatica.sifter.parser.ParseResult;

import java.util.Collections;
import java.util.HashSet;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Registration-time checks over a verb graph. Reports the first defect found, depth first.
 */
final class GrammarValidator {
    private GrammarValidator() {}

    static ParseResult<VerbDefinition> validate(VerbDefinition root) {
        Set<VerbDefinition> visited = Collections.newSetFromMap(new IdentityHashMap<>());
        return findDefect(root, visited)
            .<ParseResult<VerbDefinition>>map(ParseResult::failure)
            .orElseGet(() -> ParseResult.success(root));
    }

    private static Optional<CommandError> findDefect(VerbDefinition verb, Set<VerbDefinition> visited) {
        if (!visited.add(verb)) {
            return Optional.empty();
        }

        var defect = checkArguments(verb.id(), verb.positionals())
            .or(() -> checkOptions(verb));
        if (defect.isPresent()) {
            return defect;
        }

        for (var subverb : verb.subverbs()) {
            var nested = findDefect(subverb, visited);
            if (nested.isPresent()) {
                return nested;
            }
        }
        return Optional.empty();
    }

    private static Optional<CommandError> checkArguments(String owner, List<ArgumentDefinition<?>> arguments) {
        var seenOptional = false;
        for (var argument : arguments) {
            if (argument.isRequired() && seenOptional) {
                return Optional.of(new CommandError.ArgumentOrder(owner, argument.id()));
            }
            if (argument.optional() && argument.defaultValue() == null) {
                return Optional.of(new CommandError.MissingDefault(owner, argument.id()));
            }
            seenOptional |= argument.optional();
        }
        return Optional.empty();
    }

    private static Optional<CommandError> checkOptions(VerbDefinition verb) {
        var names = new HashSet<String>();
        for (var option : verb.options()) {
            for (var name : option.names()) {
                if (!OptionDefinition.isLongName(name) && !OptionDefinition.isShortName(name)) {
                    return Optional.of(new CommandError.InvalidOptionName(option.id(), name));
                }
                if (!names.add(name)) {
                    return Optional.of(new CommandError.DuplicateOptionName(verb.id(), name));
                }
            }
            var defect = checkArguments(option.id(), option.arguments());
            if (defect.isPresent()) {
                return defect;
            }
        }
        return Optional.empty();
    }
}
