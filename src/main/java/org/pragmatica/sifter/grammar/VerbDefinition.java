package org.pragmatica.sifter.grammar;

import org.pragmatica.sifter.parser.ParseResult;

import java.util.ArrayList;
import java.util.List;

/**
 * A command or subcommand: positional arguments, options and child verbs.
 *
 * <p>An empty {@code name} marks an unnamed verb, which is selected only by trial parsing.
 * Verbs are shared read-only between parses. The lists are kept as given, so a host can
 * (by mistake) build a cyclic graph; the parser tolerates that.
 */
public record VerbDefinition(
 String id,
 String name,
 List<String> aliases,
 List<ArgumentDefinition<?>> positionals,
 List<OptionDefinition> options,
 List<VerbDefinition> subverbs) {

    public static Builder builder(String id) {
        return new Builder(id);
    }

    public boolean isUnnamed() {
        return name.isEmpty();
    }

    public boolean matches(String token) {
        return !isUnnamed() && (name.equals(token) || aliases.contains(token));
    }

    public boolean allPositionalsOptional() {
        return positionals.stream()
                          .allMatch(ArgumentDefinition::optional);
    }

    /**
     * Check the grammar rooted at this verb for authoring defects.
     */
    public ParseResult<VerbDefinition> validate() {
        return GrammarValidator.validate(this);
    }

    /**
     * Shallow description. Subverbs are not rendered, the graph may contain cycles.
     */
    @Override
    public String toString() {
        return "VerbDefinition[id=" + id + ", name=" + name + "]";
    }

    public static final class Builder {
        private final String id;
        private String name = "";
        private final List<String> aliases = new ArrayList<>();
        private final List<ArgumentDefinition<?>> positionals = new ArrayList<>();
        private final List<OptionDefinition> options = new ArrayList<>();
        private final List<VerbDefinition> subverbs = new ArrayList<>();

        private Builder(String id) {
            this.id = id;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder alias(String... aliases) {
            this.aliases.addAll(List.of(aliases));
            return this;
        }

        public Builder positional(ArgumentDefinition<?> argument) {
            positionals.add(argument);
            return this;
        }

        public Builder option(OptionDefinition option) {
            options.add(option);
            return this;
        }

        public Builder subverb(VerbDefinition subverb) {
            subverbs.add(subverb);
            return this;
        }

        public VerbDefinition build() {
            return new VerbDefinition(id,
                                      name,
                                      List.copyOf(aliases),
                                      List.copyOf(positionals),
                                      List.copyOf(options),
                                      List.copyOf(subverbs));
        }
    }
}
