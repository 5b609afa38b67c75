package org.pragmatica.sifter.grammar;

import org.junit.jupiter.api.Test;
import org.pragmatica.sifter.error.CommandError;
import org.pragmatica.sifter.types.Resolvers;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class GrammarValidatorTest {

    @Test
    void validate_wellFormedGrammar_succeeds() {
        var grammar = VerbDefinition.builder("tool")
                                    .name("tool")
                                    .positional(ArgumentDefinition.required("target", Resolvers.string()))
                                    .positional(ArgumentDefinition.optional("count", Resolvers.integer(), 1))
                                    .option(OptionDefinition.flag("verbose", "--verbose", "-v"))
                                    .subverb(VerbDefinition.builder("run").name("run").build())
                                    .build();

        var result = grammar.validate();

        assertTrue(result.isSuccess());
        assertSame(grammar, result.unwrap());
    }

    @Test
    void validate_requiredPositionalAfterOptional_fails() {
        var grammar = VerbDefinition.builder("bad")
                                    .positional(ArgumentDefinition.optional("first", Resolvers.string(), "x"))
                                    .positional(ArgumentDefinition.required("second", Resolvers.string()))
                                    .build();

        var error = grammar.validate().error().orElseThrow();

        assertEquals(new CommandError.ArgumentOrder("bad", "second"), error);
        assertEquals(CommandError.Kind.GRAMMAR_DEFINITION, error.kind());
    }

    @Test
    void validate_requiredOptionArgumentAfterOptional_fails() {
        var option = OptionDefinition.option("range",
                                             List.of("--range"),
                                             ArgumentDefinition.optional("lo", Resolvers.integer(), 0),
                                             ArgumentDefinition.required("hi", Resolvers.integer()));
        var grammar = VerbDefinition.builder("root").option(option).build();

        assertEquals(new CommandError.ArgumentOrder("range", "hi"), grammar.validate().error().orElseThrow());
    }

    @Test
    void validate_defectInNestedSubverb_isFound() {
        var nested = VerbDefinition.builder("child")
                                   .name("child")
                                   .positional(ArgumentDefinition.optional("a", Resolvers.string(), "a"))
                                   .positional(ArgumentDefinition.required("b", Resolvers.string()))
                                   .build();
        var grammar = VerbDefinition.builder("root").subverb(nested).build();

        assertEquals(new CommandError.ArgumentOrder("child", "b"), grammar.validate().error().orElseThrow());
    }

    @Test
    void validate_duplicateOptionName_fails() {
        var grammar = VerbDefinition.builder("root")
                                    .option(OptionDefinition.flag("verbose", "--verbose", "-v"))
                                    .option(OptionDefinition.flag("version", "--version", "-v"))
                                    .build();

        assertEquals(new CommandError.DuplicateOptionName("root", "-v"), grammar.validate().error().orElseThrow());
    }

    @Test
    void validate_sameOptionNameInDifferentVerbs_succeeds() {
        var child = VerbDefinition.builder("child")
                                  .name("child")
                                  .option(OptionDefinition.flag("verbose", "--verbose"))
                                  .build();
        var grammar = VerbDefinition.builder("root")
                                    .option(OptionDefinition.flag("verbose", "--verbose"))
                                    .subverb(child)
                                    .build();

        assertTrue(grammar.validate().isSuccess());
    }

    @Test
    void validate_malformedOptionNames_fail() {
        for (var name : List.of("verbose", "-", "--", "-ab", "--a=b", "---")) {
            var grammar = VerbDefinition.builder("root")
                                        .option(OptionDefinition.flag("opt", name))
                                        .build();

            assertEquals(new CommandError.InvalidOptionName("opt", name),
                         grammar.validate().error().orElseThrow(),
                         "name " + name);
        }
    }

    @Test
    void validate_optionalArgumentWithoutDefault_fails() {
        var grammar = VerbDefinition.builder("root")
                                    .positional(ArgumentDefinition.optional("x", Resolvers.string(), null))
                                    .build();

        assertEquals(new CommandError.MissingDefault("root", "x"), grammar.validate().error().orElseThrow());
    }

    @Test
    void validate_cyclicGrammar_terminates() {
        var subverbs = new ArrayList<VerbDefinition>();
        var loop = new VerbDefinition("loop", "", List.of(), List.of(), List.of(), subverbs);
        subverbs.add(loop);
        var grammar = VerbDefinition.builder("root").subverb(loop).build();

        assertTrue(grammar.validate().isSuccess());
        assertThat(loop.toString()).isEqualTo("VerbDefinition[id=loop, name=]");
    }

    @Test
    void matches_checksNameAndAliases() {
        var verb = VerbDefinition.builder("remove").name("remove").alias("rm", "del").build();
        var unnamed = VerbDefinition.builder("any").build();

        assertTrue(verb.matches("remove"));
        assertTrue(verb.matches("rm"));
        assertFalse(verb.matches("delete"));
        assertTrue(unnamed.isUnnamed());
        assertFalse(unnamed.matches(""));
    }
}
