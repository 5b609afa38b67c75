package org.pragmatica.sifter.grammar;

import java.util.List;

/**
 * A flag matched by one or more names ({@code --long} or {@code -c}), with its own arguments.
 */
public record OptionDefinition(
 String id,
 List<String> names,
 List<ArgumentDefinition<?>> arguments) {

    /**
     * Option without arguments. Only its occurrence count is recorded.
     */
    public static OptionDefinition flag(String id, String... names) {
        return new OptionDefinition(id, List.of(names), List.of());
    }

    public static OptionDefinition option(String id, List<String> names, ArgumentDefinition<?>... arguments) {
        return new OptionDefinition(id, List.copyOf(names), List.of(arguments));
    }

    public boolean matches(String name) {
        return names.contains(name);
    }

    public boolean hasArguments() {
        return !arguments.isEmpty();
    }

    public static boolean isLongName(String name) {
        return name.length() > 2 && name.startsWith("--") && name.charAt(2) != '-' && name.indexOf('=') < 0;
    }

    public static boolean isShortName(String name) {
        return name.length() == 2 && name.charAt(0) == '-' && name.charAt(1) != '-';
    }
}
