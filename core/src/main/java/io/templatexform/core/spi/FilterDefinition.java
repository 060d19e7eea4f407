package io.templatexform.core.spi;

import java.util.List;
import java.util.Objects;

/**
 * An engine-specific filter: its name plus default arguments.
 *
 * @param name engine filter or helper name, e.g. {@code upcase}
 * @param args default arguments as source text, e.g. {@code "%Y-%m-%d"} with its quotes
 */
public record FilterDefinition(String name, List<String> args) {

    public FilterDefinition {
        Objects.requireNonNull(name, "name must not be null");
        args = args != null ? List.copyOf(args) : List.of();
    }

    public static FilterDefinition of(String name) {
        return new FilterDefinition(name, List.of());
    }

    public static FilterDefinition of(String name, String... args) {
        return new FilterDefinition(name, List.of(args));
    }

    public boolean hasArgs() {
        return !args.isEmpty();
    }
}
