package io.templatexform.core;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;

/** Loads component sources from {@code src/test/resources/components}. */
public final class Fixtures {

    private Fixtures() {}

    public static String component(String name) {
        try (InputStream in = Fixtures.class.getResourceAsStream("/components/" + name)) {
            if (in == null) {
                throw new IllegalArgumentException("No component fixture: " + name);
            }
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
