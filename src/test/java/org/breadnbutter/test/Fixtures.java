package org.breadnbutter.test;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;

/**
 * Shared test inputs.
 */
public final class Fixtures {

  private Fixtures() {}

  /** Reads a test resource from the classpath root. */
  public static String load(String name) {
    try (InputStream in = Fixtures.class.getResourceAsStream("/" + name)) {
      if (in == null) {
        throw new IllegalStateException("Missing test resource: " + name);
      }
      return new String(in.readAllBytes(), StandardCharsets.UTF_8);
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
  }

  public static String registration() {
    return load("registration.bnb");
  }

  public static String lines(String... lines) {
    return String.join("\n", lines);
  }
}
