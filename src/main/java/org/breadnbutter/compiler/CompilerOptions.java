package org.breadnbutter.compiler;

import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.Scanner;

import com.google.gson.Gson;
import com.google.gson.JsonParseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Compiler settings, read from JSON with Gson.
 *
 * <p>{@link #defaults()} loads {@value #DEFAULTS_RESOURCE} from the classpath. Fields missing
 * from a JSON document keep their built-in values.
 */
public class CompilerOptions {
  private static final Logger log = LoggerFactory.getLogger(CompilerOptions.class);

  public static final String DEFAULTS_RESOURCE = "/org/breadnbutter/compiler/defaults.json";
  public static final char DEFAULT_MARKER = '>';

  char nestingMarker = DEFAULT_MARKER;
  RegionMatching regionMatching = RegionMatching.EXACT;
  boolean parallelParsing = true;
  double placeWidth = 300;
  double placeHeight = 200;

  public CompilerOptions() {}

  private CompilerOptions(CompilerOptions other) {
    this.nestingMarker = other.nestingMarker;
    this.regionMatching = other.regionMatching;
    this.parallelParsing = other.parallelParsing;
    this.placeWidth = other.placeWidth;
    this.placeHeight = other.placeHeight;
  }

  public static CompilerOptions defaults() {
    return loadFromResources(DEFAULTS_RESOURCE);
  }

  public static CompilerOptions loadFromResources(String resourcePath) {
    InputStream inputStream = CompilerOptions.class.getResourceAsStream(resourcePath);
    if (inputStream == null) {
      throw new IllegalStateException("Configuration file not found: " + resourcePath);
    }

    try (Scanner scanner = new Scanner(inputStream, StandardCharsets.UTF_8.name())) {
      String jsonText = scanner.useDelimiter("\\A").next(); // Read the entire file
      CompilerOptions options = fromJson(jsonText);
      log.debug("Loaded compiler options from {}: {}", resourcePath, options);
      return options;
    }
  }

  /**
   * @throws IllegalArgumentException if the JSON is malformed or describes invalid options
   */
  public static CompilerOptions fromJson(String jsonText) {
    CompilerOptions options;
    try {
      options = new Gson().fromJson(jsonText, CompilerOptions.class);
    } catch (JsonParseException e) {
      throw new IllegalArgumentException("Bad compiler options: " + e.getMessage(), e);
    }
    if (options == null) {
      options = new CompilerOptions();
    }
    options.validate();
    return options;
  }

  void validate() {
    Lexer.checkMarker(nestingMarker);
    if (regionMatching == null) {
      throw new IllegalArgumentException("regionMatching must be one of exact, normalized");
    }
    if (placeWidth < 0 || placeHeight < 0) {
      throw new IllegalArgumentException("place size cannot be negative");
    }
  }

  public char nestingMarker() {
    return nestingMarker;
  }

  public RegionMatching regionMatching() {
    return regionMatching;
  }

  public boolean parallelParsing() {
    return parallelParsing;
  }

  public double placeWidth() {
    return placeWidth;
  }

  public double placeHeight() {
    return placeHeight;
  }

  public CompilerOptions withNestingMarker(char marker) {
    CompilerOptions copy = new CompilerOptions(this);
    copy.nestingMarker = marker;
    copy.validate();
    return copy;
  }

  public CompilerOptions withRegionMatching(RegionMatching matching) {
    CompilerOptions copy = new CompilerOptions(this);
    copy.regionMatching = matching;
    copy.validate();
    return copy;
  }

  public CompilerOptions withParallelParsing(boolean parallel) {
    CompilerOptions copy = new CompilerOptions(this);
    copy.parallelParsing = parallel;
    return copy;
  }

  public CompilerOptions withPlaceSize(double width, double height) {
    CompilerOptions copy = new CompilerOptions(this);
    copy.placeWidth = width;
    copy.placeHeight = height;
    copy.validate();
    return copy;
  }

  @Override
  public String toString() {
    return "CompilerOptions{" +
        "nestingMarker='" + nestingMarker + '\'' +
        ", regionMatching=" + regionMatching +
        ", parallelParsing=" + parallelParsing +
        ", placeWidth=" + placeWidth +
        ", placeHeight=" + placeHeight +
        '}';
  }
}
