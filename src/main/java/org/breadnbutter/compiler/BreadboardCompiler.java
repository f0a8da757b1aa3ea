package org.breadnbutter.compiler;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import org.breadnbutter.model.Breadboard;
import org.breadnbutter.model.Component;
import org.breadnbutter.model.Place;
import org.breadnbutter.resolve.PlaceGeometry;
import org.breadnbutter.resolve.PositionResolver;
import org.breadnbutter.resolve.ReferenceResolver;
import org.breadnbutter.resolve.SketchRegionValidator;
import org.breadnbutter.resolve.UniformGeometry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point: source text in, resolved {@link Breadboard} (or the full diagnostic list) out.
 *
 * <p>Documents are parsed independently, in parallel when enabled. Merging and the reference,
 * position and sketch stages then run in sequence on the calling thread, because names may
 * cross documents. Every stage runs even after an earlier one has failed. A single compile
 * therefore reports all problems at once.
 *
 * <p>Instances hold no per-compilation state and may be shared.
 */
public class BreadboardCompiler {
  private static final Logger log = LoggerFactory.getLogger(BreadboardCompiler.class);

  private final CompilerOptions options;
  private final PlaceGeometry geometry;

  public BreadboardCompiler() {
    this(CompilerOptions.defaults());
  }

  public BreadboardCompiler(CompilerOptions options) {
    this(options, new UniformGeometry(options.placeWidth(), options.placeHeight()));
  }

  public BreadboardCompiler(CompilerOptions options, PlaceGeometry geometry) {
    this.options = options;
    this.geometry = geometry;
  }

  public CompilerOptions options() {
    return options;
  }

  public Result<Breadboard> compile(String text) {
    return compile(List.of(new SourceDocument("<input>", text)));
  }

  public Result<Breadboard> compile(List<SourceDocument> documents) {
    List<Diagnostic> errors = new ArrayList<>();
    List<Place> places = new ArrayList<>();
    List<Component> components = new ArrayList<>();
    for (ParsedDocument doc : parseAll(documents)) {
      errors.addAll(doc.errors);
      places.addAll(doc.places);
      components.addAll(doc.components);
    }
    log.debug("Parsed {} document(s): {} places, {} components, {} syntax errors",
        documents.size(), places.size(), components.size(), errors.size());

    Result<Breadboard> result = resolve(places, components, errors);
    if (result.isSuccess()) {
      log.info("Compiled breadboard with {} places and {} components",
          result.value().places.size(), result.value().components.size());
    } else {
      log.info("Compilation failed with {} error(s)", result.diagnostics().size());
    }
    return result;
  }

  /**
   * Re-runs reference, position and sketch resolution. On an already resolved breadboard this
   * returns an equal breadboard.
   */
  public Result<Breadboard> resolve(Breadboard board) {
    return resolve(new ArrayList<>(board.places()), new ArrayList<>(board.components()), new ArrayList<>());
  }

  private Result<Breadboard> resolve(List<Place> places, List<Component> components, List<Diagnostic> errors) {
    ReferenceResolver references = new ReferenceResolver(places, components);
    Breadboard board = references.resolve();
    errors.addAll(references.errors());

    PositionResolver positions = new PositionResolver(geometry);
    board = positions.resolve(board);
    errors.addAll(positions.errors());

    SketchRegionValidator sketches = new SketchRegionValidator(options.regionMatching());
    errors.addAll(sketches.validate(board));

    return errors.isEmpty() ? Result.ok(board) : Result.failed(errors);
  }

  public ParsedDocument parse(SourceDocument document) {
    Parser parser = new Parser(new Lexer(document.text, options.nestingMarker()), document.name);
    ParseTree tree = parser.parse();
    return new AstBuilder().build(tree, parser.errors());
  }

  // Results come back in document order regardless of which parse finishes first
  List<ParsedDocument> parseAll(List<SourceDocument> documents) {
    List<ParsedDocument> out = new ArrayList<>(documents.size());
    if (!options.parallelParsing() || documents.size() < 2) {
      for (SourceDocument doc : documents) {
        out.add(parse(doc));
      }
      return out;
    }

    int threads = Math.min(documents.size(), Runtime.getRuntime().availableProcessors());
    ExecutorService executorService = Executors.newFixedThreadPool(threads);
    try {
      List<Future<ParsedDocument>> futures = new ArrayList<>();
      for (SourceDocument doc : documents) {
        futures.add(executorService.submit(() -> parse(doc)));
      }
      for (Future<ParsedDocument> future : futures) {
        out.add(future.get());
      }
      return out;
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new IllegalStateException("Interrupted while parsing", e);
    } catch (ExecutionException e) {
      Throwable cause = e.getCause();
      if (cause instanceof RuntimeException) {
        throw (RuntimeException) cause;
      }
      throw new IllegalStateException("Parsing failed", cause);
    } finally {
      executorService.shutdownNow();
    }
  }
}
