package com.gentoro.tangle;

import com.gentoro.tangle.diagnostics.DiagnosticsSink;
import com.gentoro.tangle.diagnostics.LoggingDiagnosticsSink;
import com.gentoro.tangle.diagnostics.NoOpDiagnosticsSink;
import com.gentoro.tangle.engine.BlockSymbol;
import com.gentoro.tangle.engine.DocumentParseScheduler;
import com.gentoro.tangle.engine.EngineSettings;
import com.gentoro.tangle.engine.LiterateEngine;
import com.gentoro.tangle.engine.ParseOutcome;
import com.gentoro.tangle.exception.BlockNotFoundException;
import com.gentoro.tangle.exception.ConfigException;
import com.gentoro.tangle.exception.ExceptionUtil;
import com.gentoro.tangle.exception.IoException;
import com.gentoro.tangle.exception.StateException;
import com.gentoro.tangle.extraction.BlockExtractor;
import com.gentoro.tangle.extraction.BlockExtractorFactory;
import com.gentoro.tangle.location.LocationResolver;
import com.gentoro.tangle.logging.LoggingService;
import com.gentoro.tangle.model.CircularReference;
import com.gentoro.tangle.utility.JacksonUtility;
import com.gentoro.tangle.utility.StdoutUtility;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeSet;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.Logger;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import org.apache.commons.configuration2.Configuration;

/**
 * Process-level context: owns the configuration, the block extractor, the engine and the parse
 * scheduler, and runs the selected command.
 */
public class Tangle {

  private static final org.slf4j.Logger log = LoggingService.getLogger(Tangle.class);

  public static final int EXIT_OK = 0;
  public static final int EXIT_FINDINGS = 1;
  public static final int EXIT_FAILURE = 2;

  private final StartupParameters startupParameters;
  private final PrintStream out;
  private final PrintStream err;
  private ConfigurationProvider configurationProvider;
  private BlockExtractor extractor;
  private DiagnosticsSink diagnostics;
  private LiterateEngine engine;
  private DocumentParseScheduler scheduler;
  private final AtomicBoolean shuttingDown = new AtomicBoolean(false);

  public Tangle(String[] applicationArgs) {
    this(applicationArgs, System.out, System.err);
  }

  public Tangle(String[] applicationArgs, PrintStream out, PrintStream err) {
    this.startupParameters = new StartupParameters(applicationArgs);
    this.out = out;
    this.err = err;
  }

  public void initialize() {
    // Disable java logging entirely.
    LogManager.getLogManager().reset();
    Logger.getLogger("").setLevel(Level.OFF);

    this.configurationProvider = new ConfigurationProvider(startupParameters.configFile());
    // Apply logging levels from application.yaml as early as possible
    LoggingService.applyConfiguration(configuration());

    this.extractor = BlockExtractorFactory.create(configuration());
    this.diagnostics = createDiagnosticsSink(configuration());
    this.engine =
        new LiterateEngine(
            extractor,
            new LocationResolver(),
            diagnostics,
            EngineSettings.fromConfiguration(configuration()));

    int threads = configuration().getInt("scheduler.threads", 2);
    if (threads <= 0) {
      throw new ConfigException("scheduler.threads must be positive: " + threads);
    }
    this.scheduler = new DocumentParseScheduler(engine, threads);
    log.debug("Tangle initialized in mode {}", startupParameters.mode());
  }

  private static DiagnosticsSink createDiagnosticsSink(Configuration configuration) {
    String kind =
        configuration.getString("diagnostics.sink", "logging").trim().toLowerCase(Locale.ROOT);
    switch (kind) {
      case "logging":
        return new LoggingDiagnosticsSink(LoggingService.getLogger(DiagnosticsSink.class));
      case "none":
        return new NoOpDiagnosticsSink();
      default:
        throw new ConfigException("Unknown diagnostics.sink: " + kind);
    }
  }

  /** Run the command selected by {@code --mode} and return the process exit status. */
  public int run() {
    if (engine == null) {
      throw new StateException("Tangle not initialized. Call initialize() first.");
    }
    String mode = startupParameters.mode();
    if ("help".equals(mode)) {
      StdoutUtility.printResult(out, usage());
      return EXIT_OK;
    }

    int failures = loadDocuments(Paths.get(startupParameters.getParameter("input", String.class)));

    int status;
    switch (mode) {
      case "outline":
        status = printOutline();
        break;
      case "expand":
        status = printExpansion(startupParameters.getParameter("block", String.class));
        break;
      case "cycles":
        status = printCycles();
        break;
      default:
        throw new IllegalArgumentException("Invalid mode: " + mode);
    }
    return failures > 0 ? Math.max(status, EXIT_FAILURE) : status;
  }

  /** Parse every document under {@code input}; returns the number of documents that failed. */
  int loadDocuments(Path input) {
    List<Path> documents = collectDocuments(input);
    if (documents.isEmpty()) {
      StdoutUtility.printWarning(err, "No markdown documents found under " + input);
    }

    Map<String, CompletableFuture<ParseOutcome>> pending = new LinkedHashMap<>();
    for (Path path : documents) {
      String documentId = documentId(input, path);
      pending.put(documentId, scheduler.submit(documentId, readDocument(path)));
    }

    int failures = 0;
    for (Map.Entry<String, CompletableFuture<ParseOutcome>> entry : pending.entrySet()) {
      try {
        ParseOutcome outcome = entry.getValue().join();
        log.debug("{}: {}", entry.getKey(), outcome.status());
      } catch (CompletionException e) {
        failures++;
        StdoutUtility.printError(
            err, "Failed to parse " + entry.getKey(), ExceptionUtil.unwrap(e));
      }
    }
    return failures;
  }

  private static List<Path> collectDocuments(Path input) {
    if (Files.isRegularFile(input)) {
      return List.of(input);
    }
    if (!Files.isDirectory(input)) {
      throw new IoException("Input not found: " + input.toAbsolutePath());
    }
    try (Stream<Path> files = Files.walk(input)) {
      return files
          .filter(Files::isRegularFile)
          .filter(Tangle::isMarkdown)
          .sorted()
          .collect(Collectors.toList());
    } catch (IOException e) {
      throw new IoException("Failed to list documents under " + input, e);
    }
  }

  private static boolean isMarkdown(Path path) {
    String name = path.getFileName().toString().toLowerCase(Locale.ROOT);
    return name.endsWith(".md") || name.endsWith(".markdown");
  }

  private static String documentId(Path input, Path document) {
    Path relative = Files.isDirectory(input) ? input.relativize(document) : document.getFileName();
    return relative.toString().replace('\\', '/');
  }

  private static String readDocument(Path path) {
    try {
      return Files.readString(path, StandardCharsets.UTF_8);
    } catch (IOException e) {
      throw new IoException("Failed to read " + path, e);
    }
  }

  private int printOutline() {
    Map<String, List<BlockSymbol>> outline = new LinkedHashMap<>();
    // documents are applied concurrently, so order by id for stable output
    for (String documentId : new TreeSet<>(engine.documentIds())) {
      outline.put(documentId, engine.getDocumentSymbols(documentId));
    }
    String rendered =
        "yaml".equals(startupParameters.getParameter("format", String.class))
            ? JacksonUtility.toYaml(outline)
            : JacksonUtility.toPrettyJson(outline);
    StdoutUtility.printResult(out, rendered);
    return EXIT_OK;
  }

  private int printExpansion(String identifier) {
    try {
      out.print(engine.getExpandedContent(identifier));
      out.flush();
      return EXIT_OK;
    } catch (BlockNotFoundException e) {
      StdoutUtility.printError(err, e.getMessage(), null);
      return EXIT_FINDINGS;
    }
  }

  private int printCycles() {
    List<CircularReference> cycles = engine.findCircularReferences();
    for (CircularReference cycle : cycles) {
      out.println(cycle);
    }
    out.flush();
    return cycles.isEmpty() ? EXIT_OK : EXIT_FINDINGS;
  }

  static String usage() {
    return String.join(
        "\n",
        "Usage: tangle --input <file|dir> [--mode outline|expand|cycles|help] [options]",
        "",
        "  --input <path>        markdown document, or directory searched for *.md",
        "  --mode <mode>         outline (default), expand, cycles or help",
        "  --block <identifier>  block to expand (mode expand)",
        "  --format json|yaml    outline format (default json)",
        "  --config-file <loc>   classpath:<resource>, file: URI or path",
        "                        (default classpath:application.yaml)",
        "");
  }

  /** Release resources. Safe to call multiple times; executed only once. */
  public void shutdown() {
    if (shuttingDown.compareAndSet(false, true) && scheduler != null) {
      scheduler.close();
    }
  }

  /** Expose the application configuration to other components. */
  public Configuration configuration() {
    if (configurationProvider == null) {
      throw new StateException("Tangle not initialized. Call initialize() first.");
    }
    return configurationProvider.config();
  }

  public StartupParameters startupParameters() {
    return startupParameters;
  }

  public BlockExtractor extractor() {
    return extractor;
  }

  public DiagnosticsSink diagnostics() {
    return diagnostics;
  }

  public LiterateEngine engine() {
    return engine;
  }

  public DocumentParseScheduler scheduler() {
    return scheduler;
  }
}
