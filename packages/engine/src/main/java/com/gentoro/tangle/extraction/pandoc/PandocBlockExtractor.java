package com.gentoro.tangle.extraction.pandoc;

import com.fasterxml.jackson.databind.JsonNode;
import com.gentoro.tangle.exception.ExtractionException;
import com.gentoro.tangle.exception.IoException;
import com.gentoro.tangle.exception.SerializationException;
import com.gentoro.tangle.extraction.AbstractBlockExtractor;
import com.gentoro.tangle.logging.LoggingService;
import com.gentoro.tangle.utility.JacksonUtility;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.TimeUnit;

/**
 * Extractor that shells out to pandoc ({@code pandoc -f markdown -t json}) and walks the JSON AST
 * for {@code CodeBlock} nodes.
 *
 * <p>A pandoc code block is {@code {"t":"CodeBlock","c":[[id, [classes], [[k, v]]], content]}}.
 */
public class PandocBlockExtractor extends AbstractBlockExtractor {
  private static final org.slf4j.Logger log =
      LoggingService.getLogger(PandocBlockExtractor.class);

  private final String executable;
  private final String format;
  private final Duration timeout;

  public PandocBlockExtractor(String executable, String format, Duration timeout) {
    this.executable = Objects.requireNonNull(executable, "executable");
    this.format = Objects.requireNonNull(format, "format");
    this.timeout = Objects.requireNonNull(timeout, "timeout");
  }

  @Override
  protected List<Fence> findFences(String documentText) {
    String json = runConverter(documentText);
    JsonNode ast;
    try {
      ast = JacksonUtility.readTree(json);
    } catch (SerializationException e) {
      throw new ExtractionException("Converter produced unparseable output", e.getMessage(), e);
    }
    return parseAst(ast);
  }

  /** Walk a pandoc JSON document and return its code blocks in document order. */
  List<Fence> parseAst(JsonNode ast) {
    if (ast == null || !ast.isObject() || !ast.path("blocks").isArray()) {
      throw new ExtractionException("Invalid AST structure", "missing top-level 'blocks' array");
    }
    List<Fence> out = new ArrayList<>();
    for (JsonNode block : ast.get("blocks")) {
      collect(block, out);
    }
    return out;
  }

  private void collect(JsonNode node, List<Fence> out) {
    if (node.isObject() && "CodeBlock".equals(node.path("t").asText())) {
      out.add(toFence(node.path("c")));
      return;
    }
    JsonNode children = node.isObject() ? node.path("c") : node;
    if (children.isArray()) {
      for (JsonNode child : children) {
        if (child.isContainerNode()) {
          collect(child, out);
        }
      }
    }
  }

  private Fence toFence(JsonNode c) {
    if (!c.isArray() || c.size() != 2 || !c.get(0).isArray() || !c.get(1).isTextual()) {
      throw new ExtractionException("Malformed CodeBlock node", c.toString());
    }
    JsonNode attr = c.get(0);
    String id = attr.path(0).asText("");
    if (id.startsWith("#")) id = id.substring(1);
    String language = "";
    JsonNode classes = attr.path(1);
    if (classes.isArray() && classes.size() > 0) {
      language = classes.get(0).asText("");
      if (language.startsWith(".")) language = language.substring(1);
    }
    return new Fence(id, language, c.get(1).asText());
  }

  /**
   * Run the converter with {@code input} on stdin and return its stdout.
   *
   * @throws ExtractionException on start failure, timeout or non-zero exit; stderr is attached
   */
  protected String runConverter(String input) {
    List<String> command = List.of(executable, "-f", format, "-t", "json");
    log.debug("Executing converter {}", command);
    Process process;
    try {
      process = new ProcessBuilder(command).start();
    } catch (IOException e) {
      throw new ExtractionException("Failed to execute " + executable, e.getMessage(), e);
    }

    CompletableFuture<String> stdout =
        CompletableFuture.supplyAsync(() -> drain(process.getInputStream()));
    CompletableFuture<String> stderr =
        CompletableFuture.supplyAsync(() -> drain(process.getErrorStream()));

    try (OutputStream stdin = process.getOutputStream()) {
      stdin.write(input.getBytes(StandardCharsets.UTF_8));
    } catch (IOException e) {
      process.destroyForcibly();
      throw new ExtractionException("Failed to write document to converter", e.getMessage(), e);
    }

    try {
      if (!process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
        process.destroyForcibly();
        throw new ExtractionException(
            "Converter timed out after " + timeout.toSeconds() + "s", "");
      }
    } catch (InterruptedException e) {
      process.destroyForcibly();
      Thread.currentThread().interrupt();
      throw new ExtractionException("Interrupted while waiting for converter", "", e);
    }

    int exit = process.exitValue();
    if (exit != 0) {
      String err = await(stderr);
      log.error("Converter exited with code {}: {}", exit, err);
      throw new ExtractionException("Converter exited with code " + exit, err);
    }
    return await(stdout);
  }

  private static String await(CompletableFuture<String> stream) {
    try {
      return stream.join();
    } catch (CompletionException e) {
      throw new ExtractionException(
          "Failed to read converter output", String.valueOf(e.getCause()), e.getCause());
    }
  }

  private static String drain(InputStream in) {
    try (in) {
      ByteArrayOutputStream buffer = new ByteArrayOutputStream();
      in.transferTo(buffer);
      return buffer.toString(StandardCharsets.UTF_8);
    } catch (IOException e) {
      throw new IoException("Failed to read converter stream", e);
    }
  }

  @Override
  public String name() {
    return PandocBlockExtractorProvider.ID;
  }
}
