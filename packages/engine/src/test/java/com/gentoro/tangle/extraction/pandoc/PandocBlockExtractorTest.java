package com.gentoro.tangle.extraction.pandoc;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.tangle.exception.ExtractionException;
import com.gentoro.tangle.extraction.AbstractBlockExtractor.Fence;
import com.gentoro.tangle.extraction.RawBlock;
import com.gentoro.tangle.utility.JacksonUtility;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class PandocBlockExtractorTest {

  private static String fixture(String name) throws Exception {
    try (InputStream in = PandocBlockExtractorTest.class.getResourceAsStream("/pandoc/" + name)) {
      assertNotNull(in, "missing fixture " + name);
      return new String(in.readAllBytes(), StandardCharsets.UTF_8);
    }
  }

  /** Extractor whose converter output is fixed, so no pandoc binary is needed. */
  private static PandocBlockExtractor withOutput(String converterOutput) {
    return new PandocBlockExtractor("pandoc", "markdown", Duration.ofSeconds(5)) {
      @Override
      protected String runConverter(String input) {
        return converterOutput;
      }
    };
  }

  @Test
  @DisplayName("Walks the AST recursively and returns code blocks in document order")
  void parsesAst() throws Exception {
    PandocBlockExtractor extractor = withOutput("");
    List<Fence> fences = extractor.parseAst(JacksonUtility.readTree(fixture("sample-ast.json")));

    assertEquals(4, fences.size());
    assertEquals(new Fence("hello", "python", "print('hi')\n<<name>>"), fences.get(0));
    assertEquals(new Fence("name", "python", "'World'\n"), fences.get(1));
    assertEquals(new Fence("", "sh", "echo unnamed"), fences.get(2));
    assertEquals(new Fence("hello", "", "more"), fences.get(3));
  }

  @Test
  void extractsNamedBlocksFromConverterOutput() throws Exception {
    List<RawBlock> blocks = withOutput(fixture("sample-ast.json")).extract("ignored");

    assertEquals(3, blocks.size());
    assertEquals("hello", blocks.get(0).identifier());
    assertEquals(List.of("name"), blocks.get(0).references());
    assertEquals("'World'", blocks.get(1).content());
    assertEquals(1, blocks.get(2).occurrenceIndex());
  }

  @Test
  void unparseableOutputIsAnExtractionFailure() {
    ExtractionException e =
        assertThrows(ExtractionException.class, () -> withOutput("not json {").extract("x"));
    assertEquals("Converter produced unparseable output", e.getMessage());
  }

  @Test
  void missingBlocksArrayIsAnExtractionFailure() {
    ExtractionException e =
        assertThrows(ExtractionException.class, () -> withOutput("{\"meta\":{}}").extract("x"));
    assertEquals("Invalid AST structure", e.getMessage());
  }

  @Test
  void malformedCodeBlockIsAnExtractionFailure() {
    String json = "{\"blocks\":[{\"t\":\"CodeBlock\",\"c\":[\"oops\"]}]}";
    assertThrows(ExtractionException.class, () -> withOutput(json).extract("x"));
  }

  @Test
  @DisplayName("A converter that cannot be started surfaces as ExtractionException")
  void missingExecutable() {
    PandocBlockExtractor extractor =
        new PandocBlockExtractor(
            "/nonexistent/tangle-test/pandoc", "markdown", Duration.ofSeconds(5));
    ExtractionException e =
        assertThrows(ExtractionException.class, () -> extractor.extract("```{#a}\nx\n```\n"));
    assertTrue(e.getMessage().startsWith("Failed to execute"), e.getMessage());
    assertEquals("pandoc", extractor.name());
  }
}
