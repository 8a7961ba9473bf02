package com.gentoro.tangle.engine;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

import com.gentoro.tangle.diagnostics.DiagnosticsSink;
import com.gentoro.tangle.exception.BlockNotFoundException;
import com.gentoro.tangle.exception.CircularReferenceException;
import com.gentoro.tangle.exception.DocumentParseException;
import com.gentoro.tangle.exception.ExtractionException;
import com.gentoro.tangle.extraction.BlockExtractor;
import com.gentoro.tangle.extraction.CachingBlockExtractor;
import com.gentoro.tangle.extraction.flexmark.FlexmarkBlockExtractor;
import com.gentoro.tangle.location.LocationResolver;
import com.gentoro.tangle.model.Block;
import com.gentoro.tangle.model.ReferenceMarker;
import com.gentoro.tangle.model.SourceLocation;
import com.gentoro.tangle.model.TextRange;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class LiterateEngineTest {

  private static final String DOC =
      "# Title\n"
          + "\n"
          + "```{.python #main}\n"
          + "print(\"start\")\n"
          + "<<helper>>\n"
          + "```\n"
          + "\n"
          + "Text.\n"
          + "\n"
          + "```{.python #helper}\n"
          + "def helper(): pass\n"
          + "```\n"
          + "\n"
          + "```{.python #main}\n"
          + "print(\"end\")\n"
          + "```\n";

  @Mock private DiagnosticsSink sink;

  private LiterateEngine engine;

  @BeforeEach
  void setUp() {
    engine = newEngine(new FlexmarkBlockExtractor(), EngineSettings.defaults());
  }

  private LiterateEngine newEngine(BlockExtractor extractor, EngineSettings settings) {
    return new LiterateEngine(extractor, new LocationResolver(), sink, settings);
  }

  @Test
  void indexesBlocksWithLocations() {
    ParseReport report = engine.parseDocument("doc.md", DOC);

    assertEquals(3, report.blockCount());
    assertEquals(0, report.droppedBlocks());
    assertTrue(report.cycles().isEmpty());
    assertEquals(Set.of("main", "helper"), engine.identifiers());
    assertEquals(2, engine.lookup("main").size());

    SourceLocation main = engine.findDefinition("main").orElseThrow();
    assertEquals("doc.md", main.documentId());
    assertEquals(TextRange.of(2, 0, 5, 3), main.range());
    assertEquals(TextRange.of(2, 13, 2, 17), main.identifierRange());
    assertTrue(engine.findDefinition("unknown").isEmpty());
    verifyNoInteractions(sink);
  }

  @Test
  @DisplayName("Expansion splices references and concatenates occurrences")
  void expandsAcrossOccurrences() {
    engine.parseDocument("doc.md", DOC);
    assertEquals(
        "print(\"start\")\ndef helper(): pass\n\nprint(\"end\")\n",
        engine.getExpandedContent("main"));
    assertThrows(BlockNotFoundException.class, () -> engine.getExpandedContent("missing"));
  }

  @Test
  void referencesListDefinitionsThenUsers() {
    engine.parseDocument("doc.md", DOC);

    List<SourceLocation> refs = engine.findReferences("helper");

    assertEquals(2, refs.size());
    assertEquals(9, refs.get(0).range().start().line());
    assertEquals(2, refs.get(1).range().start().line());

    List<ReferenceMarker> markers = engine.findReferenceMarkers("helper");
    assertEquals(
        List.of(new ReferenceMarker("helper", "doc.md", TextRange.of(4, 0, 4, 10))), markers);
  }

  @Test
  @DisplayName("Parsing the same text twice yields the same registry")
  void reparseIsIdempotent() {
    engine.parseDocument("doc.md", DOC);
    List<Block> before = engine.getDocumentBlocks("doc.md");
    engine.parseDocument("doc.md", DOC);
    List<Block> after = engine.getDocumentBlocks("doc.md");

    assertEquals(before.size(), after.size());
    for (int i = 0; i < before.size(); i++) {
      assertEquals(before.get(i).identifier(), after.get(i).identifier());
      assertEquals(before.get(i).occurrenceIndex(), after.get(i).occurrenceIndex());
      assertEquals(before.get(i).content(), after.get(i).content());
      assertEquals(before.get(i).location(), after.get(i).location());
      assertEquals(before.get(i).dependents(), after.get(i).dependents());
    }
    assertEquals(Set.of("main"), engine.lookup("helper").get(0).dependents());
  }

  @Test
  void reparseDropsRemovedBlocks() {
    engine.parseDocument("doc.md", DOC);
    engine.parseDocument("doc.md", "```{#main}\n<<helper>>\n```\n");

    assertEquals(Set.of("main"), engine.identifiers());
    assertEquals("<<helper not found>>\n", engine.getExpandedContent("main"));
  }

  @Test
  @DisplayName("A failed extraction leaves the document's previous blocks in place")
  void extractionFailureKeepsPreviousBlocks() {
    BlockExtractor extractor = mock(BlockExtractor.class);
    FlexmarkBlockExtractor flexmark = new FlexmarkBlockExtractor();
    ExtractionException failure = new ExtractionException("converter crashed", "segfault");
    when(extractor.extract(anyString()))
        .thenAnswer(inv -> flexmark.extract(inv.getArgument(0)))
        .thenThrow(failure);
    LiterateEngine engine = newEngine(extractor, EngineSettings.defaults());

    engine.parseDocument("doc.md", DOC);
    ExtractionException thrown =
        assertThrows(ExtractionException.class, () -> engine.parseDocument("doc.md", "changed"));

    assertSame(failure, thrown);
    assertEquals("segfault", thrown.getDiagnostics());
    assertEquals(2, engine.lookup("main").size());
    verify(sink).parseFailed("doc.md", failure);
  }

  @Test
  void unexpectedExtractorErrorIsWrapped() {
    BlockExtractor extractor = mock(BlockExtractor.class);
    when(extractor.extract(anyString())).thenThrow(new IllegalStateException("bug"));
    when(extractor.name()).thenReturn("broken");
    LiterateEngine engine = newEngine(extractor, EngineSettings.defaults());

    DocumentParseException e =
        assertThrows(DocumentParseException.class, () -> engine.parseDocument("doc.md", DOC));
    assertInstanceOf(IllegalStateException.class, e.getCause());
    verify(sink).parseFailed(eq("doc.md"), same(e));
  }

  @Test
  void unlocatableBlockIsDropped() {
    ParseReport report = engine.parseDocument("doc.md", "```{#a}\nx\n```\n\n```{#b}\ny\n");

    assertEquals(1, report.blockCount());
    assertEquals(1, report.droppedBlocks());
    assertEquals(Set.of("a"), engine.identifiers());
    verify(sink).blockDropped(eq("doc.md"), eq("b"), eq(0), contains("no closing fence"));
  }

  @Test
  @DisplayName("A block-quoted occurrence keeps its own span next to a top-level one")
  void quotedAndTopLevelOccurrencesStayApart() {
    ParseReport report =
        engine.parseDocument(
            "doc.md", "> ```{.py #x}\n> quoted\n> ```\n\n```{.py #x}\nreal\n```\n");

    assertEquals(2, report.blockCount());
    assertEquals(0, report.droppedBlocks());
    List<Block> occurrences = engine.lookup("x");
    assertTrue(occurrences.get(0).content().contains("quoted"));
    assertEquals(TextRange.of(0, 0, 2, 5), occurrences.get(0).location().range());
    assertEquals("real", occurrences.get(1).content());
    assertEquals(TextRange.of(4, 0, 6, 3), occurrences.get(1).location().range());
    assertTrue(engine.getExpandedContent("x").endsWith("real\n"));
    verify(sink, never()).blockDropped(any(), any(), anyInt(), any());
  }

  @Test
  void indentedExampleFenceDoesNotShiftDefinition() {
    engine.parseDocument(
        "doc.md", "Para.\n\n    ```{.py #x}\n    fake\n    ```\n\n```{.py #x}\nreal\n```\n");

    SourceLocation definition = engine.findDefinition("x").orElseThrow();
    assertEquals(TextRange.of(6, 0, 8, 3), definition.range());
    assertEquals("real\n", engine.getExpandedContent("x"));
  }

  @Test
  void oversizedBlockIsDropped() {
    LiterateEngine engine = newEngine(new FlexmarkBlockExtractor(), new EngineSettings(5));

    engine.parseDocument("doc.md", "```{#small}\n12345\n```\n\n```{#big}\n123456\n```\n");

    assertEquals(Set.of("small"), engine.identifiers());
    verify(sink).blockDropped(eq("doc.md"), eq("big"), eq(0), contains("exceeds 5"));
  }

  @Test
  void cyclesAreReportedAndCanBeEnforced() {
    ParseReport report =
        engine.parseDocument("doc.md", "```{#a}\n<<b>>\n```\n\n```{#b}\n<<a>>\n```\n");

    assertEquals(1, report.cycles().size());
    verify(sink).circularReferences("doc.md", report.cycles());
    assertEquals(report.cycles(), engine.findCircularReferences());
    assertEquals("<<circular reference to a>>\n\n", engine.getExpandedContent("a"));

    CircularReferenceException e =
        assertThrows(CircularReferenceException.class, engine::requireAcyclic);
    assertEquals(List.of("a", "b", "a"), e.getPath());
  }

  @Test
  void dependenciesResolveAcrossDocuments() {
    engine.parseDocument("a.md", "```{#a}\n<<b>>\n```\n");
    engine.parseDocument("b.md", "```{#b}\nB\n```\n");
    assertEquals("B\n\n", engine.getExpandedContent("a"));
    assertEquals(Set.of("a"), engine.lookup("b").get(0).dependents());

    assertTrue(engine.removeDocument("b.md"));
    assertFalse(engine.removeDocument("b.md"));
    assertEquals("<<b not found>>\n", engine.getExpandedContent("a"));
    assertEquals(Set.of("a.md"), engine.documentIds());
  }

  @Test
  void outlineSymbols() {
    engine.parseDocument("doc.md", DOC);

    List<BlockSymbol> symbols = engine.getDocumentSymbols("doc.md");

    assertEquals(3, symbols.size());
    BlockSymbol first = symbols.get(0);
    assertEquals("main", first.identifier());
    assertEquals("python", first.language());
    assertEquals(3, first.startLine());
    assertEquals(6, first.endLine());
    assertEquals(List.of("helper"), first.dependencies());
    assertEquals(List.of("main"), symbols.get(1).dependents());
    assertEquals(1, symbols.get(2).occurrenceIndex());
  }

  @Test
  void clearCacheForgetsDocumentsAndConversions() {
    CachingBlockExtractor cache = new CachingBlockExtractor(new FlexmarkBlockExtractor(), 8);
    LiterateEngine engine = newEngine(cache, EngineSettings.defaults());
    engine.parseDocument("doc.md", DOC);
    assertEquals(1, cache.size());

    engine.clearCache();

    assertTrue(engine.identifiers().isEmpty());
    assertTrue(engine.documentIds().isEmpty());
    assertTrue(engine.findReferenceMarkers("helper").isEmpty());
    assertEquals(0, cache.size());
  }
}
