package com.gentoro.tangle.engine;

import com.gentoro.tangle.diagnostics.DiagnosticsSink;
import com.gentoro.tangle.exception.CircularReferenceException;
import com.gentoro.tangle.exception.DocumentParseException;
import com.gentoro.tangle.exception.ExtractionException;
import com.gentoro.tangle.exception.LocationNotFoundException;
import com.gentoro.tangle.expansion.ContentExpander;
import com.gentoro.tangle.extraction.BlockExtractor;
import com.gentoro.tangle.extraction.CachingBlockExtractor;
import com.gentoro.tangle.extraction.RawBlock;
import com.gentoro.tangle.graph.CycleDetector;
import com.gentoro.tangle.graph.DependencyGraph;
import com.gentoro.tangle.location.BlockSpan;
import com.gentoro.tangle.location.LocationResolver;
import com.gentoro.tangle.logging.LoggingService;
import com.gentoro.tangle.model.Block;
import com.gentoro.tangle.model.CircularReference;
import com.gentoro.tangle.model.ReferenceMarker;
import com.gentoro.tangle.model.SourceLocation;
import com.gentoro.tangle.registry.BlockRegistry;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Supplier;

/**
 * Resolves named code blocks and their {@code <<references>>} across a set of documents.
 *
 * <p>Parsing a document runs in two phases. {@link #prepare} extracts and locates the blocks
 * without touching shared state, so it can run on any thread. {@link #apply} swaps the document's
 * blocks into the registry, rebuilds reverse edges and reports cycles, all under the write lock.
 * Queries take the read lock and therefore observe a document either entirely before or entirely
 * after a re-parse.
 */
public class LiterateEngine {
  private static final org.slf4j.Logger log = LoggingService.getLogger(LiterateEngine.class);

  private final BlockExtractor extractor;
  private final LocationResolver locationResolver;
  private final DiagnosticsSink diagnostics;
  private final EngineSettings settings;

  private final BlockRegistry registry = new BlockRegistry();
  private final DependencyGraph graph = new DependencyGraph(registry);
  private final CycleDetector cycleDetector = new CycleDetector(registry, graph);
  private final ContentExpander expander = new ContentExpander(registry);
  private final Map<String, List<ReferenceMarker>> markersByDocument = new LinkedHashMap<>();
  private final ReadWriteLock lock = new ReentrantReadWriteLock();

  public LiterateEngine(
      BlockExtractor extractor,
      LocationResolver locationResolver,
      DiagnosticsSink diagnostics,
      EngineSettings settings) {
    this.extractor = Objects.requireNonNull(extractor, "extractor");
    this.locationResolver = Objects.requireNonNull(locationResolver, "locationResolver");
    this.diagnostics = Objects.requireNonNull(diagnostics, "diagnostics");
    this.settings = Objects.requireNonNull(settings, "settings");
  }

  /**
   * Parse {@code text} and replace everything {@code documentId} previously contributed.
   *
   * @throws ExtractionException when the extractor fails; the document's previous blocks are kept
   */
  public ParseReport parseDocument(String documentId, String text) {
    return apply(prepare(documentId, text));
  }

  /**
   * Extract and locate the blocks of a document. Reads no shared state.
   *
   * @throws ExtractionException when the extractor fails
   * @throws DocumentParseException when the extractor fails with an unexpected error
   */
  public PreparedDocument prepare(String documentId, String text) {
    Objects.requireNonNull(documentId, "documentId");
    String source = text == null ? "" : text;

    List<RawBlock> rawBlocks;
    try {
      rawBlocks = extractor.extract(source);
    } catch (ExtractionException e) {
      diagnostics.parseFailed(documentId, e);
      throw e;
    } catch (RuntimeException e) {
      DocumentParseException failure =
          new DocumentParseException(documentId, "extractor " + extractor.name() + " failed", e);
      diagnostics.parseFailed(documentId, failure);
      throw failure;
    }

    LocationResolver.FenceIndex fences = locationResolver.index(source);
    List<Block> blocks = new ArrayList<>(rawBlocks.size());
    int dropped = 0;
    for (RawBlock raw : rawBlocks) {
      if (raw.content().length() > settings.maxBlockSize()) {
        drop(documentId, raw, "content exceeds " + settings.maxBlockSize() + " characters");
        dropped++;
        continue;
      }
      BlockSpan span;
      try {
        span =
            raw.hasPosition()
                ? fences.locateAt(
                    raw.identifier(), raw.occurrenceIndex(), raw.openLine(), raw.closeLine())
                : fences.locate(raw.identifier(), raw.occurrenceIndex());
      } catch (LocationNotFoundException e) {
        drop(documentId, raw, e.getReason());
        dropped++;
        continue;
      }
      blocks.add(
          new Block(
              raw.identifier(),
              raw.occurrenceIndex(),
              raw.language(),
              raw.content(),
              new LinkedHashSet<>(raw.references()),
              new SourceLocation(documentId, span.range(), span.identifierRange())));
    }

    List<ReferenceMarker> markers = locationResolver.scanReferences(documentId, source);
    return new PreparedDocument(documentId, blocks, markers, dropped);
  }

  private void drop(String documentId, RawBlock raw, String reason) {
    log.warn(
        "Dropping block #{} (occurrence {}) of {}: {}",
        raw.identifier(),
        raw.occurrenceIndex(),
        documentId,
        reason);
    diagnostics.blockDropped(documentId, raw.identifier(), raw.occurrenceIndex(), reason);
  }

  /** Swap a prepared document into the registry and rebuild the graph. */
  public ParseReport apply(PreparedDocument document) {
    List<CircularReference> cycles;
    lock.writeLock().lock();
    try {
      registry.replaceDocument(document.documentId(), document.blocks());
      markersByDocument.put(document.documentId(), document.markers());
      graph.rebuild();
      cycles = cycleDetector.findCycles();
    } finally {
      lock.writeLock().unlock();
    }

    log.debug(
        "Indexed {}: {} block(s), {} dropped",
        document.documentId(),
        document.blocks().size(),
        document.droppedBlocks());
    if (!cycles.isEmpty()) {
      log.warn("Circular references detected after parsing {}: {}", document.documentId(), cycles);
      diagnostics.circularReferences(document.documentId(), cycles);
    }
    return new ParseReport(
        document.documentId(), document.blocks().size(), document.droppedBlocks(), cycles);
  }

  /**
   * Drop everything a document contributed. Returns false when it was not indexed. Parses scheduled
   * through a {@link DocumentParseScheduler} should be removed through it instead.
   */
  public boolean removeDocument(String documentId) {
    lock.writeLock().lock();
    try {
      markersByDocument.remove(documentId);
      if (!registry.removeDocument(documentId)) return false;
      graph.rebuild();
      log.debug("Removed document {}", documentId);
      return true;
    } finally {
      lock.writeLock().unlock();
    }
  }

  /** Location of the first occurrence of {@code identifier}. */
  public Optional<SourceLocation> findDefinition(String identifier) {
    return read(() -> registry.lookup(identifier).stream().findFirst().map(Block::location));
  }

  /**
   * Locations of every occurrence of {@code identifier} followed by the locations of every block
   * that references it.
   */
  public List<SourceLocation> findReferences(String identifier) {
    return read(
        () -> {
          Set<SourceLocation> locations = new LinkedHashSet<>();
          for (Block block : registry.lookup(identifier)) {
            locations.add(block.location());
          }
          for (Block block : registry.allBlocks()) {
            if (block.dependencies().contains(identifier)) {
              locations.add(block.location());
            }
          }
          return List.copyOf(locations);
        });
  }

  /** Exact spans of every {@code <<identifier>>} marker, in every indexed document. */
  public List<ReferenceMarker> findReferenceMarkers(String identifier) {
    return read(
        () -> {
          List<ReferenceMarker> out = new ArrayList<>();
          for (List<ReferenceMarker> markers : markersByDocument.values()) {
            for (ReferenceMarker marker : markers) {
              if (marker.identifier().equals(identifier)) out.add(marker);
            }
          }
          return out;
        });
  }

  public List<CircularReference> findCircularReferences() {
    return read(cycleDetector::findCycles);
  }

  /**
   * Fail when the graph has any cycle.
   *
   * @throws CircularReferenceException carrying the first cycle found, closed by its start
   */
  public void requireAcyclic() {
    List<CircularReference> cycles = findCircularReferences();
    if (!cycles.isEmpty()) {
      CircularReference first = cycles.get(0);
      List<String> closed = new ArrayList<>(first.path());
      closed.add(first.start());
      throw new CircularReferenceException(closed);
    }
  }

  /**
   * Fully expanded body of {@code identifier}.
   *
   * @throws com.gentoro.tangle.exception.BlockNotFoundException when the identifier is unknown
   */
  public String getExpandedContent(String identifier) {
    return read(() -> expander.getExpandedContent(identifier));
  }

  /** Blocks a document contributed, in document order. */
  public List<Block> getDocumentBlocks(String documentId) {
    return read(() -> registry.documentBlocks(documentId));
  }

  /** Outline of a document: one entry per block, in document order. */
  public List<BlockSymbol> getDocumentSymbols(String documentId) {
    return read(
        () -> {
          List<BlockSymbol> out = new ArrayList<>();
          for (Block block : registry.documentBlocks(documentId)) {
            out.add(
                new BlockSymbol(
                    block.identifier(),
                    block.occurrenceIndex(),
                    block.language(),
                    block.location().range().start().line() + 1,
                    block.location().range().end().line() + 1,
                    new ArrayList<>(block.dependencies()),
                    new ArrayList<>(block.dependents())));
          }
          return out;
        });
  }

  /** Occurrences of {@code identifier} in concatenation order. */
  public List<Block> lookup(String identifier) {
    return read(() -> List.copyOf(registry.lookup(identifier)));
  }

  public Set<String> identifiers() {
    return read(registry::allIdentifiers);
  }

  public Set<String> documentIds() {
    return read(registry::documentIds);
  }

  /**
   * Forget every document and any cached conversion result. Use {@link
   * DocumentParseScheduler#clearCache()} when parses may still be in flight.
   */
  public void clearCache() {
    lock.writeLock().lock();
    try {
      registry.clear();
      markersByDocument.clear();
    } finally {
      lock.writeLock().unlock();
    }
    if (extractor instanceof CachingBlockExtractor caching) {
      caching.clear();
    }
    log.debug("Engine state cleared");
  }

  private <T> T read(Supplier<T> query) {
    lock.readLock().lock();
    try {
      return query.get();
    } finally {
      lock.readLock().unlock();
    }
  }
}
