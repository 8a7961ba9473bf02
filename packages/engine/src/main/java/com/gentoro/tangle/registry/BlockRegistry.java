package com.gentoro.tangle.registry;

import com.gentoro.tangle.exception.ValidationException;
import com.gentoro.tangle.logging.LoggingService;
import com.gentoro.tangle.model.Block;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Identifier to ordered block occurrences, across every indexed document.
 *
 * <p>All occurrences of one identifier form a single logical body: the concatenation of their
 * contents in list order. Within a document, list order is occurrence order; documents contribute
 * in the order they were last (re-)parsed.
 *
 * <p>Not thread-safe. {@code LiterateEngine} performs every mutation under its write lock so that
 * readers never observe a half-replaced document.
 */
public class BlockRegistry {
  private static final org.slf4j.Logger log = LoggingService.getLogger(BlockRegistry.class);

  private final Map<String, List<Block>> blocksByIdentifier = new LinkedHashMap<>();
  private final Map<String, Set<String>> identifiersByDocument = new LinkedHashMap<>();

  /**
   * Remove every block previously contributed by {@code documentId} and insert {@code blocks}.
   *
   * <p>Removal goes through the per-document identifier index and filters by source document, so
   * occurrences of the same identifier defined in other documents are kept. Identifiers left without
   * occurrences are pruned.
   *
   * @throws ValidationException when a block does not belong to {@code documentId}
   */
  public void replaceDocument(String documentId, List<Block> blocks) {
    for (Block block : blocks) {
      if (!documentId.equals(block.documentId())) {
        throw new ValidationException(
            "Block #%s belongs to %s, not %s"
                .formatted(block.identifier(), block.documentId(), documentId));
      }
    }

    int removed = removeBlocksOf(documentId);

    Map<String, List<Block>> grouped = new LinkedHashMap<>();
    for (Block block : blocks) {
      grouped.computeIfAbsent(block.identifier(), k -> new ArrayList<>()).add(block);
    }
    for (Map.Entry<String, List<Block>> entry : grouped.entrySet()) {
      List<Block> occurrences = entry.getValue();
      occurrences.sort(Comparator.comparingInt(Block::occurrenceIndex));
      blocksByIdentifier
          .computeIfAbsent(entry.getKey(), k -> new ArrayList<>())
          .addAll(occurrences);
    }
    Set<String> identifiers = new LinkedHashSet<>(grouped.keySet());
    identifiersByDocument.put(documentId, identifiers);
    log.debug(
        "Replaced document {}: removed {} block(s), added {} block(s) under {} identifier(s)",
        documentId,
        removed,
        blocks.size(),
        identifiers.size());
  }

  /** Drop a document and all of its blocks. Returns false when it was not indexed. */
  public boolean removeDocument(String documentId) {
    if (!identifiersByDocument.containsKey(documentId)) return false;
    removeBlocksOf(documentId);
    identifiersByDocument.remove(documentId);
    return true;
  }

  private int removeBlocksOf(String documentId) {
    Set<String> previous = identifiersByDocument.get(documentId);
    if (previous == null) return 0;
    int removed = 0;
    for (String identifier : previous) {
      List<Block> occurrences = blocksByIdentifier.get(identifier);
      if (occurrences == null) continue;
      for (Iterator<Block> it = occurrences.iterator(); it.hasNext(); ) {
        if (documentId.equals(it.next().documentId())) {
          it.remove();
          removed++;
        }
      }
      if (occurrences.isEmpty()) {
        blocksByIdentifier.remove(identifier);
      }
    }
    identifiersByDocument.put(documentId, new LinkedHashSet<>());
    return removed;
  }

  /** Occurrences of {@code identifier} in concatenation order; empty when unknown. */
  public List<Block> lookup(String identifier) {
    List<Block> blocks = blocksByIdentifier.get(identifier);
    return blocks == null ? List.of() : Collections.unmodifiableList(blocks);
  }

  /** Every identifier with at least one occurrence, in insertion order. */
  public Set<String> allIdentifiers() {
    return Collections.unmodifiableSet(new LinkedHashSet<>(blocksByIdentifier.keySet()));
  }

  /** Every block, grouped by identifier in insertion order. */
  public List<Block> allBlocks() {
    List<Block> out = new ArrayList<>();
    for (List<Block> blocks : blocksByIdentifier.values()) {
      out.addAll(blocks);
    }
    return out;
  }

  /** Live view over the identifier lists, for the dependency graph and cycle detector. */
  public Collection<List<Block>> occurrenceLists() {
    return Collections.unmodifiableCollection(blocksByIdentifier.values());
  }

  /** Blocks contributed by one document, in document order. */
  public List<Block> documentBlocks(String documentId) {
    Set<String> identifiers = identifiersByDocument.getOrDefault(documentId, Set.of());
    List<Block> out = new ArrayList<>();
    for (String identifier : identifiers) {
      for (Block block : lookup(identifier)) {
        if (documentId.equals(block.documentId())) out.add(block);
      }
    }
    out.sort(Comparator.comparing(b -> b.location().range().start()));
    return out;
  }

  public Set<String> documentIds() {
    return Collections.unmodifiableSet(new LinkedHashSet<>(identifiersByDocument.keySet()));
  }

  public void clear() {
    blocksByIdentifier.clear();
    identifiersByDocument.clear();
  }
}
