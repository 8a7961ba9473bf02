package com.gentoro.tangle.model;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/**
 * One physical occurrence of a named code fragment.
 *
 * <p>Everything except {@link #dependents()} is fixed at parse time. Dependents are owned by the
 * dependency graph, which clears and recomputes them after every registry change.
 */
public final class Block {
  private final String identifier;
  private final int occurrenceIndex;
  private final String language;
  private final String content;
  private final Set<String> references;
  private final SourceLocation location;
  private final Set<String> dependents = new LinkedHashSet<>();

  public Block(
      String identifier,
      int occurrenceIndex,
      String language,
      String content,
      Set<String> references,
      SourceLocation location) {
    if (identifier == null || identifier.isBlank()) {
      throw new IllegalArgumentException("Block identifier must not be empty");
    }
    if (occurrenceIndex < 0) {
      throw new IllegalArgumentException("Negative occurrence index: " + occurrenceIndex);
    }
    this.identifier = identifier;
    this.occurrenceIndex = occurrenceIndex;
    this.language = language == null ? "" : language;
    this.content = content == null ? "" : content;
    this.references = Collections.unmodifiableSet(new LinkedHashSet<>(references));
    this.location = Objects.requireNonNull(location, "location");
  }

  public String identifier() {
    return identifier;
  }

  public int occurrenceIndex() {
    return occurrenceIndex;
  }

  public String language() {
    return language;
  }

  public String content() {
    return content;
  }

  /** Identifiers mentioned via {@code <<id>>} in the raw content. */
  public Set<String> references() {
    return references;
  }

  /** Same as {@link #references()}; forward edges of the graph. */
  public Set<String> dependencies() {
    return references;
  }

  /** Identifiers of blocks whose content references this block's identifier. Read-only view. */
  public Set<String> dependents() {
    return Collections.unmodifiableSet(dependents);
  }

  public SourceLocation location() {
    return location;
  }

  public String documentId() {
    return location.documentId();
  }

  /** Only {@code DependencyGraph} calls this, at the start of a rebuild. */
  public void clearDependents() {
    dependents.clear();
  }

  /** Only {@code DependencyGraph} calls this while rebuilding reverse edges. */
  public void addDependent(String identifier) {
    dependents.add(identifier);
  }

  @Override
  public String toString() {
    return "Block{#"
        + identifier
        + "["
        + occurrenceIndex
        + "] in "
        + location.documentId()
        + " at "
        + location.range()
        + ", refs="
        + references
        + '}';
  }
}
