package com.gentoro.tangle.registry;

import static com.gentoro.tangle.TestBlocks.block;
import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.tangle.exception.ValidationException;
import com.gentoro.tangle.model.Block;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class BlockRegistryTest {

  private final BlockRegistry registry = new BlockRegistry();

  @Test
  @DisplayName("Replacing a document keeps other documents' occurrences of the same identifier")
  void replaceIsScopedToTheDocument() {
    registry.replaceDocument("one.md", List.of(block("one.md", "shared", "from one")));
    registry.replaceDocument("two.md", List.of(block("two.md", "shared", "from two")));

    registry.replaceDocument("one.md", List.of(block("one.md", "shared", "from one, v2")));

    List<String> contents = registry.lookup("shared").stream().map(Block::content).toList();
    assertEquals(List.of("from two", "from one, v2"), contents);
  }

  @Test
  void identifiersWithoutBlocksArePruned() {
    registry.replaceDocument(
        "doc.md", List.of(block("doc.md", "a", "x"), block("doc.md", "b", 0, 4, "y")));
    registry.replaceDocument("doc.md", List.of(block("doc.md", "a", "x")));

    assertEquals(Set.of("a"), registry.allIdentifiers());
    assertTrue(registry.lookup("b").isEmpty());
  }

  @Test
  void occurrencesAreOrderedByIndex() {
    registry.replaceDocument(
        "doc.md",
        List.of(block("doc.md", "a", 1, 8, "second"), block("doc.md", "a", 0, 0, "first")));

    assertEquals(
        List.of("first", "second"), registry.lookup("a").stream().map(Block::content).toList());
  }

  @Test
  void documentBlocksFollowDocumentOrder() {
    registry.replaceDocument(
        "doc.md",
        List.of(
            block("doc.md", "z", 0, 0, "1"),
            block("doc.md", "a", 0, 4, "2"),
            block("doc.md", "z", 1, 8, "3")));
    registry.replaceDocument("other.md", List.of(block("other.md", "a", "elsewhere")));

    assertEquals(
        List.of("1", "2", "3"),
        registry.documentBlocks("doc.md").stream().map(Block::content).toList());
    assertEquals(Set.of("doc.md", "other.md"), registry.documentIds());
    assertEquals(4, registry.allBlocks().size());
  }

  @Test
  void rejectsBlocksOfAnotherDocument() {
    assertThrows(
        ValidationException.class,
        () -> registry.replaceDocument("doc.md", List.of(block("other.md", "a", "x"))));
    assertTrue(registry.allIdentifiers().isEmpty());
  }

  @Test
  void removeAndClear() {
    registry.replaceDocument("doc.md", List.of(block("doc.md", "a", "x")));
    assertTrue(registry.removeDocument("doc.md"));
    assertFalse(registry.removeDocument("doc.md"));
    assertTrue(registry.allIdentifiers().isEmpty());

    registry.replaceDocument("doc.md", List.of(block("doc.md", "a", "x")));
    registry.clear();
    assertTrue(registry.allBlocks().isEmpty());
    assertTrue(registry.documentIds().isEmpty());
  }
}
