package com.gentoro.tangle.expansion;

import static com.gentoro.tangle.TestBlocks.block;
import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.tangle.exception.BlockNotFoundException;
import com.gentoro.tangle.model.Block;
import com.gentoro.tangle.registry.BlockRegistry;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class ContentExpanderTest {

  private final BlockRegistry registry = new BlockRegistry();
  private final ContentExpander expander = new ContentExpander(registry);

  private void define(String... idAndContent) {
    List<Block> blocks = new ArrayList<>();
    for (int i = 0; i < idAndContent.length; i += 2) {
      int occurrence = 0;
      for (int j = 0; j < i; j += 2) {
        if (idAndContent[j].equals(idAndContent[i])) occurrence++;
      }
      blocks.add(block("doc.md", idAndContent[i], occurrence, i * 4, idAndContent[i + 1]));
    }
    registry.replaceDocument("doc.md", blocks);
  }

  @Test
  @DisplayName("Greeting scenario: the referenced name is spliced in")
  void greet() {
    define("greet", "Hello, <<name>>", "name", "World");
    assertEquals("Hello, World\n\n", expander.getExpandedContent("greet"));
  }

  @Test
  @DisplayName("All occurrences of an identifier are concatenated, each followed by a newline")
  void concatenation() {
    define("a", "one", "b", "between", "a", "two");
    assertEquals("one\ntwo\n", expander.getExpandedContent("a"));
  }

  @Test
  void siblingsMayExpandTheSameIdentifier() {
    define("a", "<<b>> <<b>>", "b", "B");
    assertEquals("B\n B\n\n", expander.getExpandedContent("a"));
  }

  @Test
  @DisplayName("A cycle degrades to a placeholder instead of recursing forever")
  void cycleGuard() {
    define("a", "<<b>>", "b", "<<a>>");
    assertEquals("<<circular reference to a>>\n\n", expander.getExpandedContent("a"));
    assertEquals("<<circular reference to b>>\n\n", expander.getExpandedContent("b"));
  }

  @Test
  void unknownNestedReference() {
    define("a", "x <<missing>>");
    assertEquals("x <<missing not found>>\n", expander.getExpandedContent("a"));
  }

  @Test
  void unknownTopLevelIdentifierThrows() {
    BlockNotFoundException e =
        assertThrows(BlockNotFoundException.class, () -> expander.getExpandedContent("nope"));
    assertEquals("nope", e.getIdentifier());
    assertEquals("Block with identifier \"nope\" not found", e.getMessage());
  }

  @Test
  void replacementTextIsTakenLiterally() {
    define("a", "<<b>>", "b", "cost: $1 \\n");
    assertEquals("cost: $1 \\n\n\n", expander.getExpandedContent("a"));
  }

  @Test
  void explicitPathMarksCycles() {
    define("a", "A");
    assertEquals("<<circular reference to a>>", expander.expand("a", Set.of("a")));
    assertEquals("<<z not found>>", expander.expand("z", Set.of()));
  }
}
