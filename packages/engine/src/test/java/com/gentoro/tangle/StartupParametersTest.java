package com.gentoro.tangle;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

class StartupParametersTest {

  @Test
  void defaults() {
    StartupParameters params = new StartupParameters(new String[] {"--input", "docs"});
    assertEquals("outline", params.mode());
    assertEquals("classpath:application.yaml", params.configFile());
    assertEquals("json", params.getParameter("format", String.class));
    assertEquals("docs", params.getParameter("input", String.class));
    assertFalse(params.isParameterPresent("block"));
  }

  @Test
  void expandRequiresBlock() {
    IllegalArgumentException e =
        assertThrows(
            IllegalArgumentException.class,
            () -> new StartupParameters(new String[] {"--mode", "expand", "--input", "d"}));
    assertTrue(e.getMessage().contains("--block"));

    StartupParameters ok =
        new StartupParameters(
            new String[] {"--mode", "expand", "--input", "d", "--block", "main"});
    assertEquals("main", ok.getOptionalParameter("block", String.class).orElseThrow());
  }

  @Test
  void inputIsRequiredOutsideHelp() {
    assertThrows(IllegalArgumentException.class, () -> new StartupParameters(new String[0]));
    assertEquals("help", new StartupParameters(new String[] {"--mode", "help"}).mode());
  }

  @Test
  void rejectsUnknownModeAndFormat() {
    assertThrows(
        IllegalArgumentException.class,
        () -> new StartupParameters(new String[] {"--mode", "server", "--input", "d"}));
    assertThrows(
        IllegalArgumentException.class,
        () -> new StartupParameters(new String[] {"--input", "d", "--format", "xml"}));
  }

  @Test
  void flagWithoutValueDoesNotSwallowNextFlag() {
    IllegalArgumentException e =
        assertThrows(
            IllegalArgumentException.class,
            () -> new StartupParameters(new String[] {"--input", "--mode", "cycles"}));
    assertTrue(e.getMessage().contains("--input"));
  }
}
