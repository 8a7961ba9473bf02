package com.gentoro.tangle.syntax;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Attributes of a fenced code block info string, e.g. {@code {.python #hello .extra key="v"}}.
 *
 * <p>Only the first {@code #id} token counts as the identifier. The first class is the language.
 * An info string without braces is a bare language name.
 */
public record FenceAttributes(
    String identifier, List<String> classes, Map<String, String> attributes) {

  public static final FenceAttributes EMPTY = new FenceAttributes(null, List.of(), Map.of());

  public static FenceAttributes parse(String info) {
    if (info == null) return EMPTY;
    String s = info.trim();
    if (s.isEmpty()) return EMPTY;

    if (!s.startsWith("{")) {
      // bare language: ```python
      String lang = s.split("\\s+", 2)[0];
      return new FenceAttributes(null, List.of(lang), Map.of());
    }
    int close = s.indexOf('}');
    String body = close < 0 ? s.substring(1) : s.substring(1, close);

    String identifier = null;
    List<String> classes = new ArrayList<>();
    Map<String, String> attributes = new LinkedHashMap<>();
    for (String token : tokenize(body)) {
      if (token.startsWith("#") && token.length() > 1) {
        if (identifier == null) identifier = token.substring(1);
      } else if (token.startsWith(".") && token.length() > 1) {
        classes.add(token.substring(1));
      } else if (token.contains("=")) {
        int eq = token.indexOf('=');
        String key = token.substring(0, eq);
        String value = unquote(token.substring(eq + 1));
        if (!key.isEmpty()) attributes.put(key, value);
      }
    }
    return new FenceAttributes(
        identifier,
        Collections.unmodifiableList(classes),
        Collections.unmodifiableMap(attributes));
  }

  /** First class, or the empty string when there is none. */
  public String language() {
    return classes.isEmpty() ? "" : classes.get(0);
  }

  // Whitespace separated, double quotes group.
  private static List<String> tokenize(String body) {
    List<String> tokens = new ArrayList<>();
    StringBuilder current = new StringBuilder();
    boolean quoted = false;
    for (int i = 0; i < body.length(); i++) {
      char c = body.charAt(i);
      if (c == '"') {
        quoted = !quoted;
        current.append(c);
      } else if (Character.isWhitespace(c) && !quoted) {
        if (current.length() > 0) {
          tokens.add(current.toString());
          current.setLength(0);
        }
      } else {
        current.append(c);
      }
    }
    if (current.length() > 0) tokens.add(current.toString());
    return tokens;
  }

  private static String unquote(String v) {
    if (v.length() >= 2 && v.startsWith("\"") && v.endsWith("\"")) {
      return v.substring(1, v.length() - 1);
    }
    return v;
  }
}
