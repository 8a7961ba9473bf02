package com.gentoro.tangle.syntax;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/** Inline reference syntax shared by extraction, location scanning and expansion. */
public final class LiterateSyntax {

  /**
   * Matches a reference marker such as {@code <<hello-rust>>}. Group 1 is the identifier, which
   * may not contain whitespace or {@code >}.
   */
  public static final Pattern REFERENCE = Pattern.compile("<<([^>\\s]+)>>");

  private LiterateSyntax() {}

  /** Identifiers referenced from {@code content}, in order of first appearance. */
  public static Set<String> references(String content) {
    if (content == null || content.isEmpty()) return Set.of();
    Set<String> out = new LinkedHashSet<>();
    Matcher m = REFERENCE.matcher(content);
    while (m.find()) {
      out.add(m.group(1));
    }
    return Collections.unmodifiableSet(out);
  }

  public static String circularReferenceMarker(String identifier) {
    return "<<circular reference to " + identifier + ">>";
  }

  public static String notFoundMarker(String identifier) {
    return "<<" + identifier + " not found>>";
  }
}
