package com.example.alpenglow.theoremmap.util;

import com.example.alpenglow.theoremmap.vocabulary.TheoremVocabulary;

import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

public final class StatementTextUtils {
  private StatementTextUtils() {}

  private static final Pattern WHITESPACE = Pattern.compile("\\s+");
  private static final Pattern BOLD = Pattern.compile("\\*\\*([^*]+)\\*\\*");
  private static final Pattern ITALIC = Pattern.compile("\\*([^*]+)\\*");
  private static final Pattern CODE = Pattern.compile("`([^`]+)`");

  /** Collapse every whitespace run to one space and trim. */
  public static String collapseWhitespace(String text) {
    if (text == null) {
      return "";
    }
    return WHITESPACE.matcher(text.strip()).replaceAll(" ");
  }

  /** Whitepaper clean-up: collapsed whitespace, markdown emphasis and code ticks removed. */
  public static String cleanProse(String text) {
    String s = collapseWhitespace(text);
    s = BOLD.matcher(s).replaceAll("$1");
    s = ITALIC.matcher(s).replaceAll("$1");
    s = CODE.matcher(s).replaceAll("$1");
    return s.strip();
  }

  /** Formal clean-up: block comments dropped, whitespace collapsed. */
  public static String cleanFormal(String text) {
    if (text == null) {
      return "";
    }
    String s = TheoremVocabulary.BLOCK_COMMENT.matcher(text).replaceAll(" ");
    return collapseWhitespace(s);
  }

  /** Lowercase word tokens, i.e. whatever a word-boundary match yields. */
  public static Set<String> wordTokens(String text) {
    if (text == null || text.isBlank()) {
      return Set.of();
    }
    Set<String> tokens = new LinkedHashSet<>();
    Matcher m = TheoremVocabulary.WORD_TOKEN.matcher(text.toLowerCase(Locale.ROOT));
    while (m.find()) {
      tokens.add(m.group());
    }
    return tokens;
  }

  /** 1-based line number of a character offset. */
  public static int lineNumberAt(String content, int offset) {
    int newlines = 0;
    int end = Math.min(offset, content.length());
    for (int i = 0; i < end; i++) {
      if (content.charAt(i) == '\n') {
        newlines++;
      }
    }
    return newlines + 1;
  }
}
