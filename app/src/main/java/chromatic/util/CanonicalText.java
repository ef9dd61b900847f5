package chromatic.util;

import chromatic.core.error.MalformedInputException;
import com.google.common.base.CharMatcher;
import com.google.common.base.Joiner;
import com.google.common.base.Splitter;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Reads and writes the parenthesized canonical texts used as identities for compositions
 * {@code (2,1,3)} and set compositions {@code (2,4|1|3,5,6)}.
 */
public final class CanonicalText {
  private static final Splitter ELEMENTS = Splitter.on(',').trimResults();
  private static final Splitter BLOCKS = Splitter.on('|').trimResults();
  private static final CharMatcher DIGITS = CharMatcher.inRange('0', '9');
  private static final Joiner ELEMENT_JOINER = Joiner.on(',');
  private static final Joiner BLOCK_JOINER = Joiner.on('|');

  private CanonicalText() {}

  /** Parses {@code (a,b,c)} into its integers; {@code ()} yields an empty list. */
  public static List<Integer> parseSequence(String text) {
    String body = body(text);
    if (body.isEmpty()) {
      return List.of();
    }
    return parseIntegers(body, text);
  }

  /** Parses {@code (a,b|c|d,e)} into its blocks; {@code ()} yields an empty list. */
  public static List<List<Integer>> parseBlocks(String text) {
    String body = body(text);
    if (body.isEmpty()) {
      return List.of();
    }
    List<List<Integer>> blocks = new ArrayList<>();
    for (String block : BLOCKS.split(body)) {
      if (block.isEmpty()) {
        throw new MalformedInputException("Empty block in set composition text: " + text);
      }
      blocks.add(parseIntegers(block, text));
    }
    return blocks;
  }

  public static String formatSequence(List<Integer> values) {
    return "(" + ELEMENT_JOINER.join(values) + ")";
  }

  public static String formatBlocks(List<? extends List<Integer>> blocks) {
    List<String> rendered = new ArrayList<>(blocks.size());
    for (List<Integer> block : blocks) {
      rendered.add(ELEMENT_JOINER.join(block));
    }
    return "(" + BLOCK_JOINER.join(rendered) + ")";
  }

  private static String body(String text) {
    Objects.requireNonNull(text, "text");
    String trimmed = text.trim();
    if (trimmed.length() < 2
        || trimmed.charAt(0) != '('
        || trimmed.charAt(trimmed.length() - 1) != ')') {
      throw new MalformedInputException(
          "Expected a parenthesized form such as '(2,1,3)', got '" + text + "'");
    }
    return trimmed.substring(1, trimmed.length() - 1).trim();
  }

  private static List<Integer> parseIntegers(String body, String original) {
    List<Integer> values = new ArrayList<>();
    for (String token : ELEMENTS.split(body)) {
      if (token.isEmpty() || !DIGITS.matchesAllOf(token)) {
        throw new MalformedInputException(
            "Expected ASCII digits but got '" + token + "' in '" + original + "'");
      }
      try {
        values.add(Integer.parseInt(token));
      } catch (NumberFormatException ex) {
        throw new MalformedInputException(
            "Invalid integer '" + token + "' in '" + original + "'", ex);
      }
    }
    return values;
  }
}
