package ca.gc.cra.aoaisim.infrastructure.generate;

import java.util.List;
import java.util.Random;

/** Produces filler text of roughly the requested token length. */
final class LoremText {
  private static final List<String> WORDS = List.of(
      "lorem", "ipsum", "dolor", "sit", "amet", "consectetur", "adipiscing", "elit", "sed", "do",
      "eiusmod", "tempor", "incididunt", "ut", "labore", "et", "dolore", "magna", "aliqua", "enim",
      "ad", "minim", "veniam", "quis", "nostrud", "exercitation", "ullamco", "laboris", "nisi",
      "aliquip", "ex", "ea", "commodo", "consequat", "duis", "aute", "irure", "in", "reprehenderit",
      "voluptate", "velit", "esse", "cillum", "fugiat", "nulla", "pariatur");

  private LoremText() {
    // Utility
  }

  static String generate(Random random, long tokens) {
    long targetChars = Math.max(0L, tokens) * TokenEstimator.CHARS_PER_TOKEN;
    StringBuilder text = new StringBuilder((int) Math.min(targetChars + 16, 1 << 20));
    boolean sentenceStart = true;
    while (text.length() < targetChars) {
      String word = WORDS.get(random.nextInt(WORDS.size()));
      if (text.length() > 0) {
        text.append(' ');
      }
      if (sentenceStart) {
        text.append(Character.toUpperCase(word.charAt(0))).append(word, 1, word.length());
        sentenceStart = false;
      } else {
        text.append(word);
      }
      if (random.nextInt(12) == 0) {
        text.append('.');
        sentenceStart = true;
      }
    }
    if (text.length() > targetChars) {
      text.setLength((int) targetChars);
    }
    return text.toString();
  }
}
