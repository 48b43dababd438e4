package com.partnerbridge.bothub.outbound;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits long texts into chunks of at most {@code limit} chars. A chunk ends at a newline when one
 * falls within the last 20% of the window; the newline stays with the chunk, so the chunks
 * concatenate back to the original text. A limit of one char may split a surrogate pair.
 */
public final class MessageSplitter {

  private MessageSplitter() {}

  public static List<String> split(String text, int limit) {
    if (limit <= 0) {
      throw new IllegalArgumentException("limit must be positive");
    }
    List<String> chunks = new ArrayList<>();
    if (text == null || text.isEmpty()) {
      return chunks;
    }
    String remaining = text;
    while (remaining.length() > limit) {
      int cut = limit;
      int newline = remaining.lastIndexOf('\n', limit - 1);
      if (newline > limit * 0.8) {
        cut = newline + 1;
      } else if (cut > 1 && Character.isHighSurrogate(remaining.charAt(cut - 1))) {
        cut--;
      }
      chunks.add(remaining.substring(0, cut));
      remaining = remaining.substring(cut);
    }
    if (!remaining.isEmpty()) {
      chunks.add(remaining);
    }
    return chunks;
  }
}
