package com.flamingo.ai.finqa.domain.model;

/**
 * A run of text produced by upstream extraction.
 *
 * @param offset character offset of the span within its page
 * @param text the extracted text; may contain line breaks
 */
public record TextSpan(int offset, String text) implements PageItem {

  public TextSpan {
    text = text == null ? "" : text;
  }

  @Override
  public int endOffset() {
    return offset + text.length();
  }
}
