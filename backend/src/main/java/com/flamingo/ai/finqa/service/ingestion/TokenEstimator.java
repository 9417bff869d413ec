package com.flamingo.ai.finqa.service.ingestion;

/** Character-based token estimate: one token per four characters, rounded up. */
public final class TokenEstimator {

  private TokenEstimator() {}

  public static int estimate(CharSequence text) {
    return text == null ? 0 : estimate(text.length());
  }

  public static int estimate(int characters) {
    return (Math.max(0, characters) + 3) / 4;
  }
}
