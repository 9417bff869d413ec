package com.flamingo.ai.finqa.domain.enums;

/** Fiscal quarter; {@link #ANNUAL} covers the full fiscal year. */
public enum Quarter {
  Q1(1),
  Q2(2),
  Q3(3),
  Q4(4),
  ANNUAL(5);

  private final int sequence;

  Quarter(int sequence) {
    this.sequence = sequence;
  }

  /** Position within a fiscal year; the annual period sorts after Q4. */
  public int getSequence() {
    return sequence;
  }
}
