package com.verlumen.candlestream.execution;

import java.util.Locale;

/** Whether feeds connect to the real venue ({@code WET}) or to the simulator ({@code DRY}). */
public enum RunMode {
  WET,
  DRY;

  public static RunMode fromString(String name) {
    return RunMode.valueOf(name.trim().toUpperCase(Locale.ROOT));
  }
}
