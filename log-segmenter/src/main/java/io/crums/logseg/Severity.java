/*
 * Copyright 2025 Babak Farhang
 */
package io.crums.logseg;


import java.util.Optional;

/**
 * Severity tokens recognized in log lines. The engine records the token
 * literally (uppercased): {@code FATAL} and {@code WARNING} are kept
 * distinct from {@code ERROR} and {@code WARN}. Their equivalence is
 * a presentation concern, exposed via {@linkplain #level()}.
 */
public enum Severity {

  FATAL,
  ERROR,
  WARNING,
  WARN,
  INFO,
  DEBUG,
  TRACE;


  /**
   * Returns the presentation level: {@code FATAL} maps to {@code ERROR},
   * {@code WARNING} maps to {@code WARN}; the others map to themselves.
   */
  public Severity level() {
    switch (this) {
    case FATAL:     return ERROR;
    case WARNING:   return WARN;
    default:        return this;
    }
  }


  /** Returns {@code true} iff this is {@code ERROR} or {@code FATAL}. */
  public boolean isError() {
    return level() == ERROR;
  }


  /**
   * Looks up the instance by token, ignoring case.
   *
   * @param token   e.g. "warn", "Error"
   * @return  empty, if not a severity token
   */
  public static Optional<Severity> forToken(String token) {
    for (var sev : values())
      if (sev.name().equalsIgnoreCase(token))
        return Optional.of(sev);
    return Optional.empty();
  }

}
