/*
 * Copyright 2025 Babak Farhang
 */
package io.crums.logseg;


import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/**
 * Consumer-side entry filter: by severity level and by text. Both criteria
 * are optional and combine with AND. Since instances are immutable,
 * <em>mutator methods return new instances.</em>
 *
 * <h2>Severity Matching</h2>
 * <p>
 * A {@code WARN} filter matches entries recorded with either {@code WARN}
 * or {@code WARNING}. Every other level matches only the identical token
 * (so an {@code ERROR} filter does not match {@code FATAL}).
 * </p>
 */
public final class EntryFilter implements Predicate<LogEntry> {

  /** Matches everything. */
  public final static EntryFilter ALL = new EntryFilter(null, null);


  private final Severity severity;
  private final String query;


  private EntryFilter(Severity severity, String query) {
    this.severity = severity;
    this.query = query;
  }


  /**
   * Returns an instance matching the given severity.
   *
   * @param sev   {@code null} means any severity (including none)
   */
  public EntryFilter severity(Severity sev) {
    return sev == severity ? this : new EntryFilter(sev, query);
  }


  public Optional<Severity> severity() {
    return Optional.ofNullable(severity);
  }


  /**
   * Returns an instance matching entries whose text contains the given
   * query, ignoring case.
   *
   * @param text  {@code null} or blank means any text
   */
  public EntryFilter text(String text) {
    String q = text == null || text.isBlank() ? null : text.toLowerCase(Locale.ROOT);
    return new EntryFilter(severity, q);
  }


  /** Returns the (lowercased) text query, if any. */
  public Optional<String> text() {
    return Optional.ofNullable(query);
  }


  @Override
  public boolean test(LogEntry entry) {
    if (severity != null) {
      if (entry.severity().isEmpty())
        return false;
      Severity sev = entry.severity().get();
      boolean match =
          severity == Severity.WARN ?
              sev.level() == Severity.WARN :
                sev == severity;
      if (!match)
        return false;
    }
    return query == null || entry.text().toLowerCase(Locale.ROOT).contains(query);
  }


  /** Returns the matching entries, in order. */
  public List<LogEntry> apply(List<LogEntry> entries) {
    if (this == ALL || severity == null && query == null)
      return entries;
    return entries.stream().filter(this).collect(Collectors.toList());
  }


  @Override
  public String toString() {
    return "EntryFilter[severity=%s, text=%s]".formatted(severity, query);
  }

}
