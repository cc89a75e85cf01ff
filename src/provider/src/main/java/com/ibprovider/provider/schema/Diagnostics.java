package com.ibprovider.provider.schema;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/** Errors and warnings produced by a data source read. */
public final class Diagnostics {
  private final List<Diagnostic> entries;

  private Diagnostics(List<Diagnostic> entries) {
    this.entries = Collections.unmodifiableList(entries);
  }

  public static Diagnostics empty() {
    return new Diagnostics(List.of());
  }

  public static Diagnostics error(String summary) {
    return new Diagnostics(List.of(new Diagnostic(Severity.ERROR, summary, "")));
  }

  public static Diagnostics fromException(Throwable ex) {
    String summary = ex.getMessage() == null ? ex.getClass().getSimpleName() : ex.getMessage();
    return error(summary);
  }

  public Diagnostics append(Diagnostic diagnostic) {
    List<Diagnostic> next = new ArrayList<>(entries);
    next.add(diagnostic);
    return new Diagnostics(next);
  }

  public boolean hasErrors() {
    return entries.stream().anyMatch(d -> d.severity() == Severity.ERROR);
  }

  @JsonValue
  public List<Diagnostic> entries() {
    return entries;
  }

  @Override
  public String toString() {
    return entries.toString();
  }
}
