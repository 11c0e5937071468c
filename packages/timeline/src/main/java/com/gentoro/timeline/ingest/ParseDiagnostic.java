package com.gentoro.timeline.ingest;

/** A skipped input record, numbered after its first line, and the reason it was skipped. */
public record ParseDiagnostic(int lineNumber, String reason, String rawLine) {

  @Override
  public String toString() {
    return "line " + lineNumber + ": " + reason;
  }
}
