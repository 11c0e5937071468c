package com.gentoro.timeline.ingest;

import com.gentoro.timeline.model.TaskRecord;
import java.util.List;

/** Valid task records in input order, plus one diagnostic per skipped line. */
public record ParseResult(List<TaskRecord> tasks, List<ParseDiagnostic> diagnostics) {

  public ParseResult {
    tasks = List.copyOf(tasks);
    diagnostics = List.copyOf(diagnostics);
  }

  public boolean isEmpty() {
    return tasks.isEmpty();
  }
}
