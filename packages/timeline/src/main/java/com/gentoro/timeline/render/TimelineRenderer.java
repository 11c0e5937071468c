package com.gentoro.timeline.render;

import com.gentoro.timeline.model.TaskRecord;
import java.util.List;

/** Turns a non-empty set of task records into a document. */
public interface TimelineRenderer {

  RenderedArtifact render(List<TaskRecord> tasks);
}
