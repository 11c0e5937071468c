package com.gentoro.timeline.layout;

import com.gentoro.timeline.model.TaskRecord;

/** A task and the lane-local row it was packed into. */
public record RowAssignment(TaskRecord task, int row) {}
