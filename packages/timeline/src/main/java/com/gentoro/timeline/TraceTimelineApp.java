package com.gentoro.timeline;

import com.gentoro.timeline.cli.TimelineCommand;

public class TraceTimelineApp {

  public static void main(String[] args) {
    int exitCode = TimelineCommand.commandLine().execute(args);
    System.exit(exitCode);
  }
}
