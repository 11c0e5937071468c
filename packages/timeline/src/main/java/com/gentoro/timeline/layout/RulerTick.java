package com.gentoro.timeline.layout;

/** Ruler mark at time {@code time}, drawn at {@code x}. */
public record RulerTick(double time, double x) {}
