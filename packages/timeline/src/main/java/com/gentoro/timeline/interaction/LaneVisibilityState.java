package com.gentoro.timeline.interaction;

import com.gentoro.timeline.layout.DrawableItem;
import com.gentoro.timeline.layout.LaneBand;
import com.gentoro.timeline.layout.Scene;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;

/**
 * Collapse/expand state of every lane of a {@link Scene}.
 *
 * <p>This is the same contract the embedded viewer script implements: a collapsed lane hides every
 * non-header item whose vertical center lies inside the lane's band. Membership comes from the
 * scene's lane index, never from item labels.
 */
public class LaneVisibilityState {
  private final Scene scene;
  private final Map<String, DisclosureState> states = new LinkedHashMap<>();

  public LaneVisibilityState(Scene scene) {
    this.scene = scene;
    for (LaneBand band : scene.lanes()) {
      states.put(band.lane(), DisclosureState.EXPANDED);
    }
  }

  public DisclosureState state(String lane) {
    DisclosureState state = states.get(lane);
    if (state == null) {
      throw new NoSuchElementException("Unknown lane: " + lane);
    }
    return state;
  }

  public DisclosureState toggle(String lane) {
    DisclosureState next = state(lane).toggle();
    states.put(lane, next);
    return next;
  }

  /** Force every lane to {@code target}. */
  public void bulkSet(DisclosureState target) {
    states.replaceAll((lane, current) -> target);
  }

  public boolean isVisible(DrawableItem item) {
    if (item.kind() == DrawableItem.Kind.LANE_HEADER) {
      return true;
    }
    double cy = item.centerY();
    for (LaneBand band : scene.lanes()) {
      if (states.get(band.lane()) == DisclosureState.COLLAPSED && band.contains(cy)) {
        return false;
      }
    }
    return true;
  }

  public List<DrawableItem> visibleItems() {
    return scene.items().stream().filter(this::isVisible).toList();
  }

  public Map<String, DisclosureState> snapshot() {
    return Map.copyOf(states);
  }
}
