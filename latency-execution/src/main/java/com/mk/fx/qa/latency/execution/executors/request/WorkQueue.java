package com.mk.fx.qa.latency.execution.executors.request;

import com.mk.fx.qa.latency.execution.model.TargetDescriptor;
import com.mk.fx.qa.latency.execution.model.WorkItem;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.LongSupplier;

/** Expands targets into the flat, immutable list of work items for one run. */
public final class WorkQueue {

  private WorkQueue() {
    throw new UnsupportedOperationException("WorkQueue cannot be instantiated");
  }

  public static List<WorkItem> expand(
      List<TargetDescriptor> targets, int defaultRequestsPerTarget, boolean interleave) {
    return expand(targets, defaultRequestsPerTarget, interleave, System::currentTimeMillis);
  }

  /**
   * Builds work items for every target. Targets run one after another unless {@code interleave} is
   * set, in which case items are taken round-robin across targets. Global indices follow the
   * resulting order. Targets with a cache-buster parameter get a token unique within the run,
   * {@code <epochMillis>_<globalIndex>}.
   *
   * @param targets targets in declaration order
   * @param defaultRequestsPerTarget count used when a target has no override
   * @param interleave whether to alternate between targets
   * @param epochMillis time source for cache-buster tokens
   * @return immutable list of work items
   */
  public static List<WorkItem> expand(
      List<TargetDescriptor> targets,
      int defaultRequestsPerTarget,
      boolean interleave,
      LongSupplier epochMillis) {
    Objects.requireNonNull(targets, "targets");
    Objects.requireNonNull(epochMillis, "epochMillis");
    if (defaultRequestsPerTarget < 0) {
      throw new IllegalArgumentException("defaultRequestsPerTarget must be >= 0");
    }

    List<int[]> order = new ArrayList<>();
    int[] counts = new int[targets.size()];
    int maxCount = 0;
    for (int i = 0; i < targets.size(); i++) {
      Integer override = targets.get(i).requestCount();
      counts[i] = override != null ? override : defaultRequestsPerTarget;
      maxCount = Math.max(maxCount, counts[i]);
    }

    if (interleave) {
      for (int sequence = 0; sequence < maxCount; sequence++) {
        for (int t = 0; t < targets.size(); t++) {
          if (sequence < counts[t]) {
            order.add(new int[] {t, sequence});
          }
        }
      }
    } else {
      for (int t = 0; t < targets.size(); t++) {
        for (int sequence = 0; sequence < counts[t]; sequence++) {
          order.add(new int[] {t, sequence});
        }
      }
    }

    long runStamp = epochMillis.getAsLong();
    List<WorkItem> items = new ArrayList<>(order.size());
    long globalIndex = 0;
    for (int[] slot : order) {
      TargetDescriptor target = targets.get(slot[0]);
      Map<String, String> parameters =
          target.cacheBusterParam() != null
              ? Map.of(target.cacheBusterParam(), runStamp + "_" + globalIndex)
              : Map.of();
      items.add(new WorkItem(target.id(), slot[1], globalIndex, parameters));
      globalIndex++;
    }
    return Collections.unmodifiableList(items);
  }
}
