package com.github.fsmanalysis;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;

/**
 * Flags transitions that race each other: same source state, same trigger, same priority,
 * different targets.
 *
 * Wildcard transitions never take part. A concrete transition always wins over a wildcard on the
 * same trigger. Differing priorities on the same (source, trigger) are a deliberate tie-break
 * and are not reported.
 */
final class AmbiguityDetector {

  static List<AmbiguousTransition> ambiguousTransitions(final FsmSpecification specification) {
    // K=(fromState, trigger) in first-seen order, V=priority -> distinct targets
    final Map<TriggerKey, TreeMap<Integer, Set<String>>> groups = new LinkedHashMap<>();
    for (final Transition transition : specification.getTransitions()) {
      if (transition.isWildcard()) {
        continue;
      }
      groups
          .computeIfAbsent(new TriggerKey(transition.getFromState(), transition.getTrigger()),
              key -> new TreeMap<>())
          .computeIfAbsent(transition.getPriority(), priority -> new LinkedHashSet<>())
          .add(transition.getToState());
    }

    final List<AmbiguousTransition> ambiguous = new ArrayList<>();
    for (final Map.Entry<TriggerKey, TreeMap<Integer, Set<String>>> group : groups.entrySet()) {
      for (final Map.Entry<Integer, Set<String>> bucket : group.getValue().entrySet()) {
        if (bucket.getValue().size() > 1) {
          ambiguous.add(new AmbiguousTransition(group.getKey().fromState,
              group.getKey().trigger, bucket.getKey(), new ArrayList<>(bucket.getValue())));
        }
      }
    }
    return ambiguous;
  }

  private static final class TriggerKey {
    private final String fromState;
    private final String trigger;

    private TriggerKey(final String fromState, final String trigger) {
      this.fromState = fromState;
      this.trigger = trigger;
    }

    @Override
    public boolean equals(Object o) {
      if (this == o) {
        return true;
      }
      if (!(o instanceof TriggerKey)) {
        return false;
      }
      TriggerKey key = (TriggerKey) o;
      return Objects.equals(fromState, key.fromState) && Objects.equals(trigger, key.trigger);
    }

    @Override
    public int hashCode() {
      return Objects.hash(fromState, trigger);
    }
  }

  private AmbiguityDetector() {}
}
