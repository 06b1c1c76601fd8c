package ca.gc.cra.teleq.config;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Explicit name graph of profile {@code extends} edges.
 *
 * <p>Lineage is computed iteratively with a visited set, so arbitrarily long chains and cycles terminate. Cycles
 * are reported before any merge happens.</p>
 *
 * @since 0.1.0
 */
final class ProfileGraph {
  static final String EXTENDS = "extends";

  private final Map<String, String> parents;

  private ProfileGraph(Map<String, String> parents) {
    this.parents = parents;
  }

  /**
   * Builds the graph from the document's profile objects.
   *
   * @param profiles profiles keyed by name
   * @return graph of parent edges
   * @throws ConfigException when an {@code extends} value is not a string
   */
  static ProfileGraph of(Map<String, Map<String, Object>> profiles) {
    Map<String, String> parents = new LinkedHashMap<>();
    for (Map.Entry<String, Map<String, Object>> entry : profiles.entrySet()) {
      Object parent = entry.getValue().get(EXTENDS);
      if (parent == null) {
        parents.put(entry.getKey(), null);
      } else if (parent instanceof String name && !name.isBlank()) {
        parents.put(entry.getKey(), name.trim());
      } else {
        throw new ConfigException(ConfigException.Kind.MALFORMED_CONFIG,
            "Profile '" + entry.getKey() + "' has an invalid 'extends' value; expected a profile name");
      }
    }
    return new ProfileGraph(Collections.unmodifiableMap(parents));
  }

  boolean contains(String name) {
    return parents.containsKey(name);
  }

  Optional<String> parentOf(String name) {
    return Optional.ofNullable(parents.get(name));
  }

  Set<String> names() {
    return parents.keySet();
  }

  /**
   * Returns the inheritance chain ordered from the root ancestor down to {@code target}.
   *
   * @param target profile to resolve
   * @return lineage, root first, target last
   * @throws ConfigException {@link ConfigException.Kind#PROFILE_NOT_FOUND} for a missing target or parent,
   *     {@link ConfigException.Kind#CIRCULAR_INHERITANCE} when the chain loops
   */
  List<String> lineage(String target) {
    Objects.requireNonNull(target, "target");
    if (!parents.containsKey(target)) {
      throw new ConfigException(ConfigException.Kind.PROFILE_NOT_FOUND,
          "Profile '" + target + "' not found. Available profiles: " + String.join(", ", parents.keySet()));
    }
    LinkedHashSet<String> visited = new LinkedHashSet<>();
    String current = target;
    while (current != null) {
      if (!visited.add(current)) {
        throw new ConfigException(ConfigException.Kind.CIRCULAR_INHERITANCE,
            "Circular profile inheritance detected: " + describeCycle(visited, current));
      }
      String parent = parents.get(current);
      if (parent != null && !parents.containsKey(parent)) {
        throw new ConfigException(ConfigException.Kind.PROFILE_NOT_FOUND,
            "Profile '" + current + "' extends unknown profile '" + parent + "'");
      }
      current = parent;
    }
    List<String> chain = new ArrayList<>(visited);
    Collections.reverse(chain);
    return List.copyOf(chain);
  }

  private static String describeCycle(LinkedHashSet<String> visited, String repeated) {
    List<String> path = new ArrayList<>();
    boolean inCycle = false;
    for (String name : visited) {
      if (name.equals(repeated)) {
        inCycle = true;
      }
      if (inCycle) {
        path.add(name);
      }
    }
    path.add(repeated);
    return String.join(" -> ", path);
  }
}
