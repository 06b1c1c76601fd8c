package ca.gc.cra.teleq.config;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Merges profile objects along an inheritance chain and layers document-wide defaults underneath.
 *
 * <p>Nested objects merge key by key; arrays and scalars in the child replace the parent's value wholesale. The
 * {@code extends} key never survives a merge. Inputs are not modified.</p>
 */
public final class ConfigMerger {

  private ConfigMerger() {}

  /**
   * Deep merges {@code override} on top of {@code base}.
   *
   * @param base parent values; may be {@code null}
   * @param override child values; may be {@code null}
   * @return new mutable map with {@code extends} removed
   */
  public static Map<String, Object> deepMerge(Map<String, Object> base, Map<String, Object> override) {
    Map<String, Object> merged = copyObject(base);
    if (override != null) {
      for (Map.Entry<String, Object> entry : override.entrySet()) {
        String key = entry.getKey();
        Object value = entry.getValue();
        Object existing = merged.get(key);
        if (value instanceof Map<?, ?> childMap && existing instanceof Map<?, ?> parentMap) {
          merged.put(key, deepMerge(asObject(parentMap), asObject(childMap)));
        } else {
          merged.put(key, copyValue(value));
        }
      }
    }
    merged.remove(ProfileGraph.EXTENDS);
    return merged;
  }

  /**
   * Folds a lineage of profile objects, root ancestor first.
   *
   * @param chain profile objects ordered root to target
   * @return merged profile
   */
  public static Map<String, Object> mergeChain(List<Map<String, Object>> chain) {
    Map<String, Object> merged = new LinkedHashMap<>();
    for (Map<String, Object> layer : chain) {
      merged = deepMerge(merged, layer);
    }
    return merged;
  }

  /**
   * Applies document-wide {@code cache}, {@code sanitize} and {@code telemetry} blocks to fields the profile does
   * not set itself.
   *
   * @param profile merged profile values
   * @param document source document
   * @return new map with defaults applied
   */
  public static Map<String, Object> applyDocumentDefaults(Map<String, Object> profile, ConfigurationDocument document) {
    Map<String, Object> result = copyObject(profile);
    Map<String, Object> cache = document.section(ConfigurationDocument.CACHE_SECTION);
    putIfAbsent(result, ResolvedProfile.CACHE_ENABLED, cache.get("enabled"));
    putIfAbsent(result, ResolvedProfile.CACHE_TTL_SECONDS, cache.get("ttlSeconds"));
    Map<String, Object> sanitize = document.section(ConfigurationDocument.SANITIZE_SECTION);
    putIfAbsent(result, ResolvedProfile.REMOVE_PII, sanitize.get("removePII"));

    Map<String, Object> telemetry = document.section(ResolvedProfile.TELEMETRY);
    if (!telemetry.isEmpty()) {
      Object own = result.get(ResolvedProfile.TELEMETRY);
      if (own instanceof Map<?, ?> ownMap) {
        result.put(ResolvedProfile.TELEMETRY, deepMerge(telemetry, asObject(ownMap)));
      } else if (own == null) {
        result.put(ResolvedProfile.TELEMETRY, copyObject(telemetry));
      }
    }
    return result;
  }

  private static void putIfAbsent(Map<String, Object> target, String key, Object value) {
    if (value != null && target.get(key) == null) {
      target.put(key, copyValue(value));
    }
  }

  @SuppressWarnings("unchecked")
  static Map<String, Object> asObject(Map<?, ?> map) {
    return (Map<String, Object>) map;
  }

  static Map<String, Object> copyObject(Map<String, Object> source) {
    Map<String, Object> copy = new LinkedHashMap<>();
    if (source != null) {
      for (Map.Entry<String, Object> entry : source.entrySet()) {
        copy.put(entry.getKey(), copyValue(entry.getValue()));
      }
    }
    return copy;
  }

  static Object copyValue(Object value) {
    if (value instanceof Map<?, ?> map) {
      return copyObject(asObject(map));
    }
    if (value instanceof List<?> list) {
      List<Object> copy = new ArrayList<>(list.size());
      for (Object item : list) {
        copy.add(copyValue(item));
      }
      return copy;
    }
    return value;
  }
}
