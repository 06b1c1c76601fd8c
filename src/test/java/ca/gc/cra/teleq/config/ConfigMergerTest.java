package ca.gc.cra.teleq.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class ConfigMergerTest {

  @Test
  void overrideReplacesScalarsAndArraysWholesale() {
    Map<String, Object> base = Map.of("a", 1, "list", List.of(1, 2, 3));
    Map<String, Object> override = Map.of("a", 2, "list", List.of(9));

    Map<String, Object> merged = ConfigMerger.deepMerge(base, override);

    assertEquals(2, merged.get("a"));
    assertEquals(List.of(9), merged.get("list"));
  }

  @Test
  void nestedObjectsMergeKeyByKey() {
    Map<String, Object> base = Map.of("advanced", Map.of("x", 1, "y", Map.of("z", 1)));
    Map<String, Object> override = Map.of("advanced", Map.of("y", Map.of("w", 2)));

    Map<String, Object> merged = ConfigMerger.deepMerge(base, override);

    assertEquals(Map.of("x", 1, "y", Map.of("z", 1, "w", 2)), merged.get("advanced"));
  }

  @Test
  void extendsIsNeverCarriedIntoTheResult() {
    Map<String, Object> merged = ConfigMerger.mergeChain(List.of(
        Map.of("extends", "x", "a", 1),
        Map.of("extends", "y", "b", 2)));

    assertFalse(merged.containsKey("extends"));
    assertEquals(Map.of("a", 1, "b", 2), merged);
  }

  @Test
  void mergeDoesNotShareStateWithInputs() {
    List<Object> list = new ArrayList<>(List.of("one"));
    Map<String, Object> nested = new LinkedHashMap<>(Map.of("k", "v"));
    Map<String, Object> base = new LinkedHashMap<>();
    base.put("list", list);
    base.put("nested", nested);

    Map<String, Object> merged = ConfigMerger.deepMerge(base, null);
    list.add("two");
    nested.put("k2", "v2");

    assertEquals(List.of("one"), merged.get("list"));
    assertNull(((Map<?, ?>) merged.get("nested")).get("k2"));
  }

  @Test
  void explicitNullOverridesInheritedValue() {
    Map<String, Object> override = new LinkedHashMap<>();
    override.put("tenantId", null);

    Map<String, Object> merged = ConfigMerger.deepMerge(Map.of("tenantId", "t"), override);

    assertNull(merged.get("tenantId"));
  }
}
