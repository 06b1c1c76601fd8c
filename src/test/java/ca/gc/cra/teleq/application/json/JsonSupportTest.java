package ca.gc.cra.teleq.application.json;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.fasterxml.jackson.core.JsonProcessingException;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class JsonSupportTest {
  private final JsonSupport json = new JsonSupport();

  @Test
  void parsesNestedDocumentsPreservingKeyOrder() {
    Map<String, Object> root = json.parseObject("{\"b\":1,\"a\":{\"list\":[true,null,\"x\",1.5]}}");

    assertEquals(List.of("b", "a"), List.copyOf(root.keySet()));
    assertEquals(1, ((Number) root.get("b")).intValue());
    @SuppressWarnings("unchecked")
    Map<String, Object> nested = (Map<String, Object>) root.get("a");
    assertEquals(Arrays.asList(true, null, "x", 1.5), nested.get("list"));
  }

  @Test
  void rejectsNonObjectRootAndTrailingContent() {
    assertThrows(IllegalArgumentException.class, () -> json.parseObject("[1,2]"));
    assertThrows(IllegalArgumentException.class, () -> json.parse("{} {}"));
    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class, () -> json.parse("{\"a\":"));
    assertTrue(ex.getMessage().startsWith("Invalid JSON payload"), ex.getMessage());
  }

  @Test
  void writesMapsListsAndScalars() {
    Map<String, Object> value = new LinkedHashMap<>();
    value.put("name", "q");
    value.put("rows", List.of(List.of(1, "a"), new Object[] {2L, false}));
    value.put("missing", null);

    assertEquals("{\"name\":\"q\",\"rows\":[[1,\"a\"],[2,false]],\"missing\":null}", json.write(value));
  }

  @Test
  void emptyInputParsesToEmptyObject() {
    assertTrue(json.parseObject("   ").isEmpty());
    assertNull(json.parse("null"));
  }

  @Test
  void syntaxErrorsReportTheParserMessageWithoutSourceLocation() {
    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class, () -> json.parse("{\"a\": tru}"));

    assertTrue(ex.getMessage().startsWith("Invalid JSON payload: "), ex.getMessage());
    assertFalse(ex.getMessage().contains("[Source:"), ex.getMessage());
    assertTrue(ex.getCause() instanceof JsonProcessingException);
  }
}
