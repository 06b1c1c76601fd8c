package ca.gc.cra.teleq.application.telemetry;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import org.junit.jupiter.api.Test;

class TelemetrySanitizerTest {

  @Test
  void errorMessagesLosePathsSecretsAndIdentifiers() {
    String sanitized = TelemetrySanitizer.sanitizeErrorMessage(
        "Failed C:\\Users\\jo\\cfg.json password=hunter2 from 10.1.2.3 "
            + "tenant 0f8fad5b-d9cb-469f-a165-70867728950e Bearer abc.def");

    assertEquals("Failed <path> password=<redacted> from <ip> tenant <guid> bearer <redacted>", sanitized);
  }

  @Test
  void stackTracesKeepStructureButDropUserNames() {
    String sanitized = TelemetrySanitizer.sanitizeStackTrace(
        "at x (/Users/jane/project/a.js:1)\nInstrumentationKey=abc;apiKey=zzz");

    assertTrue(sanitized.contains("<user-path>/project/a.js"), sanitized);
    assertTrue(sanitized.contains("InstrumentationKey=<redacted>"), sanitized);
    assertTrue(sanitized.contains("apiKey=<redacted>"), sanitized);
  }

  @Test
  void categorizesByMessage() {
    assertEquals("NetworkError", TelemetrySanitizer.categorize(new IOException("Connection refused")));
    assertEquals("AuthenticationError", TelemetrySanitizer.categorize(new IllegalStateException("token expired")));
    assertEquals("QueryError", TelemetrySanitizer.categorize(new IllegalStateException("Syntax error near")));
    assertEquals("IllegalStateException", TelemetrySanitizer.categorize(new IllegalStateException()));
  }

  @Test
  void hashIsStableAndShort() {
    String hash = TelemetrySanitizer.hash16("stack");

    assertEquals(16, hash.length());
    assertEquals(hash, TelemetrySanitizer.hash16("stack"));
    assertFalse(hash.equals(TelemetrySanitizer.hash16("other")));
  }
}
