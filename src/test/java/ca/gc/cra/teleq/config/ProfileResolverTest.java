package ca.gc.cra.teleq.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

class ProfileResolverTest {
  private static final String WORKSPACE = "/work/space";

  private final ConfigDocumentParser parser = new ConfigDocumentParser();
  private final Map<String, String> env = new HashMap<>();
  private final ProfileResolver resolver = new ProfileResolver(env::get, WORKSPACE);

  private Logger logger;
  private ListAppender<ILoggingEvent> appender;
  private Level originalLevel;
  private boolean originalAdditive;

  @BeforeEach
  void attachAppender() {
    logger = (Logger) LoggerFactory.getLogger(EnvironmentExpander.class);
    originalLevel = logger.getLevel();
    originalAdditive = logger.isAdditive();
    logger.setLevel(Level.DEBUG);
    logger.setAdditive(false);
    appender = new ListAppender<>();
    appender.start();
    logger.addAppender(appender);
  }

  @AfterEach
  void detachAppender() {
    logger.detachAppender(appender);
    appender.stop();
    logger.setLevel(originalLevel);
    logger.setAdditive(originalAdditive);
  }

  @Test
  void childOverridesParentAndNestedObjectsMergeDeeply() {
    ConfigurationDocument document = json("{\"profiles\":{"
        + "\"base\":{\"tenantId\":\"t-1\",\"applicationInsightsAppId\":\"app\","
        + "\"advanced\":{\"timeout\":30,\"retries\":2}},"
        + "\"prod\":{\"extends\":\"base\",\"connectionName\":\"Prod\",\"advanced\":{\"retries\":5}}}}");

    ResolvedProfile prod = resolver.resolve(document, "prod");

    assertEquals("prod", prod.name());
    assertEquals("Prod", prod.connectionName());
    assertEquals("t-1", prod.tenantId());
    assertEquals(Map.of("timeout", 30, "retries", 5), prod.extras().get("advanced"));
    assertFalse(prod.extras().containsKey("extends"));
  }

  @Test
  void multiLevelInheritanceAppliesRootFirst() {
    ConfigurationDocument document = json("{\"profiles\":{"
        + "\"a\":{\"connectionName\":\"A\",\"cacheTTLSeconds\":10,\"removePII\":true},"
        + "\"b\":{\"extends\":\"a\",\"connectionName\":\"B\",\"cacheTTLSeconds\":20},"
        + "\"c\":{\"extends\":\"b\",\"connectionName\":\"C\"}}}");

    ResolvedProfile c = resolver.resolve(document, "c");

    assertEquals("C", c.connectionName());
    assertEquals(20, c.cacheTtlSeconds());
    assertTrue(c.removePii());
  }

  @Test
  void resolvingAResolvedProfileIsIdempotent() {
    env.put("APP_ID", "from-env");
    ConfigurationDocument document = json("{\"profiles\":{"
        + "\"base\":{\"applicationInsightsAppId\":\"${APP_ID}\",\"telemetry\":{\"enabled\":false}},"
        + "\"prod\":{\"extends\":\"base\",\"queriesFolder\":\"${workspaceFolder}/q\"}}}");
    ResolvedProfile first = resolver.resolve(document, "prod");

    ConfigurationDocument again = ConfigurationDocument.of(
        Map.of("profiles", Map.of("prod", first.toMap())));
    ResolvedProfile second = resolver.resolve(again, "prod");

    assertEquals(first, second);
  }

  @Test
  void circularInheritanceIsDetected() {
    ConfigurationDocument document = json("{\"profiles\":{"
        + "\"a\":{\"extends\":\"b\"},\"b\":{\"extends\":\"c\"},\"c\":{\"extends\":\"a\"}}}");

    ConfigException ex = assertThrows(ConfigException.class, () -> resolver.resolve(document, "a"));

    assertEquals(ConfigException.Kind.CIRCULAR_INHERITANCE, ex.kind());
    assertTrue(ex.getMessage().contains("a -> b -> c -> a"), ex.getMessage());
  }

  @Test
  void selfReferenceIsCircular() {
    ConfigurationDocument document = json("{\"profiles\":{\"a\":{\"extends\":\"a\"}}}");

    assertEquals(ConfigException.Kind.CIRCULAR_INHERITANCE,
        assertThrows(ConfigException.class, () -> resolver.resolve(document, "a")).kind());
  }

  @Test
  void cycleAtTheEndOfALongChainIsDetected() {
    StringBuilder profiles = new StringBuilder("{\"profiles\":{");
    for (int i = 0; i < 50; i++) {
      int parent = i == 49 ? 25 : i + 1;
      profiles.append(i == 0 ? "" : ",").append("\"p").append(i).append("\":{\"extends\":\"p").append(parent)
          .append("\"}");
    }
    ConfigurationDocument document = json(profiles.append("}}").toString());

    ConfigException ex = assertThrows(ConfigException.class, () -> resolver.resolve(document, "p0"));

    assertEquals(ConfigException.Kind.CIRCULAR_INHERITANCE, ex.kind());
    assertTrue(ex.getMessage().contains("p25 -> p26"), ex.getMessage());
    assertTrue(ex.getMessage().endsWith("p49 -> p25"), ex.getMessage());
    assertFalse(ex.getMessage().contains("p24"), ex.getMessage());
  }

  @Test
  void longAcyclicChainResolvesRootFirst() {
    StringBuilder profiles = new StringBuilder("{\"profiles\":{\"p49\":{\"connectionName\":\"root\","
        + "\"cacheTTLSeconds\":49}");
    for (int i = 48; i >= 0; i--) {
      profiles.append(",\"p").append(i).append("\":{\"extends\":\"p").append(i + 1).append("\"");
      if (i == 10) {
        profiles.append(",\"cacheTTLSeconds\":10");
      }
      profiles.append('}');
    }
    ConfigurationDocument document = json(profiles.append("}}").toString());

    ResolvedProfile leaf = resolver.resolve(document, "p0");

    assertEquals("root", leaf.connectionName());
    assertEquals(10, leaf.cacheTtlSeconds());
  }

  @Test
  void unknownProfileAndUnknownParentAreNotFound() {
    ConfigurationDocument document = json("{\"profiles\":{\"a\":{\"extends\":\"ghost\"},\"b\":{}}}");

    ConfigException missing = assertThrows(ConfigException.class, () -> resolver.resolve(document, "zzz"));
    assertEquals(ConfigException.Kind.PROFILE_NOT_FOUND, missing.kind());
    assertTrue(missing.getMessage().contains("a, b"), missing.getMessage());

    ConfigException parent = assertThrows(ConfigException.class, () -> resolver.resolve(document, "a"));
    assertEquals(ConfigException.Kind.PROFILE_NOT_FOUND, parent.kind());
  }

  @Test
  void selectionPrefersExplicitThenEnvironmentThenDeclaredDefault() {
    ConfigurationDocument document = json("{\"defaultProfile\":\"a\",\"profiles\":{\"a\":{},\"b\":{},\"c\":{}}}");

    assertEquals("a", resolver.resolve(document, null).name());
    env.put(ProfileResolver.PROFILE_ENV, "b");
    assertEquals("b", resolver.resolve(document, null).name());
    assertEquals("c", resolver.resolve(document, "c").name());
  }

  @Test
  void singleProfileIsImplicitDefault() {
    ConfigurationDocument document = json("{\"profiles\":{\"only\":{}}}");

    assertEquals("only", resolver.resolve(document, null).name());
  }

  @Test
  void ambiguousSelectionRequiresAProfile() {
    ConfigurationDocument document = json("{\"profiles\":{\"a\":{},\"b\":{}}}");

    ConfigException ex = assertThrows(ConfigException.class, () -> resolver.resolve(document, null));

    assertEquals(ConfigException.Kind.NO_PROFILE_SPECIFIED, ex.kind());
    assertEquals(ConfigException.Kind.INVALID_INPUT,
        assertThrows(ConfigException.class, () -> resolver.resolve(document, "  ")).kind());
  }

  @Test
  void flatDocumentResolvesAsDefaultProfile() {
    ConfigurationDocument document = json("{\"connectionName\":\"Flat\",\"authFlow\":\"device-code\","
        + "\"tenantId\":\"t\",\"applicationInsightsAppId\":\"app\"}");

    ResolvedProfile profile = resolver.resolve(document, null);

    assertEquals(ProfileResolver.IMPLICIT_PROFILE, profile.name());
    assertEquals(AuthFlow.DEVICE_CODE, profile.authFlow());
    assertEquals(WORKSPACE, profile.workspacePath());
  }

  @Test
  void flatDocumentBlocksBecomeProfileFieldsNotExtras() {
    ConfigurationDocument document = json("{\"connectionName\":\"Flat\","
        + "\"cache\":{\"enabled\":false,\"ttlSeconds\":120},\"sanitize\":{\"removePII\":true},"
        + "\"advanced\":{\"timeout\":5}}");

    ResolvedProfile profile = resolver.resolve(document, null);

    assertFalse(profile.cacheEnabled());
    assertEquals(120, profile.cacheTtlSeconds());
    assertTrue(profile.removePii());
    assertFalse(profile.extras().containsKey("cache"));
    assertFalse(profile.extras().containsKey("sanitize"));
    assertEquals(Map.of("timeout", 5), profile.extras().get("advanced"));
  }

  @Test
  void builtInDefaultsApplyWhenNothingIsSet() {
    ResolvedProfile profile = resolver.resolve(json("{\"profiles\":{\"a\":{}}}"), "a");

    assertEquals("Default", profile.connectionName());
    assertEquals(AuthFlow.AZURE_CLI, profile.authFlow());
    assertTrue(profile.cacheEnabled());
    assertEquals(3600, profile.cacheTtlSeconds());
    assertFalse(profile.removePii());
    assertEquals("queries", profile.queriesFolder());
    assertEquals(TelemetrySettings.DEFAULTS, profile.telemetry());
    assertNull(profile.clientSecret());
  }

  @Test
  void documentSectionsFillGapsButProfileValuesWin() {
    ConfigurationDocument document = json("{\"cache\":{\"enabled\":false,\"ttlSeconds\":120},"
        + "\"sanitize\":{\"removePII\":true},"
        + "\"telemetry\":{\"rateLimiting\":{\"maxEventsPerMinute\":5,\"maxIdenticalErrors\":3}},"
        + "\"profiles\":{\"a\":{\"cacheTTLSeconds\":60,\"telemetry\":{\"rateLimiting\":{\"maxIdenticalErrors\":7}}}}}");

    ResolvedProfile profile = resolver.resolve(document, "a");

    assertFalse(profile.cacheEnabled());
    assertEquals(60, profile.cacheTtlSeconds());
    assertTrue(profile.removePii());
    assertEquals(5, profile.telemetry().maxEventsPerMinute());
    assertEquals(7, profile.telemetry().maxIdenticalErrors());
    assertEquals(1000, profile.telemetry().maxEventsPerSession());
  }

  @Test
  void expandsEnvironmentAndWorkspacePlaceholders() {
    env.put("BC_SECRET", "s3cr3t");
    ConfigurationDocument document = json("{\"profiles\":{\"a\":{"
        + "\"authFlow\":\"client_credentials\",\"clientSecret\":\"${BC_SECRET}\","
        + "\"workspacePath\":\"${workspaceFolder}/bc\",\"references\":[\"${BC_SECRET}-ref\"]}}}");

    ResolvedProfile profile = resolver.resolve(document, "a");

    assertEquals("s3cr3t", profile.clientSecret());
    assertEquals(WORKSPACE + "/bc", profile.workspacePath());
    assertEquals(List.of("s3cr3t-ref"), profile.extras().get("references"));
    assertTrue(appender.list.isEmpty());
  }

  @Test
  void unsetVariableExpandsToEmptyWithWarning() {
    ConfigurationDocument document = json("{\"profiles\":{\"a\":{\"tenantId\":\"pre-${MISSING_TENANT}\"}}}");

    ResolvedProfile profile = resolver.resolve(document, "a");

    assertEquals("pre-", profile.tenantId());
    assertEquals(1, appender.list.size());
    ILoggingEvent event = appender.list.get(0);
    assertEquals(Level.WARN, event.getLevel());
    assertTrue(event.getFormattedMessage().contains("MISSING_TENANT"), event.getFormattedMessage());
  }

  @Test
  void listsProfilesInDocumentOrderWithDefaultMarker() {
    ConfigurationDocument document = json("{\"defaultProfile\":\"prod\",\"profiles\":{"
        + "\"prod\":{\"connectionName\":\"Production\"},\"dev\":{\"extends\":\"prod\"}}}");

    List<ProfileSummary> summaries = resolver.listProfiles(document);

    assertEquals(List.of(
        new ProfileSummary("prod", "Production", null, true),
        new ProfileSummary("dev", "dev", "prod", false)), summaries);
  }

  @Test
  void flatDocumentListsSingleImplicitProfile() {
    assertEquals(List.of(new ProfileSummary("default", "Flat", null, true)),
        resolver.listProfiles(json("{\"connectionName\":\"Flat\"}")));
  }

  @Test
  void invalidValuesAreMalformed() {
    assertEquals(ConfigException.Kind.MALFORMED_CONFIG, assertThrows(ConfigException.class,
        () -> resolver.resolve(json("{\"profiles\":{\"a\":{\"authFlow\":\"password\"}}}"), "a")).kind());
    assertEquals(ConfigException.Kind.MALFORMED_CONFIG, assertThrows(ConfigException.class,
        () -> resolver.resolve(json("{\"profiles\":{\"a\":{\"cacheTTLSeconds\":\"soon\"}}}"), "a")).kind());
    assertEquals(ConfigException.Kind.MALFORMED_CONFIG, assertThrows(ConfigException.class,
        () -> resolver.resolve(json("{\"profiles\":{\"a\":{\"extends\":42}}}"), "a")).kind());
  }

  private ConfigurationDocument json(String text) {
    return parser.parse(text, null);
  }
}
