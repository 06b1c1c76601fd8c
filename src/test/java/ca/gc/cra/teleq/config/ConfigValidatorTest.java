package ca.gc.cra.teleq.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class ConfigValidatorTest {

  @Test
  void completeAzureCliProfileHasNoProblems() {
    ResolvedProfile profile = profile(Map.of(
        "applicationInsightsAppId", "app",
        "kustoClusterUrl", "https://ade.applicationinsights.io"));

    assertTrue(ConfigValidator.validate(profile).isEmpty());
  }

  @Test
  void missingTargetsAreReported() {
    List<String> problems = ConfigValidator.validate(profile(Map.of()));

    assertEquals(List.of("applicationInsightsAppId is required", "kustoClusterUrl is required"), problems);
  }

  @Test
  void deviceCodeNeedsTenant() {
    List<String> problems = ConfigValidator.validate(profile(Map.of(
        "authFlow", "device_code",
        "applicationInsightsAppId", "app",
        "kustoClusterUrl", "https://c")));

    assertEquals(List.of("tenantId is required for the device_code auth flow"), problems);
  }

  @Test
  void clientCredentialsNeedsClientIdAndSecret() {
    List<String> problems = ConfigValidator.validate(profile(Map.of(
        "authFlow", "client_credentials",
        "tenantId", "t",
        "applicationInsightsAppId", "app",
        "kustoClusterUrl", "https://c")));

    assertEquals(List.of(
        "clientId is required for the client_credentials auth flow",
        "clientSecret is required for the client_credentials auth flow"), problems);
  }

  private static ResolvedProfile profile(Map<String, Object> values) {
    return ResolvedProfile.fromMap("p", new LinkedHashMap<>(values), "/ws");
  }
}
