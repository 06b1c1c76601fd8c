package ca.gc.cra.teleq.testutil;

import ca.gc.cra.teleq.config.ResolvedProfile;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Builders for resolved profiles used across tests.
 */
public final class Profiles {
  private Profiles() {}

  /**
   * Returns a complete azure_cli profile rooted at a workspace.
   *
   * @param name profile name
   * @param workspace workspace root
   * @return profile
   */
  public static ResolvedProfile azureCli(String name, Path workspace) {
    return with(name, workspace, Map.of());
  }

  /**
   * Returns a complete profile with extra or overriding values.
   *
   * @param name profile name
   * @param workspace workspace root
   * @param overrides values applied over the defaults
   * @return profile
   */
  public static ResolvedProfile with(String name, Path workspace, Map<String, Object> overrides) {
    Map<String, Object> values = new LinkedHashMap<>();
    values.put("connectionName", name + " connection");
    values.put("authFlow", "azure_cli");
    values.put("tenantId", "tenant-" + name);
    values.put("applicationInsightsAppId", "app-" + name);
    values.put("kustoClusterUrl", "https://ade.applicationinsights.io/subscriptions/" + name);
    values.put("workspacePath", workspace.toString());
    values.putAll(overrides);
    return ResolvedProfile.fromMap(name, values, workspace.toString());
  }
}
