package ca.gc.cra.teleq.config;

import ca.gc.cra.teleq.logging.Logs;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Fully concrete connection profile: inheritance merged, defaults applied, variables expanded.
 *
 * <p>{@link #toMap()} and {@link #fromMap(String, Map, String)} are inverses, so re-resolving a resolved profile
 * yields an equal value. Keys the core does not interpret (for example {@code advanced} or {@code references})
 * travel untouched in {@link #extras()}.</p>
 *
 * @param name profile name; {@code default} for flat documents
 * @param connectionName display name of the connection
 * @param tenantId directory tenant; may be {@code null}
 * @param clientId application (client) id; may be {@code null}
 * @param clientSecret client secret; may be {@code null}; never printed
 * @param authFlow selected authentication strategy
 * @param applicationInsightsAppId telemetry application id; may be {@code null}
 * @param kustoClusterUrl cluster URL; may be {@code null}
 * @param cacheEnabled whether query results are cached
 * @param cacheTtlSeconds cache entry lifetime in seconds
 * @param removePii whether string cells are scrubbed of personal data
 * @param workspacePath workspace root holding the cache and queries folders
 * @param queriesFolder folder of saved queries relative to the workspace
 * @param telemetry usage telemetry policy
 * @param extras uninterpreted keys carried through resolution
 * @since 0.1.0
 */
public record ResolvedProfile(
    String name,
    String connectionName,
    String tenantId,
    String clientId,
    String clientSecret,
    AuthFlow authFlow,
    String applicationInsightsAppId,
    String kustoClusterUrl,
    boolean cacheEnabled,
    long cacheTtlSeconds,
    boolean removePii,
    String workspacePath,
    String queriesFolder,
    TelemetrySettings telemetry,
    Map<String, Object> extras) {

  static final String CONNECTION_NAME = "connectionName";
  static final String TENANT_ID = "tenantId";
  static final String CLIENT_ID = "clientId";
  static final String CLIENT_SECRET = "clientSecret";
  static final String AUTH_FLOW = "authFlow";
  static final String APP_ID = "applicationInsightsAppId";
  static final String CLUSTER_URL = "kustoClusterUrl";
  static final String CACHE_ENABLED = "cacheEnabled";
  static final String CACHE_TTL_SECONDS = "cacheTTLSeconds";
  static final String REMOVE_PII = "removePII";
  static final String WORKSPACE_PATH = "workspacePath";
  static final String QUERIES_FOLDER = "queriesFolder";
  static final String TELEMETRY = "telemetry";

  private static final Set<String> KNOWN_KEYS = Set.of(
      CONNECTION_NAME, TENANT_ID, CLIENT_ID, CLIENT_SECRET, AUTH_FLOW, APP_ID, CLUSTER_URL, CACHE_ENABLED,
      CACHE_TTL_SECONDS, REMOVE_PII, WORKSPACE_PATH, QUERIES_FOLDER, TELEMETRY, ProfileGraph.EXTENDS);

  static final String DEFAULT_CONNECTION_NAME = "Default";
  static final boolean DEFAULT_CACHE_ENABLED = true;
  static final long DEFAULT_CACHE_TTL_SECONDS = 3600L;
  static final boolean DEFAULT_REMOVE_PII = false;
  static final String DEFAULT_QUERIES_FOLDER = "queries";

  /** Normalizes and validates components. */
  public ResolvedProfile {
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(connectionName, "connectionName");
    Objects.requireNonNull(authFlow, "authFlow");
    Objects.requireNonNull(workspacePath, "workspacePath");
    Objects.requireNonNull(queriesFolder, "queriesFolder");
    telemetry = telemetry == null ? TelemetrySettings.DEFAULTS : telemetry;
    if (cacheTtlSeconds < 0) {
      throw new ConfigException(ConfigException.Kind.MALFORMED_CONFIG, "cacheTTLSeconds must not be negative");
    }
    extras = extras == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(extras));
  }

  /**
   * Builds a profile from merged, expanded values, applying built-in defaults for anything unset.
   *
   * @param name profile name
   * @param values merged configuration values
   * @param defaultWorkspace workspace path used when the values do not set one
   * @return concrete profile
   * @throws ConfigException when a value has the wrong type
   */
  public static ResolvedProfile fromMap(String name, Map<String, Object> values, String defaultWorkspace) {
    Objects.requireNonNull(values, "values");
    Map<String, Object> extras = new LinkedHashMap<>();
    for (Map.Entry<String, Object> entry : values.entrySet()) {
      if (!KNOWN_KEYS.contains(entry.getKey())) {
        extras.put(entry.getKey(), ConfigMerger.copyValue(entry.getValue()));
      }
    }
    Object telemetryBlock = values.get(TELEMETRY);
    if (telemetryBlock != null && !(telemetryBlock instanceof Map<?, ?>)) {
      throw new ConfigException(ConfigException.Kind.MALFORMED_CONFIG, "telemetry must be an object");
    }
    String connection = ConfigValues.string(values.get(CONNECTION_NAME));
    String workspace = ConfigValues.string(values.get(WORKSPACE_PATH));
    String queries = ConfigValues.string(values.get(QUERIES_FOLDER));
    return new ResolvedProfile(
        name,
        connection == null ? DEFAULT_CONNECTION_NAME : connection,
        ConfigValues.string(values.get(TENANT_ID)),
        ConfigValues.string(values.get(CLIENT_ID)),
        ConfigValues.string(values.get(CLIENT_SECRET)),
        AuthFlow.fromConfig(ConfigValues.string(values.get(AUTH_FLOW))),
        ConfigValues.string(values.get(APP_ID)),
        ConfigValues.string(values.get(CLUSTER_URL)),
        ConfigValues.bool(values.get(CACHE_ENABLED), DEFAULT_CACHE_ENABLED, CACHE_ENABLED),
        ConfigValues.number(values.get(CACHE_TTL_SECONDS), DEFAULT_CACHE_TTL_SECONDS, CACHE_TTL_SECONDS),
        ConfigValues.bool(values.get(REMOVE_PII), DEFAULT_REMOVE_PII, REMOVE_PII),
        workspace == null ? defaultWorkspace : workspace,
        queries == null ? DEFAULT_QUERIES_FOLDER : queries,
        telemetryBlock == null ? TelemetrySettings.DEFAULTS
            : TelemetrySettings.fromMap(ConfigMerger.asObject((Map<?, ?>) telemetryBlock)),
        extras);
  }

  /**
   * Renders the profile back into configuration form.
   *
   * @return mutable map; {@code null} fields are omitted
   */
  public Map<String, Object> toMap() {
    Map<String, Object> map = new LinkedHashMap<>();
    map.put(CONNECTION_NAME, connectionName);
    putIfPresent(map, TENANT_ID, tenantId);
    putIfPresent(map, CLIENT_ID, clientId);
    putIfPresent(map, CLIENT_SECRET, clientSecret);
    map.put(AUTH_FLOW, authFlow.configValue());
    putIfPresent(map, APP_ID, applicationInsightsAppId);
    putIfPresent(map, CLUSTER_URL, kustoClusterUrl);
    map.put(CACHE_ENABLED, cacheEnabled);
    map.put(CACHE_TTL_SECONDS, cacheTtlSeconds);
    map.put(REMOVE_PII, removePii);
    map.put(WORKSPACE_PATH, workspacePath);
    map.put(QUERIES_FOLDER, queriesFolder);
    map.put(TELEMETRY, telemetry.toMap());
    for (Map.Entry<String, Object> entry : extras.entrySet()) {
      map.put(entry.getKey(), ConfigMerger.copyValue(entry.getValue()));
    }
    return map;
  }

  /**
   * Returns the key that scopes tokens and cache entries to this connection.
   *
   * @return stable identity string; contains no secrets
   */
  public String identity() {
    return String.join("|",
        name,
        nullToEmpty(tenantId),
        nullToEmpty(clientId),
        nullToEmpty(applicationInsightsAppId),
        nullToEmpty(kustoClusterUrl),
        authFlow.configValue());
  }

  private static void putIfPresent(Map<String, Object> map, String key, String value) {
    if (value != null) {
      map.put(key, value);
    }
  }

  private static String nullToEmpty(String value) {
    return value == null ? "" : value;
  }

  @Override
  public String toString() {
    return "ResolvedProfile{name=" + name
        + ", connectionName=" + connectionName
        + ", tenantId=" + tenantId
        + ", clientId=" + clientId
        + ", clientSecret=" + Logs.redact(clientSecret)
        + ", authFlow=" + authFlow.configValue()
        + ", applicationInsightsAppId=" + applicationInsightsAppId
        + ", kustoClusterUrl=" + kustoClusterUrl
        + ", cacheEnabled=" + cacheEnabled
        + ", cacheTtlSeconds=" + cacheTtlSeconds
        + ", removePii=" + removePii
        + ", workspacePath=" + workspacePath
        + ", queriesFolder=" + queriesFolder
        + ", telemetry=" + telemetry
        + ", extras=" + extras.keySet()
        + '}';
  }
}
