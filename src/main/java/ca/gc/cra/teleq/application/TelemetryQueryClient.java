package ca.gc.cra.teleq.application;

import ca.gc.cra.teleq.application.auth.AuthProviderRegistry;
import ca.gc.cra.teleq.application.auth.AuthResult;
import ca.gc.cra.teleq.application.port.QueryCache;
import ca.gc.cra.teleq.application.query.QueryExecutor;
import ca.gc.cra.teleq.application.query.QueryResult;
import ca.gc.cra.teleq.application.telemetry.UsageTelemetryGate;
import ca.gc.cra.teleq.config.ConfigStore;
import ca.gc.cra.teleq.config.ConfigurationDocument;
import ca.gc.cra.teleq.config.ProfileResolver;
import ca.gc.cra.teleq.config.ProfileSummary;
import ca.gc.cra.teleq.config.ResolvedProfile;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.function.Function;

/**
 * <strong>What:</strong> Entry point for resolving profiles, obtaining tokens, and running cached queries.
 * <p><strong>Role:</strong> Facade over the configuration, auth, query, and usage telemetry components; built once
 * per process by {@code CompositionRoot}.</p>
 * <p><strong>Errors:</strong> Resolution raises {@code ConfigException}, token acquisition raises
 * {@code AuthException}, and queries raise {@code QueryException}.</p>
 * <p><strong>Thread-safety:</strong> Safe for concurrent use; per-profile auth state is synchronized by the
 * providers.</p>
 *
 * @since 0.1.0
 */
public final class TelemetryQueryClient {
  private final ConfigStore configStore;
  private final ProfileResolver resolver;
  private final AuthProviderRegistry authProviders;
  private final QueryExecutor executor;
  private final Function<ResolvedProfile, QueryCache> caches;
  private final UsageTelemetryGate usageTelemetry;

  /**
   * Creates the facade.
   *
   * @param configStore configuration discovery and loading
   * @param resolver profile resolution
   * @param authProviders per-profile auth providers
   * @param executor query execution
   * @param caches cache per profile workspace
   * @param usageTelemetry rate-limited usage telemetry
   */
  public TelemetryQueryClient(
      ConfigStore configStore,
      ProfileResolver resolver,
      AuthProviderRegistry authProviders,
      QueryExecutor executor,
      Function<ResolvedProfile, QueryCache> caches,
      UsageTelemetryGate usageTelemetry) {
    this.configStore = Objects.requireNonNull(configStore, "configStore");
    this.resolver = Objects.requireNonNull(resolver, "resolver");
    this.authProviders = Objects.requireNonNull(authProviders, "authProviders");
    this.executor = Objects.requireNonNull(executor, "executor");
    this.caches = Objects.requireNonNull(caches, "caches");
    this.usageTelemetry = Objects.requireNonNull(usageTelemetry, "usageTelemetry");
  }

  /**
   * Loads the configuration and resolves a profile.
   *
   * @param configPath explicit configuration file; {@code null} uses discovery
   * @param profileName profile to resolve; {@code null} falls back to {@code BCTB_PROFILE}, then the document default
   * @return resolved profile
   */
  public ResolvedProfile resolveProfile(Path configPath, String profileName) {
    return resolver.resolve(configStore.load(configPath), profileName);
  }

  /**
   * Lists the profiles declared by the configuration.
   *
   * @param configPath explicit configuration file; {@code null} uses discovery
   * @return summaries in document order
   */
  public List<ProfileSummary> listProfiles(Path configPath) {
    ConfigurationDocument document = configStore.load(configPath);
    return resolver.listProfiles(document);
  }

  /**
   * Returns a bearer token for the profile, reusing a cached one until it nears expiry.
   *
   * @param profile resolved profile
   * @return access token
   */
  public String getAccessToken(ResolvedProfile profile) {
    return authProviders.forProfile(profile).getAccessToken();
  }

  /**
   * Forces a fresh sign-in for the profile.
   *
   * @param profile resolved profile
   * @return authentication result
   */
  public AuthResult authenticate(ResolvedProfile profile) {
    return authProviders.forProfile(profile).authenticate();
  }

  /**
   * Runs a query.
   *
   * @param profile resolved profile
   * @param query query text
   * @param accessToken bearer token
   * @param correlationId caller correlation id; may be {@code null}
   * @return normalized result
   */
  public QueryResult runQuery(ResolvedProfile profile, String query, String accessToken, String correlationId) {
    return executor.execute(profile, query, accessToken, correlationId);
  }

  /**
   * Runs a query with a row limit and a telemetry label.
   *
   * @param profile resolved profile
   * @param query query text
   * @param accessToken bearer token
   * @param correlationId caller correlation id; may be {@code null}
   * @param rowLimit maximum rows; {@code 0} for unlimited
   * @param queryName non-sensitive label; may be {@code null}
   * @return normalized result
   */
  public QueryResult runQuery(
      ResolvedProfile profile,
      String query,
      String accessToken,
      String correlationId,
      int rowLimit,
      String queryName) {
    return executor.execute(profile, query, accessToken, correlationId, rowLimit, queryName);
  }

  /**
   * Returns the cache serving a profile's workspace.
   *
   * @param profile resolved profile
   * @return cache instance
   */
  public QueryCache cache(ResolvedProfile profile) {
    return caches.apply(profile);
  }

  /**
   * Returns the rate-limited usage telemetry gate.
   *
   * @return gate shared by every component of this client
   */
  public UsageTelemetryGate usageTelemetry() {
    return usageTelemetry;
  }
}
