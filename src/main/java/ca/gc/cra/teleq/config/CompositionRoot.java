package ca.gc.cra.teleq.config;

import ca.gc.cra.teleq.application.TelemetryQueryClient;
import ca.gc.cra.teleq.application.auth.AuthProviderRegistry;
import ca.gc.cra.teleq.application.port.ClockPort;
import ca.gc.cra.teleq.application.port.QueryCache;
import ca.gc.cra.teleq.application.port.QueryLibrary;
import ca.gc.cra.teleq.application.port.QueryTransport;
import ca.gc.cra.teleq.application.query.QueryExecutor;
import ca.gc.cra.teleq.application.telemetry.UsageTelemetryGate;
import ca.gc.cra.teleq.application.telemetry.UsageTelemetrySink;
import ca.gc.cra.teleq.infrastructure.auth.TokenStrategies;
import ca.gc.cra.teleq.infrastructure.cache.FileQueryCache;
import ca.gc.cra.teleq.infrastructure.exec.CommandRunner;
import ca.gc.cra.teleq.infrastructure.exec.ProcessCommandRunner;
import ca.gc.cra.teleq.infrastructure.http.OkHttpQueryTransport;
import ca.gc.cra.teleq.infrastructure.library.FileQueryLibrary;
import ca.gc.cra.teleq.infrastructure.telemetry.UsageSinks;
import ca.gc.cra.teleq.infrastructure.time.SystemClockAdapter;
import java.nio.file.Path;
import java.util.Objects;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Wires the TELEQ components to their concrete adapters.
 * <p><strong>Role:</strong> Single place that turns the process environment into a
 * {@link TelemetryQueryClient}: filesystem config store, OkHttp transport, Azure CLI/MSAL token strategies,
 * file-backed caches and saved query libraries, and the OpenTelemetry usage sink behind a
 * {@link UsageTelemetryGate}.</p>
 * <p><strong>Lifecycle:</strong> The usage telemetry sink is built by the first {@link #client} call;
 * {@link #close()} flushes and shuts it down.</p>
 * <p><strong>Thread-safety:</strong> Construct on one thread during startup; the built client is thread-safe.</p>
 *
 * @since 0.1.0
 */
public final class CompositionRoot implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(CompositionRoot.class);

  /** Environment variable overriding the query API base URL. */
  public static final String BASE_URL_ENV = "BCTB_API_BASE_URL";

  private final Function<String, String> env;
  private final ConfigStore configStore;
  private final QueryTransport transport;
  private final Supplier<UsageTelemetrySink> sinkFactory;
  private UsageTelemetrySink sink;
  private final CommandRunner commandRunner;
  private final ClockPort clock;
  private final Consumer<String> deviceCodePrompt;

  /**
   * Creates a root wired to the real process environment.
   *
   * @param env environment lookup
   * @param deviceCodePrompt receives device-code sign-in instructions
   * @return composition root
   */
  public static CompositionRoot fromEnvironment(Function<String, String> env, Consumer<String> deviceCodePrompt) {
    return new CompositionRoot(
        env,
        ConfigStore.fromEnvironment(env),
        new OkHttpQueryTransport(),
        () -> UsageSinks.fromEnvironment(env),
        new ProcessCommandRunner(),
        new SystemClockAdapter(),
        deviceCodePrompt);
  }

  /**
   * Creates a root with explicit adapters.
   *
   * @param env environment lookup for {@code ${VAR}} expansion, profile selection and host tokens
   * @param configStore configuration store
   * @param transport query transport
   * @param sinkFactory builds the usage telemetry destination on first use
   * @param commandRunner runs the Azure CLI
   * @param clock time source
   * @param deviceCodePrompt receives device-code sign-in instructions
   */
  public CompositionRoot(
      Function<String, String> env,
      ConfigStore configStore,
      QueryTransport transport,
      Supplier<UsageTelemetrySink> sinkFactory,
      CommandRunner commandRunner,
      ClockPort clock,
      Consumer<String> deviceCodePrompt) {
    this.env = Objects.requireNonNull(env, "env");
    this.configStore = Objects.requireNonNull(configStore, "configStore");
    this.transport = Objects.requireNonNull(transport, "transport");
    this.sinkFactory = Objects.requireNonNull(sinkFactory, "sinkFactory");
    this.commandRunner = Objects.requireNonNull(commandRunner, "commandRunner");
    this.clock = clock == null ? ClockPort.SYSTEM : clock;
    this.deviceCodePrompt = Objects.requireNonNull(deviceCodePrompt, "deviceCodePrompt");
  }

  /**
   * Returns the configuration store.
   *
   * @return store
   */
  public ConfigStore configStore() {
    return configStore;
  }

  /**
   * Creates a resolver bound to this root's environment and workspace.
   *
   * @return profile resolver
   */
  public ProfileResolver profileResolver() {
    return new ProfileResolver(env, configStore.effectiveWorkspaceRoot().toString());
  }

  /**
   * Resolves a profile without building the rest of the graph.
   *
   * @param configPath explicit configuration file; {@code null} uses discovery
   * @param profileName profile name; may be {@code null}
   * @return resolved profile
   */
  public ResolvedProfile resolveProfile(Path configPath, String profileName) {
    return profileResolver().resolve(configStore.load(configPath), profileName);
  }

  /**
   * Builds a client whose usage telemetry follows the given policy.
   *
   * @param telemetry rate-limit policy, usually the resolved profile's
   * @return client
   */
  public TelemetryQueryClient client(TelemetrySettings telemetry) {
    UsageTelemetryGate gate = new UsageTelemetryGate(sink(), telemetry, clock);
    Function<ResolvedProfile, QueryCache> caches = this::cacheFor;
    String baseUrl = env.apply(BASE_URL_ENV);
    QueryExecutor executor = new QueryExecutor(transport, caches, gate, clock, baseUrl);
    TokenStrategies strategies = new TokenStrategies(commandRunner, env, clock, deviceCodePrompt);
    AuthProviderRegistry authProviders = new AuthProviderRegistry(strategies::forProfile, clock);
    log.debug("Built telemetry query client (usage telemetry enabled={})", gate.isEnabled());
    return new TelemetryQueryClient(configStore, profileResolver(), authProviders, executor, caches, gate);
  }

  private synchronized UsageTelemetrySink sink() {
    if (sink == null) {
      UsageTelemetrySink created = sinkFactory.get();
      sink = created == null ? UsageTelemetrySink.NO_OP : created;
    }
    return sink;
  }

  /**
   * Returns the file-backed cache for a profile's workspace.
   *
   * @param profile resolved profile
   * @return cache rooted at {@code <workspacePath>/.vscode/.bctb/cache}
   */
  public QueryCache cacheFor(ResolvedProfile profile) {
    return FileQueryCache.forWorkspace(Path.of(profile.workspacePath()), clock);
  }

  /**
   * Returns the saved query library for a profile's workspace.
   *
   * @param profile resolved profile
   * @return library rooted at {@code <workspacePath>/<queriesFolder>}
   */
  public QueryLibrary libraryFor(ResolvedProfile profile) {
    return FileQueryLibrary.forWorkspace(Path.of(profile.workspacePath()), profile.queriesFolder(), clock);
  }

  @Override
  public synchronized void close() {
    if (sink == null) {
      return;
    }
    sink.flush();
    if (sink instanceof AutoCloseable closeable) {
      try {
        closeable.close();
      } catch (Exception ex) {
        log.warn("Failed to close usage telemetry sink", ex);
      }
    }
  }
}
