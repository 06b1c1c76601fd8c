package ca.gc.cra.teleq.config;

import ca.gc.cra.teleq.validation.Strings;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Turns a {@link ConfigurationDocument} plus an optional profile name into a
 * {@link ResolvedProfile}.
 * <p><strong>Steps:</strong></p>
 * <ol>
 *   <li>flat documents are one implicit profile named {@value #IMPLICIT_PROFILE};</li>
 *   <li>the target is the explicit name, else {@code BCTB_PROFILE}, else {@code defaultProfile}, else the only
 *       profile when exactly one exists;</li>
 *   <li>the {@code extends} chain is walked with cycle detection before anything is merged;</li>
 *   <li>profiles merge root ancestor first, child values winning;</li>
 *   <li>document-wide {@code cache}, {@code sanitize} and {@code telemetry} blocks fill unset fields;</li>
 *   <li>{@code ${VAR}} placeholders expand from the environment.</li>
 * </ol>
 * <p><strong>Thread-safety:</strong> Stateless apart from immutable collaborators.</p>
 *
 * @since 0.1.0
 */
public final class ProfileResolver {
  private static final Logger log = LoggerFactory.getLogger(ProfileResolver.class);

  /** Environment variable overriding the document's default profile. */
  public static final String PROFILE_ENV = "BCTB_PROFILE";
  /** Name given to the single profile of a flat document. */
  public static final String IMPLICIT_PROFILE = "default";

  private final Function<String, String> env;
  private final String workspaceRoot;

  /**
   * Creates a resolver.
   *
   * @param env environment lookup used for {@code BCTB_PROFILE} and placeholder expansion
   * @param workspaceRoot value of {@code ${workspaceFolder}} and the default {@code workspacePath}
   */
  public ProfileResolver(Function<String, String> env, String workspaceRoot) {
    this.env = Objects.requireNonNull(env, "env");
    this.workspaceRoot = Strings.requireNonBlank("workspaceRoot", workspaceRoot);
  }

  /**
   * Resolves a profile.
   *
   * @param document loaded configuration
   * @param profileName explicit profile name; {@code null} to use the override or document default
   * @return concrete profile
   * @throws ConfigException {@code INVALID_INPUT} for a blank name, {@code NO_PROFILE_SPECIFIED},
   *     {@code PROFILE_NOT_FOUND}, {@code CIRCULAR_INHERITANCE}, or {@code MALFORMED_CONFIG}
   */
  public ResolvedProfile resolve(ConfigurationDocument document, String profileName) {
    Objects.requireNonNull(document, "document");
    if (profileName != null && profileName.isBlank()) {
      throw new ConfigException(ConfigException.Kind.INVALID_INPUT, "Profile name must not be blank");
    }
    EnvironmentExpander expander = new EnvironmentExpander(env, workspaceRoot);
    if (!document.isProfiled()) {
      Map<String, Object> flat = ConfigMerger.copyObject(document.root());
      flat.remove(ConfigurationDocument.DEFAULT_PROFILE);
      flat.remove(ProfileGraph.EXTENDS);
      Map<String, Object> withDefaults = ConfigMerger.applyDocumentDefaults(flat, document);
      // the document-wide blocks of a flat document have been folded into profile fields
      withDefaults.remove(ConfigurationDocument.CACHE_SECTION);
      withDefaults.remove(ConfigurationDocument.SANITIZE_SECTION);
      return ResolvedProfile.fromMap(IMPLICIT_PROFILE, expander.expand(withDefaults), workspaceRoot);
    }

    Map<String, Map<String, Object>> profiles = document.profiles();
    ProfileGraph graph = ProfileGraph.of(profiles);
    String target = selectTarget(document, profileName, graph);
    List<String> lineage = graph.lineage(target);
    log.debug("Resolving profile {} via {}", target, lineage);

    List<Map<String, Object>> layers = new ArrayList<>(lineage.size());
    for (String name : lineage) {
      layers.add(profiles.get(name));
    }
    Map<String, Object> merged = ConfigMerger.mergeChain(layers);
    Map<String, Object> withDefaults = ConfigMerger.applyDocumentDefaults(merged, document);
    return ResolvedProfile.fromMap(target, expander.expand(withDefaults), workspaceRoot);
  }

  /**
   * Lists the profiles a document declares.
   *
   * @param document loaded configuration
   * @return one summary per profile in document order; a single implicit entry for flat documents
   */
  public List<ProfileSummary> listProfiles(ConfigurationDocument document) {
    Objects.requireNonNull(document, "document");
    if (!document.isProfiled()) {
      Object connection = document.root().get(ResolvedProfile.CONNECTION_NAME);
      return List.of(new ProfileSummary(IMPLICIT_PROFILE,
          connection == null ? ResolvedProfile.DEFAULT_CONNECTION_NAME : connection.toString(), null, true));
    }
    Map<String, Map<String, Object>> profiles = document.profiles();
    ProfileGraph graph = ProfileGraph.of(profiles);
    String defaultName = document.defaultProfile().orElse(null);
    List<ProfileSummary> summaries = new ArrayList<>(profiles.size());
    for (Map.Entry<String, Map<String, Object>> entry : profiles.entrySet()) {
      Object connection = entry.getValue().get(ResolvedProfile.CONNECTION_NAME);
      summaries.add(new ProfileSummary(
          entry.getKey(),
          connection == null ? entry.getKey() : connection.toString(),
          graph.parentOf(entry.getKey()).orElse(null),
          entry.getKey().equals(defaultName)));
    }
    return List.copyOf(summaries);
  }

  private String selectTarget(ConfigurationDocument document, String profileName, ProfileGraph graph) {
    if (profileName != null) {
      return profileName.trim();
    }
    String override = Strings.trimToNull(env.apply(PROFILE_ENV));
    if (override != null) {
      log.debug("Profile selected by {}", PROFILE_ENV);
      return override;
    }
    Optional<String> declared = document.defaultProfile();
    if (declared.isPresent()) {
      return declared.get();
    }
    if (graph.names().size() == 1) {
      return graph.names().iterator().next();
    }
    throw new ConfigException(ConfigException.Kind.NO_PROFILE_SPECIFIED,
        "No profile specified and no defaultProfile set. Available profiles: " + String.join(", ", graph.names()));
  }
}
