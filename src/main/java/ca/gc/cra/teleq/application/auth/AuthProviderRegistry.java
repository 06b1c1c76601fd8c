package ca.gc.cra.teleq.application.auth;

import ca.gc.cra.teleq.application.port.ClockPort;
import ca.gc.cra.teleq.config.ResolvedProfile;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Hands out one {@link AuthProvider} per profile identity so tokens never cross profiles.
 */
public final class AuthProviderRegistry {
  private static final Logger log = LoggerFactory.getLogger(AuthProviderRegistry.class);

  private final Function<ResolvedProfile, TokenStrategy> strategies;
  private final ClockPort clock;
  private final ConcurrentMap<String, AuthProvider> providers = new ConcurrentHashMap<>();

  /**
   * Creates a registry.
   *
   * @param strategies selects the strategy for a profile
   * @param clock time source shared by providers
   */
  public AuthProviderRegistry(Function<ResolvedProfile, TokenStrategy> strategies, ClockPort clock) {
    this.strategies = Objects.requireNonNull(strategies, "strategies");
    this.clock = clock == null ? ClockPort.SYSTEM : clock;
  }

  /**
   * Returns the provider for a profile, creating it on first use.
   *
   * <p>A provider whose credentials differ from the profile's (for example after a client secret was rotated)
   * is cleared and replaced.</p>
   *
   * @param profile resolved profile
   * @return provider bound to {@code profile.identity()}
   */
  public AuthProvider forProfile(ResolvedProfile profile) {
    Objects.requireNonNull(profile, "profile");
    return providers.compute(profile.identity(), (key, existing) -> {
      if (existing != null && sameCredentials(existing.profile(), profile)) {
        return existing;
      }
      if (existing != null) {
        log.debug("Credentials of profile '{}' changed; replacing its auth provider", profile.name());
        existing.clear();
      }
      return new AuthProvider(profile, strategies.apply(profile), clock);
    });
  }

  private static boolean sameCredentials(ResolvedProfile current, ResolvedProfile candidate) {
    return Objects.equals(current.tenantId(), candidate.tenantId())
        && Objects.equals(current.clientId(), candidate.clientId())
        && Objects.equals(current.clientSecret(), candidate.clientSecret())
        && current.authFlow() == candidate.authFlow()
        && Objects.equals(current.applicationInsightsAppId(), candidate.applicationInsightsAppId())
        && Objects.equals(current.kustoClusterUrl(), candidate.kustoClusterUrl());
  }

  /** Drops every provider and its session. */
  public void clear() {
    providers.values().forEach(AuthProvider::clear);
    providers.clear();
  }

  int size() {
    return providers.size();
  }
}
