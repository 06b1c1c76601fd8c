package ca.gc.cra.teleq.infrastructure.auth;

import ca.gc.cra.teleq.application.auth.TokenStrategy;
import ca.gc.cra.teleq.application.port.ClockPort;
import ca.gc.cra.teleq.config.ResolvedProfile;
import ca.gc.cra.teleq.infrastructure.exec.CommandRunner;
import java.util.Objects;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Selects the {@link TokenStrategy} for a profile's auth flow.
 */
public final class TokenStrategies {
  private final CommandRunner commandRunner;
  private final Function<String, String> env;
  private final ClockPort clock;
  private final Consumer<String> deviceCodePrompt;

  /**
   * Creates the factory.
   *
   * @param commandRunner runs the Azure CLI
   * @param env environment lookup for host-injected tokens
   * @param clock time source
   * @param deviceCodePrompt receives device-code sign-in instructions
   */
  public TokenStrategies(
      CommandRunner commandRunner,
      Function<String, String> env,
      ClockPort clock,
      Consumer<String> deviceCodePrompt) {
    this.commandRunner = Objects.requireNonNull(commandRunner, "commandRunner");
    this.env = Objects.requireNonNull(env, "env");
    this.clock = clock == null ? ClockPort.SYSTEM : clock;
    this.deviceCodePrompt = Objects.requireNonNull(deviceCodePrompt, "deviceCodePrompt");
  }

  /**
   * Returns a strategy for the profile's auth flow.
   *
   * @param profile resolved profile
   * @return new strategy instance
   */
  public TokenStrategy forProfile(ResolvedProfile profile) {
    return switch (profile.authFlow()) {
      case AZURE_CLI -> new AzureCliTokenStrategy(commandRunner);
      case DEVICE_CODE -> new DeviceCodeTokenStrategy(deviceCodePrompt);
      case CLIENT_CREDENTIALS -> new ClientCredentialsTokenStrategy();
      case VSCODE_AUTH -> new HostDelegatedTokenStrategy(env, clock);
    };
  }
}
