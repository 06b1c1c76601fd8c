package ca.gc.cra.teleq.infrastructure.http;

import java.time.Duration;
import java.util.Arrays;
import okhttp3.Interceptor;
import okhttp3.OkHttpClient;
import okhttp3.Protocol;

/**
 * Builds the OkHttp client used for query calls.
 *
 * @since 0.1.0
 */
public final class HttpClients {
  /** Connection establishment timeout. */
  public static final Duration CONNECT_TIMEOUT = Duration.ofSeconds(10);
  /** Per-request read timeout; long-running queries may take close to a minute. */
  public static final Duration READ_TIMEOUT = Duration.ofSeconds(60);

  private HttpClients() {
    // Utility
  }

  /**
   * Creates the default client.
   *
   * @return configured client
   */
  public static OkHttpClient queryClient() {
    return builder().build();
  }

  /**
   * Creates a client with an application interceptor installed first.
   *
   * @param interceptor interceptor to install
   * @return configured client
   */
  public static OkHttpClient queryClient(Interceptor interceptor) {
    return builder().addInterceptor(interceptor).build();
  }

  private static OkHttpClient.Builder builder() {
    return new OkHttpClient.Builder()
        .protocols(Arrays.asList(Protocol.HTTP_2, Protocol.HTTP_1_1))
        .connectTimeout(CONNECT_TIMEOUT)
        .readTimeout(READ_TIMEOUT)
        .writeTimeout(READ_TIMEOUT)
        .retryOnConnectionFailure(false)
        .followRedirects(false)
        .followSslRedirects(false);
  }
}
