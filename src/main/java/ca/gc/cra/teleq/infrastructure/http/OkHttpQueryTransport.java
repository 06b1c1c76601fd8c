package ca.gc.cra.teleq.infrastructure.http;

import ca.gc.cra.teleq.application.port.QueryTransport;
import java.io.IOException;
import java.util.Objects;
import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> {@link QueryTransport} backed by OkHttp.
 * <p><strong>Behavior:</strong> Sends a JSON {@code POST} with a bearer token and returns the status and body of
 * every response. Never retries. A URL OkHttp cannot parse fails as an {@link IOException}.</p>
 * <p><strong>Thread-safety:</strong> Safe for concurrent use; the shared {@link OkHttpClient} pools connections.</p>
 *
 * @since 0.1.0
 */
public final class OkHttpQueryTransport implements QueryTransport {
  private static final Logger log = LoggerFactory.getLogger(OkHttpQueryTransport.class);
  private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");

  private final OkHttpClient client;

  /** Creates a transport with the default client from {@link HttpClients#queryClient()}. */
  public OkHttpQueryTransport() {
    this(HttpClients.queryClient());
  }

  /**
   * Creates a transport over an existing client.
   *
   * @param client OkHttp client
   */
  public OkHttpQueryTransport(OkHttpClient client) {
    this.client = Objects.requireNonNull(client, "client");
  }

  @Override
  public TransportResponse post(QueryRequest request) throws IOException {
    Objects.requireNonNull(request, "request");
    HttpUrl url = HttpUrl.parse(request.url());
    if (url == null) {
      throw new IOException("Invalid query URL: " + request.url());
    }
    Request httpRequest = new Request.Builder()
        .url(url)
        .header("Authorization", "Bearer " + request.bearerToken())
        .header("Accept", "application/json")
        .post(RequestBody.create(request.jsonBody(), JSON))
        .build();
    log.debug("POST {}", request.url());
    try (Response response = client.newCall(httpRequest).execute()) {
      ResponseBody body = response.body();
      String text = body == null ? "" : body.string();
      log.debug("POST {} returned HTTP {}", request.url(), response.code());
      return new TransportResponse(response.code(), text);
    }
  }
}
