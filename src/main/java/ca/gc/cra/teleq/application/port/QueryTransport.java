package ca.gc.cra.teleq.application.port;

import ca.gc.cra.teleq.logging.Logs;
import java.io.IOException;
import java.util.Objects;

/**
 * Port performing the HTTP exchange with the telemetry query API.
 *
 * <p>Implementations return every HTTP response, successful or not, and throw only when no response was
 * received.</p>
 */
public interface QueryTransport {

  /**
   * Posts a query request.
   *
   * @param request request to send
   * @return HTTP status and body
   * @throws IOException when the exchange fails before a response arrives
   */
  TransportResponse post(QueryRequest request) throws IOException;

  /**
   * Outbound request.
   *
   * @param url absolute endpoint URL
   * @param bearerToken access token; never printed
   * @param jsonBody request body
   */
  record QueryRequest(String url, String bearerToken, String jsonBody) {
    /** Validates components. */
    public QueryRequest {
      Objects.requireNonNull(url, "url");
      Objects.requireNonNull(bearerToken, "bearerToken");
      Objects.requireNonNull(jsonBody, "jsonBody");
    }

    @Override
    public String toString() {
      return "QueryRequest{url=" + url + ", bearerToken=" + Logs.redact(bearerToken)
          + ", jsonBody=" + jsonBody.length() + " chars}";
    }
  }

  /**
   * HTTP response.
   *
   * @param status HTTP status code
   * @param body response body; empty when none
   */
  record TransportResponse(int status, String body) {
    /** Normalizes a missing body. */
    public TransportResponse {
      body = body == null ? "" : body;
    }

    /**
     * Reports a 2xx status.
     *
     * @return {@code true} for success statuses
     */
    public boolean isSuccessful() {
      return status >= 200 && status < 300;
    }
  }
}
