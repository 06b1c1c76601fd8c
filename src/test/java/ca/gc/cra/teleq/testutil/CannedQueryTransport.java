package ca.gc.cra.teleq.testutil;

import ca.gc.cra.teleq.application.port.QueryTransport;
import java.io.IOException;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Query transport replaying queued responses and recording requests.
 */
public final class CannedQueryTransport implements QueryTransport {
  public final List<QueryRequest> requests = new ArrayList<>();
  private final Deque<Object> responses = new ArrayDeque<>();

  public CannedQueryTransport respond(int status, String body) {
    responses.addLast(new TransportResponse(status, body));
    return this;
  }

  public CannedQueryTransport fail(IOException failure) {
    responses.addLast(failure);
    return this;
  }

  @Override
  public synchronized TransportResponse post(QueryRequest request) throws IOException {
    requests.add(request);
    Object next = responses.pollFirst();
    if (next == null) {
      throw new AssertionError("Unexpected request to " + request.url());
    }
    if (next instanceof IOException failure) {
      throw failure;
    }
    return (TransportResponse) next;
  }
}
