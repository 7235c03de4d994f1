package ca.gc.cra.uvcalc.infrastructure.eubrewnet;

import ca.gc.cra.uvcalc.config.EubrewnetSettings;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import java.io.IOException;
import java.io.OutputStream;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Loopback HTTP server answering canned JSON per path and recording each request.
 */
final class FakeEubrewnetServer implements AutoCloseable {
  /** One received request. */
  record Request(String path, String rawQuery, String authorization) {}

  private record Reply(int status, String body) {}

  private final HttpServer server;
  private final Map<String, Reply> replies = new ConcurrentHashMap<>();
  private final List<Request> requests = new CopyOnWriteArrayList<>();

  FakeEubrewnetServer() throws IOException {
    server = HttpServer.create(new InetSocketAddress(InetAddress.getLoopbackAddress(), 0), 0);
    server.createContext("/", this::handle);
    server.start();
  }

  FakeEubrewnetServer reply(String path, int status, String body) {
    replies.put(path, new Reply(status, body));
    return this;
  }

  List<Request> requests() {
    return List.copyOf(requests);
  }

  EubrewnetSettings settings(Optional<String> user, Optional<String> password) {
    URI base = URI.create("http://" + server.getAddress().getHostString() + ":" + server.getAddress().getPort()
        + "/eubrewnet");
    return new EubrewnetSettings(base, user, password, Duration.ofSeconds(5));
  }

  EubrewnetClient client() {
    return new EubrewnetClient(settings(Optional.of("brewer"), Optional.of("s3cret")));
  }

  private void handle(HttpExchange exchange) throws IOException {
    URI uri = exchange.getRequestURI();
    String path = uri.getPath().substring("/eubrewnet".length());
    requests.add(new Request(path, uri.getRawQuery(), exchange.getRequestHeaders().getFirst("Authorization")));
    Reply reply = replies.getOrDefault(path, new Reply(404, "not found"));
    byte[] body = reply.body().getBytes(StandardCharsets.UTF_8);
    exchange.getResponseHeaders().add("Content-Type", "application/json");
    exchange.sendResponseHeaders(reply.status(), body.length);
    try (OutputStream out = exchange.getResponseBody()) {
      out.write(body);
    }
  }

  @Override
  public void close() {
    server.stop(0);
  }
}
