package com.codeheadsystems.coffer.client.accessor;

import java.io.ByteArrayOutputStream;
import java.net.URLDecoder;
import java.net.http.HttpRequest;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Flow;
import java.util.concurrent.TimeUnit;

/**
 * Reads the body a captured {@link HttpRequest} would send.
 */
final class RequestBodies {

  private RequestBodies() {
  }

  static String asString(final HttpRequest request) {
    return request.bodyPublisher().map(publisher -> {
      Collector collector = new Collector();
      publisher.subscribe(collector);
      return collector.done.orTimeout(5, TimeUnit.SECONDS).join();
    }).orElse("");
  }

  static Map<String, String> asForm(final HttpRequest request) {
    Map<String, String> form = new LinkedHashMap<>();
    String body = asString(request);
    if (body.isEmpty()) {
      return form;
    }
    for (String pair : body.split("&")) {
      int eq = pair.indexOf('=');
      form.put(URLDecoder.decode(pair.substring(0, eq), StandardCharsets.UTF_8),
          URLDecoder.decode(pair.substring(eq + 1), StandardCharsets.UTF_8));
    }
    return form;
  }

  private static final class Collector implements Flow.Subscriber<ByteBuffer> {

    private final ByteArrayOutputStream bytes = new ByteArrayOutputStream();
    private final CompletableFuture<String> done = new CompletableFuture<>();

    @Override
    public void onSubscribe(final Flow.Subscription subscription) {
      subscription.request(Long.MAX_VALUE);
    }

    @Override
    public void onNext(final ByteBuffer item) {
      byte[] chunk = new byte[item.remaining()];
      item.get(chunk);
      bytes.writeBytes(chunk);
    }

    @Override
    public void onError(final Throwable throwable) {
      done.completeExceptionally(throwable);
    }

    @Override
    public void onComplete() {
      done.complete(bytes.toString(StandardCharsets.UTF_8));
    }
  }
}
