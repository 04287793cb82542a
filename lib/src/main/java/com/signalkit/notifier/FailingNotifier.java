package com.signalkit.notifier;

import com.signalkit.internal.encoding.ValueRenderer;
import java.net.http.HttpRequest;
import java.util.Optional;

/**
 * Fails the running test on any notice by throwing {@link AssertionError}. Wire it in where no
 * error is expected to be reported.
 */
public class FailingNotifier implements ErrorNotifier {
  @Override
  public void notifyError(Object error, Optional<HttpRequest> request) {
    final String message =
        "unexpected error notification: "
            + ValueRenderer.render(error)
            + request.map(r -> " (" + r.method() + " " + r.uri() + ")").orElse("");
    if (error instanceof Throwable) {
      throw new AssertionError(message, (Throwable) error);
    }
    throw new AssertionError(message);
  }
}
