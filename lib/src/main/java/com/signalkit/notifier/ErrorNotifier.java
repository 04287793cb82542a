package com.signalkit.notifier;

import java.net.http.HttpRequest;
import java.util.Optional;

/** Reports unexpected errors to an error tracker. */
public interface ErrorNotifier {
  /**
   * @param error the error, usually a {@link Throwable} but any value a handler caught
   * @param request the request being served when the error occurred, if any
   */
  void notifyError(Object error, Optional<HttpRequest> request);
}
