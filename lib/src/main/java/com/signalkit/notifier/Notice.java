package com.signalkit.notifier;

import java.net.http.HttpRequest;
import java.util.Optional;
import org.immutables.value.Value;

/** One recorded call to {@link ErrorNotifier#notifyError}. */
@Value.Immutable
public abstract class Notice {
  @Value.Parameter
  public abstract Object error();

  @Value.Parameter
  public abstract Optional<HttpRequest> request();
}
