package com.signalkit.notifier;

import java.net.URI;
import java.net.http.HttpRequest;
import java.util.Optional;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

public class NotifierTest {
  private static final HttpRequest REQUEST =
      HttpRequest.newBuilder(URI.create("http://localhost/orders/7")).GET().build();

  @Test
  void bufferNotifierKeepsNoticesInOrder() {
    final BufferNotifier notifier = new BufferNotifier();
    final IllegalStateException error = new IllegalStateException("boom");

    notifier.notifyError(error, Optional.of(REQUEST));
    notifier.notifyError("plain string", Optional.empty());

    Assertions.assertEquals(2, notifier.notices().size());
    Assertions.assertSame(error, notifier.notices().get(0).error());
    Assertions.assertEquals(Optional.of(REQUEST), notifier.notices().get(0).request());
    Assertions.assertEquals("plain string", notifier.notices().get(1).error());
  }

  @Test
  void noticesAreASnapshot() {
    final BufferNotifier notifier = new BufferNotifier();
    notifier.notifyError("first", Optional.empty());
    final int before = notifier.notices().size();

    notifier.notifyError("second", Optional.empty());

    Assertions.assertEquals(1, before);
    Assertions.assertEquals(2, notifier.notices().size());
  }

  @Test
  void failingNotifierFailsWithTheError() {
    final IllegalStateException error = new IllegalStateException("boom");

    final AssertionError failure =
        Assertions.assertThrows(
            AssertionError.class, () -> new FailingNotifier().notifyError(error, Optional.of(REQUEST)));
    Assertions.assertSame(error, failure.getCause());
    Assertions.assertEquals(
        "unexpected error notification: boom (GET http://localhost/orders/7)", failure.getMessage());
  }

  @Test
  void failingNotifierAcceptsNonThrowables() {
    final AssertionError failure =
        Assertions.assertThrows(
            AssertionError.class, () -> new FailingNotifier().notifyError(42, Optional.empty()));
    Assertions.assertEquals("unexpected error notification: 42", failure.getMessage());
    Assertions.assertNull(failure.getCause());
  }
}
