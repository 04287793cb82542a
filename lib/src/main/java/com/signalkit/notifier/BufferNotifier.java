package com.signalkit.notifier;

import com.google.common.collect.ImmutableList;
import java.net.http.HttpRequest;
import java.util.Optional;
import java.util.concurrent.ConcurrentLinkedQueue;

/** Keeps every notice in memory, for tests that assert on reported errors. */
public class BufferNotifier implements ErrorNotifier {
  private final ConcurrentLinkedQueue<Notice> notices = new ConcurrentLinkedQueue<>();

  @Override
  public void notifyError(Object error, Optional<HttpRequest> request) {
    notices.add(ImmutableNotice.of(error, request));
  }

  /** Snapshot of the notices received so far, oldest first. */
  public ImmutableList<Notice> notices() {
    return ImmutableList.copyOf(notices);
  }
}
