package com.signalkit.internal;

import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/** Daemon threads named {@code <prefix>-<n>} at a fixed priority. */
public class PriorityThreadFactory implements ThreadFactory {
  private final ThreadFactory defaultFactory = Executors.defaultThreadFactory();
  private final AtomicInteger threadCount = new AtomicInteger(0);
  private final int priority;
  private final String namePrefix;

  public PriorityThreadFactory(int priority, String namePrefix) {
    this.priority = priority;
    this.namePrefix = namePrefix;
  }

  @Override
  public Thread newThread(Runnable r) {
    Thread thread = defaultFactory.newThread(r);
    thread.setPriority(priority);
    thread.setDaemon(true);
    thread.setName(namePrefix + "-" + threadCount.incrementAndGet());
    return thread;
  }
}
