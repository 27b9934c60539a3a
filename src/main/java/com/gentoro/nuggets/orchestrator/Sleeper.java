package com.gentoro.nuggets.orchestrator;

/** Backoff wait between attempts. Implementations return early when the token is cancelled. */
@FunctionalInterface
public interface Sleeper {

  Sleeper SYSTEM = (delayMillis, token) -> token.await(delayMillis);

  void sleep(long delayMillis, CancellationToken token) throws InterruptedException;
}
