package com.codeheadsystems.coffer.client.accessor;

import java.time.Duration;

/**
 * Pauses the calling thread. Replaced in tests so retries and polling never wait.
 */
@FunctionalInterface
public interface Sleeper {

  Sleeper SYSTEM = duration -> Thread.sleep(duration.toMillis());

  void sleep(Duration duration) throws InterruptedException;
}
