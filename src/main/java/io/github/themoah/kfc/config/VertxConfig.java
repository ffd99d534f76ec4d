package io.github.themoah.kfc.config;

import io.vertx.core.VertxOptions;

/**
 * Vert.x options for the short-lived instance hosting the metadata admin client.
 * The consume loop runs on the caller thread, so one event loop and a small worker pool suffice.
 */
public class VertxConfig {

  private static final int EVENT_LOOP_POOL_SIZE = 1;
  private static final int WORKER_POOL_SIZE = 2;

  public static VertxOptions createVertxOptions() {
    VertxOptions options = new VertxOptions();
    options.setPreferNativeTransport(true);
    options.setEventLoopPoolSize(EVENT_LOOP_POOL_SIZE);
    options.setWorkerPoolSize(WORKER_POOL_SIZE);
    return options;
  }
}
