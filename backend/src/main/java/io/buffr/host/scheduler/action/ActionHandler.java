package io.buffr.host.scheduler.action;

import java.util.Map;
import java.util.concurrent.CompletableFuture;

/** Performs the work of a schedule. Receives the schedule's action config verbatim. */
@FunctionalInterface
public interface ActionHandler {

  CompletableFuture<Map<String, Object>> handle(Map<String, Object> actionConfig);
}
