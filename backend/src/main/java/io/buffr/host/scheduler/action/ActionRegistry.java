package io.buffr.host.scheduler.action;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/** Maps action-type identifiers to the handlers that execute them. */
@Component
public class ActionRegistry {

  private static final Logger log = LoggerFactory.getLogger(ActionRegistry.class);

  private final Map<String, ActionHandler> handlers = new ConcurrentHashMap<>();

  public ActionRegistry(List<ScheduledAction> actions) {
    for (var action : actions) {
      register(action.actionType(), action);
    }
  }

  /** Registers a handler, replacing any handler previously registered for the same type. */
  public void register(String actionType, ActionHandler handler) {
    if (actionType == null || actionType.isBlank()) {
      throw new IllegalArgumentException("Action type must not be blank");
    }
    if (handler == null) {
      throw new IllegalArgumentException("Handler for action type " + actionType + " is null");
    }
    if (handlers.put(actionType, handler) != null) {
      log.warn("Replaced handler for action type {}", actionType);
    } else {
      log.debug("Registered handler for action type {}", actionType);
    }
  }

  public Optional<ActionHandler> resolve(String actionType) {
    if (actionType == null) {
      return Optional.empty();
    }
    return Optional.ofNullable(handlers.get(actionType));
  }

  public Set<String> registeredTypes() {
    return new TreeSet<>(handlers.keySet());
  }
}
