package io.buffr.host.scheduler.action;

/**
 * An {@link ActionHandler} bean that names its own action type. Every bean of this type is
 * registered in the {@link ActionRegistry} at startup.
 */
public interface ScheduledAction extends ActionHandler {

  String actionType();
}
