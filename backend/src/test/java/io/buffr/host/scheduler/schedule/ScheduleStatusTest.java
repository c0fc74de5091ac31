package io.buffr.host.scheduler.schedule;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

class ScheduleStatusTest {

  @Test
  void active_canPauseCancelAndComplete() {
    assertThat(ScheduleStatus.ACTIVE.canTransitionTo(ScheduleStatus.PAUSED)).isTrue();
    assertThat(ScheduleStatus.ACTIVE.canTransitionTo(ScheduleStatus.CANCELLED)).isTrue();
    assertThat(ScheduleStatus.ACTIVE.canTransitionTo(ScheduleStatus.COMPLETED)).isTrue();
  }

  @Test
  void paused_canResumeCancelAndComplete() {
    assertThat(ScheduleStatus.PAUSED.canTransitionTo(ScheduleStatus.ACTIVE)).isTrue();
    assertThat(ScheduleStatus.PAUSED.canTransitionTo(ScheduleStatus.CANCELLED)).isTrue();
    assertThat(ScheduleStatus.PAUSED.canTransitionTo(ScheduleStatus.COMPLETED)).isTrue();
  }

  @ParameterizedTest
  @EnumSource(value = ScheduleStatus.class, names = {"COMPLETED", "CANCELLED"})
  void terminalStatus_allowsNoTransition(ScheduleStatus terminal) {
    assertThat(terminal.isTerminal()).isTrue();
    for (var target : ScheduleStatus.values()) {
      assertThat(terminal.canTransitionTo(target)).as("%s -> %s", terminal, target).isFalse();
    }
  }

  @Test
  void onlyActive_isDispatchEligible() {
    assertThat(ScheduleStatus.ACTIVE.isDispatchEligible()).isTrue();
    assertThat(ScheduleStatus.PAUSED.isDispatchEligible()).isFalse();
    assertThat(ScheduleStatus.COMPLETED.isDispatchEligible()).isFalse();
    assertThat(ScheduleStatus.CANCELLED.isDispatchEligible()).isFalse();
  }
}
