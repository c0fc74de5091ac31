package io.buffr.host.scheduler.schedule;

import static org.assertj.core.api.Assertions.assertThat;

import io.buffr.host.scheduler.TestcontainersConfiguration;
import io.buffr.host.scheduler.action.ActionRegistry;
import io.buffr.host.scheduler.schedule.dto.CreateScheduleRequest;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.ActiveProfiles;
import org.testcontainers.junit.jupiter.Testcontainers;

@SpringBootTest
@Import(TestcontainersConfiguration.class)
@ActiveProfiles("test")
@Testcontainers(disabledWithoutDocker = true)
class ScheduleIntegrationTest {

  private static final String ECHO_ACTION = "it_echo";

  @Autowired private ScheduleStore scheduleStore;
  @Autowired private ScheduleService scheduleService;
  @Autowired private ScheduleExecutor scheduleExecutor;
  @Autowired private ActionRegistry actionRegistry;

  @BeforeEach
  void registerEchoAction() {
    actionRegistry.register(
        ECHO_ACTION,
        config -> CompletableFuture.completedFuture(Map.of("echo", config.get("message"))));
  }

  @Test
  void insertSchedule_roundTripsJsonbColumns() {
    var now = Instant.now().truncatedTo(ChronoUnit.MILLIS);
    var config =
        new ScheduleConfig(
            "Europe/Berlin",
            Instant.parse("2024-01-01T00:00:00Z"),
            Instant.parse("2030-01-01T00:00:00Z"),
            10,
            RecurrencePattern.WEEKDAYS,
            List.of(0, 2, 4),
            2,
            "0 9 * * MON",
            Map.of("owner", "ops"),
            new ScheduleConfig.RetryPolicy(3, 60L));
    var schedule =
        new Schedule(
            "Jsonb round trip",
            "checks jsonb mapping",
            ScheduleType.CRON,
            config,
            ECHO_ACTION,
            Map.of("message", "hi", "nested", Map.of("level", "deep")),
            5,
            "integration",
            now);
    scheduleStore.insertSchedule(schedule);

    var loaded = scheduleStore.getSchedule(schedule.getId()).orElseThrow();

    assertThat(loaded.getConfig()).isEqualTo(config);
    assertThat(loaded.getActionConfig())
        .containsEntry("message", "hi")
        .containsEntry("nested", Map.of("level", "deep"));
    assertThat(loaded.getMaxRuns()).isEqualTo(5);
    assertThat(loaded.getCreatedAt()).isEqualTo(now);
  }

  @Test
  void queryDueSchedules_skipsFutureAndClaimedSchedules() {
    var now = Instant.now().truncatedTo(ChronoUnit.MILLIS);
    var due = insertActive("due", now.minus(Duration.ofMinutes(1)), now);
    var future = insertActive("future", now.plus(Duration.ofHours(1)), now);

    assertThat(scheduleStore.queryDueSchedules(now))
        .extracting(Schedule::getId)
        .contains(due.getId())
        .doesNotContain(future.getId());

    var leaseUntil = now.plus(Duration.ofMinutes(5));
    assertThat(scheduleStore.claim(due.getId(), now, leaseUntil)).isTrue();
    assertThat(scheduleStore.claim(due.getId(), now, leaseUntil)).isFalse();
    assertThat(scheduleStore.queryDueSchedules(now))
        .extracting(Schedule::getId)
        .doesNotContain(due.getId());

    // an expired lease makes the schedule due again
    assertThat(scheduleStore.queryDueSchedules(leaseUntil))
        .extracting(Schedule::getId)
        .contains(due.getId());
  }

  @Test
  void renewClaim_afterRoundTrip_matchesOnlyTheCurrentLease() {
    var now = Instant.now().truncatedTo(ChronoUnit.MILLIS);
    var due = insertActive("renewable", now.minus(Duration.ofMinutes(1)), now);
    var firstLease = now.plus(Duration.ofMinutes(5));
    assertThat(scheduleStore.claim(due.getId(), now, firstLease)).isTrue();

    var renewed =
        scheduleStore.updateSchedule(
            due.getId(),
            s -> s.renewClaim(firstLease, now, firstLease.plusSeconds(60)) ? s : null);
    var stale =
        scheduleStore.updateSchedule(
            due.getId(),
            s -> s.renewClaim(firstLease, now, firstLease.plusSeconds(120)) ? s : null);

    assertThat(renewed).isPresent();
    assertThat(stale).isEmpty();
    assertThat(scheduleStore.getSchedule(due.getId()).orElseThrow().getClaimedUntil())
        .isEqualTo(firstLease.plusSeconds(60));
  }

  @Test
  void updateSchedule_unknownId_isEmpty() {
    assertThat(scheduleStore.updateSchedule(UUID.randomUUID(), s -> s)).isEmpty();
  }

  @Test
  void execute_registeredAction_recordsCompletedExecutionAndAdvances() {
    var created =
        scheduleService.create(
            new CreateScheduleRequest(
                "Echo daily",
                null,
                ScheduleType.DAILY,
                null,
                ECHO_ACTION,
                Map.of("message", "hello"),
                null),
            "integration");
    var schedule = scheduleStore.getSchedule(created.id()).orElseThrow();

    var execution = scheduleExecutor.execute(schedule);

    assertThat(execution.getStatus()).isEqualTo(ExecutionStatus.COMPLETED);
    var history = scheduleService.getScheduleExecutions(created.id(), null);
    assertThat(history).hasSize(1);
    assertThat(history.get(0).result()).containsEntry("echo", "hello");

    var after = scheduleService.get(created.id());
    assertThat(after.runCount()).isEqualTo(1);
    assertThat(after.lastRun()).isNotNull();
    assertThat(after.nextRun()).isAfter(after.lastRun());
    assertThat(after.status()).isEqualTo(ScheduleStatus.ACTIVE);
  }

  @Test
  void lifecycle_pauseResumeCancel_persistsStatus() {
    var created =
        scheduleService.create(
            new CreateScheduleRequest(
                "Lifecycle", null, ScheduleType.WEEKLY, null, ECHO_ACTION, Map.of(), null),
            null);

    assertThat(scheduleService.pause(created.id())).isTrue();
    assertThat(scheduleService.get(created.id()).isActive()).isFalse();

    assertThat(scheduleService.resume(created.id())).isTrue();
    assertThat(scheduleService.get(created.id()).status()).isEqualTo(ScheduleStatus.ACTIVE);

    assertThat(scheduleService.cancel(created.id())).isTrue();
    var cancelled = scheduleService.get(created.id());
    assertThat(cancelled.status()).isEqualTo(ScheduleStatus.CANCELLED);
    assertThat(cancelled.isActive()).isFalse();
    assertThat(cancelled.createdBy()).isEqualTo("system");
    assertThat(scheduleService.pause(created.id())).isFalse();
  }

  private Schedule insertActive(String name, Instant nextRun, Instant now) {
    var schedule =
        new Schedule(
            name,
            null,
            ScheduleType.DAILY,
            ScheduleConfig.defaults(),
            ECHO_ACTION,
            Map.of(),
            null,
            "integration",
            now);
    schedule.advanceTo(nextRun, now);
    return scheduleStore.insertSchedule(schedule);
  }
}
