package io.buffr.host.scheduler.schedule;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import io.buffr.host.scheduler.exception.InvalidStateException;
import io.buffr.host.scheduler.exception.ResourceNotFoundException;
import io.buffr.host.scheduler.exception.ScheduleValidationException;
import io.buffr.host.scheduler.schedule.dto.CreateScheduleRequest;
import io.buffr.host.scheduler.schedule.dto.ScheduleExecutionResponse;
import io.buffr.host.scheduler.schedule.dto.ScheduleResponse;
import io.buffr.host.scheduler.schedule.dto.ScheduleStatistics;
import io.buffr.host.scheduler.schedule.dto.UpdateScheduleRequest;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

@WebMvcTest(ScheduleController.class)
class ScheduleControllerTest {

  private static final Instant NOW = Instant.parse("2024-01-01T00:00:00Z");

  private static final String DAILY_REPORT =
      """
      {
        "name": "Daily report",
        "type": "DAILY",
        "actionType": "send_report",
        "actionConfig": {"recipient": "ops@example.com"},
        "config": {"timezone": "UTC"}
      }
      """;

  @Autowired private MockMvc mockMvc;
  @MockitoBean private ScheduleService scheduleService;

  @Test
  void createSchedule_validRequest_returns201WithLocation() throws Exception {
    var created = response(UUID.randomUUID(), ScheduleStatus.ACTIVE);
    when(scheduleService.create(any(CreateScheduleRequest.class), eq("alice")))
        .thenReturn(created);

    mockMvc
        .perform(
            post("/api/schedules")
                .header("X-Created-By", "alice")
                .contentType(MediaType.APPLICATION_JSON)
                .content(DAILY_REPORT))
        .andExpect(status().isCreated())
        .andExpect(header().string("Location", "/api/schedules/" + created.id()))
        .andExpect(jsonPath("$.id").value(created.id().toString()))
        .andExpect(jsonPath("$.status").value("ACTIVE"))
        .andExpect(jsonPath("$.nextRun").value("2024-01-02T00:00:00Z"));
  }

  @Test
  void createSchedule_withoutCreatedByHeader_passesNull() throws Exception {
    when(scheduleService.create(any(CreateScheduleRequest.class), isNull()))
        .thenReturn(response(UUID.randomUUID(), ScheduleStatus.ACTIVE));

    mockMvc
        .perform(
            post("/api/schedules").contentType(MediaType.APPLICATION_JSON).content(DAILY_REPORT))
        .andExpect(status().isCreated());
  }

  @Test
  void createSchedule_blankName_returns400() throws Exception {
    mockMvc
        .perform(
            post("/api/schedules")
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"name": " ", "type": "DAILY", "actionType": "send_report"}
                    """))
        .andExpect(status().isBadRequest());

    verify(scheduleService, never()).create(any(), any());
  }

  @Test
  void createSchedule_invalidConfig_returnsProblemWithErrors() throws Exception {
    when(scheduleService.create(any(CreateScheduleRequest.class), any()))
        .thenThrow(new ScheduleValidationException("cronExpression is invalid: nope"));

    mockMvc
        .perform(
            post("/api/schedules").contentType(MediaType.APPLICATION_JSON).content(DAILY_REPORT))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.title").value("Invalid schedule"))
        .andExpect(jsonPath("$.errors[0]").value("cronExpression is invalid: nope"));
  }

  @Test
  void getSchedule_unknownId_returns404() throws Exception {
    var id = UUID.randomUUID();
    when(scheduleService.get(id)).thenThrow(new ResourceNotFoundException("Schedule", id));

    mockMvc
        .perform(get("/api/schedules/{id}", id))
        .andExpect(status().isNotFound())
        .andExpect(jsonPath("$.title").value("Schedule not found"));
  }

  @Test
  void listSchedules_passesFilters() throws Exception {
    var id = UUID.randomUUID();
    when(scheduleService.getSchedules(ScheduleStatus.PAUSED, ScheduleType.DAILY, 5))
        .thenReturn(List.of(response(id, ScheduleStatus.PAUSED)));

    mockMvc
        .perform(get("/api/schedules").param("status", "PAUSED").param("type", "DAILY"))
        .andExpect(status().isOk());
    mockMvc
        .perform(
            get("/api/schedules")
                .param("status", "PAUSED")
                .param("type", "DAILY")
                .param("limit", "5"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$[0].id").value(id.toString()))
        .andExpect(jsonPath("$[0].status").value("PAUSED"));
  }

  @Test
  void updateSchedule_terminalSchedule_returns400() throws Exception {
    var id = UUID.randomUUID();
    when(scheduleService.update(eq(id), any(UpdateScheduleRequest.class)))
        .thenThrow(new InvalidStateException("Schedule not editable", "Schedule is CANCELLED"));

    mockMvc
        .perform(
            put("/api/schedules/{id}", id)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"name\": \"Renamed\"}"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.title").value("Schedule not editable"));
  }

  @Test
  void pauseSchedule_allowed_returnsPausedSchedule() throws Exception {
    var id = UUID.randomUUID();
    when(scheduleService.pause(id)).thenReturn(true);
    when(scheduleService.get(id)).thenReturn(response(id, ScheduleStatus.PAUSED));

    mockMvc
        .perform(post("/api/schedules/{id}/pause", id))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.status").value("PAUSED"));
  }

  @Test
  void pauseSchedule_forbiddenTransition_returns400() throws Exception {
    var id = UUID.randomUUID();
    when(scheduleService.pause(id)).thenReturn(false);
    when(scheduleService.get(id)).thenReturn(response(id, ScheduleStatus.CANCELLED));

    mockMvc
        .perform(post("/api/schedules/{id}/pause", id))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.detail").value("Schedule cannot be paused from status CANCELLED"));
  }

  @Test
  void resumeSchedule_unknownId_returns404() throws Exception {
    var id = UUID.randomUUID();
    when(scheduleService.resume(id)).thenReturn(false);
    when(scheduleService.get(id)).thenThrow(new ResourceNotFoundException("Schedule", id));

    mockMvc.perform(post("/api/schedules/{id}/resume", id)).andExpect(status().isNotFound());
  }

  @Test
  void cancelSchedule_allowed_returnsCancelledSchedule() throws Exception {
    var id = UUID.randomUUID();
    when(scheduleService.cancel(id)).thenReturn(true);
    when(scheduleService.get(id)).thenReturn(response(id, ScheduleStatus.CANCELLED));

    mockMvc
        .perform(post("/api/schedules/{id}/cancel", id))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.status").value("CANCELLED"));
  }

  @Test
  void listExecutions_forSchedule_returnsHistory() throws Exception {
    var scheduleId = UUID.randomUUID();
    var execution =
        new ScheduleExecutionResponse(
            UUID.randomUUID(),
            scheduleId,
            NOW,
            NOW,
            NOW.plusSeconds(2),
            ExecutionStatus.COMPLETED,
            Map.of("sent", 3),
            null);
    when(scheduleService.getScheduleExecutions(scheduleId, 10)).thenReturn(List.of(execution));

    mockMvc
        .perform(get("/api/schedules/{id}/executions", scheduleId).param("limit", "10"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$[0].status").value("COMPLETED"))
        .andExpect(jsonPath("$[0].result.sent").value(3));
  }

  @Test
  void listAllExecutions_queriesWithoutScheduleFilter() throws Exception {
    when(scheduleService.getScheduleExecutions(null, null)).thenReturn(List.of());

    mockMvc
        .perform(get("/api/schedules/executions"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$").isEmpty());
  }

  @Test
  void getStatistics_returnsAggregates() throws Exception {
    when(scheduleService.getScheduleStatistics())
        .thenReturn(new ScheduleStatistics(4, 3, 10, 8, 80.0));

    mockMvc
        .perform(get("/api/schedules/statistics"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.totalSchedules").value(4))
        .andExpect(jsonPath("$.activeSchedules").value(3))
        .andExpect(jsonPath("$.successRate").value(80.0));
  }

  private static ScheduleResponse response(UUID id, ScheduleStatus status) {
    return new ScheduleResponse(
        id,
        "Daily report",
        null,
        ScheduleType.DAILY,
        status,
        ScheduleConfig.defaults(),
        "send_report",
        Map.of("recipient", "ops@example.com"),
        status == ScheduleStatus.ACTIVE ? NOW.plusSeconds(86_400) : null,
        null,
        0,
        null,
        status == ScheduleStatus.ACTIVE,
        0,
        "alice",
        NOW,
        NOW);
  }
}
