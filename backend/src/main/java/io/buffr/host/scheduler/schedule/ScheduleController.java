package io.buffr.host.scheduler.schedule;

import io.buffr.host.scheduler.exception.InvalidStateException;
import io.buffr.host.scheduler.schedule.dto.CreateScheduleRequest;
import io.buffr.host.scheduler.schedule.dto.ScheduleExecutionResponse;
import io.buffr.host.scheduler.schedule.dto.ScheduleResponse;
import io.buffr.host.scheduler.schedule.dto.ScheduleStatistics;
import io.buffr.host.scheduler.schedule.dto.UpdateScheduleRequest;
import jakarta.validation.Valid;
import java.net.URI;
import java.util.List;
import java.util.UUID;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/schedules")
public class ScheduleController {

  static final String CREATED_BY_HEADER = "X-Created-By";

  private final ScheduleService scheduleService;

  public ScheduleController(ScheduleService scheduleService) {
    this.scheduleService = scheduleService;
  }

  @GetMapping
  public ResponseEntity<List<ScheduleResponse>> listSchedules(
      @RequestParam(required = false) ScheduleStatus status,
      @RequestParam(required = false) ScheduleType type,
      @RequestParam(required = false) Integer limit) {
    return ResponseEntity.ok(scheduleService.getSchedules(status, type, limit));
  }

  @GetMapping("/{id}")
  public ResponseEntity<ScheduleResponse> getSchedule(@PathVariable UUID id) {
    return ResponseEntity.ok(scheduleService.get(id));
  }

  @PostMapping
  public ResponseEntity<ScheduleResponse> createSchedule(
      @Valid @RequestBody CreateScheduleRequest request,
      @RequestHeader(name = CREATED_BY_HEADER, required = false) String createdBy) {
    var response = scheduleService.create(request, createdBy);
    return ResponseEntity.created(URI.create("/api/schedules/" + response.id())).body(response);
  }

  @PutMapping("/{id}")
  public ResponseEntity<ScheduleResponse> updateSchedule(
      @PathVariable UUID id, @Valid @RequestBody UpdateScheduleRequest request) {
    return ResponseEntity.ok(scheduleService.update(id, request));
  }

  @PostMapping("/{id}/pause")
  public ResponseEntity<ScheduleResponse> pauseSchedule(@PathVariable UUID id) {
    if (!scheduleService.pause(id)) {
      throw rejectedTransition(id, "paused");
    }
    return ResponseEntity.ok(scheduleService.get(id));
  }

  @PostMapping("/{id}/resume")
  public ResponseEntity<ScheduleResponse> resumeSchedule(@PathVariable UUID id) {
    if (!scheduleService.resume(id)) {
      throw rejectedTransition(id, "resumed");
    }
    return ResponseEntity.ok(scheduleService.get(id));
  }

  @PostMapping("/{id}/cancel")
  public ResponseEntity<ScheduleResponse> cancelSchedule(@PathVariable UUID id) {
    if (!scheduleService.cancel(id)) {
      throw rejectedTransition(id, "cancelled");
    }
    return ResponseEntity.ok(scheduleService.get(id));
  }

  @GetMapping("/{id}/executions")
  public ResponseEntity<List<ScheduleExecutionResponse>> listExecutions(
      @PathVariable UUID id, @RequestParam(required = false) Integer limit) {
    return ResponseEntity.ok(scheduleService.getScheduleExecutions(id, limit));
  }

  @GetMapping("/executions")
  public ResponseEntity<List<ScheduleExecutionResponse>> listAllExecutions(
      @RequestParam(required = false) Integer limit) {
    return ResponseEntity.ok(scheduleService.getScheduleExecutions(null, limit));
  }

  @GetMapping("/statistics")
  public ResponseEntity<ScheduleStatistics> getStatistics() {
    return ResponseEntity.ok(scheduleService.getScheduleStatistics());
  }

  // get() answers 404 for an unknown id before the state error is built
  private InvalidStateException rejectedTransition(UUID id, String action) {
    var current = scheduleService.get(id);
    return new InvalidStateException(
        "Invalid state transition",
        "Schedule cannot be " + action + " from status " + current.status());
  }
}
