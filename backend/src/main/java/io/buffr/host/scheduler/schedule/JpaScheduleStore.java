package io.buffr.host.scheduler.schedule;

import jakarta.persistence.EntityManager;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Consumer;
import java.util.function.Function;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

/** PostgreSQL-backed store. Row mutations run inside a transaction holding a FOR UPDATE lock. */
@Component
public class JpaScheduleStore implements ScheduleStore {

  private final EntityManager entityManager;
  private final ScheduleRepository scheduleRepository;
  private final ScheduleExecutionRepository executionRepository;

  public JpaScheduleStore(
      EntityManager entityManager,
      ScheduleRepository scheduleRepository,
      ScheduleExecutionRepository executionRepository) {
    this.entityManager = entityManager;
    this.scheduleRepository = scheduleRepository;
    this.executionRepository = executionRepository;
  }

  @Override
  @Transactional
  public Schedule insertSchedule(Schedule schedule) {
    // persist, not save: ids are assigned up front, so save() would attempt a merge
    entityManager.persist(schedule);
    return schedule;
  }

  @Override
  @Transactional(readOnly = true)
  public Optional<Schedule> getSchedule(UUID id) {
    return scheduleRepository.findById(id);
  }

  @Override
  @Transactional
  public <T> Optional<T> updateSchedule(UUID id, Function<Schedule, T> mutation) {
    return scheduleRepository.findByIdForUpdate(id).map(mutation);
  }

  @Override
  @Transactional(readOnly = true)
  public List<Schedule> queryDueSchedules(Instant now) {
    return scheduleRepository.findDue(now);
  }

  @Override
  @Transactional
  public boolean claim(UUID id, Instant now, Instant leaseUntil) {
    return scheduleRepository
        .findByIdForUpdate(id)
        .map(schedule -> schedule.claim(now, leaseUntil))
        .orElse(false);
  }

  @Override
  @Transactional
  public ScheduleExecution insertExecution(ScheduleExecution execution) {
    entityManager.persist(execution);
    return execution;
  }

  @Override
  @Transactional
  public Optional<ScheduleExecution> updateExecution(
      UUID id, Consumer<ScheduleExecution> mutation) {
    return executionRepository
        .findByIdForUpdate(id)
        .map(
            execution -> {
              mutation.accept(execution);
              return execution;
            });
  }

  @Override
  @Transactional(readOnly = true)
  public List<Schedule> listSchedules(ScheduleStatus status, ScheduleType type, int limit) {
    var page = PageRequest.of(0, limit);
    if (status != null && type != null) {
      return scheduleRepository.findByStatusAndTypeOrderByCreatedAtDesc(status, type, page);
    } else if (status != null) {
      return scheduleRepository.findByStatusOrderByCreatedAtDesc(status, page);
    } else if (type != null) {
      return scheduleRepository.findByTypeOrderByCreatedAtDesc(type, page);
    }
    return scheduleRepository.findAllByOrderByCreatedAtDesc(page);
  }

  @Override
  @Transactional(readOnly = true)
  public List<ScheduleExecution> listExecutions(UUID scheduleId, int limit) {
    var page = PageRequest.of(0, limit);
    if (scheduleId != null) {
      return executionRepository.findByScheduleIdOrderByScheduledAtDesc(scheduleId, page);
    }
    return executionRepository.findAllByOrderByScheduledAtDesc(page);
  }

  @Override
  @Transactional(readOnly = true)
  public long countSchedules() {
    return scheduleRepository.count();
  }

  @Override
  @Transactional(readOnly = true)
  public long countActiveSchedules() {
    return scheduleRepository.countByActiveTrue();
  }

  @Override
  @Transactional(readOnly = true)
  public long countExecutions() {
    return executionRepository.count();
  }

  @Override
  @Transactional(readOnly = true)
  public long countExecutions(ExecutionStatus status) {
    return executionRepository.countByStatus(status);
  }
}
