package io.buffr.host.scheduler.schedule;

import jakarta.persistence.LockModeType;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface ScheduleExecutionRepository extends JpaRepository<ScheduleExecution, UUID> {

  @Lock(LockModeType.PESSIMISTIC_WRITE)
  @Query("SELECT e FROM ScheduleExecution e WHERE e.id = :id")
  Optional<ScheduleExecution> findByIdForUpdate(@Param("id") UUID id);

  List<ScheduleExecution> findByScheduleIdOrderByScheduledAtDesc(
      UUID scheduleId, Pageable pageable);

  List<ScheduleExecution> findAllByOrderByScheduledAtDesc(Pageable pageable);

  long countByStatus(ExecutionStatus status);
}
