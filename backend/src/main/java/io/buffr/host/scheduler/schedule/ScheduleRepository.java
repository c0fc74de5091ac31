package io.buffr.host.scheduler.schedule;

import jakarta.persistence.LockModeType;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface ScheduleRepository extends JpaRepository<Schedule, UUID> {

  @Lock(LockModeType.PESSIMISTIC_WRITE)
  @Query("SELECT s FROM Schedule s WHERE s.id = :id")
  Optional<Schedule> findByIdForUpdate(@Param("id") UUID id);

  @Query(
      """
      SELECT s FROM Schedule s
      WHERE s.active = true
        AND s.status = io.buffr.host.scheduler.schedule.ScheduleStatus.ACTIVE
        AND s.nextRun <= :now
        AND (s.claimedUntil IS NULL OR s.claimedUntil <= :now)
      ORDER BY s.nextRun ASC
      """)
  List<Schedule> findDue(@Param("now") Instant now);

  List<Schedule> findAllByOrderByCreatedAtDesc(Pageable pageable);

  List<Schedule> findByStatusOrderByCreatedAtDesc(ScheduleStatus status, Pageable pageable);

  List<Schedule> findByTypeOrderByCreatedAtDesc(ScheduleType type, Pageable pageable);

  List<Schedule> findByStatusAndTypeOrderByCreatedAtDesc(
      ScheduleStatus status, ScheduleType type, Pageable pageable);

  long countByActiveTrue();
}
