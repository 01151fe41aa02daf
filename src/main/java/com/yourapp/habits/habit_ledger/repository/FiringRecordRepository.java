package com.yourapp.habits.habit_ledger.repository;

import com.yourapp.habits.habit_ledger.model.FiringRecord;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

public interface FiringRecordRepository extends JpaRepository<FiringRecord, Long>, FiringRecordRepositoryCustom {

    boolean existsByScheduleIdAndFiredDate(Long scheduleId, LocalDate firedDate);

    Optional<FiringRecord> findByScheduleIdAndFiredDate(Long scheduleId, LocalDate firedDate);

    @Query("SELECT f.firedDate FROM FiringRecord f WHERE f.schedule.id = :scheduleId " +
           "AND f.firedDate BETWEEN :start AND :end ORDER BY f.firedDate ASC")
    List<LocalDate> findFiredDates(@Param("scheduleId") Long scheduleId,
                                   @Param("start") LocalDate start,
                                   @Param("end") LocalDate end);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE FiringRecord f SET f.deliveredAt = :deliveredAt " +
           "WHERE f.schedule.id = :scheduleId AND f.firedDate = :firedDate AND f.deliveredAt IS NULL")
    int markDelivered(@Param("scheduleId") Long scheduleId,
                      @Param("firedDate") LocalDate firedDate,
                      @Param("deliveredAt") Instant deliveredAt);

    // Only unconfirmed claims can be released; a delivered record is permanent
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("DELETE FROM FiringRecord f WHERE f.schedule.id = :scheduleId AND f.firedDate = :firedDate " +
           "AND f.deliveredAt IS NULL")
    int deleteUndelivered(@Param("scheduleId") Long scheduleId, @Param("firedDate") LocalDate firedDate);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("DELETE FROM FiringRecord f WHERE f.deliveredAt IS NULL AND f.claimedAt < :cutoff")
    int deleteUndeliveredClaimedBefore(@Param("cutoff") Instant cutoff);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("DELETE FROM FiringRecord f WHERE f.schedule.id IN " +
           "(SELECT s.id FROM Schedule s WHERE s.habit.id = :habitId)")
    void deleteByHabitId(@Param("habitId") Long habitId);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("DELETE FROM FiringRecord f WHERE f.schedule.id = :scheduleId")
    void deleteByScheduleId(@Param("scheduleId") Long scheduleId);
}
