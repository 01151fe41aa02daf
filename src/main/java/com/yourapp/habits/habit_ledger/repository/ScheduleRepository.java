package com.yourapp.habits.habit_ledger.repository;

import com.yourapp.habits.habit_ledger.model.Schedule;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.LocalTime;
import java.util.List;
import java.util.Optional;

public interface ScheduleRepository extends JpaRepository<Schedule, Long> {

    // Active schedules with their habit loaded, in dispatch order
    @Query("SELECT s FROM Schedule s JOIN FETCH s.habit h WHERE s.active = true " +
           "ORDER BY h.id ASC, s.timeOfDay ASC, s.id ASC")
    List<Schedule> findActiveWithHabit();

    @Query("SELECT s FROM Schedule s JOIN FETCH s.habit WHERE s.id = :id")
    Optional<Schedule> findByIdWithHabit(@Param("id") Long id);

    List<Schedule> findByHabitIdOrderByTimeOfDayAsc(Long habitId);

    @Query("SELECT s FROM Schedule s JOIN FETCH s.habit h WHERE h.ownerId = :ownerId AND s.active = true " +
           "ORDER BY s.timeOfDay ASC, h.name ASC")
    List<Schedule> findActiveByOwner(@Param("ownerId") Long ownerId);

    boolean existsByHabitIdAndTimeOfDayAndActiveTrue(Long habitId, LocalTime timeOfDay);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("DELETE FROM Schedule s WHERE s.habit.id = :habitId")
    void deleteByHabitId(@Param("habitId") Long habitId);
}
