package com.yourapp.habits.habit_ledger.repository;

import com.yourapp.habits.habit_ledger.model.CompletionRecord;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

public interface CompletionRecordRepository extends JpaRepository<CompletionRecord, Long> {

    Optional<CompletionRecord> findByHabitIdAndRecordDate(Long habitId, LocalDate recordDate);

    // Full history of a habit, oldest first
    List<CompletionRecord> findByHabitIdOrderByRecordDateAsc(Long habitId);

    List<CompletionRecord> findByHabitIdAndRecordDateBetweenOrderByRecordDateAsc(
        Long habitId, LocalDate start, LocalDate end);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("DELETE FROM CompletionRecord c WHERE c.habit.id = :habitId")
    void deleteByHabitId(@Param("habitId") Long habitId);
}
