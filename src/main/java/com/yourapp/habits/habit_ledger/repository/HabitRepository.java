package com.yourapp.habits.habit_ledger.repository;

import com.yourapp.habits.habit_ledger.model.Habit;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.Optional;

public interface HabitRepository extends JpaRepository<Habit, Long> {

    // Habits of one user, alphabetically
    List<Habit> findByOwnerIdOrderByNameAsc(Long ownerId);

    Optional<Habit> findByIdAndOwnerId(Long id, Long ownerId);
}
