package com.yourapp.habits.habit_ledger.service;

import com.yourapp.habits.habit_ledger.model.Habit;
import com.yourapp.habits.habit_ledger.model.Schedule;

import java.time.LocalDate;

/**
 * Sends a habit's daily prompt to its owner on the messaging platform.
 */
public interface PromptDelivery {

    /**
     * @param promptDate the local date the prompt asks about
     * @return true once the platform accepted the message, false if it refused it
     * @throws com.yourapp.habits.habit_ledger.exception.DeliveryFailureException on transport errors
     */
    boolean deliver(Habit habit, Schedule schedule, LocalDate promptDate);
}
