package com.yourapp.habits.habit_ledger.service;

import com.yourapp.habits.habit_ledger.model.Habit;
import com.yourapp.habits.habit_ledger.model.Schedule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

import java.time.LocalDate;

// Used when no messaging platform is configured
@Service
@ConditionalOnProperty(prefix = "telegram", name = "enabled", havingValue = "false", matchIfMissing = true)
public class LoggingPromptDelivery implements PromptDelivery {
    private static final Logger logger = LoggerFactory.getLogger(LoggingPromptDelivery.class);

    @Override
    public boolean deliver(Habit habit, Schedule schedule, LocalDate promptDate) {
        logger.info("Prompt for owner {}: did you complete '{}' on {}? (schedule {} at {})",
            habit.getOwnerId(), habit.getName(), promptDate, schedule.getId(), schedule.getTimeOfDay());
        return true;
    }
}
