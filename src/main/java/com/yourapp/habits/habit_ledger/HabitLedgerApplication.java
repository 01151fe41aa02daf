package com.yourapp.habits.habit_ledger;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class HabitLedgerApplication {

    public static void main(String[] args) {
        SpringApplication.run(HabitLedgerApplication.class, args);
    }

}
