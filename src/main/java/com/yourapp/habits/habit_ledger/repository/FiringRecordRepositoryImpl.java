package com.yourapp.habits.habit_ledger.repository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.sql.Date;
import java.sql.Timestamp;
import java.time.Instant;
import java.time.LocalDate;

/**
 * Conditional insert for firing records. Runs as a plain JDBC statement so a uniqueness
 * violation never marks a surrounding JPA transaction rollback-only.
 */
@Repository
public class FiringRecordRepositoryImpl implements FiringRecordRepositoryCustom {
    private static final Logger logger = LoggerFactory.getLogger(FiringRecordRepositoryImpl.class);

    private static final String INSERT_SQL =
        "INSERT INTO firing_record (schedule_id, fired_date, claimed_at) VALUES (?, ?, ?)";
    private static final String COUNT_SQL =
        "SELECT COUNT(*) FROM firing_record WHERE schedule_id = ? AND fired_date = ?";

    private final JdbcTemplate jdbcTemplate;

    public FiringRecordRepositoryImpl(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    public boolean insertIfAbsent(Long scheduleId, LocalDate firedDate, Instant claimedAt) {
        try {
            int rows = jdbcTemplate.update(INSERT_SQL,
                scheduleId, Date.valueOf(firedDate), Timestamp.from(claimedAt));
            return rows == 1;
        } catch (DataIntegrityViolationException e) {
            // DuplicateKeyException on most drivers; anything else (e.g. a missing schedule) propagates
            Integer existing = jdbcTemplate.queryForObject(COUNT_SQL, Integer.class,
                scheduleId, Date.valueOf(firedDate));
            if (existing != null && existing > 0) {
                logger.debug("Firing record for schedule {} on {} already exists", scheduleId, firedDate);
                return false;
            }
            throw e;
        }
    }
}
