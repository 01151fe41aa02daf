package db.migration;

import org.flywaydb.core.api.migration.BaseJavaMigration;
import org.flywaydb.core.api.migration.Context;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.SingleConnectionDataSource;

/**
 * Creates the habit, schedule, firing_record and completion_record tables.
 */
public class V1__CreateLedgerTables extends BaseJavaMigration {

    @Override
    public void migrate(Context context) throws Exception {
        final JdbcTemplate jdbcTemplate = new JdbcTemplate(
            new SingleConnectionDataSource(context.getConnection(), true)
        );

        jdbcTemplate.execute("""
            CREATE TABLE habit (
                id BIGINT AUTO_INCREMENT PRIMARY KEY,
                owner_id BIGINT NOT NULL,
                name VARCHAR(255) NOT NULL,
                description VARCHAR(1000),
                time_zone VARCHAR(64) NOT NULL,
                created_at TIMESTAMP(6) NOT NULL
            )
        """);

        jdbcTemplate.execute("""
            CREATE TABLE schedule (
                id BIGINT AUTO_INCREMENT PRIMARY KEY,
                habit_id BIGINT NOT NULL,
                time_of_day TIME NOT NULL,
                time_zone VARCHAR(64) NOT NULL,
                active BOOLEAN DEFAULT TRUE NOT NULL,
                created_at TIMESTAMP(6) NOT NULL,
                CONSTRAINT fk_schedule_habit FOREIGN KEY (habit_id) REFERENCES habit (id) ON DELETE CASCADE
            )
        """);

        jdbcTemplate.execute("""
            CREATE TABLE firing_record (
                id BIGINT AUTO_INCREMENT PRIMARY KEY,
                schedule_id BIGINT NOT NULL,
                fired_date DATE NOT NULL,
                claimed_at TIMESTAMP(6) NOT NULL,
                delivered_at TIMESTAMP(6) NULL,
                CONSTRAINT uk_firing_schedule_date UNIQUE (schedule_id, fired_date),
                CONSTRAINT fk_firing_schedule FOREIGN KEY (schedule_id) REFERENCES schedule (id) ON DELETE CASCADE
            )
        """);

        jdbcTemplate.execute("""
            CREATE TABLE completion_record (
                id BIGINT AUTO_INCREMENT PRIMARY KEY,
                habit_id BIGINT NOT NULL,
                record_date DATE NOT NULL,
                outcome VARCHAR(16) NOT NULL,
                recorded_at TIMESTAMP(6) NOT NULL,
                CONSTRAINT uk_completion_habit_date UNIQUE (habit_id, record_date),
                CONSTRAINT fk_completion_habit FOREIGN KEY (habit_id) REFERENCES habit (id) ON DELETE CASCADE
            )
        """);

        jdbcTemplate.execute("CREATE INDEX idx_schedule_habit_active ON schedule (habit_id, active)");
        jdbcTemplate.execute("CREATE INDEX idx_firing_claimed ON firing_record (delivered_at, claimed_at)");
    }
}
