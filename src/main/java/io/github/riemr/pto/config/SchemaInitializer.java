package io.github.riemr.pto.config;

import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.JdbcTemplate;

@Configuration
@RequiredArgsConstructor
@Slf4j
public class SchemaInitializer {
    private final JdbcTemplate jdbc;

    @PostConstruct
    public void ensureTables() {
        try {
            jdbc.execute("CREATE TABLE IF NOT EXISTS ledger_settings (" +
                    "user_id VARCHAR(64) PRIMARY KEY, " +
                    "initial_balance NUMERIC(10,3), " +
                    "as_of_date DATE, " +
                    "carry_over_limit NUMERIC(10,3), " +
                    "renewal_date DATE, " +
                    "max_balance NUMERIC(10,3), " +
                    "allow_negative_balance BOOLEAN, " +
                    "display_unit VARCHAR(8), " +
                    "hours_per_day NUMERIC(5,2), " +
                    "updated_at TIMESTAMP" +
                    ")");
            jdbc.execute("CREATE TABLE IF NOT EXISTS accrual_rule (" +
                    "rule_id BIGINT GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY, " +
                    "user_id VARCHAR(64) NOT NULL, " +
                    "name VARCHAR(100), " +
                    "amount NUMERIC(10,3) NOT NULL, " +
                    "frequency VARCHAR(16) NOT NULL, " +
                    "anchor_day SMALLINT, " +
                    "effective_date DATE NOT NULL, " +
                    "end_date DATE, " +
                    "is_active BOOLEAN NOT NULL DEFAULT TRUE" +
                    ")");
            jdbc.execute("CREATE INDEX IF NOT EXISTS idx_accrual_rule_user ON accrual_rule(user_id)");

            jdbc.execute("CREATE TABLE IF NOT EXISTS taken_day (" +
                    "taken_day_id BIGINT GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY, " +
                    "user_id VARCHAR(64) NOT NULL, " +
                    "day_date DATE NOT NULL, " +
                    "status VARCHAR(16) NOT NULL DEFAULT 'PLANNED', " +
                    "description TEXT, " +
                    "UNIQUE (user_id, day_date)" +
                    ")");

            jdbc.execute("CREATE TABLE IF NOT EXISTS holiday (" +
                    "holiday_id BIGINT GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY, " +
                    "user_id VARCHAR(64) NOT NULL, " +
                    "name VARCHAR(200) NOT NULL, " +
                    "holiday_date DATE NOT NULL, " +
                    "repeats_yearly BOOLEAN NOT NULL DEFAULT FALSE, " +
                    "is_paid BOOLEAN NOT NULL DEFAULT TRUE, " +
                    "country_code VARCHAR(8)" +
                    ")");
            jdbc.execute("CREATE INDEX IF NOT EXISTS idx_holiday_user_date ON holiday(user_id, holiday_date)");

            jdbc.execute("CREATE TABLE IF NOT EXISTS suggestion_preferences (" +
                    "user_id VARCHAR(64) PRIMARY KEY, " +
                    "earliest_start DATE NOT NULL, " +
                    "latest_end DATE NOT NULL, " +
                    "min_pto_to_keep NUMERIC(10,3) NOT NULL, " +
                    "min_consecutive_days_off INT NOT NULL, " +
                    "max_consecutive_days_off INT NOT NULL, " +
                    "min_spacing_between_breaks INT NOT NULL, " +
                    "ranking_mode VARCHAR(16) NOT NULL, " +
                    "extend_existing_pto BOOLEAN NOT NULL DEFAULT TRUE" +
                    ")");

            // 0 = Sunday .. 6 = Saturday, comma separated
            jdbc.execute("CREATE TABLE IF NOT EXISTS weekend_config (" +
                    "user_id VARCHAR(64) PRIMARY KEY, " +
                    "weekend_days VARCHAR(32) NOT NULL" +
                    ")");

            log.info("Schema checked/initialized: ledger, accrual, taken day, holiday, preference and weekend tables ensured.");
        } catch (Exception e) {
            log.warn("Schema initialization failed: {}", e.getMessage());
        }
    }
}
