package com.unifiedplatform.backend.health;

import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.env.Environment;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

/**
 * Probes the backing store for the diagnostics page: whether it answers, and which collections it holds.
 */
@Component
public class StoreDiagnostics {

    static final int MAX_LISTED_TABLES = 20;
    // the datasource url has a local default, so only the deployment variable tells whether one was supplied
    static final String DATABASE_URL_VARIABLE = "DATABASE_URL";

    private static final Logger log = LoggerFactory.getLogger(StoreDiagnostics.class);

    private final JdbcTemplate jdbcTemplate;
    private final Environment environment;

    public StoreDiagnostics(JdbcTemplate jdbcTemplate, Environment environment) {
        this.jdbcTemplate = jdbcTemplate;
        this.environment = environment;
    }

    public Probe probe() {
        boolean urlConfigured = StringUtils.hasText(environment.getProperty(DATABASE_URL_VARIABLE));
        try {
            List<String> tables = jdbcTemplate.queryForList("""
                    select table_name from information_schema.tables
                     where table_schema = current_schema() and table_type = 'BASE TABLE'
                     order by table_name
                     limit ?
                    """, String.class, MAX_LISTED_TABLES);
            return new Probe(true, urlConfigured, tables, null);
        } catch (DataAccessException ex) {
            log.warn("Store diagnostics failed: {}", ex.getMessage());
            return new Probe(false, urlConfigured, List.of(), abbreviate(ex.getMostSpecificCause().getMessage()));
        }
    }

    private static String abbreviate(String message) {
        if (message == null) {
            return null;
        }
        return message.length() <= 100 ? message : message.substring(0, 100);
    }

    public record Probe(boolean connected, boolean urlConfigured, List<String> tables, String error) {
    }
}
