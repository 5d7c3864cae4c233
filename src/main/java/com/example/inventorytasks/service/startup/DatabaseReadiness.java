package com.example.inventorytasks.service.startup;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import javax.sql.DataSource;
import java.sql.SQLException;

/**
 * Tells "store unreachable" and "schema not created yet" apart from a ready store.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class DatabaseReadiness {

    static final String MARKER_TABLE = "scheduled_jobs";

    private static final int VALIDATION_TIMEOUT_SECONDS = 5;

    private final DataSource dataSource;

    public StoreState check() {
        try (var connection = dataSource.getConnection()) {
            if (!connection.isValid(VALIDATION_TIMEOUT_SECONDS)) {
                log.info("Database connection is not valid");
                return StoreState.UNREACHABLE;
            }
            try (var tables = connection.getMetaData().getTables(null, null, MARKER_TABLE, new String[]{"TABLE"})) {
                if (!tables.next()) {
                    log.info("Table {} does not exist yet", MARKER_TABLE);
                    return StoreState.NOT_PROVISIONED;
                }
            }
            return StoreState.READY;
        } catch (SQLException e) {
            log.info("Database not reachable: {}", e.getMessage());
            return StoreState.UNREACHABLE;
        }
    }
}
