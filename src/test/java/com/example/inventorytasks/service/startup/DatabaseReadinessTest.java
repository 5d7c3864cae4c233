package com.example.inventorytasks.service.startup;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Answers;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("DatabaseReadiness Tests")
class DatabaseReadinessTest {

    @Mock
    private DataSource dataSource;

    @Mock(answer = Answers.RETURNS_DEEP_STUBS)
    private Connection connection;

    @Mock
    private ResultSet tables;

    @Test
    @DisplayName("Should report ready when the job table exists")
    void shouldReportReady() throws SQLException {
        // Given
        when(dataSource.getConnection()).thenReturn(connection);
        when(connection.isValid(anyInt())).thenReturn(true);
        when(connection.getMetaData().getTables(isNull(), isNull(), eq("scheduled_jobs"), any())).thenReturn(tables);
        when(tables.next()).thenReturn(true);

        // When / Then
        assertThat(new DatabaseReadiness(dataSource).check()).isEqualTo(StoreState.READY);
    }

    @Test
    @DisplayName("Should report not provisioned when the job table is missing")
    void shouldReportNotProvisioned() throws SQLException {
        // Given
        when(dataSource.getConnection()).thenReturn(connection);
        when(connection.isValid(anyInt())).thenReturn(true);
        when(connection.getMetaData().getTables(isNull(), isNull(), eq("scheduled_jobs"), any())).thenReturn(tables);
        when(tables.next()).thenReturn(false);

        // When / Then
        assertThat(new DatabaseReadiness(dataSource).check()).isEqualTo(StoreState.NOT_PROVISIONED);
    }

    @Test
    @DisplayName("Should report unreachable when no connection can be obtained")
    void shouldReportUnreachable() throws SQLException {
        // Given
        when(dataSource.getConnection()).thenThrow(new SQLException("Connection refused"));

        // When / Then
        assertThat(new DatabaseReadiness(dataSource).check()).isEqualTo(StoreState.UNREACHABLE);
    }
}
