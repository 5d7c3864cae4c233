package com.example.inventorytasks.service.plugin;

import com.example.inventorytasks.service.startup.InitializationContext;
import com.example.inventorytasks.service.startup.StoreState;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("PluginBootstrap Tests")
class PluginBootstrapTest {

    @Mock
    private PluginRegistry pluginRegistry;

    private MaintenanceMode maintenanceMode;
    private PluginBootstrap bootstrap;

    @BeforeEach
    void setUp() {
        maintenanceMode = new MaintenanceMode();
        bootstrap = new PluginBootstrap(pluginRegistry, maintenanceMode);
    }

    private static InitializationContext.InitializationContextBuilder contextBuilder() {
        return InitializationContext.builder().storeState(StoreState.READY).pluginsEnabled(true);
    }

    @Test
    @DisplayName("Should collect then load plugins and leave maintenance mode")
    void shouldCollectThenLoad() {
        // Given
        var context = contextBuilder().build();
        var maintenanceDuringLoad = new AtomicBoolean();
        doAnswer(inv -> {
            maintenanceDuringLoad.set(maintenanceMode.isEnabled());
            return null;
        }).when(pluginRegistry).loadPlugins();
        when(pluginRegistry.getActivePlugins()).thenReturn(List.of("barcode"));

        // When
        var loaded = bootstrap.loadPlugins(context);

        // Then
        assertThat(loaded).isTrue();
        InOrder inOrder = inOrder(pluginRegistry);
        inOrder.verify(pluginRegistry).collectPlugins();
        inOrder.verify(pluginRegistry).loadPlugins();
        assertThat(maintenanceDuringLoad).isTrue();
        assertThat(maintenanceMode.isEnabled()).isFalse();
        assertThat(context.isPluginLoadInProgress()).isFalse();
    }

    @Test
    @DisplayName("Should skip plugin loading while importing data")
    void shouldSkipWhileImporting() {
        var context = contextBuilder().importingData(true).build();

        assertThat(bootstrap.loadPlugins(context)).isFalse();
        verifyNoInteractions(pluginRegistry);
    }

    @Test
    @DisplayName("Should do nothing when plugins are disabled")
    void shouldSkipWhenDisabled() {
        var context = contextBuilder().pluginsEnabled(false).build();

        assertThat(bootstrap.loadPlugins(context)).isFalse();
        verifyNoInteractions(pluginRegistry);
    }

    @Test
    @DisplayName("Should ignore a nested load for the same context")
    void shouldIgnoreNestedLoad() {
        // Given
        var context = contextBuilder().build();
        var nestedResult = new AtomicBoolean(true);
        doAnswer(inv -> {
            assertThat(context.isPluginLoadInProgress()).isTrue();
            nestedResult.set(bootstrap.loadPlugins(context));
            return null;
        }).when(pluginRegistry).collectPlugins();

        // When
        var loaded = bootstrap.loadPlugins(context);

        // Then
        assertThat(loaded).isTrue();
        assertThat(nestedResult).isFalse();
        verify(pluginRegistry, times(1)).collectPlugins();
        verify(pluginRegistry, times(1)).loadPlugins();
    }

    @Test
    @DisplayName("Should stay in maintenance mode when loading fails")
    void shouldStayInMaintenanceOnFailure() {
        // Given
        var context = contextBuilder().build();
        doThrow(new IllegalStateException("broken plugin")).when(pluginRegistry).loadPlugins();

        // When
        var loaded = bootstrap.loadPlugins(context);

        // Then
        assertThat(loaded).isFalse();
        assertThat(maintenanceMode.isEnabled()).isTrue();
        assertThat(context.isPluginLoadInProgress()).isFalse();
    }
}
