package me.golemcore.runtime.auto;

import me.golemcore.runtime.domain.model.OperationException;
import me.golemcore.runtime.domain.service.CronService;
import me.golemcore.runtime.infrastructure.config.RuntimeProperties;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class CronSchedulerTest {

    private CronService cronService;
    private RuntimeProperties properties;
    private CronScheduler scheduler;

    @BeforeEach
    void setUp() {
        cronService = mock(CronService.class);
        properties = new RuntimeProperties();
        scheduler = new CronScheduler(cronService, properties);
    }

    @AfterEach
    void tearDown() {
        scheduler.shutdown();
    }

    @Test
    void init_doesNothingWhenBackgroundDisabled() {
        properties.setBackgroundEnabled(false);

        scheduler.init();

        assertFalse(scheduler.isRunning());
        verifyNoInteractions(cronService);
    }

    @Test
    void init_doesNothingWhenCronDisabled() {
        properties.getCron().setEnabled(false);

        scheduler.init();

        assertFalse(scheduler.isRunning());
    }

    @Test
    void init_firesDueJobsImmediately() {
        when(cronService.fireDueJobs()).thenReturn(List.of());

        scheduler.init();

        assertTrue(scheduler.isRunning());
        verify(cronService, timeout(2000).atLeastOnce()).fireDueJobs();
    }

    @Test
    void tick_survivesServiceFailure() {
        when(cronService.fireDueJobs())
                .thenThrow(OperationException.infrastructure("store corrupt", null))
                .thenReturn(List.of());

        assertDoesNotThrow(() -> scheduler.tick());
        assertDoesNotThrow(() -> scheduler.tick());

        verify(cronService, times(2)).fireDueJobs();
    }
}
