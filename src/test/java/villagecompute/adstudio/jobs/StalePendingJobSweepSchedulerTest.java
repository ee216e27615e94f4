package villagecompute.adstudio.jobs;

import org.jboss.logging.MDC;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;
import villagecompute.adstudio.observability.LoggingConfig;
import villagecompute.adstudio.services.GenerationJobService;

import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Unit tests for {@link StalePendingJobSweepScheduler}.
 */
class StalePendingJobSweepSchedulerTest {

    @Mock
    GenerationJobService generationJobService;

    @InjectMocks
    StalePendingJobSweepScheduler scheduler;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
    }

    @Test
    void testSweepDelegatesToService() {
        when(generationJobService.expireStalePendingJobs()).thenReturn(2);

        scheduler.sweep();

        verify(generationJobService, times(1)).expireStalePendingJobs();
        assertNull(MDC.get(LoggingConfig.MDC_REQUEST_ORIGIN));
    }

    @Test
    void testSweepClearsMdcWhenServiceFails() {
        when(generationJobService.expireStalePendingJobs()).thenThrow(new IllegalStateException("db down"));

        assertThrows(IllegalStateException.class, () -> scheduler.sweep());
        assertNull(MDC.get(LoggingConfig.MDC_REQUEST_ORIGIN));
    }
}
