package villagecompute.adstudio.jobs;

import io.quarkus.scheduler.Scheduled;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import villagecompute.adstudio.observability.LoggingConfig;
import villagecompute.adstudio.services.GenerationJobService;

/**
 * Scheduled sweep that fails generation jobs whose provider never called back.
 *
 * <p>
 * Without it a lost webhook leaves a job {@code pending} forever and its queue entry inflates the queue depth gauge.
 * The threshold is {@code adstudio.generation.pending-timeout}; the interval is
 * {@code adstudio.generation.sweep-interval}.
 */
@ApplicationScoped
public class StalePendingJobSweepScheduler {

    private static final Logger LOG = Logger.getLogger(StalePendingJobSweepScheduler.class);

    @Inject
    GenerationJobService generationJobService;

    @Scheduled(
            identity = "stale-pending-generation-sweep",
            every = "{adstudio.generation.sweep-interval}",
            concurrentExecution = Scheduled.ConcurrentExecution.SKIP)
    public void sweep() {
        LoggingConfig.enrichWithTraceContext();
        LoggingConfig.setRequestOrigin("StalePendingJobSweep");
        try {
            LOG.debug("Running stale pending generation sweep");
            generationJobService.expireStalePendingJobs();
        } finally {
            LoggingConfig.clearMDC();
        }
    }
}
