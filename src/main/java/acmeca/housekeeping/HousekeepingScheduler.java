package acmeca.housekeeping;

import acmeca.config.AppProperties;
import acmeca.housekeeping.HousekeepingJobs.Job;
import java.time.Clock;
import java.time.Duration;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;

/**
 * In-process timers for single node deployments. Everything else triggers the jobs externally.
 */
@Component
@ConditionalOnProperty(prefix = "acme.housekeeping", name = "enabled", havingValue = "true")
@Slf4j
public class HousekeepingScheduler {

    private final HousekeepingJobs jobs;
    private final TaskScheduler taskScheduler;
    private final AppProperties appProperties;
    private final Clock clock;

    public HousekeepingScheduler(HousekeepingJobs jobs,
        TaskScheduler taskScheduler,
        AppProperties appProperties,
        Clock clock
    ) {
        this.jobs = jobs;
        this.taskScheduler = taskScheduler;
        this.appProperties = appProperties;
        this.clock = clock;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void scheduleJobs() {
        final AppProperties.Housekeeping housekeeping = appProperties.housekeeping();
        schedule(Job.GENERATE_OCSP_KEYS, housekeeping.ocspKeyInterval());
        schedule(Job.CACHE_CRLS, housekeeping.crlInterval());
        schedule(Job.ACME_CLEANUP, housekeeping.cleanupInterval());
    }

    private void schedule(Job job, Duration interval) {
        log.info("Scheduling job={} every {}", job.jobName(), interval);
        taskScheduler.scheduleWithFixedDelay(() -> {
            try {
                final String summary = jobs.run(job, clock.instant());
                log.debug("Completed job={} {}", job.jobName(), summary);
            } catch (RuntimeException e) {
                log.error("Job={} failed", job.jobName(), e);
            }
        }, interval);
    }
}
