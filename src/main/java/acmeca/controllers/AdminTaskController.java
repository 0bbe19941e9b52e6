package acmeca.controllers;

import acmeca.housekeeping.HousekeepingJobs;
import acmeca.housekeeping.HousekeepingJobs.Job;
import acmeca.messages.AdminTaskResponse;
import acmeca.services.AcmeProblemException;
import java.time.Clock;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * Lets an external scheduler trigger the housekeeping jobs. The reverse proxy is expected to restrict access to the
 * admin prefix.
 */
@RestController
@ConditionalOnProperty(prefix = "acme.housekeeping", name = "admin-endpoint", havingValue = "true",
    matchIfMissing = true)
@Slf4j
public class AdminTaskController {

    private final HousekeepingJobs housekeepingJobs;
    private final Clock clock;

    public AdminTaskController(HousekeepingJobs housekeepingJobs, Clock clock) {
        this.housekeepingJobs = housekeepingJobs;
        this.clock = clock;
    }

    @PostMapping(value = "/admin/tasks/{name}", produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<AdminTaskResponse> runTask(@PathVariable String name) {
        final Job job = Job.byName(name)
            .orElseThrow(() -> AcmeProblemException.notFound("Unknown task " + name));
        log.info("Running task={} on request", job.jobName());
        return Mono.fromCallable(() -> housekeepingJobs.run(job, clock.instant()))
            .subscribeOn(Schedulers.boundedElastic())
            .map(result -> new AdminTaskResponse(job.jobName(), result));
    }
}
