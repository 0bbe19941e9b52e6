package acmeca.housekeeping;

import acmeca.revocation.CrlService;
import acmeca.revocation.OcspKeyService;
import java.time.Instant;
import java.util.Arrays;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * The periodic jobs by name. Each is a function of the current time and the datastore, so running one again or
 * concurrently with itself has no further effect.
 */
@Service
@Slf4j
public class HousekeepingJobs {

    public enum Job {
        CACHE_CRLS("cache-crls"),
        GENERATE_OCSP_KEYS("generate-ocsp-keys"),
        ACME_CLEANUP("acme-cleanup");

        private final String jobName;

        Job(String jobName) {
            this.jobName = jobName;
        }

        public String jobName() {
            return jobName;
        }

        public static Optional<Job> byName(String name) {
            return Arrays.stream(values())
                .filter(job -> job.jobName.equals(name))
                .findFirst();
        }
    }

    private final CrlService crlService;
    private final OcspKeyService ocspKeyService;
    private final AcmeCleanupService cleanupService;

    public HousekeepingJobs(CrlService crlService,
        OcspKeyService ocspKeyService,
        AcmeCleanupService cleanupService
    ) {
        this.crlService = crlService;
        this.ocspKeyService = ocspKeyService;
        this.cleanupService = cleanupService;
    }

    /**
     * @return a short summary of what the job did
     */
    public String run(Job job, Instant now) {
        log.debug("Running job={} now={}", job.jobName(), now);
        return switch (job) {
            case CACHE_CRLS -> "crlNumber=" + crlService.cacheCrl(now).crlNumber();
            case GENERATE_OCSP_KEYS -> ocspKeyService.generateKeys(now)
                .map(key -> "generated generation=" + key.generation())
                .orElse("unchanged");
            case ACME_CLEANUP -> {
                final AcmeCleanupService.CleanupResult result = cleanupService.cleanup(now);
                yield "nonces=" + result.nonces() + " orders=" + result.orders();
            }
        };
    }
}
