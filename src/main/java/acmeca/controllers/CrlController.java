package acmeca.controllers;

import acmeca.model.CrlRecord;
import acmeca.revocation.CrlService;
import org.springframework.http.CacheControl;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * Publishes the latest CRL produced by the cache-crls job.
 */
@RestController
public class CrlController {

    public static final String PKIX_CRL = "application/pkix-crl";

    private final CrlService crlService;

    public CrlController(CrlService crlService) {
        this.crlService = crlService;
    }

    @GetMapping("/crl")
    public Mono<ResponseEntity<byte[]>> crl() {
        return Mono.fromCallable(crlService::currentCrl)
            .subscribeOn(Schedulers.boundedElastic())
            .map(this::toResponse);
    }

    private ResponseEntity<byte[]> toResponse(CrlRecord crl) {
        return ResponseEntity.ok()
            .contentType(MediaType.parseMediaType(PKIX_CRL))
            .lastModified(crl.thisUpdate())
            .cacheControl(CacheControl.noCache())
            .body(crl.der());
    }
}
