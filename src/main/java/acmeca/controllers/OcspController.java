package acmeca.controllers;

import acmeca.revocation.OcspResponderService;
import java.util.Base64;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * OCSP over HTTP, <a href="https://datatracker.ietf.org/doc/html/rfc6960#appendix-A.1">RFC 6960 Appendix A.1</a>.
 * Every answer is a 200 carrying an OCSPResponse, errors included.
 */
@RestController
@Slf4j
public class OcspController {

    public static final String OCSP_REQUEST = "application/ocsp-request";
    public static final String OCSP_RESPONSE = "application/ocsp-response";

    private static final byte[] EMPTY = new byte[0];

    private final OcspResponderService responderService;

    public OcspController(OcspResponderService responderService) {
        this.responderService = responderService;
    }

    @PostMapping(value = "/ocsp", consumes = OCSP_REQUEST)
    public Mono<ResponseEntity<byte[]>> post(@RequestBody byte[] body) {
        return respond(body);
    }

    /**
     * The request is the base64 encoding of the DER request. Standard base64 may contain slashes, so the path variable
     * captures the whole remainder.
     */
    @GetMapping("/ocsp/{*encoded}")
    public Mono<ResponseEntity<byte[]>> get(@PathVariable String encoded) {
        return respond(decode(encoded));
    }

    static byte[] decode(String encoded) {
        final String value = encoded.startsWith("/") ? encoded.substring(1) : encoded;
        try {
            return Base64.getDecoder().decode(value.replace('-', '+').replace('_', '/'));
        } catch (IllegalArgumentException e) {
            log.debug("Invalid base64 in OCSP GET request: {}", e.getMessage());
            // answered as a malformed request
            return EMPTY;
        }
    }

    private Mono<ResponseEntity<byte[]>> respond(byte[] request) {
        return Mono.fromCallable(() -> responderService.respond(request))
            .subscribeOn(Schedulers.boundedElastic())
            .map(response -> ResponseEntity.ok()
                .contentType(MediaType.parseMediaType(OCSP_RESPONSE))
                .body(response));
    }
}
