package acmeca.controllers;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestMethod;
import org.springframework.web.bind.annotation.RestController;

/**
 * <a href="https://datatracker.ietf.org/doc/html/rfc8555#section-7.2">Getting a Nonce</a>. The nonce itself is
 * added by {@link AcmeResponseHeadersFilter} like on every other ACME response.
 */
@RestController
@RequestMapping("/new-nonce")
public class NonceController {

    @RequestMapping(method = RequestMethod.HEAD)
    public ResponseEntity<Void> headNonce() {
        return ResponseEntity.ok().build();
    }

    @GetMapping
    public ResponseEntity<Void> getNonce() {
        return ResponseEntity.status(HttpStatus.NO_CONTENT).build();
    }
}
