package acmeca.controllers;

import acmeca.jws.AuthenticatedRequest;
import acmeca.jws.KeyMode;
import acmeca.jws.RequestAuthenticator;
import java.util.concurrent.Callable;
import org.springframework.http.server.reactive.ServerHttpRequest;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * Common plumbing of the ACME resource controllers: JWS authentication and offloading of blocking datastore work.
 */
abstract class AcmeControllerSupport {

    public static final String PEM_CERTIFICATE_CHAIN = "application/pem-certificate-chain";

    protected final RequestAuthenticator authenticator;

    protected AcmeControllerSupport(RequestAuthenticator authenticator) {
        this.authenticator = authenticator;
    }

    /**
     * Authenticates the request and runs the work with its outcome, both on a thread that may block.
     */
    protected <T> Mono<T> authenticated(ServerHttpRequest request, byte[] body, KeyMode keyMode,
        AuthenticatedWork<T> work
    ) {
        final String path = request.getPath().pathWithinApplication().value();
        return blocking(() -> work.apply(authenticator.authenticate(body, path, keyMode)));
    }

    protected static <T> Mono<T> blocking(Callable<T> work) {
        return Mono.fromCallable(work)
            .subscribeOn(Schedulers.boundedElastic());
    }

    @FunctionalInterface
    protected interface AuthenticatedWork<T> {

        T apply(AuthenticatedRequest request);
    }
}
