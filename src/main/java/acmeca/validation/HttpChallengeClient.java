package acmeca.validation;

import java.net.URI;
import reactor.core.publisher.Mono;

/**
 * Fetches http-01 resources from the host being validated.
 */
public interface HttpChallengeClient {

    /**
     * @return the status and body of the response; connection level failures are signalled as errors
     */
    Mono<HttpChallengeResponse> fetch(URI uri);

    record HttpChallengeResponse(
        int status,
        byte[] body
    ) {

    }
}
