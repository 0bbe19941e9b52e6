package acmeca.validation;

import java.util.List;
import reactor.core.publisher.Mono;

/**
 * Looks up DNS TXT records for dns-01 validation.
 */
public interface TxtRecordResolver {

    /**
     * @return the TXT record values at the name, each with its character strings concatenated. Empty if there are none.
     */
    Mono<List<String>> resolveTxt(String name);
}
