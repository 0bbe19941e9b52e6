package acmeca.messages;

import acmeca.model.Problem;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonInclude.Include;
import java.net.URI;
import java.time.Instant;
import lombok.Builder;

@Builder
@JsonInclude(Include.NON_NULL)
public record ChallengeResponse(
    String type,
    URI url,
    String status,
    String token,
    Instant validated,
    Problem error
) {

}
