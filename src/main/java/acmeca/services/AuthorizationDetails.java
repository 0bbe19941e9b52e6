package acmeca.services;

import acmeca.model.Authorization;
import acmeca.model.Challenge;
import java.util.List;

public record AuthorizationDetails(
    Authorization authorization,
    List<Challenge> challenges
) {

}
