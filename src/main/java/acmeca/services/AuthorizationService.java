package acmeca.services;

import acmeca.model.Account;
import acmeca.model.Authorization;
import acmeca.model.Order;
import acmeca.repository.AuthorizationRepository;
import acmeca.repository.ChallengeRepository;
import acmeca.repository.OrderRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * <a href="https://datatracker.ietf.org/doc/html/rfc8555#section-7.5">RFC 8555 Sec 7.5</a>
 */
@Service
@Slf4j
public class AuthorizationService {

    private final AuthorizationRepository authorizationRepository;
    private final ChallengeRepository challengeRepository;
    private final OrderRepository orderRepository;
    private final OrderStateMachine stateMachine;

    public AuthorizationService(AuthorizationRepository authorizationRepository,
        ChallengeRepository challengeRepository,
        OrderRepository orderRepository,
        OrderStateMachine stateMachine
    ) {
        this.authorizationRepository = authorizationRepository;
        this.challengeRepository = challengeRepository;
        this.orderRepository = orderRepository;
        this.stateMachine = stateMachine;
    }

    public AuthorizationDetails findOwned(Account account, String authorizationId) {
        final Authorization authorization = stateMachine.refresh(loadOwned(account, authorizationId));
        return new AuthorizationDetails(authorization, challengeRepository.findByAuthorization(authorization.id()));
    }

    public AuthorizationDetails deactivate(Account account, String authorizationId) {
        final Authorization authorization = stateMachine.deactivate(
            stateMachine.refresh(loadOwned(account, authorizationId)));
        return new AuthorizationDetails(authorization, challengeRepository.findByAuthorization(authorization.id()));
    }

    /**
     * Loads the authorization after checking that it belongs to an order of the given account.
     */
    Authorization loadOwned(Account account, String authorizationId) {
        final Authorization authorization = authorizationRepository.findById(authorizationId)
            .orElseThrow(() -> AcmeProblemException.notFound("Authorization " + authorizationId + " does not exist"));
        final Order order = orderRepository.findById(authorization.orderId())
            .orElseThrow(() -> AcmeProblemException.notFound("Authorization " + authorizationId + " does not exist"));
        if (!order.accountId().equals(account.id())) {
            log.debug("Account={} tried to access authorization={} of account={}",
                account.id(), authorizationId, order.accountId());
            throw AcmeProblemException.unauthorized("Authorization belongs to another account");
        }
        return authorization;
    }
}
