package acmeca.services;

import acmeca.model.Authorization;
import acmeca.model.AuthorizationStatus;
import acmeca.model.Challenge;
import acmeca.model.Order;
import acmeca.model.OrderStatus;
import acmeca.model.Problem;
import acmeca.model.ProblemType;
import acmeca.repository.AuthorizationRepository;
import acmeca.repository.ChallengeRepository;
import acmeca.repository.OrderRepository;
import acmeca.validation.ValidationResult;
import acmeca.validation.ValidationTarget;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Drives orders, authorizations and challenges through the status transitions of
 * <a href="https://datatracker.ietf.org/doc/html/rfc8555#section-7.1.6">RFC 8555 Sec 7.1.6</a>.
 * <p>
 * Every transition is a conditional update on the current status, so concurrent requests, validation callbacks and
 * housekeeping may race freely: exactly one of them applies a given transition and the others observe its result.
 * Expiry is evaluated lazily whenever a resource is read.
 */
@Service
@Slf4j
public class OrderStateMachine {

    private static final List<OrderStatus> OPEN_ORDER = List.of(OrderStatus.PENDING, OrderStatus.READY);
    private static final List<AuthorizationStatus> EXPIRABLE_AUTHZ =
        List.of(AuthorizationStatus.PENDING, AuthorizationStatus.VALID);
    private static final List<AuthorizationStatus> DEACTIVATABLE_AUTHZ =
        List.of(AuthorizationStatus.PENDING, AuthorizationStatus.VALID);

    private final OrderRepository orderRepository;
    private final AuthorizationRepository authorizationRepository;
    private final ChallengeRepository challengeRepository;
    private final Clock clock;

    public OrderStateMachine(OrderRepository orderRepository,
        AuthorizationRepository authorizationRepository,
        ChallengeRepository challengeRepository,
        Clock clock
    ) {
        this.orderRepository = orderRepository;
        this.authorizationRepository = authorizationRepository;
        this.challengeRepository = challengeRepository;
        this.clock = clock;
    }

    /**
     * Applies expiry and the outcome of the order's authorizations, then returns the current state.
     */
    public OrderDetails refresh(Order order) {
        final Instant now = clock.instant();

        final List<Authorization> authorizations = authorizationRepository.findByOrder(order.id()).stream()
            .map(authorization -> expireIfDue(authorization, now))
            .toList();

        if (order.status() == OrderStatus.PENDING || order.status() == OrderStatus.READY) {
            if (order.isExpired(now)) {
                invalidateOrder(order.id(), Problem.of(ProblemType.MALFORMED, "Order expired at " + order.expires()));
            }
            else {
                final Optional<Authorization> failed = authorizations.stream()
                    .filter(authorization -> authorization.status().isFailed())
                    .findFirst();
                if (failed.isPresent()) {
                    invalidateOrder(order.id(), problemOf(failed.get()));
                }
                else if (order.status() == OrderStatus.PENDING && allValid(authorizations)) {
                    if (orderRepository.compareAndSetStatus(order.id(), OrderStatus.PENDING, OrderStatus.READY)) {
                        log.debug("All authorizations valid, order={} is ready", order.id());
                    }
                }
            }
        }

        return new OrderDetails(reload(order.id()), authorizations);
    }

    /**
     * Expires the authorization if due and propagates a failed authorization to its order.
     */
    public Authorization refresh(Authorization authorization) {
        final Authorization current = expireIfDue(authorization, clock.instant());
        if (current.status().isFailed()) {
            invalidateOrder(current.orderId(), problemOf(current));
        }
        return current;
    }

    /**
     * Writes the outcome of a challenge validation back to the challenge, its authorization and order.
     */
    public void recordValidation(ValidationTarget target, ValidationResult result) {
        if (result.valid()) {
            if (!challengeRepository.markValid(target.challengeId(), clock.instant())) {
                log.warn("Challenge={} was no longer processing when validation succeeded", target.challengeId());
                return;
            }
            if (authorizationRepository.compareAndSetStatus(target.authorizationId(),
                AuthorizationStatus.PENDING, AuthorizationStatus.VALID)) {
                log.info("Validated authorization={} for host={} via {}",
                    target.authorizationId(), target.hostname(), target.type().value());
            }
        }
        else {
            if (!challengeRepository.markInvalid(target.challengeId(), result.problem())) {
                log.warn("Challenge={} was no longer processing when validation failed", target.challengeId());
                return;
            }
            if (authorizationRepository.compareAndSetStatus(target.authorizationId(),
                AuthorizationStatus.PENDING, AuthorizationStatus.INVALID)) {
                log.info("Authorization={} for host={} failed validation: {}",
                    target.authorizationId(), target.hostname(), result.problem().detail());
            }
        }
        orderRepository.findById(target.orderId())
            .ifPresent(this::refresh);
    }

    /**
     * Client initiated deactivation, see RFC 8555 Sec 7.5.2. The order can no longer become valid.
     *
     * @return the authorization as it is after the attempt
     */
    public Authorization deactivate(Authorization authorization) {
        if (authorizationRepository.compareAndSetStatus(authorization.id(), DEACTIVATABLE_AUTHZ,
            AuthorizationStatus.DEACTIVATED)) {
            log.info("Deactivated authorization={}", authorization.id());
            invalidateOrder(authorization.orderId(),
                Problem.of(ProblemType.UNAUTHORIZED, "Authorization for " + authorization.identifier().value()
                    + " was deactivated"));
        }
        return authorizationRepository.findById(authorization.id())
            .orElseThrow(() -> AcmeProblemException.notFound("Authorization no longer exists"));
    }

    /**
     * @return true when this caller moved the order from ready to processing
     */
    public boolean beginProcessing(Order order) {
        return orderRepository.compareAndSetStatus(order.id(), OrderStatus.READY, OrderStatus.PROCESSING);
    }

    /**
     * Re-checks that every authorization of the order is still valid before a certificate is signed for it.
     */
    public void requireAuthorizationsValid(Order order) {
        final Instant now = clock.instant();
        final List<Authorization> authorizations = authorizationRepository.findByOrder(order.id());
        for (Authorization authorization : authorizations) {
            if (authorization.status() != AuthorizationStatus.VALID || authorization.isExpired(now)) {
                throw AcmeProblemException.unauthorized("Authorization for " + authorization.identifier().value()
                    + " is no longer valid");
            }
        }
    }

    public boolean completeIssuance(Order order, String certificateSerial) {
        final boolean completed = orderRepository.markValid(order.id(), certificateSerial);
        if (completed) {
            log.info("Order={} is valid with certificate serial={}", order.id(), certificateSerial);
        }
        else {
            log.warn("Order={} was no longer processing when certificate serial={} was issued",
                order.id(), certificateSerial);
        }
        return completed;
    }

    public void failIssuance(Order order, Problem problem) {
        if (orderRepository.markInvalid(order.id(), List.of(OrderStatus.PROCESSING), problem)) {
            log.info("Issuance for order={} failed: {}", order.id(), problem.detail());
        }
    }

    public Order reload(String orderId) {
        return orderRepository.findById(orderId)
            .orElseThrow(() -> AcmeProblemException.notFound("Order " + orderId + " does not exist"));
    }

    private Authorization expireIfDue(Authorization authorization, Instant now) {
        if (EXPIRABLE_AUTHZ.contains(authorization.status()) && authorization.isExpired(now)) {
            // a pending authorization that ran out of time failed; a valid one simply lapsed
            final AuthorizationStatus target = authorization.status() == AuthorizationStatus.PENDING
                ? AuthorizationStatus.INVALID : AuthorizationStatus.EXPIRED;
            if (authorizationRepository.compareAndSetStatus(authorization.id(), authorization.status(), target)) {
                log.debug("Authorization={} is {} after expiring at {}",
                    authorization.id(), target.value(), authorization.expires());
            }
            return authorizationRepository.findById(authorization.id()).orElse(authorization);
        }
        return authorization;
    }

    private void invalidateOrder(String orderId, Problem problem) {
        if (orderRepository.markInvalid(orderId, OPEN_ORDER, problem)) {
            log.info("Order={} is invalid: {}", orderId, problem.detail());
        }
    }

    private Problem problemOf(Authorization authorization) {
        if (authorization.status() == AuthorizationStatus.INVALID && authorization.selectedChallengeId() != null) {
            final Problem challengeError = challengeRepository.findById(authorization.selectedChallengeId())
                .map(Challenge::error)
                .orElse(null);
            if (challengeError != null) {
                return challengeError;
            }
        }
        return Problem.of(ProblemType.UNAUTHORIZED,
            "Authorization for " + authorization.identifier().value() + " is " + authorization.status().value());
    }

    private static boolean allValid(List<Authorization> authorizations) {
        return !authorizations.isEmpty() && authorizations.stream()
            .allMatch(authorization -> authorization.status() == AuthorizationStatus.VALID);
    }
}
