package acmeca.services;

import acmeca.config.AppProperties;
import acmeca.issuance.CertificateIssuanceService;
import acmeca.issuance.CertificateRequests;
import acmeca.messages.OrderRequest;
import acmeca.model.Account;
import acmeca.model.Authorization;
import acmeca.model.AuthorizationStatus;
import acmeca.model.Challenge;
import acmeca.model.ChallengeStatus;
import acmeca.model.ChallengeType;
import acmeca.model.Identifier;
import acmeca.model.IssuedCertificate;
import acmeca.model.Order;
import acmeca.model.OrderStatus;
import acmeca.model.Problem;
import acmeca.model.ProblemType;
import acmeca.repository.AuthorizationRepository;
import acmeca.repository.ChallengeRepository;
import acmeca.repository.OrderRepository;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;
import org.bouncycastle.pkcs.PKCS10CertificationRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Order creation and finalization, see
 * <a href="https://datatracker.ietf.org/doc/html/rfc8555#section-7.4">RFC 8555 Sec 7.4</a>
 */
@Service
@Slf4j
public class OrderService {

    private static final List<OrderStatus> UNFINISHED =
        List.of(OrderStatus.PENDING, OrderStatus.READY, OrderStatus.PROCESSING);

    private final OrderRepository orderRepository;
    private final AuthorizationRepository authorizationRepository;
    private final ChallengeRepository challengeRepository;
    private final OrderStateMachine stateMachine;
    private final CertificateIssuanceService issuanceService;
    private final AppProperties appProperties;
    private final Clock clock;

    public OrderService(OrderRepository orderRepository,
        AuthorizationRepository authorizationRepository,
        ChallengeRepository challengeRepository,
        OrderStateMachine stateMachine,
        CertificateIssuanceService issuanceService,
        AppProperties appProperties,
        Clock clock
    ) {
        this.orderRepository = orderRepository;
        this.authorizationRepository = authorizationRepository;
        this.challengeRepository = challengeRepository;
        this.stateMachine = stateMachine;
        this.issuanceService = issuanceService;
        this.appProperties = appProperties;
        this.clock = clock;
    }

    /**
     * Creates the order with one pending authorization per distinct identifier, each offering the challenges its
     * identifier supports.
     */
    @Transactional
    public OrderDetails newOrder(Account account, OrderRequest request) {
        final Instant now = clock.instant();
        final List<Identifier> identifiers = normalizeIdentifiers(request.identifiers());
        checkValidityWindow(request.notBefore(), request.notAfter(), now);

        final int open = orderRepository.countByAccountAndStatus(account.id(), UNFINISHED);
        if (open >= appProperties.maxPendingOrders()) {
            log.warn("Rejecting new order for account={} with {} unfinished orders", account.id(), open);
            throw new AcmeProblemException(ProblemType.RATE_LIMITED,
                "Too many unfinished orders, at most " + appProperties.maxPendingOrders() + " are allowed");
        }

        final Instant expires = now.plus(appProperties.orderValidity());
        final Order order = Order.builder()
            .id(Ids.newId())
            .accountId(account.id())
            .status(OrderStatus.PENDING)
            .expires(expires)
            .notBefore(request.notBefore())
            .notAfter(request.notAfter())
            .createdAt(now)
            .build();
        orderRepository.insert(order);

        final List<Authorization> authorizations = new ArrayList<>();
        for (Identifier identifier : identifiers) {
            final boolean wildcard = identifier.isWildcard();
            final Authorization authorization = Authorization.builder()
                .id(Ids.newId())
                .orderId(order.id())
                .identifier(wildcard ? Identifier.dns(identifier.value().substring(2)) : identifier)
                .wildcard(wildcard)
                .status(AuthorizationStatus.PENDING)
                .expires(expires)
                .build();
            authorizationRepository.insert(authorization);
            authorizations.add(authorization);

            // http-01 cannot prove control over a whole domain, RFC 8555 Sec 7.1.3
            if (!wildcard) {
                createChallenge(authorization, ChallengeType.HTTP_01);
            }
            createChallenge(authorization, ChallengeType.DNS_01);
        }

        log.info("Created order={} for account={} identifiers={}", order.id(), account.id(),
            identifiers.stream().map(Identifier::value).toList());
        return new OrderDetails(order, authorizations);
    }

    public OrderDetails findOwned(Account account, String orderId) {
        final Order order = orderRepository.findById(orderId)
            .orElseThrow(() -> AcmeProblemException.notFound("Order " + orderId + " does not exist"));
        if (!order.accountId().equals(account.id())) {
            throw AcmeProblemException.unauthorized("Order belongs to another account");
        }
        return stateMachine.refresh(order);
    }

    public List<Order> listOrders(Account account) {
        return orderRepository.findByAccount(account.id());
    }

    /**
     * Finalizes a ready order by issuing its certificate. Repeated or concurrent finalize requests return the order as
     * it is once one of them moved it to processing.
     *
     * @param csr base64url DER of the CSR
     */
    public OrderDetails finalizeOrder(Account account, String orderId, String csr) {
        final OrderDetails details = findOwned(account, orderId);
        final Order order = details.order();

        switch (order.status()) {
            case VALID, PROCESSING -> {
                log.debug("Order={} is already {}, finalize is a no-op", order.id(), order.status().value());
                return details;
            }
            case READY -> log.debug("Finalizing order={}", order.id());
            default -> throw new AcmeProblemException(ProblemType.ORDER_NOT_READY,
                "Order is " + order.status().value() + ", not ready");
        }

        final PKCS10CertificationRequest request = CertificateRequests.decode(csr);

        if (!stateMachine.beginProcessing(order)) {
            final Order current = stateMachine.reload(order.id());
            if (current.status() == OrderStatus.PROCESSING || current.status() == OrderStatus.VALID) {
                log.debug("Lost finalize race for order={}, now {}", order.id(), current.status().value());
                return new OrderDetails(current, details.authorizations());
            }
            throw new AcmeProblemException(ProblemType.ORDER_NOT_READY,
                "Order is " + current.status().value() + ", not ready");
        }

        try {
            stateMachine.requireAuthorizationsValid(order);
            final List<String> names = details.identifiers().stream()
                .map(Identifier::value)
                .toList();
            final IssuedCertificate certificate = issuanceService.issue(order, names, request);
            stateMachine.completeIssuance(order, certificate.serial());
        } catch (AcmeProblemException e) {
            stateMachine.failIssuance(order, e.toProblem());
            throw e;
        } catch (RuntimeException e) {
            log.error("Issuance failed for order={}", order.id(), e);
            stateMachine.failIssuance(order, Problem.of(ProblemType.SERVER_INTERNAL, "Certificate issuance failed"));
            throw new AcmeProblemException(ProblemType.SERVER_INTERNAL, "Certificate issuance failed", e);
        }

        return new OrderDetails(stateMachine.reload(order.id()), details.authorizations());
    }

    private void createChallenge(Authorization authorization, ChallengeType type) {
        challengeRepository.insert(Challenge.builder()
            .id(Ids.newId())
            .authorizationId(authorization.id())
            .type(type)
            .token(Ids.newToken())
            .status(ChallengeStatus.PENDING)
            .build());
    }

    List<Identifier> normalizeIdentifiers(List<Identifier> requested) {
        if (requested == null || requested.isEmpty()) {
            throw AcmeProblemException.malformed("At least one identifier is required");
        }
        final Set<Identifier> distinct = new LinkedHashSet<>();
        for (Identifier identifier : requested) {
            if (identifier == null || !Identifier.TYPE_DNS.equals(identifier.type())) {
                throw new AcmeProblemException(ProblemType.REJECTED_IDENTIFIER,
                    "Unsupported identifier type " + (identifier == null ? null : identifier.type()));
            }
            final Identifier normalized = identifier.normalized();
            final String host = normalized.isWildcard() ? normalized.value().substring(2) : normalized.value();
            if (!Hostnames.isValid(host)) {
                throw new AcmeProblemException(ProblemType.REJECTED_IDENTIFIER,
                    "Invalid DNS name " + identifier.value());
            }
            if (Hostnames.isWithin(host, appProperties.blockedDomains())) {
                throw new AcmeProblemException(ProblemType.REJECTED_IDENTIFIER,
                    "Issuance for " + identifier.value() + " is not allowed");
            }
            distinct.add(normalized);
        }
        return List.copyOf(distinct);
    }

    private void checkValidityWindow(Instant notBefore, Instant notAfter, Instant now) {
        if (notBefore != null && notBefore.isBefore(now)) {
            throw AcmeProblemException.malformed("notBefore must not be in the past");
        }
        if (notAfter != null) {
            if (!notAfter.isAfter(notBefore != null ? notBefore : now)) {
                throw AcmeProblemException.malformed("notAfter must be after notBefore and in the future");
            }
            if (notAfter.isAfter(now.plus(appProperties.issuance().maxValidity()))) {
                throw AcmeProblemException.malformed("notAfter exceeds the maximum certificate lifetime of "
                    + appProperties.issuance().maxValidity().toDays() + " days");
            }
        }
    }
}
