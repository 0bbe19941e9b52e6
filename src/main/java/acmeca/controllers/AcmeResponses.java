package acmeca.controllers;

import acmeca.config.AppProperties;
import acmeca.messages.AccountResponse;
import acmeca.messages.AuthzResponse;
import acmeca.messages.ChallengeResponse;
import acmeca.messages.DirectoryResponse;
import acmeca.messages.OrderResponse;
import acmeca.model.Account;
import acmeca.model.Authorization;
import acmeca.model.Challenge;
import acmeca.model.Order;
import acmeca.model.OrderStatus;
import acmeca.services.AcmeUrls;
import acmeca.services.AuthorizationDetails;
import acmeca.services.OrderDetails;
import java.util.Comparator;
import org.springframework.stereotype.Component;

/**
 * Renders domain objects as the resource representations of RFC 8555 Sec 7.1.
 */
@Component
public class AcmeResponses {

    private final AcmeUrls acmeUrls;
    private final AppProperties appProperties;

    public AcmeResponses(AcmeUrls acmeUrls, AppProperties appProperties) {
        this.acmeUrls = acmeUrls;
        this.appProperties = appProperties;
    }

    public DirectoryResponse directory() {
        return DirectoryResponse.builder()
            .newNonce(acmeUrls.newNonce())
            .newAccount(acmeUrls.newAccount())
            .newOrder(acmeUrls.newOrder())
            .revokeCert(acmeUrls.revokeCert())
            .meta(DirectoryResponse.Meta.builder()
                .termsOfService(appProperties.termsOfService())
                .website(appProperties.website())
                .caaIdentities(appProperties.caaIdentities())
                .build())
            .build();
    }

    public AccountResponse account(Account account) {
        return AccountResponse.builder()
            .status(account.status().value())
            .contact(account.contacts())
            .termsOfServiceAgreed(account.termsOfServiceAgreed() ? Boolean.TRUE : null)
            .orders(acmeUrls.accountOrders(account.id()))
            .build();
    }

    public OrderResponse order(OrderDetails details) {
        final Order order = details.order();
        return OrderResponse.builder()
            .status(order.status().value())
            .expires(order.expires())
            .identifiers(details.identifiers())
            .notBefore(order.notBefore())
            .notAfter(order.notAfter())
            .error(order.error())
            .authorizations(details.authorizations().stream()
                .map(authorization -> acmeUrls.authorization(authorization.id()))
                .toList())
            .finalizeUri(acmeUrls.finalizeOrder(order.id()))
            .certificate(order.status() == OrderStatus.VALID && order.certificateSerial() != null ?
                acmeUrls.certificate(order.certificateSerial()) : null)
            .build();
    }

    public AuthzResponse authorization(AuthorizationDetails details) {
        final Authorization authorization = details.authorization();
        return AuthzResponse.builder()
            .identifier(authorization.identifier())
            .status(authorization.status().value())
            .expires(authorization.expires())
            .challenges(details.challenges().stream()
                .sorted(Comparator.comparing(Challenge::type))
                .map(this::challenge)
                .toList())
            .wildcard(authorization.wildcard() ? Boolean.TRUE : null)
            .build();
    }

    public ChallengeResponse challenge(Challenge challenge) {
        return ChallengeResponse.builder()
            .type(challenge.type().value())
            .url(acmeUrls.challenge(challenge.id()))
            .status(challenge.status().value())
            .token(challenge.token())
            .validated(challenge.validated())
            .error(challenge.error())
            .build();
    }
}
