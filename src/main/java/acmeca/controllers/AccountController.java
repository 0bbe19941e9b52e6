package acmeca.controllers;

import acmeca.jws.AuthenticatedRequest;
import acmeca.jws.KeyMode;
import acmeca.jws.RequestAuthenticator;
import acmeca.messages.AccountRequest;
import acmeca.messages.AccountResponse;
import acmeca.messages.OrderListResponse;
import acmeca.model.Account;
import acmeca.model.AccountStatus;
import acmeca.model.Order;
import acmeca.services.AccountService;
import acmeca.services.AccountService.Registration;
import acmeca.services.AcmeProblemException;
import acmeca.services.AcmeUrls;
import acmeca.services.OrderService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.server.reactive.ServerHttpRequest;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

@RestController
@Slf4j
public class AccountController extends AcmeControllerSupport {

    private final AccountService accountService;
    private final OrderService orderService;
    private final AcmeResponses acmeResponses;
    private final AcmeUrls acmeUrls;

    public AccountController(RequestAuthenticator authenticator, AccountService accountService,
        OrderService orderService, AcmeResponses acmeResponses, AcmeUrls acmeUrls
    ) {
        super(authenticator);
        this.accountService = accountService;
        this.orderService = orderService;
        this.acmeResponses = acmeResponses;
        this.acmeUrls = acmeUrls;
    }

    @PostMapping(value = "/new-account", consumes = RequestAuthenticator.JOSE_JSON_VALUE,
        produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<ResponseEntity<AccountResponse>> newAccount(ServerHttpRequest request, @RequestBody byte[] body) {
        return authenticated(request, body, KeyMode.JWK, authenticated -> {
            final AccountRequest payload = authenticator.readPayload(authenticated, AccountRequest.class);
            final Registration registration = accountService.register(authenticated.jwk(), payload);
            final Account account = registration.account();
            log.debug("Account id={} created={}", account.id(), registration.created());
            return ResponseEntity.status(registration.created() ? HttpStatus.CREATED : HttpStatus.OK)
                .location(acmeUrls.account(account.id()))
                .body(acmeResponses.account(account));
        });
    }

    @PostMapping(value = AcmeUrls.ACCOUNT_PATH + "{accountId}", consumes = RequestAuthenticator.JOSE_JSON_VALUE,
        produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<AccountResponse> account(ServerHttpRequest request, @RequestBody byte[] body,
        @PathVariable String accountId
    ) {
        return authenticated(request, body, KeyMode.KID, authenticated -> {
            final Account account = requireSameAccount(authenticated, accountId);
            if (authenticated.isPostAsGet()) {
                return acmeResponses.account(account);
            }

            final AccountRequest payload = authenticator.readPayload(authenticated, AccountRequest.class);
            if (payload.status() != null) {
                if (!AccountStatus.DEACTIVATED.value().equals(payload.status())) {
                    throw AcmeProblemException.malformed("Accounts can only be updated to status deactivated");
                }
                log.info("Deactivating account id={}", account.id());
                return acmeResponses.account(accountService.deactivate(account));
            }
            if (payload.contact() != null) {
                return acmeResponses.account(accountService.updateContacts(account, payload.contact()));
            }
            return acmeResponses.account(account);
        });
    }

    @PostMapping(value = AcmeUrls.ACCOUNT_PATH + "{accountId}/orders", consumes = RequestAuthenticator.JOSE_JSON_VALUE,
        produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<OrderListResponse> orders(ServerHttpRequest request, @RequestBody byte[] body,
        @PathVariable String accountId
    ) {
        return authenticated(request, body, KeyMode.KID, authenticated -> {
            final Account account = requireSameAccount(authenticated, accountId);
            return new OrderListResponse(
                orderService.listOrders(account).stream()
                    .map(Order::id)
                    .map(acmeUrls::order)
                    .toList()
            );
        });
    }

    private static Account requireSameAccount(AuthenticatedRequest authenticated, String accountId) {
        final Account account = authenticated.account();
        if (account == null || !account.id().equals(accountId)) {
            throw AcmeProblemException.unauthorized("Requests may only address the signing account");
        }
        return account;
    }
}
