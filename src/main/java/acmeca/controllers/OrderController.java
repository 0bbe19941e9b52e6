package acmeca.controllers;

import acmeca.jws.AuthenticatedRequest;
import acmeca.jws.KeyMode;
import acmeca.jws.RequestAuthenticator;
import acmeca.messages.FinalizeRequest;
import acmeca.messages.OrderRequest;
import acmeca.messages.OrderResponse;
import acmeca.model.Account;
import acmeca.model.OrderStatus;
import acmeca.services.AcmeProblemException;
import acmeca.services.AcmeUrls;
import acmeca.services.OrderDetails;
import acmeca.services.OrderService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
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
public class OrderController extends AcmeControllerSupport {

    /**
     * Seconds a client is asked to wait before polling an order that is still processing.
     */
    static final String PROCESSING_RETRY_AFTER = "1";

    private final OrderService orderService;
    private final AcmeResponses acmeResponses;
    private final AcmeUrls acmeUrls;

    public OrderController(RequestAuthenticator authenticator, OrderService orderService, AcmeResponses acmeResponses,
        AcmeUrls acmeUrls
    ) {
        super(authenticator);
        this.orderService = orderService;
        this.acmeResponses = acmeResponses;
        this.acmeUrls = acmeUrls;
    }

    @PostMapping(value = "/new-order", consumes = RequestAuthenticator.JOSE_JSON_VALUE,
        produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<ResponseEntity<OrderResponse>> newOrder(ServerHttpRequest request, @RequestBody byte[] body) {
        return authenticated(request, body, KeyMode.KID, authenticated -> {
            final OrderRequest payload = authenticator.readPayload(authenticated, OrderRequest.class);
            final OrderDetails details = orderService.newOrder(account(authenticated), payload);
            log.debug("Created order id={} identifiers={}", details.order().id(), details.identifiers());
            return ResponseEntity.status(HttpStatus.CREATED)
                .location(acmeUrls.order(details.order().id()))
                .body(acmeResponses.order(details));
        });
    }

    /**
     * POST-as-GET of an order. A payload carrying a CSR is treated like a request to the finalize URL.
     */
    @PostMapping(value = AcmeUrls.ORDER_PATH + "{orderId}", consumes = RequestAuthenticator.JOSE_JSON_VALUE,
        produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<ResponseEntity<OrderResponse>> order(ServerHttpRequest request, @RequestBody byte[] body,
        @PathVariable String orderId
    ) {
        return authenticated(request, body, KeyMode.KID, authenticated -> {
            if (authenticated.isPostAsGet()) {
                return respond(orderService.findOwned(account(authenticated), orderId));
            }
            return finalizeOrder(authenticated, orderId);
        });
    }

    @PostMapping(value = AcmeUrls.ORDER_PATH + "{orderId}/finalize", consumes = RequestAuthenticator.JOSE_JSON_VALUE,
        produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<ResponseEntity<OrderResponse>> finalizeOrder(ServerHttpRequest request, @RequestBody byte[] body,
        @PathVariable String orderId
    ) {
        return authenticated(request, body, KeyMode.KID, authenticated -> finalizeOrder(authenticated, orderId));
    }

    private ResponseEntity<OrderResponse> finalizeOrder(AuthenticatedRequest authenticated, String orderId) {
        final FinalizeRequest payload = authenticator.readPayload(authenticated, FinalizeRequest.class);
        if (payload.csr() == null || payload.csr().isBlank()) {
            throw AcmeProblemException.malformed("Missing csr");
        }
        log.debug("Finalizing order id={}", orderId);
        return respond(orderService.finalizeOrder(account(authenticated), orderId, payload.csr()));
    }

    private ResponseEntity<OrderResponse> respond(OrderDetails details) {
        final ResponseEntity.BodyBuilder response = ResponseEntity.ok()
            .location(acmeUrls.order(details.order().id()));
        if (details.order().status() == OrderStatus.PROCESSING) {
            response.header(HttpHeaders.RETRY_AFTER, PROCESSING_RETRY_AFTER);
        }
        return response.body(acmeResponses.order(details));
    }

    private static Account account(AuthenticatedRequest authenticated) {
        return authenticated.account();
    }
}
