package acmeca.services;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import acmeca.messages.OrderRequest;
import acmeca.model.Account;
import acmeca.model.Authorization;
import acmeca.model.AuthorizationStatus;
import acmeca.model.Challenge;
import acmeca.model.ChallengeType;
import acmeca.model.Identifier;
import acmeca.model.OrderStatus;
import acmeca.model.ProblemType;
import acmeca.repository.AuthorizationRepository;
import acmeca.repository.ChallengeRepository;
import acmeca.support.TestAccounts;
import acmeca.support.TestCsrs;
import acmeca.support.TestKeys;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.HttpStatus;
import org.springframework.jdbc.core.simple.JdbcClient;

@SpringBootTest(properties = {
    "spring.datasource.url=jdbc:h2:mem:order-service;DB_CLOSE_DELAY=-1",
    "acme.max-pending-orders=3"
})
class OrderServiceTest {

    @Autowired
    OrderService orderService;

    @Autowired
    AccountService accountService;

    @Autowired
    AuthorizationRepository authorizationRepository;

    @Autowired
    ChallengeRepository challengeRepository;

    @Autowired
    JdbcClient jdbcClient;

    @Test
    void newOrderCreatesAuthorizationPerDistinctIdentifier() {
        final Account account = TestAccounts.register(accountService);

        final OrderDetails details = orderService.newOrder(account, request(
            "WWW.Example.test", "*.example.test", "www.example.test"));

        assertThat(details.order().status()).isEqualTo(OrderStatus.PENDING);
        assertThat(details.identifiers())
            .containsExactlyInAnyOrder(Identifier.dns("www.example.test"), Identifier.dns("*.example.test"));
        assertThat(details.authorizations()).hasSize(2);

        final Authorization wildcard = details.authorizations().stream()
            .filter(Authorization::wildcard)
            .findFirst().orElseThrow();
        assertThat(wildcard.identifier().value()).isEqualTo("example.test");
        assertThat(challengeTypes(wildcard)).containsExactly(ChallengeType.DNS_01);

        final Authorization plain = details.authorizations().stream()
            .filter(authorization -> !authorization.wildcard())
            .findFirst().orElseThrow();
        assertThat(challengeTypes(plain)).containsExactlyInAnyOrder(ChallengeType.HTTP_01, ChallengeType.DNS_01);
        assertThat(plain.expires()).isEqualTo(details.order().expires());
    }

    @Test
    void rejectsUnsupportedIdentifiers() {
        final Account account = TestAccounts.register(accountService);

        assertThatThrownBy(() -> orderService.newOrder(account, OrderRequest.builder()
            .identifiers(List.of(new Identifier("ip", "192.0.2.1")))
            .build()))
            .isInstanceOf(AcmeProblemException.class)
            .extracting("type").isEqualTo(ProblemType.REJECTED_IDENTIFIER);
        assertThatThrownBy(() -> orderService.newOrder(account, request("host.blocked.test")))
            .isInstanceOf(AcmeProblemException.class)
            .extracting("type").isEqualTo(ProblemType.REJECTED_IDENTIFIER);
        assertThatThrownBy(() -> orderService.newOrder(account, request("not_a_hostname.test")))
            .isInstanceOf(AcmeProblemException.class)
            .extracting("type").isEqualTo(ProblemType.REJECTED_IDENTIFIER);
        assertThatThrownBy(() -> orderService.newOrder(account, OrderRequest.builder().identifiers(List.of()).build()))
            .isInstanceOf(AcmeProblemException.class)
            .extracting("type").isEqualTo(ProblemType.MALFORMED);
    }

    @Test
    void rejectsValidityWindowInThePast() {
        final Account account = TestAccounts.register(accountService);

        assertThatThrownBy(() -> orderService.newOrder(account, OrderRequest.builder()
            .identifiers(List.of(Identifier.dns("past.example.test")))
            .notBefore(Instant.now().minus(1, ChronoUnit.DAYS))
            .build()))
            .isInstanceOf(AcmeProblemException.class)
            .extracting("type").isEqualTo(ProblemType.MALFORMED);
    }

    @Test
    void limitsUnfinishedOrdersPerAccount() {
        final Account account = TestAccounts.register(accountService);
        for (int i = 0; i < 3; i++) {
            orderService.newOrder(account, request("limit" + i + ".example.test"));
        }

        assertThatThrownBy(() -> orderService.newOrder(account, request("limit3.example.test")))
            .isInstanceOf(AcmeProblemException.class)
            .extracting("type").isEqualTo(ProblemType.RATE_LIMITED);
    }

    @Test
    void ordersAreOnlyVisibleToTheirAccount() {
        final Account owner = TestAccounts.register(accountService);
        final Account other = TestAccounts.register(accountService);
        final String orderId = orderService.newOrder(owner, request("mine.example.test")).order().id();

        assertThatThrownBy(() -> orderService.findOwned(other, orderId))
            .isInstanceOf(AcmeProblemException.class)
            .extracting("type").isEqualTo(ProblemType.UNAUTHORIZED);
        assertThatThrownBy(() -> orderService.findOwned(owner, "no-such-order"))
            .isInstanceOf(AcmeProblemException.class)
            .extracting("status").isEqualTo(HttpStatus.NOT_FOUND);
        assertThat(orderService.listOrders(owner)).extracting("id").containsExactly(orderId);
    }

    @Test
    void orderBecomesReadyOnceAllAuthorizationsAreValid() {
        final Account account = TestAccounts.register(accountService);
        final OrderDetails details = orderService.newOrder(account, request("a.example.test", "b.example.test"));

        final Authorization first = details.authorizations().get(0);
        authorizationRepository.compareAndSetStatus(first.id(), AuthorizationStatus.PENDING, AuthorizationStatus.VALID);
        assertThat(orderService.findOwned(account, details.order().id()).order().status())
            .isEqualTo(OrderStatus.PENDING);

        final Authorization second = details.authorizations().get(1);
        authorizationRepository.compareAndSetStatus(second.id(), AuthorizationStatus.PENDING, AuthorizationStatus.VALID);
        assertThat(orderService.findOwned(account, details.order().id()).order().status())
            .isEqualTo(OrderStatus.READY);
    }

    @Test
    void failedAuthorizationInvalidatesOrder() {
        final Account account = TestAccounts.register(accountService);
        final OrderDetails details = orderService.newOrder(account, request("fail.example.test"));

        authorizationRepository.compareAndSetStatus(details.authorizations().get(0).id(),
            AuthorizationStatus.PENDING, AuthorizationStatus.INVALID);

        final OrderDetails refreshed = orderService.findOwned(account, details.order().id());
        assertThat(refreshed.order().status()).isEqualTo(OrderStatus.INVALID);
        assertThat(refreshed.order().error()).isNotNull();
    }

    @Test
    void overduePendingAuthorizationBecomesInvalid() {
        final Account account = TestAccounts.register(accountService);
        final OrderDetails details = orderService.newOrder(account, request("overdue.example.test"));
        final Authorization authorization = details.authorizations().get(0);
        backdate(authorization.id());

        final OrderDetails refreshed = orderService.findOwned(account, details.order().id());

        assertThat(authorizationRepository.findById(authorization.id()).orElseThrow().status())
            .isEqualTo(AuthorizationStatus.INVALID);
        assertThat(refreshed.order().status()).isEqualTo(OrderStatus.INVALID);
    }

    @Test
    void overdueValidAuthorizationExpires() {
        final Account account = TestAccounts.register(accountService);
        final OrderDetails details = orderService.newOrder(account, request("lapsed.example.test", "b.lapsed.example.test"));
        final Authorization authorization = details.authorizations().get(0);
        authorizationRepository.compareAndSetStatus(authorization.id(),
            AuthorizationStatus.PENDING, AuthorizationStatus.VALID);
        backdate(authorization.id());

        final OrderDetails refreshed = orderService.findOwned(account, details.order().id());

        assertThat(authorizationRepository.findById(authorization.id()).orElseThrow().status())
            .isEqualTo(AuthorizationStatus.EXPIRED);
        assertThat(refreshed.order().status()).isEqualTo(OrderStatus.INVALID);
    }

    @Test
    void finalizeOfPendingOrderChangesNothing() {
        final Account account = TestAccounts.register(accountService);
        final OrderDetails details = orderService.newOrder(account, request("pending.example.test"));
        final String csr = TestCsrs.encode(TestCsrs.csr(TestKeys.rsaKeyPair(2048), "pending.example.test",
            List.of("pending.example.test")));

        assertThatThrownBy(() -> orderService.finalizeOrder(account, details.order().id(), csr))
            .isInstanceOf(AcmeProblemException.class)
            .extracting("type").isEqualTo(ProblemType.ORDER_NOT_READY);

        assertThat(orderService.findOwned(account, details.order().id()).order().status())
            .isEqualTo(OrderStatus.PENDING);
        assertThat(certificateCount(details.order().id())).isZero();
    }

    @Test
    void finalizeIssuesCertificate() {
        final Account account = TestAccounts.register(accountService);
        final String orderId = readyOrder(account, "issue.example.test", "www.issue.example.test");
        final String csr = TestCsrs.encode(TestCsrs.csr(TestKeys.ecKeyPair("secp256r1"), null,
            List.of("www.issue.example.test", "ISSUE.example.test")));

        final OrderDetails finalized = orderService.finalizeOrder(account, orderId, csr);

        assertThat(finalized.order().status()).isEqualTo(OrderStatus.VALID);
        assertThat(finalized.order().certificateSerial()).isNotBlank();
        assertThat(certificateCount(orderId)).isEqualTo(1);

        // finalizing again is a no-op
        assertThat(orderService.finalizeOrder(account, orderId, csr).order().certificateSerial())
            .isEqualTo(finalized.order().certificateSerial());
    }

    @Test
    void concurrentFinalizeIssuesOnce() throws Exception {
        final Account account = TestAccounts.register(accountService);
        final String orderId = readyOrder(account, "race.example.test");
        final String csr = TestCsrs.encode(TestCsrs.csr(TestKeys.rsaKeyPair(2048), "race.example.test",
            List.of("race.example.test")));

        final int threads = 4;
        final CountDownLatch start = new CountDownLatch(1);
        final ExecutorService executor = Executors.newFixedThreadPool(threads);
        try {
            final List<Future<OrderDetails>> results = new ArrayList<>();
            for (int i = 0; i < threads; i++) {
                results.add(executor.submit(() -> {
                    start.await();
                    return orderService.finalizeOrder(account, orderId, csr);
                }));
            }
            start.countDown();
            for (Future<OrderDetails> result : results) {
                assertThat(result.get().order().status()).isIn(OrderStatus.PROCESSING, OrderStatus.VALID);
            }
        } finally {
            executor.shutdownNow();
        }

        assertThat(certificateCount(orderId)).isEqualTo(1);
        assertThat(orderService.findOwned(account, orderId).order().status()).isEqualTo(OrderStatus.VALID);
    }

    @Test
    void csrNameMismatchInvalidatesOrder() {
        final Account account = TestAccounts.register(accountService);
        final String orderId = readyOrder(account, "match.example.test");
        final String csr = TestCsrs.encode(TestCsrs.csr(TestKeys.rsaKeyPair(2048), "other.example.test",
            List.of("match.example.test", "other.example.test")));

        assertThatThrownBy(() -> orderService.finalizeOrder(account, orderId, csr))
            .isInstanceOf(AcmeProblemException.class)
            .extracting("type").isEqualTo(ProblemType.BAD_CSR);

        final OrderDetails details = orderService.findOwned(account, orderId);
        assertThat(details.order().status()).isEqualTo(OrderStatus.INVALID);
        assertThat(details.order().error().type()).isEqualTo(ProblemType.BAD_CSR.urn());
        assertThat(certificateCount(orderId)).isZero();
    }

    @Test
    void unparseableCsrLeavesOrderReady() {
        final Account account = TestAccounts.register(accountService);
        final String orderId = readyOrder(account, "garbage.example.test");

        assertThatThrownBy(() -> orderService.finalizeOrder(account, orderId, "bm90IGEgY3Ny"))
            .isInstanceOf(AcmeProblemException.class)
            .extracting("type").isEqualTo(ProblemType.BAD_CSR);

        assertThat(orderService.findOwned(account, orderId).order().status()).isEqualTo(OrderStatus.READY);
    }

    private String readyOrder(Account account, String... names) {
        final OrderDetails details = orderService.newOrder(account, request(names));
        for (Authorization authorization : details.authorizations()) {
            authorizationRepository.compareAndSetStatus(authorization.id(),
                AuthorizationStatus.PENDING, AuthorizationStatus.VALID);
        }
        final OrderDetails ready = orderService.findOwned(account, details.order().id());
        assertThat(ready.order().status()).isEqualTo(OrderStatus.READY);
        return ready.order().id();
    }

    private void backdate(String authorizationId) {
        jdbcClient.sql("UPDATE authorizations SET expires = :expires WHERE id = :id")
            .param("expires", Instant.now().minus(1, ChronoUnit.MINUTES).atOffset(ZoneOffset.UTC))
            .param("id", authorizationId)
            .update();
    }

    private List<ChallengeType> challengeTypes(Authorization authorization) {
        return challengeRepository.findByAuthorization(authorization.id()).stream()
            .map(Challenge::type)
            .toList();
    }

    private int certificateCount(String orderId) {
        return jdbcClient.sql("SELECT COUNT(*) FROM certificates WHERE order_id = :orderId")
            .param("orderId", orderId)
            .query(Integer.class)
            .single();
    }

    private static OrderRequest request(String... names) {
        return OrderRequest.builder()
            .identifiers(Arrays.stream(names).map(Identifier::dns).toList())
            .build();
    }
}
