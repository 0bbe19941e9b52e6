package acmeca.housekeeping;

import static org.assertj.core.api.Assertions.assertThat;

import acmeca.housekeeping.AcmeCleanupService.CleanupResult;
import acmeca.issuance.CertificateIssuanceService;
import acmeca.messages.OrderRequest;
import acmeca.model.Account;
import acmeca.model.Authorization;
import acmeca.model.Identifier;
import acmeca.model.IssuedCertificate;
import acmeca.repository.AuthorizationRepository;
import acmeca.repository.CertificateRepository;
import acmeca.repository.ChallengeRepository;
import acmeca.repository.NonceRepository;
import acmeca.repository.OrderRepository;
import acmeca.services.AccountService;
import acmeca.services.OrderDetails;
import acmeca.services.OrderService;
import acmeca.support.TestAccounts;
import acmeca.support.TestCertificates;
import acmeca.support.TestKeys;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

@SpringBootTest(properties = "spring.datasource.url=jdbc:h2:mem:acme-cleanup;DB_CLOSE_DELAY=-1")
class AcmeCleanupServiceTest {

    @Autowired
    AcmeCleanupService cleanupService;

    @Autowired
    AccountService accountService;

    @Autowired
    OrderService orderService;

    @Autowired
    CertificateIssuanceService issuanceService;

    @Autowired
    OrderRepository orderRepository;

    @Autowired
    AuthorizationRepository authorizationRepository;

    @Autowired
    ChallengeRepository challengeRepository;

    @Autowired
    NonceRepository nonceRepository;

    @Autowired
    CertificateRepository certificateRepository;

    @Test
    void removesExpiredStateAndKeepsCertificates() {
        final Account account = TestAccounts.register(accountService);
        final OrderDetails order = orderService.newOrder(account, OrderRequest.builder()
            .identifiers(List.of(Identifier.dns("cleanup.example.test")))
            .build());
        final Authorization authorization = order.authorizations().get(0);
        final IssuedCertificate certificate = TestCertificates.issue(issuanceService, account.id(),
            TestKeys.rsaKeyPair(2048), "cleanup.example.test");

        final Instant now = order.order().expires().plus(1, ChronoUnit.MINUTES);
        nonceRepository.insert("stale-nonce", now.minus(2, ChronoUnit.HOURS));
        nonceRepository.insert("fresh-nonce", now.minus(1, ChronoUnit.MINUTES));

        final CleanupResult result = cleanupService.cleanup(now);

        assertThat(result.orders()).isGreaterThanOrEqualTo(1);
        assertThat(result.nonces()).isGreaterThanOrEqualTo(1);
        assertThat(orderRepository.findById(order.order().id())).isEmpty();
        assertThat(authorizationRepository.findById(authorization.id())).isEmpty();
        assertThat(challengeRepository.findByAuthorization(authorization.id())).isEmpty();
        assertThat(nonceRepository.consume("stale-nonce", now.minus(3, ChronoUnit.HOURS))).isFalse();
        assertThat(nonceRepository.consume("fresh-nonce", now.minus(1, ChronoUnit.HOURS))).isTrue();
        assertThat(certificateRepository.findBySerial(certificate.serial())).isPresent();

        final CleanupResult again = cleanupService.cleanup(now);
        assertThat(again.orders()).isZero();
        assertThat(again.nonces()).isZero();
    }

    @Test
    void keepsOrdersThatHaveNotExpired() {
        final Account account = TestAccounts.register(accountService);
        final OrderDetails order = orderService.newOrder(account, OrderRequest.builder()
            .identifiers(List.of(Identifier.dns("current.example.test")))
            .build());

        cleanupService.cleanup(order.order().expires().minus(1, ChronoUnit.MINUTES));

        assertThat(orderRepository.findById(order.order().id())).isPresent();
    }
}
