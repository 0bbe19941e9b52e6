package acmeca.services;

import acmeca.config.AppProperties;
import acmeca.jws.Thumbprints;
import acmeca.messages.AccountRequest;
import acmeca.model.Account;
import acmeca.model.AccountStatus;
import acmeca.model.ProblemType;
import acmeca.repository.AccountRepository;
import com.nimbusds.jose.jwk.JWK;
import java.time.Clock;
import java.util.List;
import java.util.Locale;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;

/**
 * Account registration and management, see
 * <a href="https://datatracker.ietf.org/doc/html/rfc8555#section-7.3">RFC 8555 Sec 7.3</a>
 */
@Service
@Slf4j
public class AccountService {

    private static final String MAILTO = "mailto:";

    private final AccountRepository accountRepository;
    private final AppProperties appProperties;
    private final Clock clock;

    public AccountService(AccountRepository accountRepository, AppProperties appProperties, Clock clock) {
        this.accountRepository = accountRepository;
        this.appProperties = appProperties;
        this.clock = clock;
    }

    public record Registration(
        Account account,
        boolean created
    ) {}

    /**
     * Registers the key or returns the account already registered for it.
     */
    public Registration register(JWK jwk, AccountRequest request) {
        final String thumbprint = Thumbprints.thumbprint(jwk);

        final var existing = accountRepository.findByThumbprint(thumbprint);
        if (existing.isPresent()) {
            log.debug("Found existing account={} for thumbprint={}", existing.get().id(), thumbprint);
            return new Registration(existing.get(), false);
        }
        if (request.onlyReturnExisting()) {
            throw new AcmeProblemException(ProblemType.ACCOUNT_DOES_NOT_EXIST, "No account exists for this key");
        }

        final List<String> contacts = request.contact() != null ? request.contact() : List.of();
        validateContacts(contacts);
        if (appProperties.termsOfService() != null && !request.termsOfServiceAgreed()) {
            throw AcmeProblemException.malformed("The terms of service at " + appProperties.termsOfService()
                + " must be agreed to");
        }

        final Account account = Account.builder()
            .id(Ids.newId())
            .jwk(jwk.toPublicJWK().toJSONString())
            .thumbprint(thumbprint)
            .status(AccountStatus.VALID)
            .contacts(contacts)
            .termsOfServiceAgreed(request.termsOfServiceAgreed())
            .createdAt(clock.instant())
            .build();
        try {
            accountRepository.insert(account);
        } catch (DuplicateKeyException e) {
            // a concurrent registration of the same key won
            log.debug("Concurrent registration for thumbprint={}, returning the stored account", thumbprint);
            return new Registration(
                accountRepository.findByThumbprint(thumbprint)
                    .orElseThrow(() -> new IllegalStateException("Account vanished after duplicate insert", e)),
                false
            );
        }
        log.info("Registered account={} contacts={}", account.id(), contacts);
        return new Registration(account, true);
    }

    public Account updateContacts(Account account, List<String> contacts) {
        final List<String> newContacts = contacts != null ? contacts : List.of();
        validateContacts(newContacts);
        accountRepository.updateContacts(account.id(), newContacts);
        log.debug("Updated contacts of account={} to {}", account.id(), newContacts);
        return account.toBuilder().contacts(newContacts).build();
    }

    /**
     * Deactivation is terminal. Orders and certificates of the account are left as they are.
     */
    public Account deactivate(Account account) {
        if (!accountRepository.compareAndSetStatus(account.id(), AccountStatus.VALID, AccountStatus.DEACTIVATED)) {
            throw AcmeProblemException.unauthorized("Account is no longer valid");
        }
        log.info("Deactivated account={}", account.id());
        return account.toBuilder().status(AccountStatus.DEACTIVATED).build();
    }

    void validateContacts(List<String> contacts) {
        if (appProperties.requireContact() && contacts.isEmpty()) {
            throw new AcmeProblemException(ProblemType.INVALID_CONTACT, "At least one contact address is required");
        }
        for (String contact : contacts) {
            if (contact == null || !contact.startsWith(MAILTO)) {
                throw new AcmeProblemException(ProblemType.UNSUPPORTED_CONTACT,
                    contact + ": Unsupported address scheme");
            }
            final String address = contact.substring(MAILTO.length());
            // quoted local parts are too hard to validate, and an unquoted one cannot contain a comma
            if (address.startsWith("\"")) {
                throw new AcmeProblemException(ProblemType.INVALID_CONTACT, "Quoted local part in email is not allowed");
            }
            if (address.contains(",")) {
                throw new AcmeProblemException(ProblemType.INVALID_CONTACT, "More than one addr-spec is not allowed");
            }
            final int at = address.lastIndexOf('@');
            if (at <= 0) {
                throw new AcmeProblemException(ProblemType.INVALID_CONTACT, address + ": Not a valid email address");
            }
            final String domain = address.substring(at + 1);
            if (domain.contains("?")) {
                throw new AcmeProblemException(ProblemType.INVALID_CONTACT, domain + ": hfields are not allowed");
            }
            if (!Hostnames.isValid(domain.toLowerCase(Locale.ROOT))
                || address.substring(0, at).chars().anyMatch(Character::isWhitespace)) {
                throw new AcmeProblemException(ProblemType.INVALID_CONTACT, domain + ": Not a valid email address");
            }
        }
    }
}
