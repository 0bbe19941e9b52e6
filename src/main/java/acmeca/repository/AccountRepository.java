package acmeca.repository;

import acmeca.model.Account;
import acmeca.model.AccountStatus;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import org.springframework.jdbc.core.simple.JdbcClient;
import org.springframework.stereotype.Repository;

@Repository
public class AccountRepository {

    private final JdbcClient jdbcClient;

    public AccountRepository(JdbcClient jdbcClient) {
        this.jdbcClient = jdbcClient;
    }

    /**
     * @throws org.springframework.dao.DuplicateKeyException if an account with the same thumbprint exists
     */
    public void insert(Account account) {
        jdbcClient.sql("""
            INSERT INTO accounts (id, jwk, thumbprint, status, contacts, terms_of_service_agreed, created_at)
            VALUES (:id, :jwk, :thumbprint, :status, :contacts, :tosAgreed, :createdAt)
            """)
            .param("id", account.id())
            .param("jwk", account.jwk())
            .param("thumbprint", account.thumbprint())
            .param("status", account.status().value())
            .param("contacts", joinContacts(account.contacts()))
            .param("tosAgreed", account.termsOfServiceAgreed())
            .param("createdAt", Timestamps.toDb(account.createdAt()))
            .update();
    }

    public Optional<Account> findById(String id) {
        return jdbcClient.sql("SELECT * FROM accounts WHERE id = :id")
            .param("id", id)
            .query(this::mapRow)
            .optional();
    }

    public Optional<Account> findByThumbprint(String thumbprint) {
        return jdbcClient.sql("SELECT * FROM accounts WHERE thumbprint = :thumbprint")
            .param("thumbprint", thumbprint)
            .query(this::mapRow)
            .optional();
    }

    public void updateContacts(String id, List<String> contacts) {
        jdbcClient.sql("UPDATE accounts SET contacts = :contacts WHERE id = :id")
            .param("id", id)
            .param("contacts", joinContacts(contacts))
            .update();
    }

    /**
     * @return true if this call moved the account from {@code expected} to {@code target}
     */
    public boolean compareAndSetStatus(String id, AccountStatus expected, AccountStatus target) {
        return jdbcClient.sql("UPDATE accounts SET status = :target WHERE id = :id AND status = :expected")
            .param("id", id)
            .param("expected", expected.value())
            .param("target", target.value())
            .update() == 1;
    }

    private static String joinContacts(List<String> contacts) {
        return contacts == null || contacts.isEmpty() ? null : String.join("\n", contacts);
    }

    private Account mapRow(ResultSet rs, int rowNum) throws SQLException {
        final String contacts = rs.getString("contacts");
        return Account.builder()
            .id(rs.getString("id"))
            .jwk(rs.getString("jwk"))
            .thumbprint(rs.getString("thumbprint"))
            .status(AccountStatus.of(rs.getString("status")))
            .contacts(contacts == null ? List.of() : Arrays.asList(contacts.split("\n")))
            .termsOfServiceAgreed(rs.getBoolean("terms_of_service_agreed"))
            .createdAt(Timestamps.fromDb(rs, "created_at"))
            .build();
    }
}
