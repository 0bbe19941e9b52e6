package acmeca.repository;

import java.time.Instant;
import org.springframework.jdbc.core.simple.JdbcClient;
import org.springframework.stereotype.Repository;

@Repository
public class NonceRepository {

    private final JdbcClient jdbcClient;

    public NonceRepository(JdbcClient jdbcClient) {
        this.jdbcClient = jdbcClient;
    }

    public void insert(String value, Instant issuedAt) {
        jdbcClient.sql("INSERT INTO nonces (nonce_value, issued_at) VALUES (:value, :issuedAt)")
            .param("value", value)
            .param("issuedAt", Timestamps.toDb(issuedAt))
            .update();
    }

    /**
     * Checks and invalidates the nonce in one statement, so of any number of concurrent callers at most one sees
     * {@code true}.
     *
     * @param notIssuedBefore nonces issued before this instant count as unknown
     */
    public boolean consume(String value, Instant notIssuedBefore) {
        return jdbcClient.sql("DELETE FROM nonces WHERE nonce_value = :value AND issued_at >= :notIssuedBefore")
            .param("value", value)
            .param("notIssuedBefore", Timestamps.toDb(notIssuedBefore))
            .update() == 1;
    }

    public int deleteIssuedBefore(Instant cutoff) {
        return jdbcClient.sql("DELETE FROM nonces WHERE issued_at < :cutoff")
            .param("cutoff", Timestamps.toDb(cutoff))
            .update();
    }
}
