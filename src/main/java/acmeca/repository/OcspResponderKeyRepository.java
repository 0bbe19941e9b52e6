package acmeca.repository;

import acmeca.model.OcspResponderKey;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import org.springframework.jdbc.core.simple.JdbcClient;
import org.springframework.stereotype.Repository;

@Repository
public class OcspResponderKeyRepository {

    private final JdbcClient jdbcClient;

    public OcspResponderKeyRepository(JdbcClient jdbcClient) {
        this.jdbcClient = jdbcClient;
    }

    /**
     * @throws org.springframework.dao.DuplicateKeyException if the generation was stored concurrently
     */
    public void insert(OcspResponderKey key) {
        jdbcClient.sql("""
            INSERT INTO ocsp_responder_keys (generation, serial, not_before, not_after, certificate_pem, private_key_pem)
            VALUES (:generation, :serial, :notBefore, :notAfter, :certificatePem, :privateKeyPem)
            """)
            .param("generation", key.generation())
            .param("serial", key.serial())
            .param("notBefore", Timestamps.toDb(key.notBefore()))
            .param("notAfter", Timestamps.toDb(key.notAfter()))
            .param("certificatePem", key.certificatePem())
            .param("privateKeyPem", key.privateKeyPem())
            .update();
    }

    public Optional<OcspResponderKey> findLatest() {
        return jdbcClient.sql("SELECT * FROM ocsp_responder_keys ORDER BY generation DESC LIMIT 1")
            .query(this::mapRow)
            .optional();
    }

    /**
     * Keys usable at {@code instant}, newest generation first.
     */
    public List<OcspResponderKey> findValidAt(Instant instant) {
        return jdbcClient.sql("""
                SELECT * FROM ocsp_responder_keys
                WHERE not_before <= :instant AND not_after > :instant
                ORDER BY generation DESC
                """)
            .param("instant", Timestamps.toDb(instant))
            .query(this::mapRow)
            .list();
    }

    public int deleteExpiredBefore(Instant cutoff) {
        return jdbcClient.sql("DELETE FROM ocsp_responder_keys WHERE not_after < :cutoff")
            .param("cutoff", Timestamps.toDb(cutoff))
            .update();
    }

    private OcspResponderKey mapRow(ResultSet rs, int rowNum) throws SQLException {
        return OcspResponderKey.builder()
            .generation(rs.getLong("generation"))
            .serial(rs.getString("serial"))
            .notBefore(Timestamps.fromDb(rs, "not_before"))
            .notAfter(Timestamps.fromDb(rs, "not_after"))
            .certificatePem(rs.getString("certificate_pem"))
            .privateKeyPem(rs.getString("private_key_pem"))
            .build();
    }
}
