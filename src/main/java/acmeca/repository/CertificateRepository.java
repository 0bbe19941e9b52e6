package acmeca.repository;

import acmeca.model.IssuedCertificate;
import acmeca.model.RevocationReason;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import org.springframework.jdbc.core.simple.JdbcClient;
import org.springframework.stereotype.Repository;

@Repository
public class CertificateRepository {

    private final JdbcClient jdbcClient;

    public CertificateRepository(JdbcClient jdbcClient) {
        this.jdbcClient = jdbcClient;
    }

    /**
     * @throws org.springframework.dao.DuplicateKeyException if the serial is already taken
     */
    public void insert(IssuedCertificate certificate) {
        jdbcClient.sql("""
            INSERT INTO certificates (serial, account_id, order_id, subject, not_before, not_after, pem)
            VALUES (:serial, :accountId, :orderId, :subject, :notBefore, :notAfter, :pem)
            """)
            .param("serial", certificate.serial())
            .param("accountId", certificate.accountId())
            .param("orderId", certificate.orderId())
            .param("subject", certificate.subject())
            .param("notBefore", Timestamps.toDb(certificate.notBefore()))
            .param("notAfter", Timestamps.toDb(certificate.notAfter()))
            .param("pem", certificate.pem())
            .update();
    }

    public boolean existsBySerial(String serial) {
        return jdbcClient.sql("SELECT 1 FROM certificates WHERE serial = :serial")
            .param("serial", serial)
            .query(Integer.class)
            .optional()
            .isPresent();
    }

    public Optional<IssuedCertificate> findBySerial(String serial) {
        return jdbcClient.sql("SELECT * FROM certificates WHERE serial = :serial")
            .param("serial", serial)
            .query(this::mapRow)
            .optional();
    }

    /**
     * Records the revocation unless one was recorded before. Revocation fields are never cleared.
     *
     * @return true if this call revoked the certificate
     */
    public boolean revoke(String serial, Instant revokedAt, RevocationReason reason) {
        return jdbcClient.sql("""
                UPDATE certificates SET revoked_at = :revokedAt, revocation_reason = :reason
                WHERE serial = :serial AND revoked_at IS NULL
                """)
            .param("serial", serial)
            .param("revokedAt", Timestamps.toDb(revokedAt))
            .param("reason", reason.code())
            .update() == 1;
    }

    /**
     * Revoked certificates that have not expired at {@code now}, ordered by serial.
     */
    public List<IssuedCertificate> findRevokedNotExpired(Instant now) {
        return jdbcClient.sql("""
                SELECT * FROM certificates
                WHERE revoked_at IS NOT NULL AND not_after > :now
                ORDER BY serial
                """)
            .param("now", Timestamps.toDb(now))
            .query(this::mapRow)
            .list();
    }

    private IssuedCertificate mapRow(ResultSet rs, int rowNum) throws SQLException {
        final int reason = rs.getInt("revocation_reason");
        final boolean hasReason = !rs.wasNull();
        return IssuedCertificate.builder()
            .serial(rs.getString("serial"))
            .accountId(rs.getString("account_id"))
            .orderId(rs.getString("order_id"))
            .subject(rs.getString("subject"))
            .notBefore(Timestamps.fromDb(rs, "not_before"))
            .notAfter(Timestamps.fromDb(rs, "not_after"))
            .pem(rs.getString("pem"))
            .revokedAt(Timestamps.fromDb(rs, "revoked_at"))
            .revocationReason(hasReason ? RevocationReason.fromCode(reason) : null)
            .build();
    }
}
