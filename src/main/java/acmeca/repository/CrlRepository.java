package acmeca.repository;

import acmeca.model.CrlRecord;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.Base64;
import java.util.Optional;
import org.springframework.jdbc.core.simple.JdbcClient;
import org.springframework.stereotype.Repository;

@Repository
public class CrlRepository {

    private final JdbcClient jdbcClient;

    public CrlRepository(JdbcClient jdbcClient) {
        this.jdbcClient = jdbcClient;
    }

    /**
     * @throws org.springframework.dao.DuplicateKeyException if a CRL with the same number was stored concurrently
     */
    public void insert(CrlRecord crl) {
        jdbcClient.sql("""
            INSERT INTO crls (crl_number, this_update, next_update, fingerprint, der)
            VALUES (:crlNumber, :thisUpdate, :nextUpdate, :fingerprint, :der)
            """)
            .param("crlNumber", crl.crlNumber())
            .param("thisUpdate", Timestamps.toDb(crl.thisUpdate()))
            .param("nextUpdate", Timestamps.toDb(crl.nextUpdate()))
            .param("fingerprint", crl.fingerprint())
            .param("der", Base64.getEncoder().encodeToString(crl.der()))
            .update();
    }

    public Optional<CrlRecord> findLatest() {
        return jdbcClient.sql("SELECT * FROM crls ORDER BY crl_number DESC LIMIT 1")
            .query(this::mapRow)
            .optional();
    }

    /**
     * Prunes superseded CRLs.
     */
    public int deleteOlderThan(long crlNumber) {
        return jdbcClient.sql("DELETE FROM crls WHERE crl_number < :crlNumber")
            .param("crlNumber", crlNumber)
            .update();
    }

    private CrlRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
        return CrlRecord.builder()
            .crlNumber(rs.getLong("crl_number"))
            .thisUpdate(Timestamps.fromDb(rs, "this_update"))
            .nextUpdate(Timestamps.fromDb(rs, "next_update"))
            .fingerprint(rs.getString("fingerprint"))
            .der(Base64.getDecoder().decode(rs.getString("der")))
            .build();
    }
}
