package acmeca.repository;

import acmeca.model.Authorization;
import acmeca.model.AuthorizationStatus;
import acmeca.model.Identifier;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import org.springframework.jdbc.core.simple.JdbcClient;
import org.springframework.stereotype.Repository;

@Repository
public class AuthorizationRepository {

    private final JdbcClient jdbcClient;

    public AuthorizationRepository(JdbcClient jdbcClient) {
        this.jdbcClient = jdbcClient;
    }

    public void insert(Authorization authorization) {
        jdbcClient.sql("""
            INSERT INTO authorizations (id, order_id, identifier_type, identifier_value, wildcard, status, expires)
            VALUES (:id, :orderId, :identifierType, :identifierValue, :wildcard, :status, :expires)
            """)
            .param("id", authorization.id())
            .param("orderId", authorization.orderId())
            .param("identifierType", authorization.identifier().type())
            .param("identifierValue", authorization.identifier().value())
            .param("wildcard", authorization.wildcard())
            .param("status", authorization.status().value())
            .param("expires", Timestamps.toDb(authorization.expires()))
            .update();
    }

    public Optional<Authorization> findById(String id) {
        return jdbcClient.sql("SELECT * FROM authorizations WHERE id = :id")
            .param("id", id)
            .query(this::mapRow)
            .optional();
    }

    public List<Authorization> findByOrder(String orderId) {
        return jdbcClient.sql("SELECT * FROM authorizations WHERE order_id = :orderId ORDER BY identifier_value, id")
            .param("orderId", orderId)
            .query(this::mapRow)
            .list();
    }

    /**
     * Selects the challenge the client responds to. Only the first caller on a pending authorization succeeds.
     */
    public boolean selectChallenge(String id, String challengeId) {
        return jdbcClient.sql("""
                UPDATE authorizations SET selected_challenge_id = :challengeId
                WHERE id = :id AND status = :pending AND selected_challenge_id IS NULL
                """)
            .param("id", id)
            .param("challengeId", challengeId)
            .param("pending", AuthorizationStatus.PENDING.value())
            .update() == 1;
    }

    public boolean compareAndSetStatus(String id, AuthorizationStatus expected, AuthorizationStatus target) {
        return compareAndSetStatus(id, List.of(expected), target);
    }

    /**
     * @return true if this call moved the authorization from one of {@code expected} to {@code target}
     */
    public boolean compareAndSetStatus(String id, Collection<AuthorizationStatus> expected, AuthorizationStatus target) {
        return jdbcClient.sql("UPDATE authorizations SET status = :target WHERE id = :id AND status IN (:expected)")
            .param("id", id)
            .param("expected", expected.stream().map(AuthorizationStatus::value).toList())
            .param("target", target.value())
            .update() == 1;
    }

    private Authorization mapRow(ResultSet rs, int rowNum) throws SQLException {
        return Authorization.builder()
            .id(rs.getString("id"))
            .orderId(rs.getString("order_id"))
            .identifier(new Identifier(rs.getString("identifier_type"), rs.getString("identifier_value")))
            .wildcard(rs.getBoolean("wildcard"))
            .status(AuthorizationStatus.of(rs.getString("status")))
            .expires(Timestamps.fromDb(rs, "expires"))
            .selectedChallengeId(rs.getString("selected_challenge_id"))
            .build();
    }
}
