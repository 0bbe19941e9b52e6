package acmeca.repository;

import acmeca.model.Challenge;
import acmeca.model.ChallengeStatus;
import acmeca.model.ChallengeType;
import acmeca.model.Problem;
import acmeca.model.ProblemType;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import org.springframework.jdbc.core.simple.JdbcClient;
import org.springframework.stereotype.Repository;

@Repository
public class ChallengeRepository {

    private final JdbcClient jdbcClient;

    public ChallengeRepository(JdbcClient jdbcClient) {
        this.jdbcClient = jdbcClient;
    }

    public void insert(Challenge challenge) {
        jdbcClient.sql("""
            INSERT INTO challenges (id, authorization_id, type, token, status)
            VALUES (:id, :authorizationId, :type, :token, :status)
            """)
            .param("id", challenge.id())
            .param("authorizationId", challenge.authorizationId())
            .param("type", challenge.type().value())
            .param("token", challenge.token())
            .param("status", challenge.status().value())
            .update();
    }

    public Optional<Challenge> findById(String id) {
        return jdbcClient.sql("SELECT * FROM challenges WHERE id = :id")
            .param("id", id)
            .query(this::mapRow)
            .optional();
    }

    public List<Challenge> findByAuthorization(String authorizationId) {
        return jdbcClient.sql("SELECT * FROM challenges WHERE authorization_id = :authorizationId ORDER BY type")
            .param("authorizationId", authorizationId)
            .query(this::mapRow)
            .list();
    }

    public boolean compareAndSetStatus(String id, ChallengeStatus expected, ChallengeStatus target) {
        return jdbcClient.sql("UPDATE challenges SET status = :target WHERE id = :id AND status = :expected")
            .param("id", id)
            .param("expected", expected.value())
            .param("target", target.value())
            .update() == 1;
    }

    public boolean markValid(String id, Instant validated) {
        return jdbcClient.sql("""
                UPDATE challenges SET status = :valid, validated = :validated
                WHERE id = :id AND status = :processing
                """)
            .param("id", id)
            .param("validated", Timestamps.toDb(validated))
            .param("valid", ChallengeStatus.VALID.value())
            .param("processing", ChallengeStatus.PROCESSING.value())
            .update() == 1;
    }

    public boolean markInvalid(String id, Problem error) {
        return jdbcClient.sql("""
                UPDATE challenges SET status = :invalid, error_type = :errorType, error_detail = :errorDetail
                WHERE id = :id AND status = :processing
                """)
            .param("id", id)
            .param("errorType", error.type())
            .param("errorDetail", error.detail())
            .param("invalid", ChallengeStatus.INVALID.value())
            .param("processing", ChallengeStatus.PROCESSING.value())
            .update() == 1;
    }

    private Challenge mapRow(ResultSet rs, int rowNum) throws SQLException {
        final String errorType = rs.getString("error_type");
        return Challenge.builder()
            .id(rs.getString("id"))
            .authorizationId(rs.getString("authorization_id"))
            .type(ChallengeType.of(rs.getString("type")))
            .token(rs.getString("token"))
            .status(ChallengeStatus.of(rs.getString("status")))
            .validated(Timestamps.fromDb(rs, "validated"))
            .error(errorType == null ? null :
                new Problem(errorType, rs.getString("error_detail"), ProblemType.fromUrn(errorType).status().value(), null))
            .build();
    }
}
