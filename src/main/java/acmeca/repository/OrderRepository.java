package acmeca.repository;

import acmeca.model.Order;
import acmeca.model.OrderStatus;
import acmeca.model.Problem;
import acmeca.model.ProblemType;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import org.springframework.jdbc.core.simple.JdbcClient;
import org.springframework.stereotype.Repository;

@Repository
public class OrderRepository {

    private final JdbcClient jdbcClient;

    public OrderRepository(JdbcClient jdbcClient) {
        this.jdbcClient = jdbcClient;
    }

    public void insert(Order order) {
        jdbcClient.sql("""
            INSERT INTO orders (id, account_id, status, expires, not_before, not_after, created_at)
            VALUES (:id, :accountId, :status, :expires, :notBefore, :notAfter, :createdAt)
            """)
            .param("id", order.id())
            .param("accountId", order.accountId())
            .param("status", order.status().value())
            .param("expires", Timestamps.toDb(order.expires()))
            .param("notBefore", Timestamps.toDb(order.notBefore()))
            .param("notAfter", Timestamps.toDb(order.notAfter()))
            .param("createdAt", Timestamps.toDb(order.createdAt()))
            .update();
    }

    public Optional<Order> findById(String id) {
        return jdbcClient.sql("SELECT * FROM orders WHERE id = :id")
            .param("id", id)
            .query(this::mapRow)
            .optional();
    }

    public List<Order> findByAccount(String accountId) {
        return jdbcClient.sql("SELECT * FROM orders WHERE account_id = :accountId ORDER BY created_at")
            .param("accountId", accountId)
            .query(this::mapRow)
            .list();
    }

    public int countByAccountAndStatus(String accountId, Collection<OrderStatus> statuses) {
        return jdbcClient.sql("SELECT COUNT(*) FROM orders WHERE account_id = :accountId AND status IN (:statuses)")
            .param("accountId", accountId)
            .param("statuses", statuses.stream().map(OrderStatus::value).toList())
            .query(Integer.class)
            .single();
    }

    /**
     * @return true if this call moved the order from {@code expected} to {@code target}
     */
    public boolean compareAndSetStatus(String id, OrderStatus expected, OrderStatus target) {
        return jdbcClient.sql("UPDATE orders SET status = :target WHERE id = :id AND status = :expected")
            .param("id", id)
            .param("expected", expected.value())
            .param("target", target.value())
            .update() == 1;
    }

    public boolean markValid(String id, String certificateSerial) {
        return jdbcClient.sql("""
                UPDATE orders SET status = :valid, certificate_serial = :serial
                WHERE id = :id AND status = :processing
                """)
            .param("id", id)
            .param("serial", certificateSerial)
            .param("valid", OrderStatus.VALID.value())
            .param("processing", OrderStatus.PROCESSING.value())
            .update() == 1;
    }

    /**
     * Moves the order to invalid from any of the given states, recording the problem.
     */
    public boolean markInvalid(String id, Collection<OrderStatus> expected, Problem error) {
        return jdbcClient.sql("""
                UPDATE orders SET status = :invalid, error_type = :errorType, error_detail = :errorDetail
                WHERE id = :id AND status IN (:expected)
                """)
            .param("id", id)
            .param("invalid", OrderStatus.INVALID.value())
            .param("expected", expected.stream().map(OrderStatus::value).toList())
            .param("errorType", error.type())
            .param("errorDetail", error.detail())
            .update() == 1;
    }

    public int deleteExpiredBefore(Instant cutoff) {
        return jdbcClient.sql("DELETE FROM orders WHERE expires < :cutoff")
            .param("cutoff", Timestamps.toDb(cutoff))
            .update();
    }

    private Order mapRow(ResultSet rs, int rowNum) throws SQLException {
        final String errorType = rs.getString("error_type");
        return Order.builder()
            .id(rs.getString("id"))
            .accountId(rs.getString("account_id"))
            .status(OrderStatus.of(rs.getString("status")))
            .expires(Timestamps.fromDb(rs, "expires"))
            .notBefore(Timestamps.fromDb(rs, "not_before"))
            .notAfter(Timestamps.fromDb(rs, "not_after"))
            .certificateSerial(rs.getString("certificate_serial"))
            .error(errorType == null ? null :
                new Problem(errorType, rs.getString("error_detail"), ProblemType.fromUrn(errorType).status().value(), null))
            .createdAt(Timestamps.fromDb(rs, "created_at"))
            .build();
    }
}
