package acmeca.services;

import acmeca.model.Authorization;
import acmeca.model.Identifier;
import acmeca.model.Order;
import java.util.List;

/**
 * An order together with its authorizations, one per identifier.
 */
public record OrderDetails(
    Order order,
    List<Authorization> authorizations
) {

    /**
     * @return the identifiers as requested, including any wildcard prefix
     */
    public List<Identifier> identifiers() {
        return authorizations.stream()
            .map(OrderDetails::requestedIdentifier)
            .toList();
    }

    public static Identifier requestedIdentifier(Authorization authorization) {
        return authorization.wildcard() ?
            new Identifier(authorization.identifier().type(), "*." + authorization.identifier().value())
            : authorization.identifier();
    }
}
