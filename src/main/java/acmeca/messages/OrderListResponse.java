package acmeca.messages;

import java.net.URI;
import java.util.List;

/**
 * <a href="https://datatracker.ietf.org/doc/html/rfc8555#section-7.1.2.1">Orders List</a>
 */
public record OrderListResponse(
    List<URI> orders
) {

}
