package acmeca.messages;

/**
 * @param status only {@code deactivated} is accepted
 */
public record AuthzRequest(
    String status
) {

}
