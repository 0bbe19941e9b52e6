package acmeca.messages;

/**
 * @param result short summary of what the job changed
 */
public record AdminTaskResponse(
    String task,
    String result
) {
}
