package dev.loom.query;

/**
 * One message of the conversation preceding the query.
 *
 * @param sender speaker label as it should appear in prompts, e.g. {@code user} or {@code
 *     assistant}
 * @param content message text
 */
public record ConversationTurn(String sender, String content) {

  public ConversationTurn {
    sender = sender == null ? "" : sender;
    content = content == null ? "" : content;
  }
}
