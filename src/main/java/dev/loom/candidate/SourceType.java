package dev.loom.candidate;

import java.util.Locale;
import org.jspecify.annotations.Nullable;

/** Corpus a candidate was retrieved from. */
public enum SourceType {
  KNOWLEDGE_BASE("knowledge_base"),
  EMAIL("email"),
  OTHER("other");

  private final String wireName;

  SourceType(String wireName) {
    this.wireName = wireName;
  }

  public String wireName() {
    return wireName;
  }

  /**
   * Lenient lookup used when normalising raw search rows. Accepts the wire name ({@code
   * knowledge_base}), the enum name, and common aliases ({@code kb}, {@code document}); anything
   * unrecognised maps to {@link #OTHER}.
   */
  public static SourceType fromValue(@Nullable Object value) {
    if (value == null) {
      return OTHER;
    }
    String normalised = value.toString().trim().toLowerCase(Locale.ROOT).replace('-', '_');
    return switch (normalised) {
      case "knowledge_base", "kb", "document", "knowledge" -> KNOWLEDGE_BASE;
      case "email", "mail" -> EMAIL;
      default -> OTHER;
    };
  }
}
