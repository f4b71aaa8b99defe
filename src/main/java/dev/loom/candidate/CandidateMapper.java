package dev.loom.candidate;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeParseException;
import java.util.Date;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Function;
import org.jspecify.annotations.Nullable;

/**
 * Normalises raw search rows into {@link Candidate}s.
 *
 * <p>Search backends disagree on field names ({@code similarity} vs {@code score}, {@code
 * file_name} vs {@code fileName}, ...) and occasionally on types (numbers serialised as strings).
 * Mapping is total: missing or mistyped fields fall back to defaults, and the only row that is
 * rejected is one with neither an id nor any content to derive one from.
 */
public final class CandidateMapper {

  private static final List<String> ID_KEYS =
      List.of("id", "embedding_id", "embeddingId", "chunk_id");
  private static final List<String> CONTENT_KEYS = List.of("content", "text", "chunk_text", "body");
  private static final List<String> SCORE_KEYS = List.of("score", "similarity", "rank");
  private static final List<String> SOURCE_KEYS = List.of("source_type", "sourceType", "source");
  private static final List<String> FILE_NAME_KEYS = List.of("file_name", "fileName");
  private static final List<String> TITLE_KEYS = List.of("title", "subject");
  private static final List<String> SENT_AT_KEYS = List.of("sent_at", "sentAt", "date");
  private static final List<String> CHUNK_INDEX_KEYS = List.of("chunk_index", "chunkIndex");
  private static final List<String> TOTAL_CHUNKS_KEYS = List.of("total_chunks", "totalChunks");
  private static final List<String> SENDER_KEYS =
      List.of("sender_name", "senderName", "sender_email", "senderEmail", "sender", "from");

  private static final List<Function<String, Instant>> TEXT_PARSERS =
      List.of(
          text -> OffsetDateTime.parse(text).toInstant(),
          text -> LocalDateTime.parse(text).toInstant(ZoneOffset.UTC),
          text -> LocalDate.parse(text).atStartOfDay(ZoneOffset.UTC).toInstant(),
          text -> Instant.ofEpochMilli(Long.parseLong(text)));

  private CandidateMapper() {}

  /**
   * Maps a raw row to a candidate.
   *
   * @param row raw field map from a search backend
   * @param defaultSource source to use when the row does not name one
   * @return the candidate, or empty when the row has neither id nor content
   */
  public static Optional<Candidate> fromRow(
      @Nullable Map<String, ?> row, SourceType defaultSource) {
    if (row == null) {
      return Optional.empty();
    }
    String content = asText(first(row, CONTENT_KEYS));
    String id = asText(first(row, ID_KEYS));
    if (id == null || id.isBlank()) {
      if (content == null || content.isBlank()) {
        return Optional.empty();
      }
      id = UUID.nameUUIDFromBytes(content.getBytes(StandardCharsets.UTF_8)).toString();
    }

    Object rawSource = first(row, SOURCE_KEYS);
    SourceType source = rawSource == null ? defaultSource : SourceType.fromValue(rawSource);

    String fileName = asText(first(row, FILE_NAME_KEYS));
    String title = asText(first(row, TITLE_KEYS));
    if (title == null || title.isBlank()) {
      title = fileName;
    }

    Candidate candidate =
        new Candidate(
            id,
            source,
            title,
            content,
            asScore(first(row, SCORE_KEYS)),
            parseTimestamp(first(row, SENT_AT_KEYS)),
            fileName,
            asInteger(first(row, CHUNK_INDEX_KEYS)),
            asInteger(first(row, TOTAL_CHUNKS_KEYS)),
            asText(first(row, SENDER_KEYS)),
            List.of());
    return Optional.of(candidate);
  }

  /**
   * Parses a timestamp from the representations backends use: {@link Instant}, {@link Date}
   * (including SQL timestamps), offset/zoned/local date-times, epoch milliseconds, and ISO-8601
   * strings. Local values are read as UTC.
   *
   * @return the instant, or {@code null} when the value is absent or unparseable
   */
  public static @Nullable Instant parseTimestamp(@Nullable Object value) {
    if (value == null) {
      return null;
    }
    if (value instanceof Instant instant) {
      return instant;
    }
    if (value instanceof java.sql.Date sqlDate) {
      return sqlDate.toLocalDate().atStartOfDay(ZoneOffset.UTC).toInstant();
    }
    if (value instanceof Date date) {
      return date.toInstant();
    }
    if (value instanceof OffsetDateTime offsetDateTime) {
      return offsetDateTime.toInstant();
    }
    if (value instanceof ZonedDateTime zonedDateTime) {
      return zonedDateTime.toInstant();
    }
    if (value instanceof LocalDateTime localDateTime) {
      return localDateTime.toInstant(ZoneOffset.UTC);
    }
    if (value instanceof LocalDate localDate) {
      return localDate.atStartOfDay(ZoneOffset.UTC).toInstant();
    }
    if (value instanceof Number number) {
      return Instant.ofEpochMilli(number.longValue());
    }
    return parseTimestampText(value.toString().trim());
  }

  private static @Nullable Instant parseTimestampText(String text) {
    if (text.isEmpty()) {
      return null;
    }
    for (Function<String, Instant> parser : TEXT_PARSERS) {
      Instant parsed = tryParse(parser, text);
      if (parsed != null) {
        return parsed;
      }
    }
    return null;
  }

  private static @Nullable Instant tryParse(Function<String, Instant> parser, String text) {
    try {
      return parser.apply(text);
    } catch (DateTimeParseException | NumberFormatException e) {
      return null;
    }
  }

  private static @Nullable Object first(Map<String, ?> row, List<String> keys) {
    for (String key : keys) {
      Object value = row.get(key);
      if (value != null) {
        return value;
      }
    }
    return null;
  }

  private static @Nullable String asText(@Nullable Object value) {
    return value == null ? null : value.toString();
  }

  private static double asScore(@Nullable Object value) {
    double score;
    if (value instanceof Number number) {
      score = number.doubleValue();
    } else if (value != null) {
      try {
        score = Double.parseDouble(value.toString().trim());
      } catch (NumberFormatException e) {
        score = 0.0;
      }
    } else {
      score = 0.0;
    }
    return Double.isFinite(score) ? score : 0.0;
  }

  private static @Nullable Integer asInteger(@Nullable Object value) {
    if (value instanceof Number number) {
      return number.intValue();
    }
    if (value == null) {
      return null;
    }
    try {
      return Integer.valueOf(value.toString().trim());
    } catch (NumberFormatException e) {
      return null;
    }
  }
}
