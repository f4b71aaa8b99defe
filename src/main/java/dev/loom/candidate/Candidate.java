package dev.loom.candidate;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.jspecify.annotations.Nullable;

/**
 * Immutable unit flowing through every retrieval stage.
 *
 * <p>{@link #score()} is the single canonical relevance value read by the next stage. Stages never
 * mutate a candidate: they derive a copy through {@link #rescored(double, ScoreRecord)} or {@link
 * #recorded(ScoreRecord)}, which append one entry to {@link #scoreHistory()}.
 *
 * @param id identifier, unique within {@code source}
 * @param source corpus the candidate came from
 * @param title display title (file name or email subject), never null
 * @param content text used for lexical comparisons, never null
 * @param score current relevance; unbounded for raw keyword scores until fused
 * @param sentAt send time for emails, used by temporal decay
 * @param fileName originating file for knowledge-base chunks
 * @param chunkIndex position of the chunk within its file
 * @param totalChunks chunk count of the originating file
 * @param sender sender display name or address for emails
 * @param scoreHistory append-only audit trail, one record per stage survived
 */
public record Candidate(
    String id,
    SourceType source,
    String title,
    String content,
    double score,
    @Nullable Instant sentAt,
    @Nullable String fileName,
    @Nullable Integer chunkIndex,
    @Nullable Integer totalChunks,
    @Nullable String sender,
    List<ScoreRecord> scoreHistory) {

  public Candidate {
    if (id == null || id.isBlank()) {
      throw new IllegalArgumentException("Candidate id must not be blank");
    }
    Objects.requireNonNull(source, "source");
    title = title == null ? "" : title;
    content = content == null ? "" : content;
    if (Double.isNaN(score)) {
      throw new IllegalArgumentException("Candidate score must not be NaN for id " + id);
    }
    scoreHistory = scoreHistory == null ? List.of() : List.copyOf(scoreHistory);
  }

  /** Minimal candidate with no metadata and an empty history. */
  public Candidate(String id, SourceType source, String content, double score) {
    this(id, source, "", content, score, null, null, null, null, null, List.of());
  }

  /** Identity across corpora: ids are only unique within one source. */
  public String key() {
    return source.wireName() + ":" + id;
  }

  public boolean isEmail() {
    return source == SourceType.EMAIL;
  }

  /** Copy with a new score and {@code record} appended to the history. */
  public Candidate rescored(double newScore, ScoreRecord record) {
    return new Candidate(
        id,
        source,
        title,
        content,
        newScore,
        sentAt,
        fileName,
        chunkIndex,
        totalChunks,
        sender,
        append(record));
  }

  /** Copy with the same score and {@code record} appended to the history. */
  public Candidate recorded(ScoreRecord record) {
    return rescored(score, record);
  }

  private List<ScoreRecord> append(ScoreRecord record) {
    Objects.requireNonNull(record, "record");
    List<ScoreRecord> history = new ArrayList<>(scoreHistory.size() + 1);
    history.addAll(scoreHistory);
    history.add(record);
    return history;
  }
}
