package dev.loom.retrieval;

import dev.loom.candidate.Candidate;
import java.util.ArrayList;
import java.util.List;

/**
 * Raw candidate lists retrieved for one query string.
 *
 * @param query the query string searched
 * @param knowledgeBaseVector vector hits from the knowledge base
 * @param emailVector vector hits from the email corpus
 * @param knowledgeBaseKeyword keyword hits from the knowledge base
 * @param emailKeyword keyword hits from the email corpus
 * @param failedSources number of source searches that failed or timed out
 */
public record RetrievedLists(
    String query,
    List<Candidate> knowledgeBaseVector,
    List<Candidate> emailVector,
    List<Candidate> knowledgeBaseKeyword,
    List<Candidate> emailKeyword,
    int failedSources) {

  public RetrievedLists {
    knowledgeBaseVector = List.copyOf(knowledgeBaseVector);
    emailVector = List.copyOf(emailVector);
    knowledgeBaseKeyword = List.copyOf(knowledgeBaseKeyword);
    emailKeyword = List.copyOf(emailKeyword);
  }

  /** Vector hits of both corpora, knowledge base first. */
  public List<Candidate> vector() {
    return concat(knowledgeBaseVector, emailVector);
  }

  /** Keyword hits of both corpora, knowledge base first. */
  public List<Candidate> keyword() {
    return concat(knowledgeBaseKeyword, emailKeyword);
  }

  public int size() {
    return knowledgeBaseVector.size()
        + emailVector.size()
        + knowledgeBaseKeyword.size()
        + emailKeyword.size();
  }

  private static List<Candidate> concat(List<Candidate> first, List<Candidate> second) {
    List<Candidate> all = new ArrayList<>(first.size() + second.size());
    all.addAll(first);
    all.addAll(second);
    return all;
  }
}
