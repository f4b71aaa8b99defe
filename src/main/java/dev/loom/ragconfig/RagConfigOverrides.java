package dev.loom.ragconfig;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.jspecify.annotations.Nullable;

/**
 * Partial retrieval configuration as stored in {@code knowledge_bases.rag_config} or passed
 * explicitly by a caller. A {@code null} field inherits the next layer; unknown keys are ignored.
 *
 * <p>JSON keys are camelCase and keep the historical names {@code bm25Weight}, {@code useMMR},
 * {@code maxKBRatio} and {@code minKBResults}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record RagConfigOverrides(
    @Nullable Double knowledgeBaseThreshold,
    @Nullable Double emailThreshold,
    @Nullable Integer maxResults,
    @Nullable Boolean hybridSearchEnabled,
    @Nullable String fusionMethod,
    @Nullable Double vectorWeight,
    @JsonProperty("bm25Weight") @JsonAlias("keywordWeight") @Nullable Double keywordWeight,
    @Nullable Integer rrfK,
    @Nullable String normalizationMethod,
    @Nullable String combineMethod,
    @Nullable Boolean adaptiveWeights,
    @Nullable Boolean rerankingEnabled,
    @Nullable Boolean useDiversityFilter,
    @Nullable Double diversityThreshold,
    @JsonProperty("useMMR") @Nullable Boolean useMmr,
    @Nullable Double mmrLambda,
    @Nullable Boolean semanticBoostEnabled,
    @Nullable Double maxBoost,
    @Nullable Double minBoostThreshold,
    @Nullable Boolean dynamicBoostEnabled,
    @Nullable Boolean temporalDecayEnabled,
    @Nullable Double decayHalfLifeDays,
    @Nullable Double minDecay,
    @Nullable Boolean ensembleBalancingEnabled,
    @Nullable Double maxEmailRatio,
    @JsonProperty("maxKBRatio") @JsonAlias("maxKnowledgeBaseRatio")
        @Nullable Double maxKnowledgeBaseRatio,
    @Nullable Integer minEmailResults,
    @JsonProperty("minKBResults") @JsonAlias("minKnowledgeBaseResults")
        @Nullable Integer minKnowledgeBaseResults,
    @Nullable Boolean contextInjectionEnabled,
    @Nullable Boolean hydeEnabled,
    @Nullable Boolean multiQueryEnabled,
    @Nullable Integer variantCount,
    @Nullable Integer maxHistoryTurns,
    @Nullable Boolean fallbackOnError) {

  private static final RagConfigOverrides EMPTY =
      new RagConfigOverrides(
          null, null, null, null, null, null, null, null, null, null, null, null, null,
          null, null, null, null, null, null, null, null, null, null, null, null, null,
          null, null, null, null, null, null, null, null);

  public static RagConfigOverrides empty() {
    return EMPTY;
  }

  /** Overrides that only set {@code maxResults}. */
  public static RagConfigOverrides ofMaxResults(int maxResults) {
    return new RagConfigOverrides(
        null, null, maxResults, null, null, null, null, null, null, null, null, null,
        null, null, null, null, null, null, null, null, null, null, null, null, null,
        null, null, null, null, null, null, null, null, null);
  }

  /** Returns overrides where every field set here wins over the one in {@code lower}. */
  public RagConfigOverrides over(RagConfigOverrides lower) {
    return new RagConfigOverrides(
        first(knowledgeBaseThreshold, lower.knowledgeBaseThreshold),
        first(emailThreshold, lower.emailThreshold),
        first(maxResults, lower.maxResults),
        first(hybridSearchEnabled, lower.hybridSearchEnabled),
        first(fusionMethod, lower.fusionMethod),
        first(vectorWeight, lower.vectorWeight),
        first(keywordWeight, lower.keywordWeight),
        first(rrfK, lower.rrfK),
        first(normalizationMethod, lower.normalizationMethod),
        first(combineMethod, lower.combineMethod),
        first(adaptiveWeights, lower.adaptiveWeights),
        first(rerankingEnabled, lower.rerankingEnabled),
        first(useDiversityFilter, lower.useDiversityFilter),
        first(diversityThreshold, lower.diversityThreshold),
        first(useMmr, lower.useMmr),
        first(mmrLambda, lower.mmrLambda),
        first(semanticBoostEnabled, lower.semanticBoostEnabled),
        first(maxBoost, lower.maxBoost),
        first(minBoostThreshold, lower.minBoostThreshold),
        first(dynamicBoostEnabled, lower.dynamicBoostEnabled),
        first(temporalDecayEnabled, lower.temporalDecayEnabled),
        first(decayHalfLifeDays, lower.decayHalfLifeDays),
        first(minDecay, lower.minDecay),
        first(ensembleBalancingEnabled, lower.ensembleBalancingEnabled),
        first(maxEmailRatio, lower.maxEmailRatio),
        first(maxKnowledgeBaseRatio, lower.maxKnowledgeBaseRatio),
        first(minEmailResults, lower.minEmailResults),
        first(minKnowledgeBaseResults, lower.minKnowledgeBaseResults),
        first(contextInjectionEnabled, lower.contextInjectionEnabled),
        first(hydeEnabled, lower.hydeEnabled),
        first(multiQueryEnabled, lower.multiQueryEnabled),
        first(variantCount, lower.variantCount),
        first(maxHistoryTurns, lower.maxHistoryTurns),
        first(fallbackOnError, lower.fallbackOnError));
  }

  private static <T> @Nullable T first(@Nullable T preferred, @Nullable T fallback) {
    return preferred != null ? preferred : fallback;
  }
}
