package dev.loom.ragconfig;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.loom.balance.BalanceOptions;
import dev.loom.fusion.CombineMethod;
import dev.loom.fusion.FusionMethod;
import dev.loom.fusion.FusionSettings;
import dev.loom.fusion.FusionWeights;
import dev.loom.fusion.NormalizationMethod;
import dev.loom.query.EnhancementOptions;
import dev.loom.rerank.RerankOptions;
import dev.loom.scoring.DecayOptions;
import java.util.Optional;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Resolves the {@link RagConfig} of a knowledge base.
 *
 * <p>Layers, highest first: explicit caller overrides, the stored {@code rag_config} document,
 * {@link RagProperties} defaults. A stored document that cannot be read, or whose values are out
 * of range, is ignored with a warning. Invalid explicit overrides are the caller's error and throw
 * {@link IllegalArgumentException}.
 */
@Service
public class RagConfigResolver {

  private static final Logger log = LoggerFactory.getLogger(RagConfigResolver.class);

  private final KnowledgeBaseRepository knowledgeBaseRepository;
  private final RagProperties defaults;
  private final ObjectMapper objectMapper;

  public RagConfigResolver(
      KnowledgeBaseRepository knowledgeBaseRepository,
      RagProperties defaults,
      ObjectMapper objectMapper) {
    this.knowledgeBaseRepository = knowledgeBaseRepository;
    this.defaults = defaults;
    this.objectMapper = objectMapper;
  }

  public RagConfig resolve(String knowledgeBaseId) {
    return resolve(knowledgeBaseId, RagConfigOverrides.empty());
  }

  /**
   * Resolves the configuration of {@code knowledgeBaseId} with {@code explicit} on top.
   *
   * @throws IllegalArgumentException if {@code explicit} holds an out-of-range value
   */
  public RagConfig resolve(String knowledgeBaseId, RagConfigOverrides explicit) {
    Optional<RagConfigOverrides> stored = loadStored(knowledgeBaseId);
    if (stored.isPresent()) {
      try {
        return apply(knowledgeBaseId, defaults, explicit.over(stored.get()));
      } catch (IllegalArgumentException e) {
        log.warn(
            "Stored rag_config of knowledge base {} is invalid, using defaults: {}",
            knowledgeBaseId,
            e.getMessage());
      }
    }
    return apply(knowledgeBaseId, defaults, explicit);
  }

  private Optional<RagConfigOverrides> loadStored(String knowledgeBaseId) {
    String document;
    try {
      document =
          knowledgeBaseRepository
              .findById(knowledgeBaseId)
              .map(KnowledgeBase::getRagConfig)
              .orElse(null);
    } catch (RuntimeException e) {
      log.warn(
          "Could not load rag_config of knowledge base {}, using defaults: {}",
          knowledgeBaseId,
          e.getMessage());
      return Optional.empty();
    }
    if (document == null || document.isBlank()) {
      return Optional.empty();
    }
    try {
      return Optional.ofNullable(objectMapper.readValue(document, RagConfigOverrides.class));
    } catch (JsonProcessingException e) {
      log.warn(
          "Unreadable rag_config of knowledge base {}, using defaults: {}",
          knowledgeBaseId,
          e.getOriginalMessage());
      return Optional.empty();
    }
  }

  /**
   * Builds a config from {@code defaults} with every non-null field of {@code overrides} applied.
   *
   * @throws IllegalArgumentException if a resulting value is out of range or an enum name is
   *     unknown
   */
  static RagConfig apply(String knowledgeBaseId, RagProperties defaults, RagConfigOverrides o) {
    FusionSettings fusion =
        new FusionSettings(
            or(o.hybridSearchEnabled(), defaults.isHybridSearchEnabled()),
            o.fusionMethod() != null
                ? FusionMethod.fromValue(o.fusionMethod())
                : defaults.getFusionMethod(),
            or(o.rrfK(), defaults.getRrfK()),
            new FusionWeights(
                or(o.vectorWeight(), defaults.getVectorWeight()),
                or(o.keywordWeight(), defaults.getKeywordWeight())),
            o.normalizationMethod() != null
                ? NormalizationMethod.fromValue(o.normalizationMethod())
                : defaults.getNormalizationMethod(),
            o.combineMethod() != null
                ? CombineMethod.fromValue(o.combineMethod())
                : defaults.getCombineMethod(),
            or(o.adaptiveWeights(), defaults.isAdaptiveWeights()));

    RerankOptions rerank =
        new RerankOptions(
            or(o.rerankingEnabled(), defaults.isRerankingEnabled()),
            or(o.semanticBoostEnabled(), defaults.isSemanticBoostEnabled()),
            or(o.maxBoost(), defaults.getMaxBoost()),
            or(o.minBoostThreshold(), defaults.getMinBoostThreshold()),
            or(o.dynamicBoostEnabled(), defaults.isDynamicBoostEnabled()),
            or(o.useMmr(), defaults.isUseMmr()),
            or(o.mmrLambda(), defaults.getMmrLambda()),
            or(o.useDiversityFilter(), defaults.isUseDiversityFilter()),
            or(o.diversityThreshold(), defaults.getDiversityThreshold()));

    DecayOptions decay =
        new DecayOptions(
            or(o.temporalDecayEnabled(), defaults.isTemporalDecayEnabled()),
            or(o.decayHalfLifeDays(), defaults.getDecayHalfLifeDays()),
            or(o.minDecay(), defaults.getMinDecay()));

    BalanceOptions balance =
        new BalanceOptions(
            or(o.ensembleBalancingEnabled(), defaults.isEnsembleBalancingEnabled()),
            or(o.maxEmailRatio(), defaults.getMaxEmailRatio()),
            or(o.maxKnowledgeBaseRatio(), defaults.getMaxKnowledgeBaseRatio()),
            or(o.minEmailResults(), defaults.getMinEmailResults()),
            or(o.minKnowledgeBaseResults(), defaults.getMinKnowledgeBaseResults()));

    EnhancementOptions enhancement =
        new EnhancementOptions(
            or(o.contextInjectionEnabled(), defaults.isContextInjectionEnabled()),
            or(o.hydeEnabled(), defaults.isHydeEnabled()),
            or(o.multiQueryEnabled(), defaults.isMultiQueryEnabled()),
            or(o.variantCount(), defaults.getVariantCount()),
            or(o.maxHistoryTurns(), defaults.getMaxHistoryTurns()),
            or(o.fallbackOnError(), defaults.isFallbackOnError()));

    return new RagConfig(
        knowledgeBaseId,
        or(o.knowledgeBaseThreshold(), defaults.getKnowledgeBaseThreshold()),
        or(o.emailThreshold(), defaults.getEmailThreshold()),
        or(o.maxResults(), defaults.getMaxResults()),
        fusion,
        rerank,
        decay,
        balance,
        enhancement);
  }

  private static <T> T or(@Nullable T value, T fallback) {
    return value != null ? value : fallback;
  }
}
