package dev.loom.ragconfig;

import dev.loom.fusion.CombineMethod;
import dev.loom.fusion.FusionMethod;
import dev.loom.fusion.FusionSettings;
import dev.loom.fusion.NormalizationMethod;
import dev.loom.scoring.DecayOptions;
import jakarta.annotation.PostConstruct;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * System-wide retrieval defaults, bound from {@code loom.rag.*}.
 *
 * <p>Every field can be overridden per knowledge base through the {@code rag_config} document, see
 * {@link RagConfigOverrides}. Notable defaults:
 *
 * <ul>
 *   <li>{@code knowledge-base-threshold} 0.20 and {@code email-threshold} 0.50, applied after
 *       fusion
 *   <li>{@code fusion-method} weighted, {@code vector-weight} 0.6, {@code keyword-weight} 0.4
 *   <li>{@code max-email-ratio} 0.2 and {@code max-knowledge-base-ratio} 0.8
 * </ul>
 *
 * <p>Validated at startup via {@link #validate()} by building a {@link RagConfig} from the
 * defaults; the application fails to start if any value is out of range.
 */
@Configuration
@ConfigurationProperties(prefix = "loom.rag")
public class RagProperties {
  private double knowledgeBaseThreshold = 0.20;
  private double emailThreshold = 0.50;
  private int maxResults = 5;
  private boolean hybridSearchEnabled = true;
  private FusionMethod fusionMethod = FusionMethod.WEIGHTED;
  private double vectorWeight = 0.6;
  private double keywordWeight = 0.4;
  private int rrfK = FusionSettings.DEFAULT_RRF_K;
  private NormalizationMethod normalizationMethod = NormalizationMethod.MIN_MAX;
  private CombineMethod combineMethod = CombineMethod.MAX;
  private boolean adaptiveWeights = false;
  private boolean rerankingEnabled = true;
  private boolean useDiversityFilter = true;
  private double diversityThreshold = 0.85;
  private boolean useMmr = false;
  private double mmrLambda = 0.7;
  private boolean semanticBoostEnabled = true;
  private double maxBoost = 0.05;
  private double minBoostThreshold = 0.30;
  private boolean dynamicBoostEnabled = false;
  private boolean temporalDecayEnabled = true;
  private double decayHalfLifeDays = DecayOptions.DEFAULT_HALF_LIFE_DAYS;
  private double minDecay = DecayOptions.DEFAULT_MIN_DECAY;
  private boolean ensembleBalancingEnabled = true;
  private double maxEmailRatio = 0.2;
  private double maxKnowledgeBaseRatio = 0.8;
  private int minEmailResults = 1;
  private int minKnowledgeBaseResults = 1;
  private boolean contextInjectionEnabled = true;
  private boolean hydeEnabled = false;
  private boolean multiQueryEnabled = false;
  private int variantCount = 3;
  private int maxHistoryTurns = 3;
  private boolean fallbackOnError = true;

  /** Validates configuration at startup. Throws if values are out of allowed range. */
  @PostConstruct
  void validate() {
    try {
      RagConfigResolver.apply("defaults", this, RagConfigOverrides.empty());
    } catch (IllegalArgumentException e) {
      throw new IllegalStateException("Invalid loom.rag configuration: " + e.getMessage(), e);
    }
  }

  public double getKnowledgeBaseThreshold() {
    return knowledgeBaseThreshold;
  }

  public void setKnowledgeBaseThreshold(double knowledgeBaseThreshold) {
    this.knowledgeBaseThreshold = knowledgeBaseThreshold;
  }

  public double getEmailThreshold() {
    return emailThreshold;
  }

  public void setEmailThreshold(double emailThreshold) {
    this.emailThreshold = emailThreshold;
  }

  public int getMaxResults() {
    return maxResults;
  }

  public void setMaxResults(int maxResults) {
    this.maxResults = maxResults;
  }

  public boolean isHybridSearchEnabled() {
    return hybridSearchEnabled;
  }

  public void setHybridSearchEnabled(boolean hybridSearchEnabled) {
    this.hybridSearchEnabled = hybridSearchEnabled;
  }

  public FusionMethod getFusionMethod() {
    return fusionMethod;
  }

  public void setFusionMethod(FusionMethod fusionMethod) {
    this.fusionMethod = fusionMethod;
  }

  public double getVectorWeight() {
    return vectorWeight;
  }

  public void setVectorWeight(double vectorWeight) {
    this.vectorWeight = vectorWeight;
  }

  public double getKeywordWeight() {
    return keywordWeight;
  }

  public void setKeywordWeight(double keywordWeight) {
    this.keywordWeight = keywordWeight;
  }

  public int getRrfK() {
    return rrfK;
  }

  public void setRrfK(int rrfK) {
    this.rrfK = rrfK;
  }

  public NormalizationMethod getNormalizationMethod() {
    return normalizationMethod;
  }

  public void setNormalizationMethod(NormalizationMethod normalizationMethod) {
    this.normalizationMethod = normalizationMethod;
  }

  public CombineMethod getCombineMethod() {
    return combineMethod;
  }

  public void setCombineMethod(CombineMethod combineMethod) {
    this.combineMethod = combineMethod;
  }

  public boolean isAdaptiveWeights() {
    return adaptiveWeights;
  }

  public void setAdaptiveWeights(boolean adaptiveWeights) {
    this.adaptiveWeights = adaptiveWeights;
  }

  public boolean isRerankingEnabled() {
    return rerankingEnabled;
  }

  public void setRerankingEnabled(boolean rerankingEnabled) {
    this.rerankingEnabled = rerankingEnabled;
  }

  public boolean isUseDiversityFilter() {
    return useDiversityFilter;
  }

  public void setUseDiversityFilter(boolean useDiversityFilter) {
    this.useDiversityFilter = useDiversityFilter;
  }

  public double getDiversityThreshold() {
    return diversityThreshold;
  }

  public void setDiversityThreshold(double diversityThreshold) {
    this.diversityThreshold = diversityThreshold;
  }

  public boolean isUseMmr() {
    return useMmr;
  }

  public void setUseMmr(boolean useMmr) {
    this.useMmr = useMmr;
  }

  public double getMmrLambda() {
    return mmrLambda;
  }

  public void setMmrLambda(double mmrLambda) {
    this.mmrLambda = mmrLambda;
  }

  public boolean isSemanticBoostEnabled() {
    return semanticBoostEnabled;
  }

  public void setSemanticBoostEnabled(boolean semanticBoostEnabled) {
    this.semanticBoostEnabled = semanticBoostEnabled;
  }

  public double getMaxBoost() {
    return maxBoost;
  }

  public void setMaxBoost(double maxBoost) {
    this.maxBoost = maxBoost;
  }

  public double getMinBoostThreshold() {
    return minBoostThreshold;
  }

  public void setMinBoostThreshold(double minBoostThreshold) {
    this.minBoostThreshold = minBoostThreshold;
  }

  public boolean isDynamicBoostEnabled() {
    return dynamicBoostEnabled;
  }

  public void setDynamicBoostEnabled(boolean dynamicBoostEnabled) {
    this.dynamicBoostEnabled = dynamicBoostEnabled;
  }

  public boolean isTemporalDecayEnabled() {
    return temporalDecayEnabled;
  }

  public void setTemporalDecayEnabled(boolean temporalDecayEnabled) {
    this.temporalDecayEnabled = temporalDecayEnabled;
  }

  public double getDecayHalfLifeDays() {
    return decayHalfLifeDays;
  }

  public void setDecayHalfLifeDays(double decayHalfLifeDays) {
    this.decayHalfLifeDays = decayHalfLifeDays;
  }

  public double getMinDecay() {
    return minDecay;
  }

  public void setMinDecay(double minDecay) {
    this.minDecay = minDecay;
  }

  public boolean isEnsembleBalancingEnabled() {
    return ensembleBalancingEnabled;
  }

  public void setEnsembleBalancingEnabled(boolean ensembleBalancingEnabled) {
    this.ensembleBalancingEnabled = ensembleBalancingEnabled;
  }

  public double getMaxEmailRatio() {
    return maxEmailRatio;
  }

  public void setMaxEmailRatio(double maxEmailRatio) {
    this.maxEmailRatio = maxEmailRatio;
  }

  public double getMaxKnowledgeBaseRatio() {
    return maxKnowledgeBaseRatio;
  }

  public void setMaxKnowledgeBaseRatio(double maxKnowledgeBaseRatio) {
    this.maxKnowledgeBaseRatio = maxKnowledgeBaseRatio;
  }

  public int getMinEmailResults() {
    return minEmailResults;
  }

  public void setMinEmailResults(int minEmailResults) {
    this.minEmailResults = minEmailResults;
  }

  public int getMinKnowledgeBaseResults() {
    return minKnowledgeBaseResults;
  }

  public void setMinKnowledgeBaseResults(int minKnowledgeBaseResults) {
    this.minKnowledgeBaseResults = minKnowledgeBaseResults;
  }

  public boolean isContextInjectionEnabled() {
    return contextInjectionEnabled;
  }

  public void setContextInjectionEnabled(boolean contextInjectionEnabled) {
    this.contextInjectionEnabled = contextInjectionEnabled;
  }

  public boolean isHydeEnabled() {
    return hydeEnabled;
  }

  public void setHydeEnabled(boolean hydeEnabled) {
    this.hydeEnabled = hydeEnabled;
  }

  public boolean isMultiQueryEnabled() {
    return multiQueryEnabled;
  }

  public void setMultiQueryEnabled(boolean multiQueryEnabled) {
    this.multiQueryEnabled = multiQueryEnabled;
  }

  public int getVariantCount() {
    return variantCount;
  }

  public void setVariantCount(int variantCount) {
    this.variantCount = variantCount;
  }

  public int getMaxHistoryTurns() {
    return maxHistoryTurns;
  }

  public void setMaxHistoryTurns(int maxHistoryTurns) {
    this.maxHistoryTurns = maxHistoryTurns;
  }

  public boolean isFallbackOnError() {
    return fallbackOnError;
  }

  public void setFallbackOnError(boolean fallbackOnError) {
    this.fallbackOnError = fallbackOnError;
  }
}
