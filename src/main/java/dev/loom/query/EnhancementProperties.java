package dev.loom.query;

import jakarta.annotation.PostConstruct;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Prompt templates and sampling parameters for query enhancement.
 *
 * <p>Bound from {@code loom.enhancement.*}. Templates use the placeholders {@code {{QUERY}}},
 * {@code {{HISTORY}}} (context injection) and {@code {{COUNT}}} (multi-query).
 *
 * <ul>
 *   <li>{@code context-injection} - temperature 0.3, 150 tokens
 *   <li>{@code hyde} - temperature 0.7, 300 tokens
 *   <li>{@code multi-query} - temperature 0.8, 200 tokens
 * </ul>
 *
 * <p>Which steps run is decided per knowledge base, see {@link EnhancementOptions}.
 */
@Configuration
@ConfigurationProperties(prefix = "loom.enhancement")
public class EnhancementProperties {

  static final String CONTEXT_INJECTION_TEMPLATE =
      """
      Given the conversation history and current question, rephrase the question to be \
      standalone and include relevant context:

      Conversation history:
      {{HISTORY}}

      Current question: {{QUERY}}

      Rephrased standalone question:""";

  static final String HYDE_TEMPLATE =
      """
      Given the following question, write a detailed hypothetical answer that would perfectly \
      answer this question:

      Question: {{QUERY}}

      Write a detailed, informative answer (2-3 paragraphs):""";

  static final String MULTI_QUERY_TEMPLATE =
      """
      You are a helpful expert. Generate {{COUNT}} different versions of the following question \
      to retrieve relevant documents from a knowledge base. Each version should capture the same \
      intent but use different wording or perspective.

      Original question: {{QUERY}}

      Provide the variations as a JSON array of strings.""";

  private Step contextInjection = new Step(CONTEXT_INJECTION_TEMPLATE, 0.3, 150);
  private Step hyde = new Step(HYDE_TEMPLATE, 0.7, 300);
  private Step multiQuery = new Step(MULTI_QUERY_TEMPLATE, 0.8, 200);

  /** Validates configuration at startup. Throws if a step is misconfigured. */
  @PostConstruct
  void validate() {
    contextInjection.validate("context-injection", "{{QUERY}}", "{{HISTORY}}");
    hyde.validate("hyde", "{{QUERY}}");
    multiQuery.validate("multi-query", "{{QUERY}}", "{{COUNT}}");
  }

  public Step getContextInjection() {
    return contextInjection;
  }

  public void setContextInjection(Step contextInjection) {
    this.contextInjection = contextInjection;
  }

  public Step getHyde() {
    return hyde;
  }

  public void setHyde(Step hyde) {
    this.hyde = hyde;
  }

  public Step getMultiQuery() {
    return multiQuery;
  }

  public void setMultiQuery(Step multiQuery) {
    this.multiQuery = multiQuery;
  }

  /** Prompt template and sampling parameters of one enhancement step. */
  public static class Step {

    private String template;
    private double temperature;
    private int maxTokens;

    public Step() {
      this("", 0.0, 1);
    }

    public Step(String template, double temperature, int maxTokens) {
      this.template = template;
      this.temperature = temperature;
      this.maxTokens = maxTokens;
    }

    void validate(String name, String... placeholders) {
      for (String placeholder : placeholders) {
        if (template == null || !template.contains(placeholder)) {
          throw new IllegalStateException(
              "loom.enhancement." + name + ".template must contain " + placeholder);
        }
      }
      if (temperature < 0.0 || temperature > 2.0) {
        throw new IllegalStateException(
            "loom.enhancement." + name + ".temperature must be in [0.0, 2.0], got: " + temperature);
      }
      if (maxTokens < 1) {
        throw new IllegalStateException(
            "loom.enhancement." + name + ".max-tokens must be >= 1, got: " + maxTokens);
      }
    }

    public String getTemplate() {
      return template;
    }

    public void setTemplate(String template) {
      this.template = template;
    }

    public double getTemperature() {
      return temperature;
    }

    public void setTemperature(double temperature) {
      this.temperature = temperature;
    }

    public int getMaxTokens() {
      return maxTokens;
    }

    public void setMaxTokens(int maxTokens) {
      this.maxTokens = maxTokens;
    }
  }
}
