package dev.loom.query;

/** Single-prompt text generation used by query enhancement. */
public interface TextGenerator {

  /**
   * Generates a completion for {@code prompt}.
   *
   * @param prompt full prompt text
   * @param temperature sampling temperature
   * @param maxTokens upper bound on generated tokens
   * @return the generated text, untrimmed
   * @throws RuntimeException when the provider fails after its own retries
   */
  String generate(String prompt, double temperature, int maxTokens);
}
