package com.flamingo.ai.messagesearch.service.embedding;

import com.flamingo.ai.messagesearch.config.SemanticSearchConfig;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Turns text into fixed-size TF-IDF vectors using feature hashing.
 *
 * <p>Each distinct token weighs {@code tf(t) * idf(t)} and lands in bucket {@code
 * floorMod(t.hashCode(), dimension)}. {@link String#hashCode()} is specified by the language, so
 * bucket assignment is identical across processes and platforms. Colliding terms add up. The
 * vector is then scaled to unit length, or left at zero when no token survived tokenization.
 */
@Service
@Slf4j
public class EmbeddingGenerator {

  private static final String SEPARATOR = ",";

  private final Tokenizer tokenizer;
  private final MeterRegistry meterRegistry;
  private final int dimension;

  public EmbeddingGenerator(
      Tokenizer tokenizer, SemanticSearchConfig config, MeterRegistry meterRegistry) {
    this.tokenizer = tokenizer;
    this.meterRegistry = meterRegistry;
    this.dimension = config.getEmbedding().getDimension();
  }

  /**
   * Generates the embedding of a text against a corpus snapshot.
   *
   * @param text the text to embed, may be null or empty
   * @param statistics corpus statistics supplying idf weights
   * @return a vector of {@link #getDimension()} components with unit norm, or all zeros
   */
  public float[] embed(String text, CorpusStatistics statistics) {
    List<String> tokens = tokenizer.tokenize(text);
    if (tokens.isEmpty()) {
      meterRegistry.counter("embedding.empty").increment();
      return new float[dimension];
    }

    // insertion order keeps the summation order, and therefore the bits, stable
    Map<String, Integer> termCounts = new LinkedHashMap<>();
    for (String token : tokens) {
      termCounts.merge(token, 1, Integer::sum);
    }

    double[] accumulator = new double[dimension];
    double totalTokens = tokens.size();
    for (Map.Entry<String, Integer> entry : termCounts.entrySet()) {
      double tf = entry.getValue() / totalTokens;
      double weight = tf * statistics.idf(entry.getKey());
      accumulator[bucket(entry.getKey())] += weight;
    }

    double norm = 0.0;
    for (double v : accumulator) {
      norm += v * v;
    }
    norm = Math.sqrt(norm);

    float[] vector = new float[dimension];
    if (norm > 0.0) {
      for (int i = 0; i < dimension; i++) {
        vector[i] = (float) (accumulator[i] / norm);
      }
    }
    meterRegistry.counter("embedding.generated").increment();
    return vector;
  }

  /** Hash bucket of a term. Always within {@code [0, dimension)}. */
  public int bucket(String term) {
    return Math.floorMod(term.hashCode(), dimension);
  }

  /** Serializes a vector as comma-separated decimal floats. */
  public String toStorageForm(float[] vector) {
    StringBuilder sb = new StringBuilder(vector.length * 12);
    for (int i = 0; i < vector.length; i++) {
      if (i > 0) {
        sb.append(SEPARATOR);
      }
      sb.append(vector[i]);
    }
    return sb.toString();
  }

  /**
   * Parses a stored vector.
   *
   * @param stored the stored text, may be null
   * @return the vector, or empty when the text is missing, malformed, non-finite or of the wrong
   *     dimension
   */
  public Optional<float[]> fromStorageForm(String stored) {
    if (stored == null || stored.isBlank()) {
      return Optional.empty();
    }
    String[] parts = stored.split(SEPARATOR, -1);
    if (parts.length != dimension) {
      log.debug("Stored embedding has {} components, expected {}", parts.length, dimension);
      return Optional.empty();
    }
    float[] vector = new float[dimension];
    try {
      for (int i = 0; i < parts.length; i++) {
        float value = Float.parseFloat(parts[i].trim());
        if (!Float.isFinite(value)) {
          return Optional.empty();
        }
        vector[i] = value;
      }
    } catch (NumberFormatException e) {
      log.debug("Unparseable stored embedding: {}", e.getMessage());
      return Optional.empty();
    }
    return Optional.of(vector);
  }

  public int getDimension() {
    return dimension;
  }
}
