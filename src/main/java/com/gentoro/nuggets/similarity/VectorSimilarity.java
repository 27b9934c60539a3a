package com.gentoro.nuggets.similarity;

import com.gentoro.nuggets.exception.VectorSimilarityException;
import com.gentoro.nuggets.exception.VectorSimilarityException.Kind;
import java.util.ArrayList;
import java.util.List;

/**
 * Cosine similarity over embedding vectors.
 *
 * <p>Malformed input (dimension mismatch, empty vectors, NaN or infinite components) is a
 * programmer error and raises {@link VectorSimilarityException}. Lookups over many candidates skip
 * the malformed ones instead of failing the whole batch.
 */
public final class VectorSimilarity {
  private static final org.slf4j.Logger log =
      com.gentoro.nuggets.logging.LoggingService.getLogger(VectorSimilarity.class);

  private VectorSimilarity() {}

  /** Cosine similarity in {@code [-1, 1]}; a zero-magnitude vector yields 0. */
  public static double cosine(double[] u, double[] v) {
    check(u, v);
    double dot = 0.0;
    double normU = 0.0;
    double normV = 0.0;
    for (int i = 0; i < u.length; i++) {
      dot += u[i] * v[i];
      normU += u[i] * u[i];
      normV += v[i] * v[i];
    }
    if (normU == 0.0 || normV == 0.0) {
      return 0.0;
    }
    double result = dot / (Math.sqrt(normU) * Math.sqrt(normV));
    return Math.max(-1.0, Math.min(1.0, result));
  }

  /**
   * Pairwise cosine of {@code us[i]} and {@code vs[i]}. Fails on the first invalid pair, keeping
   * the original kind and reporting the pair index.
   */
  public static double[] batchCosine(List<double[]> us, List<double[]> vs) {
    if (us.size() != vs.size()) {
      throw new VectorSimilarityException(
          Kind.BATCH_SIZE_MISMATCH,
          "Batch sizes differ: %d vs %d".formatted(us.size(), vs.size()));
    }
    double[] out = new double[us.size()];
    for (int i = 0; i < out.length; i++) {
      try {
        out[i] = cosine(us.get(i), vs.get(i));
      } catch (VectorSimilarityException e) {
        throw new VectorSimilarityException(
            e.getKind(), "Pair %d: %s".formatted(i, e.getMessage()), i, e);
      }
    }
    return out;
  }

  /** Highest-scoring candidate at or above {@code threshold}. */
  public static SimilarityMatch findMostSimilar(
      double[] query, List<double[]> candidates, double threshold) {
    int bestIndex = -1;
    double best = Double.NEGATIVE_INFINITY;
    for (int i = 0; i < candidates.size(); i++) {
      double score;
      try {
        score = cosine(query, candidates.get(i));
      } catch (VectorSimilarityException e) {
        log.warn("Skipping candidate {}: {}", i, e.getMessage());
        continue;
      }
      if (score >= threshold && score > best) {
        best = score;
        bestIndex = i;
      }
    }
    return bestIndex < 0 ? SimilarityMatch.NONE : new SimilarityMatch(bestIndex, best, true);
  }

  /**
   * Greedy single-link clustering in index order. Each unclustered vector starts a group and
   * absorbs every later unclustered vector whose similarity to it is at least {@code threshold}.
   */
  public static List<List<Integer>> groupBySimilarity(List<double[]> vectors, double threshold) {
    List<List<Integer>> groups = new ArrayList<>();
    boolean[] used = new boolean[vectors.size()];
    for (int i = 0; i < vectors.size(); i++) {
      if (used[i]) continue;
      List<Integer> group = new ArrayList<>();
      group.add(i);
      used[i] = true;
      for (int j = i + 1; j < vectors.size(); j++) {
        if (used[j]) continue;
        try {
          if (cosine(vectors.get(i), vectors.get(j)) >= threshold) {
            group.add(j);
            used[j] = true;
          }
        } catch (VectorSimilarityException e) {
          log.warn("Skipping pair ({}, {}) while grouping: {}", i, j, e.getMessage());
        }
      }
      groups.add(List.copyOf(group));
    }
    return groups;
  }

  /** Unit vector in the direction of {@code v}; the zero vector is returned unchanged. */
  public static double[] normalize(double[] v) {
    checkVector(v, "vector");
    double norm = 0.0;
    for (double x : v) norm += x * x;
    if (norm == 0.0) return v.clone();
    norm = Math.sqrt(norm);
    double[] out = new double[v.length];
    for (int i = 0; i < v.length; i++) out[i] = v[i] / norm;
    return out;
  }

  /** Mean pairwise cosine similarity; fewer than two vectors are perfectly cohesive. */
  public static double groupCohesion(List<double[]> vectors) {
    if (vectors.size() < 2) return 1.0;
    double total = 0.0;
    int pairs = 0;
    for (int i = 0; i < vectors.size(); i++) {
      for (int j = i + 1; j < vectors.size(); j++) {
        total += cosine(vectors.get(i), vectors.get(j));
        pairs++;
      }
    }
    return total / pairs;
  }

  private static void check(double[] u, double[] v) {
    checkVector(u, "first vector");
    checkVector(v, "second vector");
    if (u.length != v.length) {
      throw new VectorSimilarityException(
          Kind.DIMENSION_MISMATCH,
          "Vector dimensions differ: %d vs %d".formatted(u.length, v.length));
    }
  }

  private static void checkVector(double[] v, String label) {
    if (v == null || v.length == 0) {
      throw new VectorSimilarityException(Kind.EMPTY_VECTOR, "The " + label + " is empty");
    }
    for (int i = 0; i < v.length; i++) {
      if (!Double.isFinite(v[i])) {
        throw new VectorSimilarityException(
            Kind.INVALID_COMPONENT,
            "The %s has a non-finite component at index %d: %s".formatted(label, i, v[i]));
      }
    }
  }
}
