package com.gentoro.nuggets.orchestrator;

import com.gentoro.nuggets.exception.NuggetsException;
import com.gentoro.nuggets.exception.VectorSimilarityException;
import com.gentoro.nuggets.exception.VectorSimilarityException.Kind;
import com.gentoro.nuggets.model.NuggetType;
import com.gentoro.nuggets.model.RawCandidate;
import com.gentoro.nuggets.similarity.SimilarityMatch;
import com.gentoro.nuggets.similarity.TextEmbedder;
import com.gentoro.nuggets.similarity.VectorSimilarity;
import com.gentoro.nuggets.similarity.WordSimilarity;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Merges the candidates of several extraction runs into consensus groups.
 *
 * <p>Only candidates of the same type are compared. With an embedder, candidates are grouped by
 * cosine similarity of their embeddings and each group is represented by the member closest to the
 * group centroid. Without one, or when embedding fails, a candidate joins the first group whose
 * first member shares enough words with it. Groups are ordered by the number of runs that proposed
 * them, most supported first.
 */
public final class ConsensusBuilder {
  private static final org.slf4j.Logger log =
      com.gentoro.nuggets.logging.LoggingService.getLogger(ConsensusBuilder.class);

  /** How candidates were compared. */
  public enum Method {
    EMBEDDING,
    WORD_OVERLAP
  }

  /**
   * One consensus nugget.
   *
   * @param runsSupporting distinct runs with at least one member in the group
   * @param cohesion mean pairwise similarity of the members, 1 for a single member
   */
  public record Group(
      RawCandidate representative,
      List<RawCandidate> members,
      int runsSupporting,
      double cohesion) {
    public Group {
      members = List.copyOf(members);
    }
  }

  /** Groups of one consensus pass and the comparison actually used. */
  public record Consensus(List<Group> groups, Method method, int candidateCount) {
    public Consensus {
      groups = List.copyOf(groups);
    }

    public int duplicatesRemoved() {
      return candidateCount - groups.size();
    }
  }

  private record Vote(int run, RawCandidate candidate) {}

  private final TextEmbedder embedder;
  private final EnsembleOptions options;

  /**
   * @param embedder source of embeddings, or {@code null} to always compare by word overlap
   */
  public ConsensusBuilder(TextEmbedder embedder, EnsembleOptions options) {
    this.embedder = embedder;
    this.options = Objects.requireNonNull(options, "options");
  }

  /** Groups the candidates of {@code runs}; each list holds the output of one successful run. */
  public Consensus build(List<List<RawCandidate>> runs) {
    Map<NuggetType, List<Vote>> byType = new LinkedHashMap<>();
    int count = 0;
    for (int run = 0; run < runs.size(); run++) {
      for (RawCandidate candidate : runs.get(run)) {
        byType
            .computeIfAbsent(candidate.type(), t -> new ArrayList<>())
            .add(new Vote(run, candidate));
        count++;
      }
    }
    if (count == 0) {
      return new Consensus(List.of(), Method.WORD_OVERLAP, 0);
    }

    List<Group> groups = null;
    Method method = Method.WORD_OVERLAP;
    if (embedder != null && options.useEmbeddings()) {
      try {
        groups = groupByEmbedding(byType);
        method = Method.EMBEDDING;
      } catch (NuggetsException e) {
        log.warn("Embedding-based grouping failed, using word overlap: {}", e.getMessage());
      }
    }
    if (groups == null) {
      groups = groupByWordOverlap(byType);
    }

    groups.sort(Comparator.comparingInt(Group::runsSupporting).reversed());
    log.debug("Grouped {} candidate(s) into {} group(s) by {}", count, groups.size(), method);
    return new Consensus(groups, method, count);
  }

  private List<Group> groupByEmbedding(Map<NuggetType, List<Vote>> byType) {
    List<Group> groups = new ArrayList<>();
    for (List<Vote> votes : byType.values()) {
      List<String> texts = votes.stream().map(v -> v.candidate().fullContent()).toList();
      List<double[]> vectors = embedder.embed(texts);
      if (vectors.size() != votes.size()) {
        throw new VectorSimilarityException(
            Kind.BATCH_SIZE_MISMATCH,
            "Embedder returned %d vectors for %d texts".formatted(vectors.size(), votes.size()));
      }
      for (List<Integer> indexes :
          VectorSimilarity.groupBySimilarity(vectors, options.embeddingThreshold())) {
        List<Vote> members = indexes.stream().map(votes::get).toList();
        List<double[]> memberVectors = indexes.stream().map(vectors::get).toList();
        SimilarityMatch closest =
            VectorSimilarity.findMostSimilar(centroid(memberVectors), memberVectors, -1.0);
        Vote representative = members.get(closest.found() ? closest.index() : 0);
        groups.add(
            group(representative, members, VectorSimilarity.groupCohesion(memberVectors)));
      }
    }
    return groups;
  }

  private List<Group> groupByWordOverlap(Map<NuggetType, List<Vote>> byType) {
    List<Group> groups = new ArrayList<>();
    for (List<Vote> votes : byType.values()) {
      List<List<Vote>> clusters = new ArrayList<>();
      for (Vote vote : votes) {
        List<Vote> home = null;
        for (List<Vote> cluster : clusters) {
          if (overlap(cluster.get(0), vote) >= options.wordOverlapThreshold()) {
            home = cluster;
            break;
          }
        }
        if (home == null) {
          home = new ArrayList<>();
          clusters.add(home);
        }
        home.add(vote);
      }
      for (List<Vote> cluster : clusters) {
        groups.add(group(cluster.get(0), cluster, wordCohesion(cluster)));
      }
    }
    return groups;
  }

  private static Group group(Vote representative, List<Vote> members, double cohesion) {
    Set<Integer> runs = new HashSet<>();
    for (Vote v : members) runs.add(v.run());
    return new Group(
        representative.candidate(),
        members.stream().map(Vote::candidate).toList(),
        runs.size(),
        cohesion);
  }

  private static double overlap(Vote a, Vote b) {
    return WordSimilarity.overlap(a.candidate().fullContent(), b.candidate().fullContent());
  }

  private static double wordCohesion(List<Vote> members) {
    if (members.size() < 2) return 1.0;
    double total = 0.0;
    int pairs = 0;
    for (int i = 0; i < members.size(); i++) {
      for (int j = i + 1; j < members.size(); j++) {
        total += overlap(members.get(i), members.get(j));
        pairs++;
      }
    }
    return total / pairs;
  }

  private static double[] centroid(List<double[]> vectors) {
    double[] sum = new double[vectors.get(0).length];
    for (double[] v : vectors) {
      double[] unit = VectorSimilarity.normalize(v);
      for (int i = 0; i < sum.length && i < unit.length; i++) sum[i] += unit[i];
    }
    return sum;
  }
}
