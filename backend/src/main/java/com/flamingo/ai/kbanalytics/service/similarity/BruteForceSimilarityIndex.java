package com.flamingo.ai.kbanalytics.service.similarity;

import com.flamingo.ai.kbanalytics.service.vector.VectorMath;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import org.springframework.stereotype.Component;

/** Linear scan over the whole corpus; O(n) per query. */
@Component
public class BruteForceSimilarityIndex implements SimilarityIndex {

  /** Similarity descending, then document id ascending by its canonical string form. */
  public static final Comparator<SimilarityMatch> RANKING =
      Comparator.comparingDouble(SimilarityMatch::similarity)
          .reversed()
          .thenComparing(match -> match.documentId().toString());

  @Override
  public List<SimilarityMatch> topSimilar(
      float[] query, Collection<EmbeddedDocument> corpus, int limit, double minSimilarity) {
    if (limit <= 0 || corpus.isEmpty()) {
      return List.of();
    }

    List<SimilarityMatch> candidates = new ArrayList<>();
    for (EmbeddedDocument document : corpus) {
      double similarity = VectorMath.cosineSimilarity(query, document.vector());
      if (similarity >= minSimilarity) {
        candidates.add(new SimilarityMatch(document.documentId(), similarity));
      }
    }

    candidates.sort(RANKING);
    return candidates.size() > limit ? List.copyOf(candidates.subList(0, limit)) : candidates;
  }
}
