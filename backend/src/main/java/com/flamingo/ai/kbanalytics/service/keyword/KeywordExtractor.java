package com.flamingo.ai.kbanalytics.service.keyword;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;
import org.springframework.stereotype.Component;

/**
 * Term-frequency keyword extraction used to label clusters, compute trending keywords and find
 * keywords shared by similar documents.
 */
@Component
public class KeywordExtractor {

  // Common English stop words
  private static final Set<String> STOP_WORDS =
      Set.of(
          "a", "an", "and", "are", "as", "at", "be", "by", "for", "from", "has", "he", "in", "is",
          "it", "its", "of", "on", "or", "that", "the", "to", "was", "were", "will", "with", "this",
          "but", "they", "have", "had", "what", "when", "where", "who", "which", "why", "how",
          "all", "each", "every", "both", "few", "more", "most", "other", "some", "such", "no",
          "nor", "not", "only", "own", "same", "so", "than", "too", "very", "just", "can", "should",
          "now", "been", "being", "do", "does", "did", "doing", "would", "could", "might", "must",
          "shall", "may", "about", "above", "after", "again", "against", "before", "below",
          "between", "down", "during", "into", "over", "through", "under", "until", "up", "while",
          "am", "i", "me", "my", "we", "our", "you", "your", "him", "her", "them", "their", "if",
          "then", "also", "here", "there", "these", "those", "else", "any", "many", "much", "even",
          "use", "using", "used", "one", "two", "new", "get", "set");

  private static final Pattern NON_WORD = Pattern.compile("[^\\p{L}\\p{N}]+");

  /**
   * Splits text into lowercase word tokens.
   *
   * @param text the text, may be null
   * @return tokens in order of appearance, stop words included
   */
  public List<String> tokenize(String text) {
    if (text == null || text.isBlank()) {
      return List.of();
    }
    List<String> tokens = new ArrayList<>();
    for (String token : NON_WORD.split(text.toLowerCase())) {
      if (!token.isEmpty()) {
        tokens.add(token);
      }
    }
    return tokens;
  }

  /**
   * Tokens worth counting as keywords: stop words, pure numbers and terms shorter than three
   * characters (two for CJK) are dropped.
   */
  public List<String> significantTerms(String text) {
    return tokenize(text).stream().filter(KeywordExtractor::isSignificant).toList();
  }

  /**
   * Extracts top keywords using log-normalized term frequency.
   *
   * @param content the text content
   * @param topN number of keywords to return
   * @return keywords ordered by score descending, ties alphabetically
   */
  public List<String> extractKeywords(String content, int topN) {
    List<String> terms = significantTerms(content);
    if (terms.isEmpty() || topN <= 0) {
      return List.of();
    }

    Map<String, Integer> tf = new HashMap<>();
    for (String term : terms) {
      tf.merge(term, 1, Integer::sum);
    }

    int totalTerms = terms.size();
    Map<String, Double> scores = new HashMap<>();
    for (Map.Entry<String, Integer> entry : tf.entrySet()) {
      String term = entry.getKey();
      int freq = entry.getValue();

      double tfScore = 1 + Math.log(freq);
      // Longer terms tend to be more specific
      double lengthBonus = term.length() >= (isCjk(term) ? 3 : 6) ? 1.2 : 1.0;
      double frequencyPenalty = (double) freq / totalTerms > 0.1 && totalTerms > 20 ? 0.5 : 1.0;

      scores.put(term, tfScore * lengthBonus * frequencyPenalty);
    }

    return scores.entrySet().stream()
        .sorted(
            Map.Entry.<String, Double>comparingByValue()
                .reversed()
                .thenComparing(Map.Entry.comparingByKey()))
        .limit(topN)
        .map(Map.Entry::getKey)
        .toList();
  }

  private static boolean isSignificant(String term) {
    if (STOP_WORDS.contains(term) || term.chars().allMatch(Character::isDigit)) {
      return false;
    }
    return term.length() >= (isCjk(term) ? 2 : 3);
  }

  private static boolean isCjk(String term) {
    return term.chars()
        .anyMatch(
            c -> Character.UnicodeBlock.of(c) == Character.UnicodeBlock.CJK_UNIFIED_IDEOGRAPHS);
  }
}
