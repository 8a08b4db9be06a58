package com.flamingo.ai.kbanalytics.service.similarity;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.flamingo.ai.kbanalytics.config.AnalyticsConfig;
import com.flamingo.ai.kbanalytics.exception.AnalyticsValidationException;
import com.flamingo.ai.kbanalytics.exception.DocumentNotFoundException;
import com.flamingo.ai.kbanalytics.exception.EmbeddingNotFoundException;
import com.flamingo.ai.kbanalytics.service.corpus.CorpusService;
import com.flamingo.ai.kbanalytics.service.corpus.DocumentProfile;
import com.flamingo.ai.kbanalytics.service.keyword.KeywordExtractor;
import java.util.List;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
@DisplayName("SimilarDocumentServiceImpl Tests")
class SimilarDocumentServiceImplTest {

  @Mock private CorpusService corpusService;

  private SimilarDocumentServiceImpl similarDocumentService;

  private DocumentProfile doc1;
  private DocumentProfile doc2;
  private DocumentProfile doc3;
  private DocumentProfile doc4;
  private DocumentProfile unembedded;

  @BeforeEach
  void setUp() {
    similarDocumentService =
        new SimilarDocumentServiceImpl(
            corpusService,
            new BruteForceSimilarityIndex(),
            new KeywordExtractor(),
            new AnalyticsConfig());

    doc1 =
        profile(1, "Postgres replication", "Streaming replication setup", new float[] {1f, 0f})
            .topics(List.of("Replication"))
            .build();
    doc2 =
        profile(2, "Replica lag", "Replication lag alerts", new float[] {0.9f, 0.1f})
            .topics(List.of("replication", "Monitoring"))
            .build();
    doc3 = profile(3, "Team offsite", "Agenda and venue", new float[] {0f, 1f}).build();
    doc4 = profile(4, "Opposite", "Nothing in common", new float[] {-1f, 0f}).build();
    unembedded = profile(5, "Draft", "Replication notes", null).build();
  }

  @Nested
  @DisplayName("Ranking")
  class Ranking {

    @Test
    @DisplayName("Should return only documents above the similarity floor")
    void shouldFilterBySimilarity() {
      when(corpusService.getProfile(doc1.documentId())).thenReturn(doc1);
      when(corpusService.getProfiles(null)).thenReturn(List.of(doc1, doc2, doc3, doc4, unembedded));

      List<DocumentSimilarity> results =
          similarDocumentService.findSimilarDocuments(doc1.documentId(), 10, 0.5);

      assertThat(results).hasSize(1);
      DocumentSimilarity match = results.get(0);
      assertThat(match.documentId()).isEqualTo(doc2.documentId());
      assertThat(match.title()).isEqualTo("Replica lag");
      assertThat(match.similarityScore()).isBetween(0.99, 1.0);
      assertThat(match.sharedKeywords()).containsExactly("replication");
    }

    @Test
    @DisplayName("Should never include the query document and respect the limit")
    void shouldExcludeSelfAndLimit() {
      when(corpusService.getProfile(doc1.documentId())).thenReturn(doc1);
      when(corpusService.getProfiles(null)).thenReturn(List.of(doc1, doc2, doc3, doc4));

      List<DocumentSimilarity> results =
          similarDocumentService.findSimilarDocuments(doc1.documentId(), 2, -1.0);

      assertThat(results)
          .extracting(DocumentSimilarity::documentId)
          .containsExactly(doc2.documentId(), doc3.documentId());
    }

    @Test
    @DisplayName("Should apply configured defaults when parameters are absent")
    void shouldUseDefaults() {
      when(corpusService.getProfile(doc1.documentId())).thenReturn(doc1);
      when(corpusService.getProfiles(null)).thenReturn(List.of(doc1, doc2, doc3, doc4));

      List<DocumentSimilarity> results =
          similarDocumentService.findSimilarDocuments(doc1.documentId(), null, null);

      assertThat(results)
          .extracting(DocumentSimilarity::documentId)
          .containsExactly(doc2.documentId());
    }
  }

  @Nested
  @DisplayName("Errors")
  class Errors {

    @Test
    @DisplayName("Should reject a document without an embedding")
    void shouldRejectUnembeddedDocument() {
      when(corpusService.getProfile(unembedded.documentId())).thenReturn(unembedded);

      assertThatThrownBy(
              () -> similarDocumentService.findSimilarDocuments(unembedded.documentId(), 5, 0.5))
          .isInstanceOf(EmbeddingNotFoundException.class);
    }

    @Test
    @DisplayName("Should propagate unknown documents")
    void shouldPropagateUnknownDocument() {
      UUID missing = id(99);
      when(corpusService.getProfile(missing)).thenThrow(new DocumentNotFoundException(missing));

      assertThatThrownBy(() -> similarDocumentService.findSimilarDocuments(missing, 5, 0.5))
          .isInstanceOf(DocumentNotFoundException.class);
    }

    @Test
    @DisplayName("Should validate limit and similarity range before loading anything")
    void shouldValidateParameters() {
      UUID documentId = doc1.documentId();

      assertThatThrownBy(() -> similarDocumentService.findSimilarDocuments(documentId, 0, 0.5))
          .isInstanceOf(AnalyticsValidationException.class)
          .hasMessageContaining("limit");
      assertThatThrownBy(() -> similarDocumentService.findSimilarDocuments(documentId, 51, 0.5))
          .isInstanceOf(AnalyticsValidationException.class);
      assertThatThrownBy(() -> similarDocumentService.findSimilarDocuments(documentId, 5, 1.5))
          .isInstanceOf(AnalyticsValidationException.class)
          .hasMessageContaining("minSimilarity");
      verifyNoInteractions(corpusService);
    }
  }

  private static DocumentProfile.DocumentProfileBuilder profile(
      int n, String title, String content, float[] vector) {
    return DocumentProfile.builder()
        .documentId(id(n))
        .title(title)
        .content(content)
        .vector(vector);
  }

  private static UUID id(int n) {
    return UUID.fromString(String.format("00000000-0000-0000-0000-%012d", n));
  }
}
