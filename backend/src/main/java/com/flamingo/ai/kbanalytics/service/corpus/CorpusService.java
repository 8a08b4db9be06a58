package com.flamingo.ai.kbanalytics.service.corpus;

import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;

/** Loads read-only snapshots of the corpus for the analytics computations. */
public interface CorpusService {

  /**
   * Gets up to {@code maxDocuments} documents, most recently updated first.
   *
   * @param maxDocuments upper bound on the number of documents
   * @return profiles in update order
   */
  List<DocumentProfile> getRecentProfiles(int maxDocuments);

  /**
   * Gets every document, optionally restricted to a category, ordered by id.
   *
   * @param categoryId category filter, or null for the whole corpus
   * @return profiles in id order
   */
  List<DocumentProfile> getProfiles(UUID categoryId);

  /** Gets documents created at or after {@code from}, oldest first. */
  List<DocumentProfile> getProfilesCreatedSince(LocalDateTime from);

  /** Gets documents that have an author. */
  List<DocumentProfile> getAuthoredProfiles();

  /**
   * Gets a single document.
   *
   * @throws com.flamingo.ai.kbanalytics.exception.DocumentNotFoundException if it does not exist
   */
  DocumentProfile getProfile(UUID documentId);

  long countDocuments();

  long countEmbeddedDocuments();
}
