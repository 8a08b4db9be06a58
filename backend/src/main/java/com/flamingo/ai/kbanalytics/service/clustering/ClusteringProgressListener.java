package com.flamingo.ai.kbanalytics.service.clustering;

/** Receives progress callbacks from a running clustering computation. */
@FunctionalInterface
public interface ClusteringProgressListener {

  ClusteringProgressListener NONE = (percent, documentsProcessed) -> {};

  /**
   * Called with non-decreasing values as the computation advances.
   *
   * @param percent progress in [0, 100]
   * @param documentsProcessed documents assigned so far
   */
  void onProgress(int percent, int documentsProcessed);
}
