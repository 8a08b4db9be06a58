package com.flamingo.ai.kbanalytics.service.anomaly;

import com.flamingo.ai.kbanalytics.service.corpus.CorpusService;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.List;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/** Implementation of AnomalyService. */
@Service
@RequiredArgsConstructor
@Slf4j
public class AnomalyServiceImpl implements AnomalyService {

  private final CorpusService corpusService;
  private final AnomalyDetector anomalyDetector;
  private final MeterRegistry meterRegistry;

  @Override
  @Timed(value = "anomaly.detect", description = "Time to detect anomalous documents")
  public List<AnomalyResult> detectAnomalies(UUID categoryId) {
    List<AnomalyResult> anomalies = anomalyDetector.detect(corpusService.getProfiles(categoryId));
    anomalies.forEach(
        anomaly ->
            meterRegistry
                .counter("anomaly.detected", "type", anomaly.anomalyType().wireName())
                .increment());
    log.info("Detected {} anomalous documents (category={})", anomalies.size(), categoryId);
    return anomalies;
  }
}
