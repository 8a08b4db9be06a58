package com.flamingo.ai.kbanalytics.service.health;

import com.flamingo.ai.kbanalytics.api.dto.response.SystemStats;

/** Service interface for health checks and system statistics. */
public interface HealthService {

  /**
   * Gets document counts and clustering job counts by status.
   *
   * @return system statistics
   */
  SystemStats getSystemStats();
}
