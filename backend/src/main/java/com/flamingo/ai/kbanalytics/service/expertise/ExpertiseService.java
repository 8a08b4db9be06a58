package com.flamingo.ai.kbanalytics.service.expertise;

/** Service interface for the team expertise map. */
public interface ExpertiseService {

  /**
   * Builds the expertise map over every authored document.
   *
   * @return team expertise map
   */
  TeamExpertiseMap buildTeamExpertiseMap();
}
