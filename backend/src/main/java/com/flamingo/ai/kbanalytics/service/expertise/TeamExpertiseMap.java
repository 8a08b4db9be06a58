package com.flamingo.ai.kbanalytics.service.expertise;

import java.util.List;

/**
 * Team-wide expertise view.
 *
 * @param entries every (user, area) count, not truncated
 * @param sharedAreas areas covered by more than one member
 */
public record TeamExpertiseMap(
    List<MemberExpertise> members,
    List<ExpertiseEntry> entries,
    List<String> sharedAreas,
    List<UniqueExpert> uniqueExperts) {}
