package com.flamingo.ai.kbanalytics.service.expertise;

import java.util.List;
import java.util.UUID;

/**
 * Expertise profile of one team member.
 *
 * @param expertiseAreas strongest areas first
 * @param totalDocuments every document the member authored, labelled or not
 */
public record MemberExpertise(
    UUID userId,
    String username,
    String email,
    List<ExpertiseEntry> expertiseAreas,
    long totalDocuments,
    List<String> topTechnologies,
    List<String> topTopics) {}
