package com.flamingo.ai.kbanalytics.agent.dto;

import java.util.List;

/** Structured output from DocumentUnderstandingAgent. */
public record DocumentUnderstandingResult(
    String summary, List<String> topics, List<String> technologies, List<String> insights) {}
