package com.flamingo.ai.kbanalytics.service.expertise;

import java.util.UUID;

/** An area covered by exactly one team member. */
public record UniqueExpert(String area, UUID expertUserId, String expertName) {}
