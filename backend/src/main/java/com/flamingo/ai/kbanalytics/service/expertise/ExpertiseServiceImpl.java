package com.flamingo.ai.kbanalytics.service.expertise;

import com.flamingo.ai.kbanalytics.service.corpus.CorpusService;
import com.flamingo.ai.kbanalytics.service.corpus.DocumentProfile;
import io.micrometer.core.annotation.Timed;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/** Implementation of ExpertiseService over the corpus snapshot. */
@Service
@RequiredArgsConstructor
@Slf4j
public class ExpertiseServiceImpl implements ExpertiseService {

  private final CorpusService corpusService;
  private final ExpertiseAggregator expertiseAggregator;

  @Override
  @Timed(value = "expertise.build", description = "Time to build the team expertise map")
  public TeamExpertiseMap buildTeamExpertiseMap() {
    List<AuthorshipRecord> records =
        corpusService.getAuthoredProfiles().stream().map(this::toRecord).toList();
    TeamExpertiseMap map = expertiseAggregator.aggregate(records);
    log.debug(
        "Built team expertise map: {} authored documents, {} members, {} shared areas",
        records.size(),
        map.members().size(),
        map.sharedAreas().size());
    return map;
  }

  private AuthorshipRecord toRecord(DocumentProfile profile) {
    return new AuthorshipRecord(
        profile.authorId(),
        profile.authorName(),
        profile.authorEmail(),
        profile.documentId(),
        profile.topics(),
        profile.technologies());
  }
}
