package dev.jobmatcher.config;

import dev.jobmatcher.ExitManager;
import dev.jobmatcher.MatchRunner;
import dev.jobmatcher.scoring.ConfiguredSkillSynonymProvider;
import dev.jobmatcher.scoring.ScoringStrategy;
import dev.jobmatcher.scoring.SkillSynonymProvider;
import dev.jobmatcher.scoring.TieredScoringStrategy;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.bean.override.mockito.MockitoBean;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest(properties = {
    "matching.strategy=tiered",
    "matching.synonyms.enabled=true"
})
@ActiveProfiles("test")
class StrategySelectionTest {

  @MockitoBean
  private MatchRunner matchRunner;

  @MockitoBean
  private ExitManager exitManager;

  @Autowired
  private ScoringStrategy scoringStrategy;

  @Autowired
  private SkillSynonymProvider skillSynonymProvider;

  @Test
  void shouldSelectTieredStrategy() {
    assertThat(scoringStrategy).isInstanceOf(TieredScoringStrategy.class);
    assertThat(scoringStrategy.name()).isEqualTo("tiered");
  }

  @Test
  void shouldLoadConfiguredSynonyms() {
    assertThat(skillSynonymProvider).isInstanceOf(ConfiguredSkillSynonymProvider.class);
    assertThat(skillSynonymProvider.synonymsOf("electrician")).contains("electrical", "wiring");
    assertThat(skillSynonymProvider.synonymsOf("tiling")).containsExactly("tiling");
  }
}
