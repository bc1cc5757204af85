package dev.jobmatcher.scoring;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.Set;

/**
 * No-op implementation of SkillSynonymProvider.
 * Used when synonym expansion is not enabled.
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "matching.synonyms.enabled", havingValue = "false", matchIfMissing = true)
public class NoOpSkillSynonymProvider implements SkillSynonymProvider {

    public NoOpSkillSynonymProvider() {
        log.info("Skill synonyms disabled - matching exact tags only");
    }

    @Override
    public Set<String> synonymsOf(String skill) {
        return Set.of(skill);
    }
}
