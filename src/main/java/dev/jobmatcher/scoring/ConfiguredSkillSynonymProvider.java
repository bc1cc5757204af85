package dev.jobmatcher.scoring;

import dev.jobmatcher.config.MatchingConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Synonym provider backed by {@code matching.synonyms.groups}: each key is
 * equivalent to the tags listed under it.
 * A tag listed in several groups is equivalent to the union of them.
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "matching.synonyms.enabled", havingValue = "true")
public class ConfiguredSkillSynonymProvider implements SkillSynonymProvider {

    private final Map<String, Set<String>> synonyms;

    public ConfiguredSkillSynonymProvider(MatchingConfig matchingConfig) {
        Map<String, Set<String>> index = new HashMap<>();
        matchingConfig.getSynonyms().getGroups().forEach((skill, equivalents) -> {
            List<String> group = new ArrayList<>(equivalents);
            group.add(skill);
            Set<String> tags = SkillMatcher.canonicalSkills(group);
            for (String tag : tags) {
                index.computeIfAbsent(tag, k -> new HashSet<>()).addAll(tags);
            }
        });
        index.replaceAll((tag, tags) -> Set.copyOf(tags));
        this.synonyms = Map.copyOf(index);
        log.info("Skill synonyms enabled: {} tags in {} groups",
                synonyms.size(), matchingConfig.getSynonyms().getGroups().size());
    }

    @Override
    public Set<String> synonymsOf(String skill) {
        return synonyms.getOrDefault(skill, Set.of(skill));
    }
}
