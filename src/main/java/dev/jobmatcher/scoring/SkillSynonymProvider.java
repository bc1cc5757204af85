package dev.jobmatcher.scoring;

import java.util.Set;

/**
 * Hook for treating different skill tags as equivalent.
 */
public interface SkillSynonymProvider {

    /**
     * Tags equivalent to the given canonical (trimmed, lower-case) skill.
     *
     * @param skill canonical skill tag
     * @return the equivalence set, always containing {@code skill} itself
     */
    Set<String> synonymsOf(String skill);
}
