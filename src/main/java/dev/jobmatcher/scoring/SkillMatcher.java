package dev.jobmatcher.scoring;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.Locale;
import java.util.Set;
import java.util.TreeSet;

/**
 * Scores the share of required skills a provider covers.
 */
@Component
@RequiredArgsConstructor
public class SkillMatcher {

    private final SkillSynonymProvider synonymProvider;

    /**
     * @return {@code |R ∩ P| / |R|}, or 1.0 when nothing is required
     */
    public double score(Collection<String> required, Collection<String> offered) {
        Set<String> requiredSkills = canonicalSkills(required);
        if (requiredSkills.isEmpty()) {
            return 1.0;
        }
        Set<String> offeredSkills = canonicalSkills(offered);

        long matched = requiredSkills.stream()
                .filter(skill -> synonymProvider.synonymsOf(skill).stream().anyMatch(offeredSkills::contains))
                .count();

        return (double) matched / requiredSkills.size();
    }

    /**
     * Trim and lower-case each tag, dropping blanks.
     */
    public static Set<String> canonicalSkills(Collection<String> skills) {
        Set<String> canonical = new TreeSet<>();
        if (skills == null) {
            return canonical;
        }
        for (String skill : skills) {
            String tag = canonicalSkill(skill);
            if (!tag.isEmpty()) {
                canonical.add(tag);
            }
        }
        return canonical;
    }

    public static String canonicalSkill(String skill) {
        return skill == null ? "" : skill.trim().toLowerCase(Locale.ROOT);
    }
}
