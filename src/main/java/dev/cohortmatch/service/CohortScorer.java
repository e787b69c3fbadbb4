package dev.cohortmatch.service;

import dev.cohortmatch.model.UserInput;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Computes the cohort of a training profile with a fixed additive rule table.
 * <p>
 * Input values are not range-checked here: an out-of-domain fitness level simply
 * produces an unusually large cohort. The result may be negative. The six scoring
 * fields must be present.
 */
@Slf4j
@Service
public class CohortScorer {

    static final int FITNESS_LEVEL_WEIGHT = 10;
    static final int ACHIEVEMENT_GOAL_BONUS = 20;
    static final int LOAD_CORRECTION_PENALTY = -10;
    static final int FREQUENT_TRAINING_BONUS = 5;
    static final int UNRESTRICTED_STRENGTH_CARDIO_BONUS = 5;

    private static final int ACHIEVEMENT_GOAL = 4;
    private static final int ADVANCED_FITNESS = 3;
    private static final int LOAD_CORRECTION_STATUS = 3;
    private static final int NO_RESTRICTIONS_STATUS = 1;
    private static final int FREQUENT_TRAINING_SESSIONS = 4;
    private static final int STRENGTH_TRAINING = 1;
    private static final int CARDIO_TRAINING = 2;

    /**
     * Result of scoring: the cohort and the contribution of every rule that fired,
     * in rule order.
     */
    public record ScoringResult(int cohort, Map<String, Integer> breakdown) {
    }

    /**
     * Compute the cohort for a profile.
     *
     * @param user profile to score
     * @return the cohort, possibly negative
     */
    public int score(UserInput user) {
        return explain(user).cohort();
    }

    /**
     * Compute the cohort and report which rules contributed to it.
     *
     * @param user profile to score
     * @return ScoringResult with cohort and ordered breakdown
     */
    public ScoringResult explain(UserInput user) {
        Map<String, Integer> breakdown = new LinkedHashMap<>();
        int cohort = 0;

        // 1. Base: fitness level
        int fitness = user.getFitnessLevel() * FITNESS_LEVEL_WEIGHT;
        breakdown.put("fitness_level", fitness);
        cohort += fitness;

        // 2. Base: age category
        breakdown.put("age_category", user.getAgeCategory());
        cohort += user.getAgeCategory();

        // 3. Advanced athletes training for achievements
        if (user.getTrainingGoal() == ACHIEVEMENT_GOAL && user.getFitnessLevel() == ADVANCED_FITNESS) {
            breakdown.put("achievement_goal_bonus", ACHIEVEMENT_GOAL_BONUS);
            cohort += ACHIEVEMENT_GOAL_BONUS;
        }

        // 4. Load correction lowers the level
        if (user.getHealthStatus() == LOAD_CORRECTION_STATUS) {
            breakdown.put("load_correction_penalty", LOAD_CORRECTION_PENALTY);
            cohort += LOAD_CORRECTION_PENALTY;
        }

        // 5. Frequent training
        if (user.getTrainingFrequency() >= FREQUENT_TRAINING_SESSIONS) {
            breakdown.put("frequent_training_bonus", FREQUENT_TRAINING_BONUS);
            cohort += FREQUENT_TRAINING_BONUS;
        }

        // 6. Strength or cardio without health restrictions
        if (isStrengthOrCardio(user.getTrainingType()) && user.getHealthStatus() == NO_RESTRICTIONS_STATUS) {
            breakdown.put("unrestricted_strength_cardio_bonus", UNRESTRICTED_STRENGTH_CARDIO_BONUS);
            cohort += UNRESTRICTED_STRENGTH_CARDIO_BONUS;
        }

        log.debug("Cohort {} from {}", cohort, breakdown);
        return new ScoringResult(cohort, Collections.unmodifiableMap(breakdown));
    }

    private boolean isStrengthOrCardio(int trainingType) {
        return trainingType == STRENGTH_TRAINING || trainingType == CARDIO_TRAINING;
    }
}
