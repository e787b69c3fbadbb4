package dev.cohortmatch.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.Set;

/**
 * Training profile submitted for a recommendation.
 * Only fitness level, age category, training type, training goal, health status
 * and training frequency feed the cohort score. The remaining fields are reserved
 * for future rules and are carried through unchanged.
 * <p>
 * The constraint annotations describe the accepted domain and which fields are required.
 * They are checked where the input enters the application, not by the scorer.
 */
@Value
@Builder
@Jacksonized
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class UserInput {

    /** 1 - beginner, 2 - intermediate, 3 - advanced */
    @NotNull
    @Min(1)
    @Max(3)
    Integer fitnessLevel;

    /** 1 - child, 2 - youth, 3 - adult, 4 - senior */
    @NotNull
    @Min(1)
    @Max(4)
    Integer ageCategory;

    /** 1 - strength, 2 - cardio, 3 - group, 4 - individual */
    @NotNull
    @Min(1)
    @Max(4)
    Integer trainingType;

    /** 1 - health, 2 - weight loss, 3 - endurance, 4 - achievements */
    @NotNull
    @Min(1)
    @Max(4)
    Integer trainingGoal;

    @NotNull
    String sportsFacility;

    /** 1 - group, 2 - individual */
    @NotNull
    @Min(1)
    @Max(2)
    Integer groupOrIndividual;

    /** 1 - no restrictions, 2 - chronic diseases, 3 - load correction */
    @NotNull
    @Min(1)
    @Max(3)
    Integer healthStatus;

    /** Sessions per week. */
    @NotNull
    @PositiveOrZero
    Integer trainingFrequency;

    /** 1 - morning, 2 - afternoon, 3 - evening */
    @NotNull
    @Min(1)
    @Max(3)
    Integer trainingTime;

    Set<String> chronicDiseases;

    /** Kilograms. */
    @NotNull
    @Positive
    Double weight;

    /** Centimetres. */
    @NotNull
    @Positive
    Double height;

    Integer healthGroup;

    /** 1 - flexibility, 2 - coordination */
    Set<Integer> skillFocus;

    @NotNull
    Boolean cooperation;

    @PositiveOrZero
    Double budget;
}
