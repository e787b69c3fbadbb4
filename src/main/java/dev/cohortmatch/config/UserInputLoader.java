package dev.cohortmatch.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import dev.cohortmatch.model.UserInput;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.File;
import java.io.IOException;
import java.util.Comparator;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Reads the training profile from a JSON file and checks it against the declared constraints.
 */
@Slf4j
@Component
public class UserInputLoader {

    private final ObjectReader reader;
    private final Validator validator;
    private final String inputFile;

    public UserInputLoader(ObjectMapper objectMapper,
                           Validator validator,
                           @Value("${recommendation.input-file:user-input.json}") String inputFile) {
        // "2.7" must not be truncated to a valid enum code
        this.reader = objectMapper.readerFor(UserInput.class)
                .without(DeserializationFeature.ACCEPT_FLOAT_AS_INT);
        this.validator = validator;
        this.inputFile = inputFile;
    }

    /**
     * Load the configured input file.
     */
    public UserInput load() {
        return load(new File(inputFile));
    }

    /**
     * Load and validate a profile.
     *
     * @param file JSON file with snake_case fields
     * @return the validated profile
     * @throws InvalidUserInputException if the file is missing, malformed, lacks a required
     *                                   field or is out of domain
     */
    public UserInput load(File file) {
        if (!file.exists()) {
            throw new InvalidUserInputException("Input file not found: " + file.getPath());
        }

        UserInput user;
        try {
            user = reader.readValue(file);
        } catch (IOException e) {
            log.error("Failed to read {}. Ensure it matches the required structure.", file.getPath());
            throw new InvalidUserInputException("Could not parse input file " + file.getPath(), e);
        }

        Set<ConstraintViolation<UserInput>> violations = validator.validate(user);
        if (!violations.isEmpty()) {
            String details = violations.stream()
                    .sorted(Comparator.comparing(v -> v.getPropertyPath().toString()))
                    .map(v -> v.getPropertyPath() + " " + v.getMessage())
                    .collect(Collectors.joining(", "));
            throw new InvalidUserInputException("Invalid input in " + file.getPath() + ": " + details);
        }

        log.info("Loaded profile from {}", file.getPath());
        return user;
    }
}
