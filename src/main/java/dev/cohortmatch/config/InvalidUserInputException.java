package dev.cohortmatch.config;

/**
 * The profile file is missing, unreadable or violates the accepted value domain.
 */
public class InvalidUserInputException extends RuntimeException {

    public InvalidUserInputException(String message) {
        super(message);
    }

    public InvalidUserInputException(String message, Throwable cause) {
        super(message, cause);
    }
}
