package dev.cohortmatch;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Terminates the process with the run's exit code.
 * Kept separate so tests can mock it without killing the test runner.
 */
@Slf4j
@Component
public class ExitManager {

  public static final int SUCCESS = 0;
  public static final int FAILURE = 1;
  public static final int CATALOG_UNAVAILABLE = 2;

  public void exit(int status) {
    if (isTest()) {
      log.debug("Exit with status {} suppressed under test runner", status);
      return;
    }
    System.exit(status);
  }

  protected boolean isTest() {
    String cp = System.getProperty("java.class.path", "");
    return cp.contains("junit") || cp.contains("surefire") || cp.contains("intellij");
  }
}
