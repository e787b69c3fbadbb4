package dev.cohortmatch;

import org.junit.jupiter.api.Test;
import static org.junit.jupiter.api.Assertions.*;

class ExitManagerTest {

  @Test
  void exitIsSuppressedUnderTestRunner() {
    ExitManager exitManager = new ExitManager();
    exitManager.exit(ExitManager.SUCCESS);
    exitManager.exit(ExitManager.CATALOG_UNAVAILABLE);
    assertTrue(exitManager.isTest());
  }

  @Test
  void exitCodesAreDistinct() {
    assertNotEquals(ExitManager.FAILURE, ExitManager.CATALOG_UNAVAILABLE);
    assertNotEquals(ExitManager.SUCCESS, ExitManager.FAILURE);
  }
}
