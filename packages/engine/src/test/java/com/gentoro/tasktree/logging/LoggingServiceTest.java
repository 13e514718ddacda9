package com.gentoro.tasktree.logging;

import static org.junit.jupiter.api.Assertions.*;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import org.apache.commons.configuration2.BaseConfiguration;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

class LoggingServiceTest {
  private Logger root;
  private Level rootLevel;

  @BeforeEach
  void rememberRoot() {
    root = (Logger) LoggerFactory.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME);
    rootLevel = root.getLevel();
  }

  @AfterEach
  void restoreRoot() {
    root.setLevel(rootLevel);
    ((Logger) LoggerFactory.getLogger("com.example.levels")).setLevel(null);
  }

  @Test
  void appliesKnownLevelsAndSkipsUnknownOnes() {
    BaseConfiguration cfg = new BaseConfiguration();
    cfg.setProperty("logging.level.root", "WARN");
    cfg.setProperty("logging.level.com.example.levels", "debug");
    cfg.setProperty("logging.level.bad", "LOUD");
    cfg.setProperty("vectorstore.provider", "memory");

    assertEquals(2, LoggingService.applyConfiguration(cfg));
    assertEquals(Level.WARN, root.getLevel());
    assertEquals(
        Level.DEBUG, ((Logger) LoggerFactory.getLogger("com.example.levels")).getLevel());
  }

  @Test
  void nothingToApply() {
    assertEquals(0, LoggingService.applyConfiguration(null));
    assertEquals(0, LoggingService.applyConfiguration(new BaseConfiguration()));
    assertEquals(rootLevel, root.getLevel());
  }
}
