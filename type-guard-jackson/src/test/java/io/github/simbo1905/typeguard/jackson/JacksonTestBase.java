package io.github.simbo1905.typeguard.jackson;

import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.TestInfo;

import java.io.InputStream;
import java.util.Locale;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.Logger;

/// Base class for Jackson module tests.
/// - Configures JUL from `java.util.logging.ConsoleHandler.level`.
/// - Emits an INFO banner per test.
public class JacksonTestBase {

  static final Logger LOG = Logger.getLogger("io.github.simbo1905.typeguard.jackson");

  @BeforeAll
  static void enableJulDebug() {
    Logger root = Logger.getLogger("");
    String levelProp = System.getProperty("java.util.logging.ConsoleHandler.level");
    Level targetLevel = Level.INFO;
    if (levelProp != null) {
      try {
        targetLevel = Level.parse(levelProp.trim().toUpperCase(Locale.ROOT));
      } catch (IllegalArgumentException ex) {
        targetLevel = Level.INFO;
      }
    }
    if (root.getLevel() == null || root.getLevel().intValue() > targetLevel.intValue()) {
      root.setLevel(targetLevel);
    }
    for (Handler handler : root.getHandlers()) {
      Level handlerLevel = handler.getLevel();
      if (handlerLevel == null || handlerLevel.intValue() > targetLevel.intValue()) {
        handler.setLevel(targetLevel);
      }
    }
  }

  @BeforeEach
  void announce(TestInfo testInfo) {
    final String cls = testInfo.getTestClass().map(Class::getSimpleName).orElse("UnknownTest");
    final String name = testInfo.getTestMethod().map(java.lang.reflect.Method::getName)
        .orElseGet(testInfo::getDisplayName);
    LOG.info(() -> "TEST: " + cls + "#" + name);
  }

  static InputStream resource(String name) {
    final var in = JacksonTestBase.class.getResourceAsStream("/descriptors/" + name);
    if (in == null) {
      throw new IllegalStateException("missing test resource /descriptors/" + name);
    }
    return in;
  }
}
