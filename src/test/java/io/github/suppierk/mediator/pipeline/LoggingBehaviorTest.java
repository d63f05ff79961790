package io.github.suppierk.mediator.pipeline;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import io.github.suppierk.mediator.cqrs.OperationResult;
import io.github.suppierk.test.PlaceOrder;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

class LoggingBehaviorTest {
  static final PlaceOrder COMMAND = new PlaceOrder("order-1", "alice");

  final LoggingBehavior behavior = new LoggingBehavior();

  Logger logger;
  ListAppender<ILoggingEvent> appender;

  @BeforeEach
  void setUp() {
    logger = (Logger) LoggerFactory.getLogger(LoggingBehavior.class);
    appender = new ListAppender<>();
    appender.start();
    logger.addAppender(appender);
  }

  @AfterEach
  void tearDown() {
    logger.detachAppender(appender);
    appender.stop();
  }

  ILoggingEvent lastEvent() {
    return appender.list.get(appender.list.size() - 1);
  }

  @Test
  void success_must_be_logged_at_info() throws Exception {
    final var result = behavior.handle(COMMAND, () -> OperationResult.created("order-1"));

    assertEquals(OperationResult.created("order-1"), result);
    assertEquals(Level.INFO, lastEvent().getLevel());
    assertTrue(lastEvent().getFormattedMessage().startsWith("PlaceOrder completed with CREATED"));
  }

  @Test
  void failure_result_must_be_logged_at_warn_with_detail() throws Exception {
    behavior.handle(COMMAND, () -> OperationResult.<String>conflict("Order exists"));

    assertEquals(Level.WARN, lastEvent().getLevel());
    assertTrue(lastEvent().getFormattedMessage().endsWith("Order exists"));
  }

  @Test
  void exception_must_be_logged_at_error_and_rethrown() {
    final var failure = new IllegalStateException("Kitchen is on fire");

    final var thrown =
        assertThrows(
            IllegalStateException.class,
            () ->
                behavior.handle(
                    COMMAND,
                    () -> {
                      throw failure;
                    }));

    assertSame(failure, thrown);
    assertEquals(Level.ERROR, lastEvent().getLevel());
    assertEquals("Kitchen is on fire", lastEvent().getThrowableProxy().getMessage());
  }
}
