package ca.gc.cra.uvcalc.infrastructure.progress;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import java.time.Duration;
import java.util.List;
import java.util.stream.Collectors;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

class LoggingProgressListenerTest {
  private final Logger logger = (Logger) LoggerFactory.getLogger(LoggingProgressListener.class);
  private final ListAppender<ILoggingEvent> appender = new ListAppender<>();

  @BeforeEach
  void attach() {
    appender.start();
    logger.addAppender(appender);
  }

  @AfterEach
  void detach() {
    logger.detachAppender(appender);
    appender.stop();
  }

  @Test
  void logsEveryTenPercentOnce() {
    LoggingProgressListener listener = new LoggingProgressListener();
    listener.init(20, "Calculating irradiance for 20 sections in 1 input...");
    for (int i = 0; i < 20; i++) {
      listener.progress();
    }
    listener.finish(Duration.ofMillis(1500));

    List<String> messages = messages();
    assertEquals("Calculating irradiance for 20 sections in 1 input... (20 jobs)", messages.get(0));
    assertEquals(12, messages.size());
    assertEquals("Calculating irradiance for 20 sections in 1 input... 10% (2/20)", messages.get(1));
    assertEquals("Calculating irradiance for 20 sections in 1 input... 100% (20/20)", messages.get(10));
    assertEquals("Finished 20 of 20 jobs in 1500 ms", messages.get(11));
    assertEquals(20, listener.completed());
  }

  @Test
  void initResetsCountersAndIgnoresEmptyPhase() {
    LoggingProgressListener listener = new LoggingProgressListener();
    listener.init(1, "Collecting data for 1 day...");
    listener.progress();
    listener.init(0, "Calculating...");
    listener.progress();

    assertEquals(1, listener.completed());
    assertTrue(messages().stream().noneMatch(m -> m.startsWith("Calculating... ")
        && m.contains("%")));
  }

  private List<String> messages() {
    return appender.list.stream().map(ILoggingEvent::getFormattedMessage).collect(Collectors.toList());
  }
}
