package com.github.processfsm;

import java.util.List;

import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * The built-in sink of the standard output channels: every send becomes one log line.
 */
final class LoggingSink implements ChannelSink {
  private static final Logger logger = LogManager.getLogger(LoggingSink.class.getSimpleName());
  private final Level level;

  LoggingSink(final Level level) {
    this.level = level;
  }

  @Override
  public void write(final ChannelName channel, final List<Value> payload) {
    logger.log(level, "[" + channel + "] " + render(payload));
  }

  static String render(final List<Value> payload) {
    final StringBuilder line = new StringBuilder();
    for (Value value : payload) {
      if (line.length() > 0) {
        line.append(' ');
      }
      line.append(Operations.render(value));
    }
    return line.toString();
  }
}
