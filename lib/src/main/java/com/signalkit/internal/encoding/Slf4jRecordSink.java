package com.signalkit.internal.encoding;

import com.signalkit.log.LogRecord;
import com.signalkit.log.RecordSink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Hands records to an SLF4J logger; the level maps one to one and the fields become logfmt. */
public class Slf4jRecordSink implements RecordSink {
  private final Logger logger;

  public Slf4jRecordSink(String loggerName) {
    this(LoggerFactory.getLogger(loggerName));
  }

  public Slf4jRecordSink(Logger logger) {
    this.logger = logger;
  }

  @Override
  public void emit(LogRecord record) {
    switch (record.level()) {
      case DEBUG:
        if (logger.isDebugEnabled()) {
          logger.debug("{}", LogfmtEncoder.encodeFields(record.fields()));
        }
        break;
      case INFO:
        if (logger.isInfoEnabled()) {
          logger.info("{}", LogfmtEncoder.encodeFields(record.fields()));
        }
        break;
      case WARN:
        if (logger.isWarnEnabled()) {
          logger.warn("{}", LogfmtEncoder.encodeFields(record.fields()));
        }
        break;
      case ERROR:
        if (logger.isErrorEnabled()) {
          logger.error("{}", LogfmtEncoder.encodeFields(record.fields()));
        }
        break;
      default:
        throw new IllegalStateException("Unhandled level " + record.level());
    }
  }
}
