package com.signalkit.internal.encoding;

import com.signalkit.log.LoggerConfig;
import com.signalkit.log.RecordSink;

public final class RecordSinks {
  private RecordSinks() {}

  public static RecordSink forConfig(LoggerConfig config) {
    switch (config.format()) {
      case LOGFMT:
        return new TextRecordSink(config.output(), new LogfmtEncoder());
      case HUMAN:
        return new TextRecordSink(config.output(), new HumanEncoder());
      case JSON:
        return new TextRecordSink(config.output(), new JsonEncoder());
      case SLF4J:
        return new Slf4jRecordSink(config.slf4jLoggerName());
      default:
        throw new IllegalArgumentException("Unsupported log format " + config.format());
    }
  }
}
