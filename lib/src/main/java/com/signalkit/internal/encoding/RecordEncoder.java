package com.signalkit.internal.encoding;

import com.signalkit.log.LogRecord;

/** Renders a record as a single line without the trailing newline. */
@FunctionalInterface
public interface RecordEncoder {
  String encode(LogRecord record);
}
