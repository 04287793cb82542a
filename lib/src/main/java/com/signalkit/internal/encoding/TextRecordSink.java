package com.signalkit.internal.encoding;

import com.signalkit.log.LogRecord;
import com.signalkit.log.RecordSink;
import java.io.PrintStream;

/**
 * Writes each record as one line. {@link PrintStream} serializes whole lines and keeps I/O
 * failures in its error flag, so a broken output never reaches the logging caller.
 */
public class TextRecordSink implements RecordSink {
  private final PrintStream output;
  private final RecordEncoder encoder;

  public TextRecordSink(PrintStream output, RecordEncoder encoder) {
    this.output = output;
    this.encoder = encoder;
  }

  @Override
  public void emit(LogRecord record) {
    output.println(encoder.encode(record));
  }
}
