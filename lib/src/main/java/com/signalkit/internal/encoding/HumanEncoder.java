package com.signalkit.internal.encoding;

import com.google.common.collect.ImmutableSet;
import com.signalkit.log.LogField;
import com.signalkit.log.LogRecord;
import java.util.HashSet;
import java.util.Set;

/** {@code 2026-10-17T10:00:00.5Z INFO  [Foo.java:12] message text key=value} */
public final class HumanEncoder implements RecordEncoder {
  private static final String TS_KEY = "ts";
  private static final String CALLER_KEY = "caller";
  private static final String MSG_KEY = "msg";
  private static final ImmutableSet<String> LEADING_KEYS = ImmutableSet.of(TS_KEY, CALLER_KEY, MSG_KEY);

  @Override
  public String encode(LogRecord record) {
    final StringBuilder line = new StringBuilder();
    record.firstValue(TS_KEY).ifPresent(ts -> line.append(ValueRenderer.render(ts)).append(' '));
    line.append(String.format("%-5s", record.level().name()));
    record
        .firstValue(CALLER_KEY)
        .ifPresent(caller -> line.append(" [").append(ValueRenderer.render(caller)).append(']'));
    record.firstValue(MSG_KEY).ifPresent(msg -> line.append(' ').append(ValueRenderer.render(msg)));

    // Only the first occurrence of a leading key is lifted out; repeats stay in place.
    final Set<String> lifted = new HashSet<>();
    for (LogField field : record.fields()) {
      if (LEADING_KEYS.contains(field.key()) && lifted.add(field.key())) {
        continue;
      }
      line.append(' ')
          .append(LogfmtEncoder.sanitizeKey(field.key()))
          .append('=')
          .append(LogfmtEncoder.formatValue(ValueRenderer.render(field.value())));
    }
    return line.toString();
  }
}
