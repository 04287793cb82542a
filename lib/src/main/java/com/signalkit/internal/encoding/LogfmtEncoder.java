package com.signalkit.internal.encoding;

import com.signalkit.log.LogField;
import com.signalkit.log.LogRecord;
import java.util.List;

/** {@code level=info ts=... caller=Foo.java:12 key=value msg="quoted text"} */
public final class LogfmtEncoder implements RecordEncoder {
  public static final String LEVEL_KEY = "level";

  @Override
  public String encode(LogRecord record) {
    final StringBuilder line = new StringBuilder();
    appendPair(line, LEVEL_KEY, record.level().toWireString());
    appendFields(line, record.fields());
    return line.toString();
  }

  public static String encodeFields(List<LogField> fields) {
    final StringBuilder line = new StringBuilder();
    appendFields(line, fields);
    return line.toString();
  }

  static void appendFields(StringBuilder line, List<LogField> fields) {
    for (LogField field : fields) {
      appendPair(line, field.key(), field.value());
    }
  }

  static void appendPair(StringBuilder line, String key, Object value) {
    if (line.length() > 0) {
      line.append(' ');
    }
    line.append(sanitizeKey(key)).append('=').append(formatValue(ValueRenderer.render(value)));
  }

  static String sanitizeKey(String key) {
    if (key.isEmpty()) {
      return "_";
    }
    final StringBuilder sanitized = new StringBuilder(key.length());
    for (int i = 0; i < key.length(); i++) {
      final char c = key.charAt(i);
      sanitized.append(c <= ' ' || c == '=' || c == '"' || c == 0x7f ? '_' : c);
    }
    return sanitized.toString();
  }

  static String formatValue(String value) {
    if (!needsQuoting(value)) {
      return value;
    }
    final StringBuilder quoted = new StringBuilder(value.length() + 2).append('"');
    for (int i = 0; i < value.length(); i++) {
      final char c = value.charAt(i);
      switch (c) {
        case '"':
          quoted.append("\\\"");
          break;
        case '\\':
          quoted.append("\\\\");
          break;
        case '\n':
          quoted.append("\\n");
          break;
        case '\r':
          quoted.append("\\r");
          break;
        case '\t':
          quoted.append("\\t");
          break;
        default:
          if (c < ' ' || c == 0x7f) {
            quoted.append(String.format("\\u%04x", (int) c));
          } else {
            quoted.append(c);
          }
      }
    }
    return quoted.append('"').toString();
  }

  private static boolean needsQuoting(String value) {
    if (value.isEmpty()) {
      return true;
    }
    for (int i = 0; i < value.length(); i++) {
      final char c = value.charAt(i);
      if (c <= ' ' || c == '=' || c == '"' || c == 0x7f) {
        return true;
      }
    }
    return false;
  }
}
