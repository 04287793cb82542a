package com.signalkit.internal.encoding;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jdk8.Jdk8Module;
import com.signalkit.log.LogField;
import com.signalkit.log.LogRecord;
import java.util.LinkedHashMap;
import java.util.Map;

/** One JSON object per record. A repeated key keeps its last value. */
public final class JsonEncoder implements RecordEncoder {
  private static final ObjectMapper SERIALIZER = new ObjectMapper().registerModule(new Jdk8Module());

  private final LogfmtEncoder fallback = new LogfmtEncoder();

  @Override
  public String encode(LogRecord record) {
    final Map<String, Object> object = new LinkedHashMap<>();
    object.put(LogfmtEncoder.LEVEL_KEY, record.level().toWireString());
    for (LogField field : record.fields()) {
      object.put(field.key(), toJsonValue(field.value()));
    }
    try {
      return SERIALIZER.writeValueAsString(object);
    } catch (JsonProcessingException exception) {
      return fallback.encode(record)
          + " json_error="
          + LogfmtEncoder.formatValue(ValueRenderer.errorMessage(exception));
    }
  }

  private static Object toJsonValue(Object value) {
    if (value == null || value instanceof Number || value instanceof Boolean) {
      return value;
    }
    return ValueRenderer.render(value);
  }
}
