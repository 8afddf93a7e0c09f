package ca.gc.cra.fragmenter.infrastructure.persistence.ndjson;

import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import java.io.IOException;
import java.io.StringWriter;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Streaming JSON codec for one NDJSON line: parses an object into an ordered map of maps, lists and
 * primitives, and writes such maps back out. Field order is preserved both ways. Integers load as the
 * smallest fitting {@code Integer}, {@code Long} or {@code BigInteger}; decimals load as {@link BigDecimal}
 * so their digits survive a round trip.
 *
 * @since 0.1.0
 */
final class JsonLines {
  private final JsonFactory factory = new JsonFactory();

  /**
   * Parses one line holding a single JSON object.
   *
   * @param line JSON text
   * @return ordered field map
   * @throws IOException if the text is not a single JSON object
   */
  Map<String, Object> parseObject(String line) throws IOException {
    Objects.requireNonNull(line, "line");
    try (JsonParser parser = factory.createParser(line)) {
      JsonToken token = parser.nextToken();
      if (token != JsonToken.START_OBJECT) {
        throw new IOException("Expected a JSON object but found " + token);
      }
      Map<String, Object> value = readObject(parser);
      if (parser.nextToken() != null) {
        throw new IOException("JSON line contains trailing content");
      }
      return value;
    }
  }

  /**
   * Serializes a field map as compact JSON without a trailing newline.
   *
   * @param fields ordered fields; values may be maps, lists, strings, numbers, booleans or {@code null}
   * @return JSON text
   * @throws IOException if a value cannot be written
   */
  String writeObject(Map<String, ?> fields) throws IOException {
    StringWriter out = new StringWriter(128);
    try (JsonGenerator gen = factory.createGenerator(out)) {
      writeValue(gen, fields);
    }
    return out.toString();
  }

  private Object readValue(JsonParser parser, JsonToken token) throws IOException {
    return switch (token) {
      case START_OBJECT -> readObject(parser);
      case START_ARRAY -> readArray(parser);
      case VALUE_STRING -> parser.getText();
      case VALUE_NUMBER_INT -> parser.getNumberValue();
      case VALUE_NUMBER_FLOAT -> parser.getDecimalValue();
      case VALUE_TRUE -> Boolean.TRUE;
      case VALUE_FALSE -> Boolean.FALSE;
      case VALUE_NULL -> null;
      default -> throw new IOException("Unsupported JSON token: " + token);
    };
  }

  private Map<String, Object> readObject(JsonParser parser) throws IOException {
    Map<String, Object> map = new LinkedHashMap<>();
    while (true) {
      JsonToken token = parser.nextToken();
      if (token == JsonToken.END_OBJECT) {
        return map;
      }
      if (token != JsonToken.FIELD_NAME) {
        throw new IOException("Expected field name but found " + token);
      }
      String fieldName = parser.currentName();
      map.put(fieldName, readValue(parser, parser.nextToken()));
    }
  }

  private List<Object> readArray(JsonParser parser) throws IOException {
    List<Object> list = new ArrayList<>();
    while (true) {
      JsonToken token = parser.nextToken();
      if (token == JsonToken.END_ARRAY) {
        return list;
      }
      if (token == null) {
        throw new IOException("Unterminated JSON array");
      }
      list.add(readValue(parser, token));
    }
  }

  private void writeValue(JsonGenerator gen, Object value) throws IOException {
    if (value == null) {
      gen.writeNull();
    } else if (value instanceof String text) {
      gen.writeString(text);
    } else if (value instanceof Integer || value instanceof Long || value instanceof Short
        || value instanceof Byte) {
      gen.writeNumber(((Number) value).longValue());
    } else if (value instanceof BigInteger big) {
      gen.writeNumber(big);
    } else if (value instanceof BigDecimal decimal) {
      gen.writeNumber(decimal);
    } else if (value instanceof Number number) {
      gen.writeNumber(number.doubleValue());
    } else if (value instanceof Boolean flag) {
      gen.writeBoolean(flag);
    } else if (value instanceof Map<?, ?> map) {
      gen.writeStartObject();
      for (Map.Entry<?, ?> entry : map.entrySet()) {
        gen.writeFieldName(String.valueOf(entry.getKey()));
        writeValue(gen, entry.getValue());
      }
      gen.writeEndObject();
    } else if (value instanceof Iterable<?> items) {
      gen.writeStartArray();
      for (Object item : items) {
        writeValue(gen, item);
      }
      gen.writeEndArray();
    } else {
      gen.writeString(value.toString());
    }
  }
}
