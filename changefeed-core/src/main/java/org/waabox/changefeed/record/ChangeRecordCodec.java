package org.waabox.changefeed.record;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Static utility class converting the old and new values of a
 * {@link ChangeRecord} to and from JSON text.
 *
 * <p>An absent value has no text: null maps to null both ways. Uses
 * Jackson's tree model ({@link JsonNode}) only.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class ChangeRecordCodec {

  /** Shared ObjectMapper for tree model operations. */
  private static final ObjectMapper MAPPER = new ObjectMapper();

  /** Private constructor to prevent instantiation. */
  private ChangeRecordCodec() {
    throw new UnsupportedOperationException("Utility class");
  }

  /**
   * Parses a single JSON value, as stored in the old or new value
   * columns of a change log.
   *
   * @param json the JSON text, may be null.
   * @return the parsed value, or null if the text is null.
   * @throws IllegalArgumentException if the JSON is malformed.
   */
  public static JsonNode readValue(final String json) {
    if (json == null) {
      return null;
    }
    try {
      return MAPPER.readTree(json);
    } catch (final JsonProcessingException e) {
      throw new IllegalArgumentException(
          "Failed to parse change value from JSON: " + json, e);
    }
  }

  /**
   * Writes a single JSON value as text.
   *
   * @param value the value, may be null.
   * @return the JSON text, or null if the value is null.
   */
  public static String writeValue(final JsonNode value) {
    if (value == null || value.isNull()) {
      return null;
    }
    return value.toString();
  }
}
