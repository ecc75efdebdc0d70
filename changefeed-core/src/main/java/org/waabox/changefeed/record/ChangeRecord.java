package org.waabox.changefeed.record;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * A single change delivered by a feed.
 *
 * <p>A record without an old value is a creation, a record without a new
 * value is a deletion, and a record carrying both is an update. A JSON
 * {@code null} is normalized to an absent value.
 *
 * @param oldValue the value before the change, null for a creation
 * @param newValue the value after the change, null for a deletion
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public record ChangeRecord(JsonNode oldValue, JsonNode newValue) {

  /**
   * Creates a new change record.
   *
   * @param oldValue the value before the change, may be null
   * @param newValue the value after the change, may be null
   *
   * @throws IllegalArgumentException if both values are absent
   */
  public ChangeRecord {
    oldValue = absentIfNull(oldValue);
    newValue = absentIfNull(newValue);
    if (oldValue == null && newValue == null) {
      throw new IllegalArgumentException(
          "A change record needs an old value, a new value or both");
    }
  }

  /**
   * Creates a record describing a newly created value.
   *
   * @param value the created value, never null
   *
   * @return the change record, never null
   */
  public static ChangeRecord created(final JsonNode value) {
    return new ChangeRecord(null, value);
  }

  /**
   * Creates a record describing an updated value.
   *
   * @param oldValue the previous value, never null
   * @param newValue the current value, never null
   *
   * @return the change record, never null
   */
  public static ChangeRecord updated(final JsonNode oldValue,
      final JsonNode newValue) {
    return new ChangeRecord(oldValue, newValue);
  }

  /**
   * Creates a record describing a deleted value.
   *
   * @param value the deleted value, never null
   *
   * @return the change record, never null
   */
  public static ChangeRecord deleted(final JsonNode value) {
    return new ChangeRecord(value, null);
  }

  /**
   * Whether this record represents a creation.
   *
   * @return true if there is no old value
   */
  public boolean isCreation() {
    return oldValue == null;
  }

  /**
   * Whether this record represents a deletion.
   *
   * @return true if there is no new value
   */
  public boolean isDeletion() {
    return newValue == null;
  }

  /**
   * Whether this record represents an update of an existing value.
   *
   * @return true if both values are present
   */
  public boolean isUpdate() {
    return oldValue != null && newValue != null;
  }

  private static JsonNode absentIfNull(final JsonNode value) {
    if (value == null || value.isNull() || value.isMissingNode()) {
      return null;
    }
    return value;
  }
}
