package org.waabox.changefeed.record;

import java.util.List;
import java.util.Objects;

/**
 * One delivery unit of a change feed: an ordered, immutable list of
 * change records. A batch may be empty.
 *
 * @param records the change records, in the order the source produced
 *                them, never null
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public record ChangeBatch(List<ChangeRecord> records) {

  /** The empty batch. */
  private static final ChangeBatch EMPTY = new ChangeBatch(List.of());

  /**
   * Creates a new batch.
   *
   * @param records the change records, never null
   */
  public ChangeBatch {
    Objects.requireNonNull(records, "records must not be null");
    records = List.copyOf(records);
  }

  /**
   * Creates a batch from the given records.
   *
   * @param records the change records, never null
   *
   * @return the batch, never null
   */
  public static ChangeBatch of(final ChangeRecord... records) {
    return new ChangeBatch(List.of(records));
  }

  /**
   * Returns the empty batch.
   *
   * @return the empty batch, never null
   */
  public static ChangeBatch empty() {
    return EMPTY;
  }

  /**
   * Returns the number of records in this batch.
   *
   * @return the record count
   */
  public int size() {
    return records.size();
  }

  /**
   * Whether this batch carries no records.
   *
   * @return true if empty
   */
  public boolean isEmpty() {
    return records.isEmpty();
  }

  /**
   * Returns the first record of this batch.
   *
   * @return the first record, never null
   *
   * @throws IllegalStateException if the batch is empty
   */
  public ChangeRecord first() {
    if (records.isEmpty()) {
      throw new IllegalStateException("The batch is empty");
    }
    return records.get(0);
  }
}
