package org.waabox.changefeed.record;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.TextNode;

import org.junit.jupiter.api.Test;

/**
 * Tests for {@link ChangeRecord} and {@link ChangeBatch}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
class ChangeRecordTest {

  @Test
  void whenCreating_givenOnlyNewValue_shouldBeACreation() {
    final ChangeRecord record = ChangeRecord.created(new TextNode("value"));

    assertTrue(record.isCreation());
    assertFalse(record.isUpdate());
    assertFalse(record.isDeletion());
    assertNull(record.oldValue());
  }

  @Test
  void whenCreating_givenJsonNullOldValue_shouldNormalizeToAbsent() {
    final ChangeRecord record = new ChangeRecord(NullNode.getInstance(),
        new TextNode("value"));

    assertNull(record.oldValue());
    assertTrue(record.isCreation());
  }

  @Test
  void whenCreating_givenBothValues_shouldBeAnUpdate() {
    final ChangeRecord record = ChangeRecord.updated(new TextNode("value"),
        new TextNode("new_value"));

    assertTrue(record.isUpdate());
    assertEquals("new_value", record.newValue().asText());
  }

  @Test
  void whenCreating_givenOnlyOldValue_shouldBeADeletion() {
    final ChangeRecord record = ChangeRecord.deleted(
        JsonNodeFactory.instance.objectNode().put("id", 1));

    assertTrue(record.isDeletion());
  }

  @Test
  void whenCreating_givenNoValues_shouldThrow() {
    assertThrows(IllegalArgumentException.class, () ->
        new ChangeRecord(null, NullNode.getInstance())
    );
  }

  @Test
  void whenTakingFirst_givenEmptyBatch_shouldThrow() {
    final ChangeBatch batch = ChangeBatch.empty();

    assertTrue(batch.isEmpty());
    assertThrows(IllegalStateException.class, batch::first);
  }

  @Test
  void whenBuildingBatch_givenRecords_shouldKeepTheirOrder() {
    final ChangeRecord first = ChangeRecord.created(new TextNode("a"));
    final ChangeRecord second = ChangeRecord.created(new TextNode("b"));

    final ChangeBatch batch = ChangeBatch.of(first, second);

    assertEquals(2, batch.size());
    assertEquals(first, batch.first());
    assertEquals(second, batch.records().get(1));
  }
}
