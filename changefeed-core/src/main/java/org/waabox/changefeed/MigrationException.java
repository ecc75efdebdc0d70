package org.waabox.changefeed;

/**
 * Thrown by {@link Changefeed#migrate(Object, Object)} when the handler
 * rejects a state migration. The feed keeps its previous state.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public class MigrationException extends ChangefeedException {

  private static final long serialVersionUID = 1L;

  /**
   * Creates a new exception.
   *
   * @param feedName the name of the feed, never null
   * @param reason   the reason given by the handler, never null
   */
  public MigrationException(final String feedName, final String reason) {
    super("Changefeed '" + feedName + "' rejected migration: " + reason);
  }
}
