package org.waabox.changefeed;

import java.util.Objects;
import java.util.Optional;

/**
 * The structured reason a feed terminated with.
 *
 * <p>{@link #normal()} and {@link #shutdown()} describe an orderly stop,
 * {@link #CONNECTION_CLOSED} a cursor or connection closed out of band,
 * {@link #error(Throwable)} a crash, and {@link #of(String)} any other
 * application defined reason.
 *
 * <p>This class is immutable and thread-safe.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class ExitReason {

  /** The reason kinds. */
  private enum Kind {
    NORMAL, SHUTDOWN, CONNECTION_CLOSED, CUSTOM, ERROR
  }

  /** The normal exit reason. */
  private static final ExitReason NORMAL =
      new ExitReason(Kind.NORMAL, "normal", null);

  /** The shutdown exit reason. */
  private static final ExitReason SHUTDOWN =
      new ExitReason(Kind.SHUTDOWN, "shutdown", null);

  /** The reason used when the source closed the connection out of band. */
  public static final ExitReason CONNECTION_CLOSED =
      new ExitReason(Kind.CONNECTION_CLOSED, "connection_closed", null);

  /** The reason kind, never null. */
  private final Kind kind;

  /** The reason description, never null. */
  private final String description;

  /** The crash cause, only present for errors. */
  private final Throwable cause;

  private ExitReason(final Kind theKind, final String theDescription,
      final Throwable theCause) {
    kind = theKind;
    description = theDescription;
    cause = theCause;
  }

  /**
   * Returns the reason for an orderly, requested stop.
   *
   * @return the normal reason, never null
   */
  public static ExitReason normal() {
    return NORMAL;
  }

  /**
   * Returns the reason used when a feed is shut down from outside.
   *
   * @return the shutdown reason, never null
   */
  public static ExitReason shutdown() {
    return SHUTDOWN;
  }

  /**
   * Creates an application defined reason.
   *
   * @param description the reason, never null or blank
   *
   * @return the reason, never null
   */
  public static ExitReason of(final String description) {
    Objects.requireNonNull(description, "description must not be null");
    if (description.isBlank()) {
      throw new IllegalArgumentException("description must not be blank");
    }
    return new ExitReason(Kind.CUSTOM, description, null);
  }

  /**
   * Creates the reason for a crashed feed.
   *
   * @param cause the failure that crashed the feed, never null
   *
   * @return the reason, never null
   */
  public static ExitReason error(final Throwable cause) {
    Objects.requireNonNull(cause, "cause must not be null");
    return new ExitReason(Kind.ERROR, String.valueOf(cause), cause);
  }

  /**
   * Whether this reason describes an orderly stop.
   *
   * @return true for {@link #normal()} and {@link #shutdown()}
   */
  public boolean isNormal() {
    return kind == Kind.NORMAL || kind == Kind.SHUTDOWN;
  }

  /**
   * Whether this reason describes a crash.
   *
   * @return true if created by {@link #error(Throwable)}
   */
  public boolean isError() {
    return kind == Kind.ERROR;
  }

  /**
   * Returns the description of this reason.
   *
   * @return the description, never null
   */
  public String description() {
    return description;
  }

  /**
   * Returns the failure that crashed the feed.
   *
   * @return the cause, empty unless this is an error reason
   */
  public Optional<Throwable> cause() {
    return Optional.ofNullable(cause);
  }

  @Override
  public boolean equals(final Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof ExitReason that)) {
      return false;
    }
    return kind == that.kind
        && description.equals(that.description)
        && Objects.equals(cause, that.cause);
  }

  @Override
  public int hashCode() {
    return Objects.hash(kind, description, cause);
  }

  @Override
  public String toString() {
    return description;
  }
}
