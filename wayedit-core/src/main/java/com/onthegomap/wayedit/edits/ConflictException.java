package com.onthegomap.wayedit.edits;

/**
 * Thrown when an edit cannot be applied to the current state of the map data because that state changed since the
 * edit was made and the conflict cannot be solved automatically.
 * <p>
 * An edit that throws this has not changed anything. The caller decides whether to retry with fresh data, or to
 * surface the conflict to the user.
 */
public class ConflictException extends Exception {

  private final String stat;

  /**
   * Constructs a new exception with a detailed error message.
   *
   * @param stat    short code that identifies the kind of conflict, for example {@code "deleted"}
   * @param message description of the conflict that should be detailed enough to find the offending element
   */
  public ConflictException(String stat, String message) {
    super(message);
    this.stat = stat;
  }

  /** Returns the code that identifies the kind of conflict. */
  public String stat() {
    return stat;
  }
}
