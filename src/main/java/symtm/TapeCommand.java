package symtm;

import java.util.Objects;

/**
 * Part of a command describing what happens on a single tape.
 *
 * @param before context the tape must be in for the command to fire
 * @param after context the tape is left in
 */
public record TapeCommand(
  Context before,
  Context after
) implements Comparable<TapeCommand> {

  public TapeCommand {
    Objects.requireNonNull(before, "before");
    Objects.requireNonNull(after, "after");
  }

  /**
   * Tape command which leaves the tape exactly as it found it.
   *
   * @param context context on both sides of the step
   */
  public static TapeCommand rest(Context context) {
    return new TapeCommand(context, context);
  }

  /**
   * Same step, run backwards.
   */
  public TapeCommand reversed() {
    return new TapeCommand(after, before);
  }

  /**
   * Whether the tape is not involved in the step: the symbol left of the head
   * is a don't-care marker both before and after.
   */
  public boolean isDontCare() {
    return before.left().equals(Symbol.EMPTY) && after.left().equals(Symbol.EMPTY);
  }

  @Override
  public int compareTo(TapeCommand other) {
    final int beforeCmp = before.compareTo(other.before);
    if (beforeCmp != 0) {
      return beforeCmp;
    }
    return after.compareTo(other.after);
  }

  public String compactString() {
    return before.compactString() + " -> " + after.compactString();
  }
}
