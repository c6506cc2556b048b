package symtm;

import java.util.Objects;

/**
 * Situation of one tape before or after a step: the symbols on either side of
 * the head and the state the tape is in.
 *
 * @param left symbol to the left of the head
 * @param state current state of the tape
 * @param right symbol to the right of the head
 */
public record Context(
  Symbol left,
  State state,
  Symbol right
) implements Comparable<Context> {

  public Context {
    Objects.requireNonNull(left, "left");
    Objects.requireNonNull(state, "state");
    Objects.requireNonNull(right, "right");
  }

  public Context withState(State newState) {
    return newState.equals(state) ? this : new Context(left, newState, right);
  }

  @Override
  public int compareTo(Context other) {
    final int leftCmp = left.compareTo(other.left);
    if (leftCmp != 0) {
      return leftCmp;
    }
    final int stateCmp = state.compareTo(other.state);
    if (stateCmp != 0) {
      return stateCmp;
    }
    return right.compareTo(other.right);
  }

  public String compactString() {
    return "(" + left.compactString() + ", " + state.compactString() + ", " + right.compactString() + ")";
  }
}
