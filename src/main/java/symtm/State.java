package symtm;

/**
 * State of one tape.
 *
 * A state only has meaning inside the state set of the tape it belongs to: two
 * tapes may well contain equal states. The tape number is part of the name so
 * that generated states stay readable, and the sub-rank separates a state from
 * its mirror siblings (see {@link StateNamer#siblingOf}).
 *
 * All three components are non-negative.
 *
 * @param index number of the state
 * @param tape tape whose state set the state was named for
 * @param subRank zero for ordinary states, positive for mirror siblings
 */
public record State(
  int index,
  int tape,
  int subRank
) implements Comparable<State> {

  public State {
    if (index < 0 || tape < 0 || subRank < 0) {
      throw new IllegalArgumentException(
        "state components must be non-negative: index " + index + ", tape " + tape + ", sub-rank " + subRank
      );
    }
  }

  public static State of(int index, int tape) {
    return new State(index, tape, 0);
  }

  @Override
  public int compareTo(State other) {
    final int tapeCmp = Integer.compare(tape, other.tape);
    if (tapeCmp != 0) {
      return tapeCmp;
    }
    final int rankCmp = Integer.compare(subRank, other.subRank);
    if (rankCmp != 0) {
      return rankCmp;
    }
    return Integer.compare(index, other.index);
  }

  public String compactString() {
    return "q" + index + "^" + tape + (subRank == 0 ? "" : "~" + subRank);
  }

  @Override
  public String toString() {
    return "State[" + compactString() + "]";
  }
}
