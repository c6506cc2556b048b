package symtm;

import java.util.Collection;
import java.util.Comparator;
import java.util.Set;
import java.util.function.UnaryOperator;

/**
 * Generates new state names.
 *
 * Every method here is a pure function of its arguments, so running a
 * transformation twice on equal machines names its states identically.
 */
public final class StateNamer {

  private StateNamer() { }

  /**
   * Pick a state which is not yet in the state set of a tape.
   *
   * The new state follows the one with the largest index in the set (same
   * tape number and sub-rank, next index). Feeding each result back into the
   * set before the next call produces pairwise distinct states.
   *
   * @param tapeStates state set of the tape
   * @return state absent from {@code tapeStates}
   * @throws ArithmeticException if the largest index is already {@code Integer.MAX_VALUE}
   */
  public static State fresh(Set<State> tapeStates) {
    final State largest = tapeStates
      .stream()
      .max(Comparator.comparingInt(State::index).thenComparing(Comparator.naturalOrder()))
      .orElseThrow(() -> new IllegalArgumentException("cannot name a state for a tape with no states"));
    return new State(Math.addExact(largest.index(), 1), largest.tape(), largest.subRank());
  }

  /**
   * Derive the mirror sibling of a state.
   *
   * @param state state to derive from
   * @param allTapeStates state sets of every tape of the machine
   * @return state absent from every one of {@code allTapeStates}
   */
  public static State siblingOf(State state, Collection<? extends Set<State>> allTapeStates) {
    return siblings(allTapeStates).apply(state);
  }

  /**
   * Mapping from states to their mirror siblings.
   *
   * The sibling keeps the index and tape of the state, and has its sub-rank
   * shifted past every sub-rank in use. The shift is shared by all states, so
   * the mapping is injective and its image avoids every given state set.
   * Sub-ranks are never negative, so the shifted ones all lie above the
   * largest sub-rank in use.
   *
   * @param allTapeStates state sets of every tape of the machine
   * @throws ArithmeticException if a shifted sub-rank does not fit in an {@code int}
   */
  public static UnaryOperator<State> siblings(Collection<? extends Set<State>> allTapeStates) {
    final int shift = Math.addExact(1, allTapeStates
      .stream()
      .flatMap(Set::stream)
      .mapToInt(State::subRank)
      .max()
      .orElse(0));
    return (State state) -> new State(state.index(), state.tape(), Math.addExact(state.subRank(), shift));
  }
}
