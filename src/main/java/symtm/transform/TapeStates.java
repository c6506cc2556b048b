package symtm.transform;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;
import symtm.Machine;
import symtm.State;
import symtm.StateNamer;

/**
 * Growing state sets of every tape, local to one run of one phase.
 *
 * Every state allocated here is added to its tape's set straight away, so the
 * next allocation for that tape sees it.
 */
final class TapeStates {

  private final List<TreeSet<State>> pools;

  TapeStates(List<? extends Set<State>> initial) {
    this.pools = new ArrayList<>(initial.size());
    for (Set<State> states : initial) {
      pools.add(new TreeSet<State>(states));
    }
  }

  int tapeCount() {
    return pools.size();
  }

  /**
   * Allocate a new state on a tape.
   *
   * @param tape index of the tape
   * @return state which was not previously in the tape's state set
   */
  State fresh(int tape) {
    final TreeSet<State> pool = pools.get(tape);
    final State state = StateNamer.fresh(pool);
    pool.add(state);
    return state;
  }

  /**
   * Current state sets, in the form stored on a {@link Machine}.
   */
  List<Set<State>> snapshot() {
    final var copies = new ArrayList<Set<State>>(pools.size());
    for (TreeSet<State> pool : pools) {
      copies.add(new TreeSet<State>(pool));
    }
    return copies;
  }
}
