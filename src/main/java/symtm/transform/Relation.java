package symtm.transform;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;
import symtm.Command;
import symtm.Machine;
import symtm.State;

/**
 * Transition relation together with the per-tape state sets it draws from.
 *
 * This is what flows between the phases which only rewrite commands and need
 * to allocate new states along the way.
 *
 * @param tapeStates state set of each tape
 * @param commands commands, iterated in their natural order
 */
public record Relation(
  List<Set<State>> tapeStates,
  Set<Command> commands
) {

  public Relation {
    final var states = new ArrayList<Set<State>>(tapeStates.size());
    for (Set<State> tape : tapeStates) {
      states.add(Collections.unmodifiableSortedSet(new TreeSet<State>(tape)));
    }
    tapeStates = Collections.unmodifiableList(states);
    commands = Collections.unmodifiableSortedSet(new TreeSet<Command>(commands));
  }

  public static Relation of(Machine machine) {
    return new Relation(machine.tapeStates(), machine.commands());
  }

  static Relation of(TapeStates states, Collection<Command> commands) {
    return new Relation(states.snapshot(), new TreeSet<Command>(commands));
  }

  public int tapeCount() {
    return tapeStates.size();
  }
}
