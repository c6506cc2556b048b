package symtm.transform;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.function.UnaryOperator;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import symtm.Command;
import symtm.Context;
import symtm.Machine;
import symtm.State;
import symtm.StateNamer;
import symtm.Symbol;
import symtm.TapeCommand;

/**
 * Gives every tape a mirror tape.
 *
 * Tape {@code i} of the input becomes tape {@code 2i} of the output, and its
 * mirror is tape {@code 2i+1}. The mirror tape has a disjoint copy of the
 * alphabet ({@link Symbol#mirror}) and of the state set
 * ({@link StateNamer#siblings}).
 *
 * The split happens at the head: the original tape keeps what is left of the
 * head and sees the right boundary on its right, while whatever was right of
 * the head is now, mirrored, left of the head of the mirror tape.
 */
public final class TapeDoubler {

  private static final Logger LOG = LoggerFactory.getLogger(TapeDoubler.class);

  private TapeDoubler() { }

  /**
   * Double the tapes of a machine.
   *
   * @param machine k-tape machine
   * @return 2k-tape machine
   */
  public static Machine fromMachine(Machine machine) {
    final UnaryOperator<State> sibling = StateNamer.siblings(machine.tapeStates());

    final var alphabets = new ArrayList<Set<Symbol>>(2 * machine.tapeCount());
    for (Set<Symbol> alphabet : machine.tapeAlphabets()) {
      alphabets.add(alphabet);
      alphabets.add(alphabet.stream().map(Symbol::mirror).collect(Collectors.toSet()));
    }

    final var tapeStates = new ArrayList<Set<State>>(2 * machine.tapeCount());
    for (Set<State> states : machine.tapeStates()) {
      tapeStates.add(states);
      tapeStates.add(states.stream().map(sibling).collect(Collectors.toSet()));
    }

    final List<Command> commands = machine
      .commands()
      .stream()
      .map((Command command) -> doubleCommand(command, sibling))
      .collect(Collectors.toList());

    LOG.debug("Doubled {} tapes into {}", machine.tapeCount(), tapeStates.size());

    return new Machine(
      machine.inputAlphabet(),
      alphabets,
      tapeStates,
      Set.copyOf(commands),
      doubleStates(machine.startStates(), sibling),
      doubleStates(machine.accessStates(), sibling)
    );
  }

  /**
   * Split every tape command in two: one on the original tape and one on its
   * mirror.
   *
   * @param command command over the original tapes
   * @param sibling mapping of states to their mirror sibling
   * @return command over the doubled tapes
   */
  static Command doubleCommand(Command command, UnaryOperator<State> sibling) {
    final var tapes = new ArrayList<TapeCommand>(2 * command.arity());
    for (TapeCommand step : command.tapes()) {
      final Context before = step.before();
      final Context after = step.after();

      tapes.add(new TapeCommand(
        new Context(before.left(), before.state(), Symbol.RIGHT_BOUNDARY),
        new Context(after.left(), after.state(), Symbol.RIGHT_BOUNDARY)
      ));

      final boolean atRightEdge = before.right().equals(Symbol.RIGHT_BOUNDARY);
      tapes.add(new TapeCommand(
        new Context(
          atRightEdge ? Symbol.LEFT_BOUNDARY : before.right().mirror(),
          sibling.apply(before.state()),
          Symbol.RIGHT_BOUNDARY
        ),
        new Context(
          atRightEdge ? Symbol.LEFT_BOUNDARY : after.right().mirror(),
          sibling.apply(after.state()),
          Symbol.RIGHT_BOUNDARY
        )
      ));
    }
    return new Command(tapes);
  }

  private static List<State> doubleStates(List<State> states, UnaryOperator<State> sibling) {
    final var doubled = new ArrayList<State>(2 * states.size());
    for (State state : states) {
      doubled.add(state);
      doubled.add(sibling.apply(state));
    }
    return doubled;
  }
}
