package symtm.transform;

import java.util.ArrayList;
import java.util.List;
import java.util.TreeSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import symtm.Command;
import symtm.Context;
import symtm.InvalidCommandShapeException;
import symtm.State;
import symtm.Symbol;
import symtm.TapeCommand;

/**
 * Brings commands into canonical (left-bounded) form.
 *
 * A tape command is left-bounded if it reads the left boundary or the
 * don't-care marker left of the head before the step, or the don't-care marker
 * after it. Commands where every tape command is left-bounded are kept. The
 * others are split in two half-steps through one fresh state per tape:
 *
 * <pre>
 *   (l, s, r) -&gt; (l', s', r')
 *
 * becomes
 *
 *   (l, s, r) -&gt; (_, m, r)
 *   (_, m, r) -&gt; (l', s', r')
 * </pre>
 */
public final class CanonicalSplitter {

  private static final Logger LOG = LoggerFactory.getLogger(CanonicalSplitter.class);

  private CanonicalSplitter() { }

  /**
   * Split every command which is not yet canonical.
   *
   * @param relation commands over some tapes and the states of those tapes
   * @return canonical commands, with the intermediate states added to the tapes
   * @throws InvalidCommandShapeException if a command does not span every tape
   */
  public static Relation split(Relation relation) {
    final var states = new TapeStates(relation.tapeStates());
    final var canonical = new TreeSet<Command>();
    int splitCount = 0;

    for (Command command : relation.commands()) {
      if (command.arity() != states.tapeCount()) {
        throw new InvalidCommandShapeException(
          "expected a command over " + states.tapeCount() + " tapes",
          command
        );
      }
      if (isCanonical(command)) {
        canonical.add(command);
      } else {
        canonical.addAll(splitCommand(command, states));
        splitCount++;
      }
    }

    LOG.debug("Split {} of {} commands into canonical form", splitCount, relation.commands().size());
    return Relation.of(states, canonical);
  }

  public static boolean isCanonical(Command command) {
    for (TapeCommand step : command.tapes()) {
      final Symbol leftBefore = step.before().left();
      final boolean leftBounded = leftBefore.equals(Symbol.LEFT_BOUNDARY)
        || leftBefore.equals(Symbol.EMPTY)
        || step.after().left().equals(Symbol.EMPTY);
      if (!leftBounded) {
        return false;
      }
    }
    return true;
  }

  /**
   * Split a command into two half-steps.
   *
   * @param command command to split
   * @param states state sets, extended with the intermediate states
   * @return first and second half-step
   */
  static List<Command> splitCommand(Command command, TapeStates states) {
    final var first = new ArrayList<TapeCommand>(command.arity());
    final var second = new ArrayList<TapeCommand>(command.arity());

    for (int tape = 0; tape < command.arity(); tape++) {
      final TapeCommand step = command.tape(tape);
      final State intermediate = states.fresh(tape);
      final var middle = new Context(Symbol.EMPTY, intermediate, step.before().right());
      first.add(new TapeCommand(step.before(), middle));
      second.add(new TapeCommand(middle, step.after()));
    }

    return List.of(new Command(first), new Command(second));
  }
}
