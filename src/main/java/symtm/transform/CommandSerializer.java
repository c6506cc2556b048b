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
 * Rewrites commands acting on several tapes at once into chains of commands
 * which each act on one tape.
 *
 * A tape is live in a command unless it reads the don't-care marker left of the
 * head both before and after. Each live tape, in increasing order, gets its own
 * command in the chain. In the command for live tape {@code n}:
 *
 *   - tape {@code n} makes its step, from its current state to its target
 *
 *   - live tapes before {@code n} have already reached their target and rest
 *
 *   - live tapes after {@code n} step into a fresh bridging state, so that no
 *     tape shows its target before its own turn
 *
 *   - tapes which are not live make their (don't-care) step in the first
 *     command of the chain and rest afterwards
 *
 * Running the chain from start to end has the same effect as the original
 * command. A command with no live tape is kept as is.
 */
public final class CommandSerializer {

  private static final Logger LOG = LoggerFactory.getLogger(CommandSerializer.class);

  private CommandSerializer() { }

  /**
   * Serialize every command of a relation.
   *
   * @param relation commands over some tapes and the states of those tapes
   * @return serialized commands, with the bridging states added to the tapes
   * @throws InvalidCommandShapeException if a command does not span every tape
   */
  public static Relation serialize(Relation relation) {
    final var states = new TapeStates(relation.tapeStates());
    final var serialized = new TreeSet<Command>();

    for (Command command : relation.commands()) {
      if (command.arity() != states.tapeCount()) {
        throw new InvalidCommandShapeException(
          "expected a command over " + states.tapeCount() + " tapes",
          command
        );
      }
      final List<Command> chain = serializeCommand(command, states);
      LOG.trace("Serialized {} into {} commands", command.compactString(), chain.size());
      serialized.addAll(chain);
    }

    LOG.debug("Serialized {} commands into {}", relation.commands().size(), serialized.size());
    return Relation.of(states, serialized);
  }

  /**
   * Serialize a single command.
   *
   * @param command command to serialize
   * @param states state sets, extended with any bridging states needed
   * @return chain of commands, in the order they need to fire
   */
  static List<Command> serializeCommand(Command command, TapeStates states) {
    final int arity = command.arity();
    final var liveTapes = new ArrayList<Integer>();
    for (int tape = 0; tape < arity; tape++) {
      if (!command.tape(tape).isDontCare()) {
        liveTapes.add(tape);
      }
    }
    if (liveTapes.isEmpty()) {
      return List.of(command);
    }

    final List<State> targets = command.targetStates();
    final var current = new ArrayList<State>(command.sourceStates());
    final var chain = new ArrayList<Command>(liveTapes.size());

    for (int live : liveTapes) {
      final var tapes = new ArrayList<TapeCommand>(arity);
      for (int tape = 0; tape < arity; tape++) {
        final TapeCommand step = command.tape(tape);
        final State from = current.get(tape);
        final State to;

        if (tape == live || step.isDontCare()) {
          to = targets.get(tape);
          tapes.add(new TapeCommand(step.before().withState(from), step.after().withState(to)));
        } else {
          // Already done if before the live tape, otherwise bridge to the next round
          to = tape < live && from.equals(targets.get(tape)) ? from : states.fresh(tape);
          tapes.add(new TapeCommand(
            new Context(Symbol.EMPTY, from, step.before().right()),
            new Context(Symbol.EMPTY, to, step.after().right())
          ));
        }
        current.set(tape, to);
      }
      chain.add(new Command(tapes));
    }
    return chain;
  }
}
