package symtm.transform;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import symtm.AmbiguousAcceptCommandException;
import symtm.ArityMismatchException;
import symtm.Command;
import symtm.Context;
import symtm.Machine;
import symtm.MissingAcceptCommandException;
import symtm.State;
import symtm.Symbol;
import symtm.TapeCommand;

/**
 * Embeds a k-tape machine into a (k+1)-tape machine with a control tape.
 *
 * The control tape goes through a fixed lifecycle (see {@link ControlState}) and
 * its alphabet holds one {@link Symbol.Logged} symbol per original command.
 * The commands of the new machine come in stages, glued together by the state
 * of the control tape:
 *
 *   - entry: the control tape records the accept command and moves from
 *     {@code START} to {@code RUNNING}, while every data tape moves from its
 *     start state into a fresh stage-local state
 *
 *   - body: for each other command, the control tape records that command and
 *     stays {@code RUNNING}, while the data tapes rest in their stage-local state
 *
 *   - exit: the data tapes move back into their start states, and the control
 *     tape from {@code RUNNING} to {@code FINAL}
 *
 *   - replay: each original command fires on the data tapes only by moving its
 *     record past the head of the control tape
 *
 *   - rewind and erase: with the data tapes in their access states, records
 *     move back to the left of the control head and are then wiped
 *
 *   - accept: the control tape moves from {@code FINAL} to {@code ACCEPT}, the
 *     only accepting configuration of the new machine
 */
public final class ControlTapeWrapper {

  private static final Logger LOG = LoggerFactory.getLogger(ControlTapeWrapper.class);

  /**
   * Lifecycle of the control tape.
   */
  public enum ControlState {
    START,
    RUNNING,
    FINAL,
    ACCEPT;

    /**
     * Name of this lifecycle state on the control tape.
     *
     * @param controlTape index of the control tape
     */
    public State on(int controlTape) {
      return State.of(ordinal(), controlTape);
    }
  }

  private ControlTapeWrapper() { }

  /**
   * Find the single command leading every tape into its access state.
   *
   * @param machine machine to search
   * @return the accept command
   * @throws MissingAcceptCommandException if there is no such command
   * @throws AmbiguousAcceptCommandException if there are several
   */
  public static Command acceptCommand(Machine machine) {
    final List<Command> candidates = machine
      .commands()
      .stream()
      .filter((Command command) -> command.targetStates().equals(machine.accessStates()))
      .collect(Collectors.toList());

    if (candidates.isEmpty()) {
      throw new MissingAcceptCommandException(machine.accessStates());
    } else if (candidates.size() > 1) {
      throw new AmbiguousAcceptCommandException(machine.accessStates(), candidates.size());
    }
    return candidates.get(0);
  }

  /**
   * Wrap a machine with a control tape.
   *
   * @param machine k-tape machine with exactly one accept command
   * @return equivalent (k+1)-tape machine, whose last tape is the control tape
   */
  public static Machine wrap(Machine machine) {
    final int dataTapes = machine.tapeCount();
    final int controlTape = dataTapes;
    final Command accept = acceptCommand(machine);

    final var states = new TapeStates(machine.tapeStates());
    final var stageLocal = new ArrayList<State>(dataTapes);
    for (int tape = 0; tape < dataTapes; tape++) {
      stageLocal.add(states.fresh(tape));
    }

    final State running = ControlState.RUNNING.on(controlTape);
    final State finalState = ControlState.FINAL.on(controlTape);
    final var commands = new TreeSet<Command>();

    // Entry
    commands.add(extend(
      stageMoves(machine.startStates(), stageLocal),
      new TapeCommand(
        new Context(Symbol.EMPTY, ControlState.START.on(controlTape), Symbol.RIGHT_BOUNDARY),
        new Context(Symbol.logged(accept), running, Symbol.RIGHT_BOUNDARY)
      )
    ));

    // Body
    for (Command command : machine.commands()) {
      if (!command.equals(accept)) {
        commands.add(extend(
          stageMoves(stageLocal, stageLocal),
          new TapeCommand(
            new Context(Symbol.EMPTY, running, Symbol.RIGHT_BOUNDARY),
            new Context(Symbol.logged(command), running, Symbol.RIGHT_BOUNDARY)
          )
        ));
      }
    }

    // Exit
    commands.add(exitCommand(machine, stageLocal, controlTape));

    // Replay, rewind and erase
    final List<TapeCommand> restAtAccess = restAt(machine.accessStates());
    for (Command command : machine.commands()) {
      final Symbol record = Symbol.logged(command);
      commands.add(extend(
        command.tapes(),
        new TapeCommand(
          new Context(record, finalState, Symbol.EMPTY),
          new Context(Symbol.EMPTY, finalState, record)
        )
      ));
      commands.add(extend(
        restAtAccess,
        new TapeCommand(
          new Context(Symbol.EMPTY, finalState, record),
          new Context(record, finalState, Symbol.EMPTY)
        )
      ));
      commands.add(extend(
        restAtAccess,
        new TapeCommand(
          new Context(record, finalState, Symbol.RIGHT_BOUNDARY),
          new Context(Symbol.EMPTY, finalState, Symbol.RIGHT_BOUNDARY)
        )
      ));
    }

    // Accept
    commands.add(extend(
      restAtAccess,
      new TapeCommand(
        new Context(Symbol.LEFT_BOUNDARY, finalState, Symbol.RIGHT_BOUNDARY),
        new Context(Symbol.LEFT_BOUNDARY, ControlState.ACCEPT.on(controlTape), Symbol.RIGHT_BOUNDARY)
      )
    ));

    final List<Set<Symbol>> alphabets = new ArrayList<>(machine.tapeAlphabets());
    alphabets.add(
      machine
        .commands()
        .stream()
        .map(Symbol::logged)
        .collect(Collectors.toSet())
    );

    final List<Set<State>> tapeStates = states.snapshot();
    final var controlStates = new TreeSet<State>();
    for (ControlState control : ControlState.values()) {
      controlStates.add(control.on(controlTape));
    }
    tapeStates.add(controlStates);

    final var startStates = new ArrayList<State>(machine.startStates());
    startStates.add(ControlState.START.on(controlTape));
    final var accessStates = new ArrayList<State>(machine.accessStates());
    accessStates.add(ControlState.ACCEPT.on(controlTape));

    LOG.debug(
      "Wrapped {} data tapes: {} commands became {}",
      dataTapes,
      machine.commands().size(),
      commands.size()
    );

    return new Machine(
      machine.inputAlphabet(),
      alphabets,
      tapeStates,
      commands,
      startStates,
      accessStates
    );
  }

  /**
   * Command moving every data tape out of its stage-local state and back into
   * its start state, while the control tape finishes the logging stage.
   */
  private static Command exitCommand(Machine machine, List<State> stageLocal, int controlTape) {
    if (stageLocal.size() != machine.startStates().size()) {
      throw new ArityMismatchException("Stage-local states", machine.startStates().size(), stageLocal.size());
    }
    if (stageLocal.size() != machine.tapeStates().size()) {
      throw new ArityMismatchException("Stage-local states", machine.tapeStates().size(), stageLocal.size());
    }
    return extend(
      stageMoves(stageLocal, machine.startStates()),
      new TapeCommand(
        new Context(Symbol.EMPTY, ControlState.RUNNING.on(controlTape), Symbol.RIGHT_BOUNDARY),
        new Context(Symbol.EMPTY, ControlState.FINAL.on(controlTape), Symbol.RIGHT_BOUNDARY)
      )
    );
  }

  /**
   * Per data tape, a move from one state to another leaving the contents be.
   *
   * The first tape has nothing to its left, so it reads the don't-care marker
   * where the other tapes read their left boundary.
   */
  private static List<TapeCommand> stageMoves(List<State> from, List<State> to) {
    final var tapes = new ArrayList<TapeCommand>(from.size());
    for (int tape = 0; tape < from.size(); tape++) {
      final Symbol left = tape == 0 ? Symbol.EMPTY : Symbol.LEFT_BOUNDARY;
      tapes.add(new TapeCommand(
        new Context(left, from.get(tape), Symbol.RIGHT_BOUNDARY),
        new Context(left, to.get(tape), Symbol.RIGHT_BOUNDARY)
      ));
    }
    return tapes;
  }

  private static List<TapeCommand> restAt(List<State> states) {
    return states
      .stream()
      .map((State state) -> TapeCommand.rest(new Context(Symbol.LEFT_BOUNDARY, state, Symbol.RIGHT_BOUNDARY)))
      .collect(Collectors.toList());
  }

  private static Command extend(List<TapeCommand> dataTapes, TapeCommand controlTape) {
    final var tapes = new ArrayList<TapeCommand>(dataTapes.size() + 1);
    tapes.addAll(dataTapes);
    tapes.add(controlTape);
    return new Command(tapes);
  }
}
