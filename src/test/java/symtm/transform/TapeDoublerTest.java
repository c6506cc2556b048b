package symtm.transform;

import static org.junit.jupiter.api.Assertions.*;
import static symtm.SampleMachines.A;
import static symtm.SampleMachines.B;
import static symtm.SampleMachines.C;
import static symtm.SampleMachines.ctx;
import static symtm.SampleMachines.q;
import static symtm.SampleMachines.step;

import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.function.UnaryOperator;
import org.junit.jupiter.api.Test;
import symtm.Command;
import symtm.Machine;
import symtm.SampleMachines;
import symtm.State;
import symtm.Symbol;

class TapeDoublerTest {

  private static final UnaryOperator<State> SHIFT_ONE =
    (State state) -> new State(state.index(), state.tape(), state.subRank() + 1);

  @Test
  void rightContextMovesOntoTheMirrorTape() {
    final Command doubled = TapeDoubler.doubleCommand(
      Command.of(step(ctx(A, q(0, 0), B), ctx(C, q(1, 0), B))),
      SHIFT_ONE
    );

    assertEquals(
      Command.of(
        step(ctx(A, q(0, 0), Symbol.RIGHT_BOUNDARY), ctx(C, q(1, 0), Symbol.RIGHT_BOUNDARY)),
        step(
          ctx(B.mirror(), new State(0, 0, 1), Symbol.RIGHT_BOUNDARY),
          ctx(B.mirror(), new State(1, 0, 1), Symbol.RIGHT_BOUNDARY)
        )
      ),
      doubled
    );
  }

  @Test
  void rightBoundaryBecomesALeftBoundaryOnTheMirrorTape() {
    final Command doubled = TapeDoubler.doubleCommand(
      Command.of(step(ctx(A, q(0, 0), Symbol.RIGHT_BOUNDARY), ctx(A, q(1, 0), Symbol.RIGHT_BOUNDARY))),
      SHIFT_ONE
    );

    assertEquals(
      step(
        ctx(Symbol.LEFT_BOUNDARY, new State(0, 0, 1), Symbol.RIGHT_BOUNDARY),
        ctx(Symbol.LEFT_BOUNDARY, new State(1, 0, 1), Symbol.RIGHT_BOUNDARY)
      ),
      doubled.tape(1)
    );
  }

  @Test
  void everyFieldDoubles() {
    final Machine machine = SampleMachines.twoTapes();
    final Machine doubled = TapeDoubler.fromMachine(machine);

    assertEquals(4, doubled.tapeCount());
    assertEquals(machine.inputAlphabet(), doubled.inputAlphabet());
    assertEquals(machine.tapeAlphabets().get(0), doubled.tapeAlphabets().get(0));
    assertEquals(Set.of(A.mirror(), B.mirror(), C.mirror()), doubled.tapeAlphabets().get(1));
    assertEquals(Set.of(A.mirror()), doubled.tapeAlphabets().get(3));
    assertEquals(
      List.of(q(0, 0), new State(0, 0, 1), q(0, 1), new State(0, 1, 1)),
      doubled.startStates()
    );
    assertEquals(
      List.of(q(1, 0), new State(1, 0, 1), q(1, 1), new State(1, 1, 1)),
      doubled.accessStates()
    );
    for (Command command : doubled.commands()) {
      assertEquals(4, command.arity());
    }
  }

  @Test
  void mirrorStatesAreDisjointFromEveryOriginalTape() {
    final Machine machine = SampleMachines.twoTapes();
    final Machine doubled = TapeDoubler.fromMachine(machine);

    final var originals = new HashSet<State>();
    machine.tapeStates().forEach(originals::addAll);

    for (int tape = 1; tape < doubled.tapeCount(); tape += 2) {
      for (State mirror : doubled.tapeStates().get(tape)) {
        assertFalse(originals.contains(mirror));
      }
      assertEquals(doubled.tapeStates().get(tape - 1).size(), doubled.tapeStates().get(tape).size());
    }
  }
}
