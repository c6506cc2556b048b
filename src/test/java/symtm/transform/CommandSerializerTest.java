package symtm.transform;

import static org.junit.jupiter.api.Assertions.*;
import static symtm.SampleMachines.A;
import static symtm.SampleMachines.B;
import static symtm.SampleMachines.C;
import static symtm.SampleMachines.ctx;
import static symtm.SampleMachines.q;
import static symtm.SampleMachines.step;

import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.Test;
import symtm.Command;
import symtm.InvalidCommandShapeException;
import symtm.State;
import symtm.Symbol;
import symtm.TapeCommand;

class CommandSerializerTest {

  private static final Symbol D = Symbol.literal("d");
  private static final Symbol RB = Symbol.RIGHT_BOUNDARY;

  private static final List<Set<State>> TWO_TAPES = List.of(
    Set.of(q(0, 0), q(1, 0)),
    Set.of(q(0, 1), q(1, 1))
  );

  @Test
  void eachLiveTapeGetsItsOwnCommand() {
    final Command command = Command.of(
      step(ctx(A, q(0, 0), RB), ctx(B, q(1, 0), RB)),
      step(ctx(C, q(0, 1), RB), ctx(D, q(1, 1), RB))
    );
    final Relation serialized = CommandSerializer.serialize(new Relation(TWO_TAPES, Set.of(command)));

    final State bridge = q(2, 1);
    final Command first = Command.of(
      step(ctx(A, q(0, 0), RB), ctx(B, q(1, 0), RB)),
      step(ctx(Symbol.EMPTY, q(0, 1), RB), ctx(Symbol.EMPTY, bridge, RB))
    );
    final Command second = Command.of(
      TapeCommand.rest(ctx(Symbol.EMPTY, q(1, 0), RB)),
      step(ctx(C, bridge, RB), ctx(D, q(1, 1), RB))
    );

    assertEquals(Set.of(first, second), serialized.commands());
    assertEquals(Set.of(q(0, 1), q(1, 1), bridge), serialized.tapeStates().get(1));
    assertEquals(TWO_TAPES.get(0), serialized.tapeStates().get(0));
  }

  @Test
  void dontCareTapesStepWithTheFirstLiveTape() {
    final Command command = Command.of(
      step(ctx(Symbol.EMPTY, q(0, 0), RB), ctx(Symbol.EMPTY, q(1, 0), RB)),
      step(ctx(C, q(0, 1), RB), ctx(D, q(1, 1), RB))
    );
    final Relation serialized = CommandSerializer.serialize(new Relation(TWO_TAPES, Set.of(command)));

    assertEquals(Set.of(command), serialized.commands());
    assertEquals(TWO_TAPES, serialized.tapeStates());
  }

  @Test
  void commandsWithoutLiveTapesAreKept() {
    final Command command = Command.of(
      step(ctx(Symbol.EMPTY, q(0, 0), RB), ctx(Symbol.EMPTY, q(1, 0), RB)),
      TapeCommand.rest(ctx(Symbol.EMPTY, q(0, 1), RB))
    );
    final Relation serialized = CommandSerializer.serialize(new Relation(TWO_TAPES, Set.of(command)));

    assertEquals(Set.of(command), serialized.commands());
  }

  @Test
  void laterTapesBridgeThroughOneStatePerRound() {
    final List<Set<State>> threeTapes = List.of(
      Set.of(q(0, 0), q(1, 0)),
      Set.of(q(0, 1), q(1, 1)),
      Set.of(q(0, 2), q(1, 2))
    );
    final Command command = Command.of(
      step(ctx(A, q(0, 0), RB), ctx(A, q(1, 0), RB)),
      step(ctx(A, q(0, 1), RB), ctx(A, q(1, 1), RB)),
      step(ctx(A, q(0, 2), RB), ctx(A, q(1, 2), RB))
    );

    final var states = new TapeStates(threeTapes);
    final List<Command> chain = CommandSerializer.serializeCommand(command, states);

    assertEquals(3, chain.size());
    assertEquals(List.of(2, 3, 4), List.of(
      states.snapshot().get(0).size(),
      states.snapshot().get(1).size(),
      states.snapshot().get(2).size()
    ));

    // Consecutive commands in the chain connect up, and the chain ends in the targets
    for (int i = 1; i < chain.size(); i++) {
      assertEquals(chain.get(i - 1).targetStates(), chain.get(i).sourceStates());
    }
    assertEquals(command.sourceStates(), chain.get(0).sourceStates());
    assertEquals(command.targetStates(), chain.get(chain.size() - 1).targetStates());

    // Command i only does real work on tape i
    for (int i = 0; i < chain.size(); i++) {
      for (int tape = 0; tape < 3; tape++) {
        assertEquals(tape != i, chain.get(i).tape(tape).isDontCare());
      }
    }
  }

  @Test
  void rejectsCommandsOfTheWrongArity() {
    final Command oneTape = Command.of(step(ctx(A, q(0, 0), RB), ctx(B, q(1, 0), RB)));
    assertThrows(
      InvalidCommandShapeException.class,
      () -> CommandSerializer.serialize(new Relation(TWO_TAPES, Set.of(oneTape)))
    );
  }
}
