package symtm.transform;

import static org.junit.jupiter.api.Assertions.*;
import static symtm.SampleMachines.A;
import static symtm.SampleMachines.ctx;
import static symtm.SampleMachines.q;
import static symtm.SampleMachines.step;

import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.Test;
import symtm.Command;
import symtm.InvalidCommandShapeException;
import symtm.SampleMachines;
import symtm.Symbol;
import symtm.TapeCommand;

class SymmetrizerTest {

  @Test
  void addsTheReverseOfEveryCommand() {
    final Command forwards = SampleMachines.writeA();
    final Set<Command> symmetric = Symmetrizer.symmetrize(List.of(forwards));

    assertEquals(Set.of(forwards, forwards.reversed()), symmetric);
    assertTrue(Symmetrizer.isSymmetric(symmetric));
    assertFalse(Symmetrizer.isSymmetric(Set.of(forwards)));
  }

  @Test
  void reversingTwiceIsTheIdentity() {
    final Command command = SampleMachines.twoTapeCommand();
    assertEquals(command, command.reversed().reversed());
  }

  @Test
  void selfReverseCommandsAreNotDuplicated() {
    final Command rest = Command.of(TapeCommand.rest(ctx(Symbol.LEFT_BOUNDARY, q(0, 0), Symbol.RIGHT_BOUNDARY)));
    assertEquals(Set.of(rest), Symmetrizer.symmetrize(List.of(rest)));
  }

  @Test
  void rejectsMixedArities() {
    final Command twoTapes = Command.of(
      step(ctx(A, q(0, 0), A), ctx(A, q(1, 0), A)),
      step(ctx(A, q(0, 1), A), ctx(A, q(1, 1), A))
    );
    assertThrows(
      InvalidCommandShapeException.class,
      () -> Symmetrizer.symmetrize(List.of(SampleMachines.writeA(), twoTapes))
    );
  }
}
