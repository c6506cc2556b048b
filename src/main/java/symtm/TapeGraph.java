package symtm;

import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Stream;

/**
 * State graph of a single tape of a machine.
 *
 * Vertices are the states of the tape and edges are the distinct tape commands
 * which the machine's commands run on that tape.
 */
final class TapeGraph implements DotGraph<State, TapeCommand> {

  private final Machine machine;
  private final int tape;

  TapeGraph(Machine machine, int tape) {
    if (tape < 0 || tape >= machine.tapeCount()) {
      throw new IndexOutOfBoundsException("tape " + tape + " of a " + machine.tapeCount() + "-tape machine");
    }
    this.machine = machine;
    this.tape = tape;
  }

  @Override
  public Stream<DotGraph.Vertex<State>> vertices() {
    final State start = machine.startStates().get(tape);
    final State access = machine.accessStates().get(tape);
    return machine
      .tapeStates()
      .get(tape)
      .stream()
      .map((State state) -> new DotGraph.Vertex<>(state, state.equals(start), state.equals(access)));
  }

  @Override
  public Stream<DotGraph.Edge<State, TapeCommand>> edges() {
    // Several commands may agree on this tape
    final Set<TapeCommand> distinct = new TreeSet<>();
    for (Command command : machine.commands()) {
      distinct.add(command.tape(tape));
    }
    return distinct
      .stream()
      .map((TapeCommand step) -> new DotGraph.Edge<>(step.before().state(), step.after().state(), step));
  }

  @Override
  public String renderVertexLabel(DotGraph.Vertex<State> vertex) {
    return DotGraph.escapeHtml(vertex.id().compactString());
  }

  @Override
  public String renderEdgeLabel(DotGraph.Edge<State, TapeCommand> edge) {
    final TapeCommand step = edge.label();
    return DotGraph.escapeHtml(
      step.before().left().compactString() + "," + step.before().right().compactString()
      + " / "
      + step.after().left().compactString() + "," + step.after().right().compactString()
    );
  }
}
