package symtm;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Transition which fires on every tape at once.
 *
 * Commands are ordered lexicographically along their tape commands, with a
 * shorter command sorting before any longer command it is a prefix of.
 *
 * @param tapes one tape command per tape, in tape order
 */
public record Command(List<TapeCommand> tapes) implements Comparable<Command> {

  public Command {
    tapes = List.copyOf(tapes);
  }

  public static Command of(TapeCommand... tapes) {
    return new Command(List.of(tapes));
  }

  /**
   * Number of tapes the command spans.
   */
  public int arity() {
    return tapes.size();
  }

  public TapeCommand tape(int tape) {
    return tapes.get(tape);
  }

  /**
   * States every tape must be in for the command to fire.
   */
  public List<State> sourceStates() {
    return tapes
      .stream()
      .map((TapeCommand tape) -> tape.before().state())
      .collect(Collectors.toUnmodifiableList());
  }

  /**
   * States every tape is left in once the command fires.
   */
  public List<State> targetStates() {
    return tapes
      .stream()
      .map((TapeCommand tape) -> tape.after().state())
      .collect(Collectors.toUnmodifiableList());
  }

  /**
   * Command with the before and after context of every tape swapped.
   */
  public Command reversed() {
    return new Command(
      tapes
        .stream()
        .map(TapeCommand::reversed)
        .collect(Collectors.toUnmodifiableList())
    );
  }

  @Override
  public int compareTo(Command other) {
    final int common = Math.min(tapes.size(), other.tapes.size());
    for (int i = 0; i < common; i++) {
      final int tapeCmp = tapes.get(i).compareTo(other.tapes.get(i));
      if (tapeCmp != 0) {
        return tapeCmp;
      }
    }
    return Integer.compare(tapes.size(), other.tapes.size());
  }

  public String compactString() {
    return tapes
      .stream()
      .map(TapeCommand::compactString)
      .collect(Collectors.joining("; "));
  }
}
