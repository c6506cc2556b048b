package symtm;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * Multi-tape nondeterministic Turing machine.
 *
 * Every field other than the input alphabet and the commands holds one entry
 * per tape, and every command spans all of the tapes. The machine accepts once
 * every tape is simultaneously in its access state.
 *
 * The record is immutable: the constructor takes sorted, unmodifiable copies of
 * every collection, so iterating over any part of a machine always visits
 * elements in the same order, whatever containers the machine was built from.
 *
 * @param inputAlphabet symbols the input may be made of
 * @param tapeAlphabets alphabet of each tape
 * @param tapeStates state set of each tape
 * @param commands transition relation
 * @param startStates initial state of each tape
 * @param accessStates accepting state of each tape
 */
public record Machine(
  Set<Symbol> inputAlphabet,
  List<Set<Symbol>> tapeAlphabets,
  List<Set<State>> tapeStates,
  Set<Command> commands,
  List<State> startStates,
  List<State> accessStates
) {

  public Machine {
    inputAlphabet = sortedCopy(inputAlphabet);
    tapeAlphabets = sortedCopies(tapeAlphabets);
    tapeStates = sortedCopies(tapeStates);
    commands = sortedCopy(commands);
    startStates = List.copyOf(startStates);
    accessStates = List.copyOf(accessStates);

    final int tapes = tapeStates.size();
    if (tapeAlphabets.size() != tapes) {
      throw new ArityMismatchException("Tape alphabets", tapes, tapeAlphabets.size());
    }
    if (startStates.size() != tapes) {
      throw new ArityMismatchException("Start states", tapes, startStates.size());
    }
    if (accessStates.size() != tapes) {
      throw new ArityMismatchException("Access states", tapes, accessStates.size());
    }
    for (Command command : commands) {
      if (command.arity() != tapes) {
        throw new ArityMismatchException("Command " + command.compactString(), tapes, command.arity());
      }
    }
  }

  public int tapeCount() {
    return tapeStates.size();
  }

  /**
   * View of the machine restricted to one tape, as a state graph.
   *
   * @param tape index of the tape
   */
  public DotGraph<State, TapeCommand> tapeGraph(int tape) {
    return new TapeGraph(this, tape);
  }

  static <A extends Comparable<? super A>> Set<A> sortedCopy(Collection<A> elements) {
    return Collections.unmodifiableSortedSet(new TreeSet<A>(elements));
  }

  private static <A extends Comparable<? super A>> List<Set<A>> sortedCopies(List<? extends Collection<A>> perTape) {
    final var copies = new ArrayList<Set<A>>(perTape.size());
    for (Collection<A> elements : perTape) {
      copies.add(sortedCopy(elements));
    }
    return Collections.unmodifiableList(copies);
  }
}
