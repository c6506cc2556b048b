package symtm.transform;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import symtm.Machine;

/**
 * Entry points turning a machine into one with a symmetric transition relation.
 *
 * Both entry points double the tapes, serialize the commands so each fires on
 * one tape, split them into canonical form and finally add their reverses. The
 * result is a complete machine with the same input alphabet, the doubled tape
 * alphabets, and every state generated along the way.
 */
public final class SymmetricMachines {

  private static final Logger LOG = LoggerFactory.getLogger(SymmetricMachines.class);

  private SymmetricMachines() { }

  /**
   * Wrap a machine with a control tape, then symmetrize it.
   *
   * @param machine k-tape machine with exactly one accept command
   * @return symmetric machine with {@code 2(k+1)} tapes
   * @throws symtm.MissingAcceptCommandException if no command is an accept command
   * @throws symtm.AmbiguousAcceptCommandException if several commands are
   */
  public static Machine normalizeAndSymmetrize(Machine machine) {
    final Machine wrapped = ControlTapeWrapper.wrap(machine);
    return symmetrize(wrapped);
  }

  /**
   * Symmetrize a machine which is already in the shape produced by
   * {@link ControlTapeWrapper#wrap}.
   *
   * No accept command is looked for here.
   *
   * @param machine k-tape machine
   * @return symmetric machine with {@code 2k} tapes
   */
  public static Machine symmetrize(Machine machine) {
    final Machine doubled = TapeDoubler.fromMachine(machine);
    final Relation serialized = CommandSerializer.serialize(Relation.of(doubled));
    final Relation canonical = CanonicalSplitter.split(serialized);

    final Machine symmetric = new Machine(
      doubled.inputAlphabet(),
      doubled.tapeAlphabets(),
      canonical.tapeStates(),
      Symmetrizer.symmetrize(canonical.commands()),
      doubled.startStates(),
      doubled.accessStates()
    );

    LOG.info(
      "Symmetrized a {}-tape machine with {} commands into a {}-tape machine with {} commands",
      machine.tapeCount(),
      machine.commands().size(),
      symmetric.tapeCount(),
      symmetric.commands().size()
    );
    return symmetric;
  }
}
