package symtm.transform;

import java.util.Collection;
import java.util.Set;
import java.util.TreeSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import symtm.Command;
import symtm.InvalidCommandShapeException;

/**
 * Closes a transition relation under reversal.
 */
public final class Symmetrizer {

  private static final Logger LOG = LoggerFactory.getLogger(Symmetrizer.class);

  private Symmetrizer() { }

  /**
   * Union of the commands and their reverses.
   *
   * @param commands canonical commands, all over the same tapes
   * @return symmetric relation
   * @throws InvalidCommandShapeException if the commands disagree on their arity
   */
  public static Set<Command> symmetrize(Collection<Command> commands) {
    final var symmetric = new TreeSet<Command>();
    int arity = -1;

    for (Command command : commands) {
      if (arity == -1) {
        arity = command.arity();
      } else if (command.arity() != arity) {
        throw new InvalidCommandShapeException("expected a command over " + arity + " tapes", command);
      }
      symmetric.add(command);
      symmetric.add(command.reversed());
    }

    LOG.debug("Symmetrized {} commands into {}", commands.size(), symmetric.size());
    return symmetric;
  }

  /**
   * Check if a relation is closed under reversal.
   *
   * @param commands relation to check
   */
  public static boolean isSymmetric(Set<Command> commands) {
    for (Command command : commands) {
      if (!commands.contains(command.reversed())) {
        return false;
      }
    }
    return true;
  }
}
