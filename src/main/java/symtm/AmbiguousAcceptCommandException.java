package symtm;

import java.util.List;

/**
 * More than one command of the machine leads every tape into its access state.
 */
public class AmbiguousAcceptCommandException extends MalformedMachineException {

  @java.io.Serial
  private static final long serialVersionUID = 1872249075260137433L;

  /**
   * Number of commands which qualified as the accept command.
   */
  public final int candidates;

  public AmbiguousAcceptCommandException(List<State> accessStates, int candidates) {
    super(candidates + " commands lead into the access states " + accessStates + ", expected exactly one");
    this.candidates = candidates;
  }
}
