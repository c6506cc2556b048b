package symtm;

import java.util.List;

/**
 * No command of the machine leads every tape into its access state.
 */
public class MissingAcceptCommandException extends MalformedMachineException {

  @java.io.Serial
  private static final long serialVersionUID = -6043905811574617321L;

  public MissingAcceptCommandException(List<State> accessStates) {
    super("no command leads into the access states " + accessStates);
  }
}
