package symtm;

/**
 * Machine handed to a transformation does not satisfy its preconditions.
 *
 * The transformations have no meaningful partial result, so these are always
 * fatal to the call which raised them.
 */
public class MalformedMachineException extends IllegalArgumentException {

  @java.io.Serial
  private static final long serialVersionUID = 3315420788640957122L;

  public MalformedMachineException(String message) {
    super(message);
  }
}
