package symtm;

/**
 * Command reaching a transformation phase does not have the shape the earlier
 * phases should have given it.
 *
 * Unlike {@link MalformedMachineException}, this points at a bug in the
 * pipeline rather than at bad input.
 */
public class InvalidCommandShapeException extends IllegalStateException {

  @java.io.Serial
  private static final long serialVersionUID = 7208343171866024551L;

  public InvalidCommandShapeException(String message, Command command) {
    super(message + ": " + command.compactString());
  }
}
