package symtm;

/**
 * Two pieces of per-tape data disagree on how many tapes there are.
 */
public class ArityMismatchException extends MalformedMachineException {

  @java.io.Serial
  private static final long serialVersionUID = -2471658802238130948L;

  public final int expected;
  public final int found;

  /**
   * @param what capitalized description of the offending per-tape data
   * @param expected number of tapes
   * @param found number of entries actually present
   */
  public ArityMismatchException(String what, int expected, int found) {
    super(what + " cover " + found + " tapes, but the machine has " + expected);
    this.expected = expected;
    this.found = found;
  }
}
