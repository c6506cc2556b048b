package symtm;

import java.util.Objects;

/**
 * Symbol written on a tape.
 *
 * Three of the variants are sentinels: the left and right boundary markers
 * (the head sits at a structural edge of the tape) and the don't-care marker
 * (the tape is not involved in that context). The other variants carry data.
 * Symbols are totally ordered, first by {@link Kind} and then by payload.
 */
public interface Symbol extends Comparable<Symbol> {

  /**
   * Left boundary marker.
   */
  public static final Symbol LEFT_BOUNDARY = new LeftBoundary();

  /**
   * Right boundary marker.
   */
  public static final Symbol RIGHT_BOUNDARY = new RightBoundary();

  /**
   * Don't-care marker.
   */
  public static final Symbol EMPTY = new Empty();

  /**
   * Every variant of symbol, in the order used to compare symbols.
   */
  enum Kind {
    LEFT_BOUNDARY(true),
    RIGHT_BOUNDARY(true),
    EMPTY(true),
    LITERAL(false),
    LOGGED(false),
    MIRRORED(false);

    public final boolean sentinel;

    Kind(boolean sentinel) {
      this.sentinel = sentinel;
    }
  }

  public Kind kind();

  /**
   * Returns a compact string representation of the symbol.
   *
   * @return compact string representation
   */
  public String compactString();

  default boolean isSentinel() {
    return kind().sentinel;
  }

  /**
   * Copy of this symbol for a mirror tape.
   *
   * Boundary and don't-care markers denote structure rather than data, so they
   * are shared between a tape and its mirror. Every other symbol gets wrapped,
   * which means it can never be equal to a symbol of the original alphabet.
   *
   * @return mirrored symbol
   */
  default Symbol mirror() {
    return isSentinel() ? this : new Mirrored(this);
  }

  /**
   * Compare the payload of this symbol to that of a symbol of the same kind.
   *
   * Variants without a payload are all equal. A symbol of the same kind but
   * of another class is ordered by its compact string.
   *
   * @param other symbol whose {@link #kind()} equals this one's
   * @return negative, zero or positive as for {@link #compareTo}
   */
  public int comparePayload(Symbol other);

  @Override
  default int compareTo(Symbol other) {
    final int kindCmp = kind().compareTo(other.kind());
    return kindCmp != 0 ? kindCmp : comparePayload(other);
  }

  static Symbol literal(String name) {
    return new Literal(name);
  }

  static Symbol logged(Command command) {
    return new Logged(command);
  }

  record LeftBoundary() implements Symbol {

    @Override
    public Kind kind() {
      return Kind.LEFT_BOUNDARY;
    }

    @Override
    public int comparePayload(Symbol other) {
      return 0;
    }

    @Override
    public String compactString() {
      return "|-";
    }
  }

  record RightBoundary() implements Symbol {

    @Override
    public Kind kind() {
      return Kind.RIGHT_BOUNDARY;
    }

    @Override
    public int comparePayload(Symbol other) {
      return 0;
    }

    @Override
    public String compactString() {
      return "-|";
    }
  }

  record Empty() implements Symbol {

    @Override
    public Kind kind() {
      return Kind.EMPTY;
    }

    @Override
    public int comparePayload(Symbol other) {
      return 0;
    }

    @Override
    public String compactString() {
      return "_";
    }
  }

  /**
   * Data symbol supplied by whoever built the machine.
   *
   * @param name name of the symbol
   */
  record Literal(String name) implements Symbol {

    public Literal {
      Objects.requireNonNull(name, "name");
    }

    @Override
    public Kind kind() {
      return Kind.LITERAL;
    }

    @Override
    public int comparePayload(Symbol other) {
      if (other instanceof Literal that) {
        return name.compareTo(that.name);
      }
      return compactString().compareTo(other.compactString());
    }

    @Override
    public String compactString() {
      return name;
    }
  }

  /**
   * Record of a command having fired, kept on the control tape.
   *
   * @param command command which this symbol stands for
   */
  record Logged(Command command) implements Symbol {

    public Logged {
      Objects.requireNonNull(command, "command");
    }

    @Override
    public Kind kind() {
      return Kind.LOGGED;
    }

    @Override
    public int comparePayload(Symbol other) {
      if (other instanceof Logged that) {
        return command.compareTo(that.command);
      }
      return compactString().compareTo(other.compactString());
    }

    @Override
    public String compactString() {
      return "[" + command.compactString() + "]";
    }
  }

  /**
   * Disjoint copy of a data symbol, used in the alphabet of a mirror tape.
   *
   * @param original symbol from the original tape
   */
  record Mirrored(Symbol original) implements Symbol {

    public Mirrored {
      Objects.requireNonNull(original, "original");
    }

    @Override
    public Kind kind() {
      return Kind.MIRRORED;
    }

    @Override
    public int comparePayload(Symbol other) {
      if (other instanceof Mirrored that) {
        return original.compareTo(that.original);
      }
      return compactString().compareTo(other.compactString());
    }

    @Override
    public String compactString() {
      return original.compactString() + "'";
    }
  }
}
