package bytedfa.table;

/**
 * How transitions are laid out in a serialized table.
 */
public enum TableLayout {

  /**
   * 256 state ids per state, indexed directly by byte.
   */
  DENSE(0),

  /**
   * Per state, a list of byte ranges and their targets. Ranges leading to the
   * dead state are left out.
   */
  SPARSE(1);

  /**
   * Value stored in the table header.
   */
  final int code;

  TableLayout(int code) {
    this.code = code;
  }

  static TableLayout fromCode(int code) {
    for (TableLayout layout : values()) {
      if (layout.code == code) {
        return layout;
      }
    }
    throw new IllegalArgumentException("Unknown table layout " + code);
  }
}
