package bytedfa.table;

/**
 * Shape of a serialized table.
 *
 * @param layout dense or sparse transitions
 * @param width bytes per state id
 */
public record TableOptions(TableLayout layout, StateIdWidth width) {

  public static final TableOptions DEFAULT = new TableOptions(TableLayout.DENSE, StateIdWidth.U32);

  public TableOptions withLayout(TableLayout layout) {
    return new TableOptions(layout, width);
  }

  public TableOptions withWidth(StateIdWidth width) {
    return new TableOptions(layout, width);
  }
}
