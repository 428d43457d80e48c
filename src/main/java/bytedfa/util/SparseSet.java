package bytedfa.util;

/**
 * Set of integers in {@code [0, capacity)} with constant time insertion,
 * membership, and clearing, remembering insertion order.
 *
 * <p>Membership is checked by cross-referencing the {@code dense} and
 * {@code sparse} arrays, so neither needs to be zeroed on {@link #clear}.
 */
public final class SparseSet {

  private final int[] dense;
  private final int[] sparse;
  private int size = 0;

  public SparseSet(int capacity) {
    this.dense = new int[capacity];
    this.sparse = new int[capacity];
  }

  public int capacity() {
    return dense.length;
  }

  public int size() {
    return size;
  }

  public boolean isEmpty() {
    return size == 0;
  }

  /**
   * Element at a position in insertion order.
   *
   * @param index index less than {@link #size}
   */
  public int get(int index) {
    if (index >= size) {
      throw new IndexOutOfBoundsException(index);
    }
    return dense[index];
  }

  /**
   * Insert a value (no-op if it is already present).
   *
   * @param value integer in {@code [0, capacity)}
   * @return whether the value was newly inserted
   */
  public boolean insert(int value) {
    if (contains(value)) {
      return false;
    }
    dense[size] = value;
    sparse[value] = size;
    size++;
    return true;
  }

  public boolean contains(int value) {
    final int index = sparse[value];
    return index < size && dense[index] == value;
  }

  public void clear() {
    size = 0;
  }
}
