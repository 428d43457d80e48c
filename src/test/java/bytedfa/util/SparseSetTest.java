package bytedfa.util;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.is;

import org.junit.Test;

public class SparseSetTest {

  @Test
  public void insertKeepsOrderAndIgnoresDuplicates() {
    final var set = new SparseSet(10);
    assertThat(set.insert(7), is(true));
    assertThat(set.insert(2), is(true));
    assertThat(set.insert(7), is(false));
    assertThat(set.size(), is(2));
    assertThat(set.get(0), is(7));
    assertThat(set.get(1), is(2));
    assertThat(set.contains(2), is(true));
    assertThat(set.contains(3), is(false));
  }

  @Test
  public void clearForgetsEverything() {
    final var set = new SparseSet(4);
    set.insert(0);
    set.insert(3);
    set.clear();
    assertThat(set.isEmpty(), is(true));
    assertThat(set.contains(0), is(false));
    assertThat(set.contains(3), is(false));
    assertThat(set.insert(3), is(true));
    assertThat(set.get(0), is(3));
  }

  @Test(expected = IndexOutOfBoundsException.class)
  public void getPastSize() {
    final var set = new SparseSet(4);
    set.insert(1);
    set.get(1);
  }
}
