package ai.statues.util;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.NoSuchElementException;

import com.google.common.collect.Iterators;

import org.junit.jupiter.api.Test;

import lombok.val;

public class ExpandingIteratorTest {
  @Test
  public void testExpand() {
    val list = Arrays.asList(1, 2, 3);
    assertThat(new ExpandingIterator.Lambda<Integer, Integer>(list.iterator(),
        i -> Collections.nCopies(i, i).iterator()))
        .toIterable().containsExactly(1, 2, 2, 3, 3, 3);
  }

  @Test
  public void testSkipEmpty() {
    val list = Arrays.asList(0, 2, 0, 0, 1, 0);
    assertThat(new ExpandingIterator.Lambda<Integer, Integer>(list.iterator(),
        i -> Collections.nCopies(i, i).iterator()))
        .toIterable().containsExactly(2, 2, 1);
  }

  @Test
  public void testEmpty() {
    val it = new ExpandingIterator.Lambda<Integer, Integer>(Collections.<Integer>emptyIterator(),
        i -> Collections.nCopies(i, i).iterator());
    assertThat(it.hasNext()).isFalse();
    assertThatThrownBy(it::next).isInstanceOf(NoSuchElementException.class);
  }

  @Test
  public void testBackingAdvancedLazily() {
    val pulled = new ArrayList<Integer>();
    val backing = Iterators.transform(Arrays.asList(1, 2).iterator(), i -> {
      pulled.add(i);
      return i;
    });
    val it = new ExpandingIterator.Lambda<Integer, String>(backing,
        i -> Arrays.asList(i + "a", i + "b").iterator());

    assertThat(pulled).isEmpty();
    assertThat(it.next()).isEqualTo("1a");
    assertThat(it.next()).isEqualTo("1b");
    assertThat(pulled).containsExactly(1);
    assertThat(it.hasNext()).isTrue();
    assertThat(pulled).containsExactly(1, 2);
    assertThat(it).toIterable().containsExactly("2a", "2b");
  }

  @Test
  public void testNested() {
    val list = Arrays.asList(1, 2);
    assertThat(new ExpandingIterator.Lambda<Integer, Integer>(list.iterator(),
        i -> new ExpandingIterator.Lambda<Integer, Integer>(Arrays.asList(10, 20).iterator(),
            j -> Collections.singletonList(i + j).iterator())))
        .toIterable().containsExactly(11, 21, 12, 22);
  }
}
