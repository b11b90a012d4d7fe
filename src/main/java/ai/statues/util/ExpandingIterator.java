package ai.statues.util;

import java.util.Collections;
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.function.Function;

/**
 * Expands each element of a backing iterator into a sub-iterator and iterates
 * over the concatenation of the sub-iterators. The backing iterator is only
 * advanced once the current sub-iterator is exhausted, and a sub-iterator is
 * only requested once its element has been pulled, so side effects of the
 * backing iterator (such as value bindings) stay in force while the elements
 * derived from them are consumed.
 */
public abstract class ExpandingIterator<S, T> implements Iterator<T> {
  public static class Lambda<S, T> extends ExpandingIterator<S, T> {
    private final Function<? super S, ? extends Iterator<? extends T>> expansion;

    public Lambda(final Iterator<? extends S> backing,
        final Function<? super S, ? extends Iterator<? extends T>> expansion) {
      super(backing);
      this.expansion = expansion;
    }

    @Override
    protected Iterator<? extends T> expand(final S item) {
      return expansion.apply(item);
    }
  }

  private final Iterator<? extends S> backing;
  private Iterator<? extends T> current = Collections.emptyIterator();
  private T next;
  private boolean needsAdvance = true, isTerminal = false;

  public ExpandingIterator(final Iterator<? extends S> backing) {
    this.backing = backing;
  }

  protected abstract Iterator<? extends T> expand(S item);

  private void advance() {
    needsAdvance = false;
    while (!current.hasNext()) {
      if (!backing.hasNext()) {
        isTerminal = true;
        return;
      }
      current = expand(backing.next());
    }

    next = current.next();
  }

  @Override
  public boolean hasNext() {
    if (needsAdvance) {
      advance();
    }
    return !isTerminal;
  }

  @Override
  public T next() {
    if (needsAdvance) {
      advance();
    }
    if (isTerminal) {
      throw new NoSuchElementException();
    }

    needsAdvance = true;
    return next;
  }
}
