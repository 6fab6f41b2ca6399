package sast;

import java.util.AbstractList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.RandomAccess;
import java.util.function.UnaryOperator;

import com.google.common.base.Preconditions;

/**
 * Fixed-capacity storage that trails a node header. Sized once by {@link ASTContext}; slots may be
 * overwritten but never added or removed.
 */
public final class TrailingArray<E> implements Iterable<E> {
  private final Object[] slots;
  private final List<E> view;

  @SuppressWarnings("unchecked")
  private TrailingArray(Object[] slots) {
    this.slots = slots;
    this.view = Collections.unmodifiableList((List<E>) Arrays.asList(slots));
  }

  static <E> TrailingArray<E> copyOf(List<? extends E> elements) {
    Object[] slots = elements.toArray();
    for (int i = 0; i < slots.length; i++) {
      Preconditions.checkNotNull(slots[i], "null trailing element at index %s", i);
    }
    return new TrailingArray<>(slots);
  }

  public int size() {
    return slots.length;
  }

  public boolean isEmpty() {
    return slots.length == 0;
  }

  public E get(int index) {
    return view.get(index);
  }

  public void set(int index, E element) {
    Preconditions.checkNotNull(element);
    Preconditions.checkElementIndex(index, slots.length);
    slots[index] = element;
  }

  /** A read-only view. */
  public List<E> asList() {
    return view;
  }

  /** A fixed-size view; {@code set} writes through, {@code add} and {@code remove} throw. */
  public List<E> asMutableList() {
    return asMutableList(UnaryOperator.identity());
  }

  /** Like {@link #asMutableList()}, storing {@code onSet(element)} for each element set. */
  List<E> asMutableList(UnaryOperator<E> onSet) {
    return new MutableView(onSet);
  }

  private final class MutableView extends AbstractList<E> implements RandomAccess {
    private final UnaryOperator<E> onSet;

    private MutableView(UnaryOperator<E> onSet) {
      this.onSet = onSet;
    }

    @Override
    public E get(int index) {
      return TrailingArray.this.get(index);
    }

    @Override
    public E set(int index, E element) {
      E previous = get(index);
      TrailingArray.this.set(index, onSet.apply(Preconditions.checkNotNull(element)));
      return previous;
    }

    @Override
    public int size() {
      return slots.length;
    }
  }

  @Override
  public Iterator<E> iterator() {
    return view.iterator();
  }

  @Override
  public String toString() {
    return view.toString();
  }
}
