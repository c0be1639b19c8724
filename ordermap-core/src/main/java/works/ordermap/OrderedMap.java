package works.ordermap;

import java.util.AbstractMap.SimpleImmutableEntry;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.ConcurrentModificationException;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Optional;
import java.util.StringJoiner;
import java.util.function.BiConsumer;
import java.util.function.BiPredicate;
import lombok.Getter;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import works.ordermap.exceptions.KeyNotFoundException;
import works.ordermap.exceptions.UnsupportedKeyTypeException;

import static java.util.Collections.unmodifiableList;
import static java.util.Objects.requireNonNull;

/**
 * A mutable map that remembers the order in which its keys were first inserted.
 *
 * <p>
 * Lookups go through a hash index; iteration follows a doubly linked list
 * threaded through the same entries. Updating the value of an existing key
 * leaves it where it is. Removed entries are retired to a per-map pool and
 * reused by later insertions, so insert/remove churn does not allocate.
 *
 * <p>
 * The order can be rearranged explicitly with {@link #reverse()},
 * {@link #sortAscending()}, {@link #sortDescending()} and {@link #sortByKey}.
 * Sorting by the natural key order, like JSON serialization, is only
 * available when the key type is {@link String}; that is determined once,
 * from the key type passed to the constructor.
 *
 * <p>
 * Keys must be non-null. Values may be <code>null</code>, so a <code>null</code>
 * result from {@link #getOrDefault(Object)} does not distinguish a stored
 * <code>null</code> from an absent key; use {@link #containsKey} or {@link #pop}
 * for that.
 *
 * <p>
 * <em>This class is not thread-safe.</em> A map shared between threads must be
 * guarded externally, including for the whole duration of any traversal.
 * Structural modification (adding or removing keys, or reordering) from inside
 * {@link #forEach(BiConsumer)}, {@link #forEachReverse(BiConsumer)} or an
 * {@link #iterator() iteration} is not supported, and is detected on a
 * best-effort basis with a {@link ConcurrentModificationException}.
 * Replacing the value of an existing key is not a structural modification.
 *
 * @param <K> key type
 * @param <V> value type
 */
public final class OrderedMap<K, V> implements Iterable<Map.Entry<K, V>> {
	@Getter private final Class<K> keyType;
	private final boolean stringKeys;
	private final Map<K, Node<K, V>> index = new HashMap<>();
	private final NodePool<K, V> pool = new NodePool<>();
	private Node<K, V> head;
	private Node<K, V> tail;
	private int size;
	private int modCount;

	public OrderedMap(Class<K> keyType) {
		this.keyType = requireNonNull(keyType);
		this.stringKeys = String.class.equals(keyType);
	}

	public static <V> OrderedMap<String, V> stringKeyed() {
		return new OrderedMap<>(String.class);
	}

	public static <V> OrderedMap<String, V> of() {
		return stringKeyed();
	}

	public static <V> OrderedMap<String, V> of(String k1, V v1) {
		OrderedMap<String, V> result = stringKeyed();
		result.set(k1, v1);
		return result;
	}

	public static <V> OrderedMap<String, V> of(String k1, V v1, String k2, V v2) {
		OrderedMap<String, V> result = of(k1, v1);
		result.set(k2, v2);
		return result;
	}

	public static <V> OrderedMap<String, V> of(String k1, V v1, String k2, V v2, String k3, V v3) {
		OrderedMap<String, V> result = of(k1, v1, k2, v2);
		result.set(k3, v3);
		return result;
	}

	/**
	 * @return true if the key type is {@link String}, which is required for
	 * JSON serialization and for sorting by natural key order.
	 */
	public boolean hasStringKeys() {
		return stringKeys;
	}

	public int size() { return size; }

	public boolean isEmpty() { return size == 0; }

	/**
	 * If <code>key</code> is already present, replaces its value without changing its position.
	 * Otherwise, appends a new entry at the end.
	 */
	public void set(K key, V value) {
		requireNonNull(key);
		Node<K, V> existing = index.get(key);
		if (existing != null) {
			existing.value = value;
			return;
		}
		Node<K, V> node = pool.acquire(key, value);
		if (tail == null) {
			head = node;
		} else {
			tail.next = node;
			node.prev = tail;
		}
		tail = node;
		index.put(key, node);
		size++;
		modCount++;
	}

	/**
	 * @throws KeyNotFoundException if <code>key</code> is absent
	 */
	public V get(K key) {
		Node<K, V> node = index.get(requireNonNull(key));
		if (node == null) {
			throw new KeyNotFoundException(key);
		}
		return node.value;
	}

	/**
	 * @return the value for <code>key</code>, or null if absent or if the stored value is null
	 */
	public @Nullable V getOrDefault(K key) {
		Node<K, V> node = index.get(requireNonNull(key));
		return (node == null) ? null : node.value;
	}

	public V getOrDefault(K key, V defaultValue) {
		Node<K, V> node = index.get(requireNonNull(key));
		return (node == null) ? defaultValue : node.value;
	}

	public boolean containsKey(K key) {
		return index.containsKey(requireNonNull(key));
	}

	public boolean containsValue(Object value) {
		return containsValue(value, Objects::equals);
	}

	/**
	 * Linear scan in iteration order.
	 *
	 * @param equality called with each stored value as its first argument and <code>value</code> as its second
	 */
	public <T> boolean containsValue(T value, BiPredicate<? super V, ? super T> equality) {
		for (Node<K, V> node = head; node != null; node = node.next) {
			if (equality.test(node.value, value)) {
				return true;
			}
		}
		return false;
	}

	/**
	 * Has no effect if <code>key</code> is absent.
	 *
	 * @return true if an entry was removed
	 */
	public boolean remove(K key) {
		Node<K, V> node = index.remove(requireNonNull(key));
		if (node == null) {
			return false;
		}
		retire(node);
		return true;
	}

	/**
	 * Removes <code>key</code> and returns the entry it had.
	 *
	 * @return the removed entry, whose value may be null,
	 * or {@link Optional#empty() empty} if <code>key</code> was absent
	 */
	public Optional<Map.Entry<K, V>> pop(K key) {
		Node<K, V> node = index.remove(requireNonNull(key));
		if (node == null) {
			return Optional.empty();
		}
		Map.Entry<K, V> entry = entryOf(node);
		retire(node);
		return Optional.of(entry);
	}

	public void clear() {
		Node<K, V> node = head;
		while (node != null) {
			Node<K, V> next = node.next;
			pool.release(node);
			node = next;
		}
		index.clear();
		head = tail = null;
		size = 0;
		modCount++;
	}

	/**
	 * Linear scan from the first entry.
	 *
	 * @return the zero-based position of <code>key</code> in iteration order, or -1 if absent
	 */
	public int indexOf(K key) {
		requireNonNull(key);
		int position = 0;
		for (Node<K, V> node = head; node != null; node = node.next) {
			if (node.key.equals(key)) {
				return position;
			}
			position++;
		}
		return -1;
	}

	public Optional<Map.Entry<K, V>> first() {
		return Optional.ofNullable(head).map(OrderedMap::entryOf);
	}

	public Optional<Map.Entry<K, V>> last() {
		return Optional.ofNullable(tail).map(OrderedMap::entryOf);
	}

	public List<K> keys() {
		List<K> result = new ArrayList<>(size);
		for (Node<K, V> node = head; node != null; node = node.next) {
			result.add(node.key);
		}
		return unmodifiableList(result);
	}

	public List<V> values() {
		List<V> result = new ArrayList<>(size);
		for (Node<K, V> node = head; node != null; node = node.next) {
			result.add(node.value);
		}
		return unmodifiableList(result);
	}

	/**
	 * Calls <code>action</code> for each entry, first to last.
	 */
	public void forEach(BiConsumer<? super K, ? super V> action) {
		requireNonNull(action);
		int expectedModCount = modCount;
		for (Node<K, V> node = head; node != null; node = node.next) {
			action.accept(node.key, node.value);
			// Check before following node.next, which is not trustworthy if node was retired
			if (modCount != expectedModCount) {
				throw new ConcurrentModificationException();
			}
		}
	}

	/**
	 * Calls <code>action</code> for each entry, last to first.
	 */
	public void forEachReverse(BiConsumer<? super K, ? super V> action) {
		requireNonNull(action);
		int expectedModCount = modCount;
		for (Node<K, V> node = tail; node != null; node = node.prev) {
			action.accept(node.key, node.value);
			if (modCount != expectedModCount) {
				throw new ConcurrentModificationException();
			}
		}
	}

	/**
	 * Iterates first to last. The entries are read-only snapshots;
	 * use {@link #set} to change a value.
	 */
	@Override
	public @NotNull Iterator<Map.Entry<K, V>> iterator() {
		return new EntryIterator();
	}

	/**
	 * Reverses the iteration order in place.
	 */
	public void reverse() {
		Node<K, V> node = head;
		while (node != null) {
			Node<K, V> next = node.next;
			node.next = node.prev;
			node.prev = next;
			node = next;
		}
		Node<K, V> oldHead = head;
		head = tail;
		tail = oldHead;
		modCount++;
	}

	/**
	 * @return an independent map with the same entries in the same order.
	 * Keys and values themselves are shared, not copied.
	 */
	public OrderedMap<K, V> copy() {
		OrderedMap<K, V> result = new OrderedMap<>(keyType);
		for (Node<K, V> node = head; node != null; node = node.next) {
			result.set(node.key, node.value);
		}
		return result;
	}

	/**
	 * {@link #set Sets} every entry of <code>other</code>, in <code>other</code>'s order.
	 * Keys already present keep their position and take the new value;
	 * new keys are appended.
	 */
	public void merge(OrderedMap<? extends K, ? extends V> other) {
		for (Node<? extends K, ? extends V> node = other.head; node != null; node = node.next) {
			set(node.key, node.value);
		}
	}

	/**
	 * @throws UnsupportedKeyTypeException if the key type is not {@link String}
	 */
	public void sortAscending() {
		sortByKey(naturalStringOrder("sort ascending"));
	}

	/**
	 * @throws UnsupportedKeyTypeException if the key type is not {@link String}
	 */
	public void sortDescending() {
		sortByKey(naturalStringOrder("sort descending").reversed());
	}

	/**
	 * Stable sort: entries whose keys compare equal keep their relative order.
	 * Only the links change; the lookup index is untouched.
	 */
	public void sortByKey(Comparator<? super K> comparator) {
		requireNonNull(comparator);
		if (size < 2) {
			return;
		}
		List<Node<K, V>> nodes = new ArrayList<>(size);
		for (Node<K, V> node = head; node != null; node = node.next) {
			nodes.add(node);
		}
		nodes.sort((a, b) -> comparator.compare(a.key, b.key));

		Node<K, V> prev = null;
		for (Node<K, V> node : nodes) {
			node.prev = prev;
			if (prev == null) {
				head = node;
			} else {
				prev.next = node;
			}
			prev = node;
		}
		tail = prev;
		tail.next = null;
		modCount++;
	}

	int pooledNodeCount() {
		return pool.size();
	}

	@SuppressWarnings("unchecked")
	private Comparator<K> naturalStringOrder(String operation) {
		if (!stringKeys) {
			throw UnsupportedKeyTypeException.forOperation(operation, keyType);
		}
		return (Comparator<K>) (Comparator<?>) Comparator.<String>naturalOrder();
	}

	/**
	 * Unlinks a node that has already been removed from {@link #index} and returns it to the pool.
	 */
	private void retire(Node<K, V> node) {
		Node<K, V> prev = node.prev;
		Node<K, V> next = node.next;
		if (prev == null) {
			head = next;
		} else {
			prev.next = next;
		}
		if (next == null) {
			tail = prev;
		} else {
			next.prev = prev;
		}
		pool.release(node);
		size--;
		modCount++;
	}

	private static <KK, VV> Map.Entry<KK, VV> entryOf(Node<KK, VV> node) {
		return new SimpleImmutableEntry<>(node.key, node.value);
	}

	private final class EntryIterator implements Iterator<Map.Entry<K, V>> {
		private final int expectedModCount = modCount;
		private Node<K, V> next = head;

		@Override
		public boolean hasNext() {
			return next != null;
		}

		@Override
		public Map.Entry<K, V> next() {
			if (modCount != expectedModCount) {
				throw new ConcurrentModificationException();
			}
			Node<K, V> node = next;
			if (node == null) {
				throw new NoSuchElementException();
			}
			next = node.next;
			return entryOf(node);
		}
	}

	/**
	 * Two maps are equal if they have equal entries in the same order.
	 * The key type does not participate.
	 */
	@Override
	public boolean equals(Object obj) {
		if (this == obj) {
			return true;
		}
		if (!(obj instanceof OrderedMap<?, ?> other) || other.size != this.size) {
			return false;
		}
		Node<?, ?> mine = this.head;
		Node<?, ?> theirs = other.head;
		while (mine != null) {
			if (!mine.key.equals(theirs.key) || !Objects.equals(mine.value, theirs.value)) {
				return false;
			}
			mine = mine.next;
			theirs = theirs.next;
		}
		return true;
	}

	@Override
	public int hashCode() {
		int result = 1;
		for (Node<K, V> node = head; node != null; node = node.next) {
			result = 31 * result + (node.key.hashCode() ^ Objects.hashCode(node.value));
		}
		return result;
	}

	@Override
	public String toString() {
		StringJoiner result = new StringJoiner(", ", "{", "}");
		for (Node<K, V> node = head; node != null; node = node.next) {
			result.add(node.toString());
		}
		return result.toString();
	}
}
