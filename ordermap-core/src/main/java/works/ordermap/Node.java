package works.ordermap;

/**
 * One entry of an {@link OrderedMap}: a key, a value, and the links
 * to its neighbours in iteration order.
 * <p>
 * Owned by exactly one map, or by that map's {@link NodePool} while retired.
 */
final class Node<K, V> {
	K key;
	V value;
	Node<K, V> prev;
	Node<K, V> next;

	Node(K key, V value) {
		this.key = key;
		this.value = value;
	}

	@Override
	public String toString() {
		return key + "=" + value;
	}
}
