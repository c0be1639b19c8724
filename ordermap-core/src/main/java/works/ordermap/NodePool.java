package works.ordermap;

/**
 * Free list of retired {@link Node}s, threaded through {@link Node#next}.
 * Unbounded.
 */
final class NodePool<K, V> {
	private Node<K, V> free;
	private int size;

	Node<K, V> acquire(K key, V value) {
		Node<K, V> node = free;
		if (node == null) {
			return new Node<>(key, value);
		}
		free = node.next;
		size--;
		node.next = null;
		node.key = key;
		node.value = value;
		return node;
	}

	/**
	 * The caller must already have unlinked <code>node</code> from its map.
	 */
	void release(Node<K, V> node) {
		// A retired node must not keep its payload or its old neighbours reachable
		node.key = null;
		node.value = null;
		node.prev = null;
		node.next = free;
		free = node;
		size++;
	}

	int size() {
		return size;
	}
}
