package works.ordermap;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Checks the structural invariants of an {@link OrderedMap} through its public operations.
 */
public final class OrderedMapAssertions {
	private OrderedMapAssertions() { }

	public static <K, V> void assertConsistent(OrderedMap<K, V> map) {
		List<K> forward = new ArrayList<>();
		List<V> forwardValues = new ArrayList<>();
		map.forEach((k, v) -> {
			forward.add(k);
			forwardValues.add(v);
		});
		List<K> backward = new ArrayList<>();
		map.forEachReverse((k, v) -> backward.add(k));
		Collections.reverse(backward);

		assertEquals(forward, backward, "Forward and backward traversals must agree");
		assertEquals(map.size(), forward.size(), "Size must equal sequence length");
		assertEquals(forward.size(), new HashSet<>(forward).size(), "Keys must be distinct");
		assertEquals(forward, map.keys());
		assertEquals(forwardValues, map.values());
		assertEquals(map.isEmpty(), forward.isEmpty());

		for (int i = 0; i < forward.size(); i++) {
			K key = forward.get(i);
			assertTrue(map.containsKey(key), "Every key in the sequence must be indexed");
			assertEquals(forwardValues.get(i), map.get(key));
			assertEquals(i, map.indexOf(key));
		}

		if (forward.isEmpty()) {
			assertTrue(map.first().isEmpty());
			assertTrue(map.last().isEmpty());
		} else {
			assertEquals(forward.get(0), map.first().map(Map.Entry::getKey).orElseThrow());
			assertEquals(forward.get(forward.size() - 1), map.last().map(Map.Entry::getKey).orElseThrow());
		}
	}
}
