package works.ordermap.jackson;

import static java.util.Objects.requireNonNull;

public record OrderedMapJacksonConfiguration(
	DuplicateMembers duplicateMembers,
	UntypedObjects untypedObjects
) {
	public OrderedMapJacksonConfiguration {
		requireNonNull(duplicateMembers);
		requireNonNull(untypedObjects);
	}

	public static OrderedMapJacksonConfiguration defaultConfiguration() {
		return new OrderedMapJacksonConfiguration(DuplicateMembers.LAST_WINS, UntypedObjects.ORDERED_MAP);
	}

	/**
	 * What to do when a JSON object being decoded into an
	 * {@link works.ordermap.OrderedMap OrderedMap} names the same member twice.
	 */
	public enum DuplicateMembers {
		/**
		 * The member keeps the position of its first occurrence and takes
		 * the value of its last, exactly as repeated calls to
		 * {@link works.ordermap.OrderedMap#set OrderedMap.set} would.
		 */
		LAST_WINS,

		/**
		 * Decoding fails.
		 */
		REJECT,
	}

	/**
	 * How JSON objects are decoded when the static value type of the
	 * enclosing {@link works.ordermap.OrderedMap OrderedMap} is {@link Object}.
	 */
	public enum UntypedObjects {
		/**
		 * As <code>OrderedMap&lt;String, Object&gt;</code>, recursively, so member order
		 * survives at every depth. Arrays become {@link java.util.ArrayList ArrayList}s
		 * whose object elements are decoded the same way.
		 */
		ORDERED_MAP,

		/**
		 * Whatever Jackson's own untyped deserializer produces
		 * (normally a {@link java.util.LinkedHashMap LinkedHashMap}).
		 */
		LINKED_HASH_MAP,
	}
}
