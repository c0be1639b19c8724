package works.ordermap.exceptions;

/**
 * Indicates an operation that requires string keys, such as JSON serialization
 * or {@link works.ordermap.OrderedMap#sortAscending() sorting by key},
 * was attempted on a map whose key type is something else.
 */
@SuppressWarnings("serial")
public class UnsupportedKeyTypeException extends UnsupportedOperationException {
	public UnsupportedKeyTypeException(String message) { super(message); }

	public static UnsupportedKeyTypeException forOperation(String operation, Class<?> keyType) {
		return new UnsupportedKeyTypeException("Cannot " + operation + ": key type is " + keyType.getSimpleName() + ", not String");
	}
}
