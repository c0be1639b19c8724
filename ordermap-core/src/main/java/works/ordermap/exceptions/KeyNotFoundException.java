package works.ordermap.exceptions;

import java.util.NoSuchElementException;
import works.ordermap.OrderedMap;

/**
 * Thrown when {@link OrderedMap#get} is called for a key the map does not contain.
 */
@SuppressWarnings("serial")
public class KeyNotFoundException extends NoSuchElementException {
	public KeyNotFoundException(Object key) {
		super("Key not found: \"" + key + "\"");
	}
}
