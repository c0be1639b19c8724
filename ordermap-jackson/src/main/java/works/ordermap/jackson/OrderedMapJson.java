package works.ordermap.jackson;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.Getter;
import works.ordermap.OrderedMap;
import works.ordermap.exceptions.UnsupportedKeyTypeException;

/**
 * String-in, string-out JSON encoding for {@link OrderedMap}s with {@link String} keys.
 *
 * <p>
 * Uses its own copy of the given {@link ObjectMapper}, with an
 * {@link OrderedMapJacksonPlugin} module registered, so the caller's mapper is not modified.
 */
public final class OrderedMapJson {
	@Getter private final ObjectMapper mapper;

	public OrderedMapJson() {
		this(new ObjectMapper());
	}

	public OrderedMapJson(ObjectMapper baseMapper) {
		this(baseMapper, new OrderedMapJacksonPlugin());
	}

	public OrderedMapJson(ObjectMapper baseMapper, OrderedMapJacksonPlugin plugin) {
		this.mapper = baseMapper.copy();
		this.mapper.registerModule(plugin.module());
	}

	/**
	 * @return a JSON object whose members appear in <code>map</code>'s iteration order
	 * @throws UnsupportedKeyTypeException if <code>map</code> does not have String keys
	 */
	public String encode(OrderedMap<?, ?> map) throws JsonProcessingException {
		requireStringKeys(map, "encode");
		return mapper.writeValueAsString(map);
	}

	public <V> OrderedMap<String, V> decode(String json, Class<V> valueType) throws JsonProcessingException {
		return decode(json, mapper.constructType(valueType));
	}

	public <V> OrderedMap<String, V> decode(String json, TypeReference<V> valueType) throws JsonProcessingException {
		return decode(json, mapper.constructType(valueType));
	}

	/**
	 * @return a new map whose iteration order is the order of the members in <code>json</code>;
	 * empty if <code>json</code> is the JSON literal <code>null</code>
	 */
	public <V> OrderedMap<String, V> decode(String json, JavaType valueType) throws JsonProcessingException {
		return mapper.readValue(json, orderedMapType(valueType));
	}

	public <V> void decodeInto(String json, OrderedMap<String, V> target, Class<V> valueType) throws JsonProcessingException {
		decodeInto(json, target, mapper.constructType(valueType));
	}

	public <V> void decodeInto(String json, OrderedMap<String, V> target, TypeReference<V> valueType) throws JsonProcessingException {
		decodeInto(json, target, mapper.constructType(valueType));
	}

	/**
	 * Replaces the contents of <code>target</code> with the members of <code>json</code>.
	 *
	 * <p>
	 * <code>target</code> is emptied first. If decoding fails, it stays empty:
	 * its previous contents are not restored. Callers that need the old contents
	 * back on failure should {@link #decode decode} into a new map instead.
	 */
	public <V> void decodeInto(String json, OrderedMap<String, V> target, JavaType valueType) throws JsonProcessingException {
		requireStringKeys(target, "decode");
		target.clear();
		try {
			mapper.readerFor(orderedMapType(valueType))
				.withValueToUpdate(target)
				.readValue(json);
		} catch (JsonProcessingException | RuntimeException e) {
			target.clear();
			throw e;
		}
	}

	public JavaType orderedMapType(JavaType valueType) {
		return mapper.getTypeFactory().constructParametricType(OrderedMap.class, mapper.constructType(String.class), valueType);
	}

	private static void requireStringKeys(OrderedMap<?, ?> map, String operation) {
		if (!map.hasStringKeys()) {
			throw UnsupportedKeyTypeException.forOperation(operation, map.getKeyType());
		}
	}
}
