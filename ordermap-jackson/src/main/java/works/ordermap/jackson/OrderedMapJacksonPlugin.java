package works.ordermap.jackson;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonParseException;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.databind.BeanDescription;
import com.fasterxml.jackson.databind.DeserializationConfig;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.JsonDeserializer;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.JsonSerializer;
import com.fasterxml.jackson.databind.SerializationConfig;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.deser.Deserializers;
import com.fasterxml.jackson.databind.ser.Serializers;
import com.fasterxml.jackson.databind.type.TypeFactory;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.ordermap.OrderedMap;
import works.ordermap.exceptions.UnsupportedKeyTypeException;

import static com.fasterxml.jackson.core.JsonToken.END_ARRAY;
import static com.fasterxml.jackson.core.JsonToken.END_OBJECT;
import static com.fasterxml.jackson.core.JsonToken.FIELD_NAME;
import static com.fasterxml.jackson.core.JsonToken.START_OBJECT;
import static com.fasterxml.jackson.core.JsonToken.VALUE_NULL;
import static works.ordermap.jackson.OrderedMapJacksonConfiguration.DuplicateMembers.REJECT;
import static works.ordermap.jackson.OrderedMapJacksonConfiguration.UntypedObjects.ORDERED_MAP;
import static works.ordermap.jackson.OrderedMapJacksonConfiguration.defaultConfiguration;

/**
 * Provides JSON serialization/deserialization of {@link OrderedMap} using Jackson.
 *
 * <p>
 * An <code>OrderedMap</code> is written as a plain JSON object whose members appear
 * in the map's iteration order. When reading, the members are {@link OrderedMap#set set}
 * in the order they appear in the input, so the resulting map has the source's order
 * rather than any order Jackson's own map handling would impose.
 * Values are read and written by whatever Jackson would use for their type;
 * values whose static type is itself an <code>OrderedMap</code> come back here,
 * so containers nest to any depth.
 *
 * <p>
 * Only maps with {@link String} keys can be serialized.
 */
public final class OrderedMapJacksonPlugin {
	private final OrderedMapJacksonConfiguration config;

	public OrderedMapJacksonPlugin() {
		this(defaultConfiguration());
	}

	public OrderedMapJacksonPlugin(OrderedMapJacksonConfiguration config) {
		this.config = config;
	}

	public OrderedMapJacksonConfiguration configuration() {
		return config;
	}

	public OrderedMapJacksonModule module() {
		return new OrderedMapJacksonModule() {
			@Override
			public void setupModule(SetupContext context) {
				context.addSerializers(new OrderedMapSerializers());
				context.addDeserializers(new OrderedMapDeserializers());
			}
		};
	}

	private final class OrderedMapSerializers extends Serializers.Base {
		private final Map<JavaType, JsonSerializer<?>> memo = new ConcurrentHashMap<>();

		@Override
		public JsonSerializer<?> findSerializer(SerializationConfig config, JavaType type, BeanDescription beanDesc) {
			if (OrderedMap.class.isAssignableFrom(type.getRawClass())) {
				return memo.computeIfAbsent(type, __ -> {
					LOGGER.trace("Creating serializer for {}", type);
					return new OrderedMapSerializer();
				});
			} else {
				return null;
			}
		}
	}

	private final class OrderedMapDeserializers extends Deserializers.Base {
		private final Map<JavaType, JsonDeserializer<?>> memo = new ConcurrentHashMap<>();

		@Override
		public JsonDeserializer<?> findBeanDeserializer(JavaType type, DeserializationConfig config, BeanDescription beanDesc) {
			if (OrderedMap.class.isAssignableFrom(type.getRawClass())) {
				return memo.computeIfAbsent(type, __ -> {
					LOGGER.trace("Creating deserializer for {}", type);
					return new OrderedMapDeserializer(type);
				});
			} else {
				return null;
			}
		}
	}

	private static final class OrderedMapSerializer extends JsonSerializer<OrderedMap<?, ?>> {
		@Override
		public void serialize(OrderedMap<?, ?> value, JsonGenerator gen, SerializerProvider serializers) throws IOException {
			if (!value.hasStringKeys()) {
				throw UnsupportedKeyTypeException.forOperation("serialize to JSON", value.getKeyType());
			}
			gen.writeStartObject(value);
			for (Map.Entry<?, ?> entry : value) {
				if (!(entry.getKey() instanceof String key)) {
					// Possible when the map was created for a wider static key type
					throw UnsupportedKeyTypeException.forOperation("serialize to JSON", entry.getKey().getClass());
				}
				Object memberValue = entry.getValue();
				gen.writeFieldName(key);
				try {
					if (memberValue == null) {
						serializers.defaultSerializeNull(gen);
					} else {
						serializers
							.findValueSerializer(memberValue.getClass())
							.serialize(memberValue, gen, serializers);
					}
				} catch (IOException | RuntimeException e) {
					throw JsonMappingException.wrapWithPath(e, value, key);
				}
			}
			gen.writeEndObject();
		}

		@Override
		public boolean isEmpty(SerializerProvider provider, OrderedMap<?, ?> value) {
			return value.isEmpty();
		}
	}

	/**
	 * Decodes into <code>OrderedMap&lt;String, V&gt;</code>, where <code>V</code>
	 * is the second type parameter of the static type it was created for.
	 */
	private final class OrderedMapDeserializer extends JsonDeserializer<OrderedMap<String, Object>> {
		private final JavaType keyType;
		private final JavaType valueType;
		private final boolean keysAreStrings;
		private final boolean readUntypedObjectsAsOrderedMaps;

		OrderedMapDeserializer(JavaType mapType) {
			this.keyType = javaParameterType(mapType, OrderedMap.class, 0);
			this.valueType = javaParameterType(mapType, OrderedMap.class, 1);
			// An unbound K, as in a raw or wildcard type, shows up as Object
			Class<?> rawKeyType = keyType.getRawClass();
			this.keysAreStrings = rawKeyType == String.class || rawKeyType == Object.class;
			this.readUntypedObjectsAsOrderedMaps = valueType.getRawClass() == Object.class
				&& config.untypedObjects() == ORDERED_MAP;
		}

		@Override
		public OrderedMap<String, Object> deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
			requireStringKeyType();
			OrderedMap<String, Object> result = OrderedMap.stringKeyed();
			readMembers(p, ctxt, result);
			return result;
		}

		/**
		 * Clears <code>intoValue</code> and fills it from the input.
		 * If decoding fails, <code>intoValue</code> is left empty.
		 */
		@Override
		public OrderedMap<String, Object> deserialize(JsonParser p, DeserializationContext ctxt, OrderedMap<String, Object> intoValue) throws IOException {
			requireStringKeyType();
			if (!intoValue.hasStringKeys()) {
				throw UnsupportedKeyTypeException.forOperation("deserialize from JSON", intoValue.getKeyType());
			}
			intoValue.clear();
			try {
				readMembers(p, ctxt, intoValue);
			} catch (IOException | RuntimeException e) {
				LOGGER.debug("Discarding {} partially decoded members", intoValue.size(), e);
				intoValue.clear();
				throw e;
			}
			return intoValue;
		}

		/**
		 * JSON <code>null</code> decodes as an empty map.
		 */
		@Override
		public OrderedMap<String, Object> getNullValue(DeserializationContext ctxt) {
			requireStringKeyType();
			return OrderedMap.stringKeyed();
		}

		@Override
		public boolean isCachable() { return true; }

		private void requireStringKeyType() {
			if (!keysAreStrings) {
				throw UnsupportedKeyTypeException.forOperation("deserialize from JSON", keyType.getRawClass());
			}
		}

		/**
		 * Expects the parser on the {@link JsonToken#START_OBJECT START_OBJECT} token.
		 * Leaves the parser sitting on the matching {@link JsonToken#END_OBJECT END_OBJECT} token.
		 */
		private void readMembers(JsonParser p, DeserializationContext ctxt, OrderedMap<String, Object> result) throws IOException {
			JsonDeserializer<Object> valueDeserializer = ctxt.findContextualValueDeserializer(valueType, null);
			expect(START_OBJECT, p);
			while (p.nextToken() != END_OBJECT) {
				expect(FIELD_NAME, p);
				String key = p.currentName();
				p.nextToken();
				Object value;
				try {
					value = readMemberValue(p, ctxt, valueDeserializer);
				} catch (IOException | RuntimeException e) {
					throw JsonMappingException.wrapWithPath(e, result, key);
				}
				if (config.duplicateMembers() == REJECT && result.containsKey(key)) {
					throw new JsonParseException(p, "Member appears twice: \"" + key + "\"");
				}
				result.set(key, value);
			}
		}

		private Object readMemberValue(JsonParser p, DeserializationContext ctxt, JsonDeserializer<Object> valueDeserializer) throws IOException {
			if (readUntypedObjectsAsOrderedMaps) {
				return readUntyped(p, ctxt, valueDeserializer);
			} else if (p.currentToken() == VALUE_NULL) {
				return valueDeserializer.getNullValue(ctxt);
			} else {
				return valueDeserializer.deserialize(p, ctxt);
			}
		}

		private Object readUntyped(JsonParser p, DeserializationContext ctxt, JsonDeserializer<Object> untypedDeserializer) throws IOException {
			switch (p.currentToken()) {
				case START_OBJECT: {
					OrderedMap<String, Object> nested = OrderedMap.stringKeyed();
					readMembers(p, ctxt, nested);
					return nested;
				}
				case START_ARRAY: {
					List<Object> elements = new ArrayList<>();
					int index = 0;
					while (p.nextToken() != END_ARRAY) {
						try {
							elements.add(readUntyped(p, ctxt, untypedDeserializer));
						} catch (IOException | RuntimeException e) {
							throw JsonMappingException.wrapWithPath(e, elements, index);
						}
						index++;
					}
					return elements;
				}
				case VALUE_NULL:
					return null;
				default:
					return untypedDeserializer.deserialize(p, ctxt);
			}
		}
	}

	//
	// Helpers
	//

	public static JavaType javaParameterType(JavaType parameterizedType, Class<?> expectedClass, int index) {
		JavaType[] parameters = parameterizedType.findTypeParameters(expectedClass);
		if (index < parameters.length) {
			return parameters[index];
		} else {
			// Raw type
			return TypeFactory.unknownType();
		}
	}

	public static void expect(JsonToken expected, JsonParser p) throws IOException {
		if (p.currentToken() != expected) {
			throw new JsonParseException(p, "Expected " + expected + "; found " + p.currentToken());
		}
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(OrderedMapJacksonPlugin.class);
}
