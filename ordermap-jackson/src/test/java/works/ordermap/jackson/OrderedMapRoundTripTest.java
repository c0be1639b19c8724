package works.ordermap.jackson;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import java.util.Random;
import java.util.stream.Stream;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;
import works.ordermap.OrderedMap;

import static org.junit.jupiter.api.Assertions.assertEquals;

public class OrderedMapRoundTripTest {
	final OrderedMapJson json = new OrderedMapJson();

	@ParameterizedTest
	@MethodSource("randomSeeds")
	void randomFlatMap_roundTrip(long seed) throws JsonProcessingException {
		Random random = new Random(seed);
		OrderedMap<String, Integer> original = randomMap(random, 50);
		OrderedMap<String, Integer> decoded = json.decode(json.encode(original), Integer.class);
		assertEquals(original.keys(), decoded.keys());
		assertEquals(original.values(), decoded.values());
	}

	@ParameterizedTest
	@MethodSource("randomSeeds")
	void randomNestedMap_roundTrip(long seed) throws JsonProcessingException {
		Random random = new Random(seed);
		OrderedMap<String, OrderedMap<String, Integer>> original = OrderedMap.stringKeyed();
		for (int i = random.nextInt(10); i > 0; i--) {
			original.set(randomKey(random), randomMap(random, 10));
		}
		// Exercise reordered maps, not just insertion order
		if (random.nextBoolean()) {
			original.reverse();
		}
		OrderedMap<String, OrderedMap<String, Integer>> decoded = json.decode(json.encode(original), new TypeReference<OrderedMap<String, Integer>>() {});
		assertEquals(original, decoded);
	}

	@ParameterizedTest
	@MethodSource("randomSeeds")
	void randomUntypedMap_roundTrip(long seed) throws JsonProcessingException {
		Random random = new Random(seed);
		OrderedMap<String, Object> original = OrderedMap.stringKeyed();
		for (int i = random.nextInt(10); i > 0; i--) {
			switch (random.nextInt(3)) {
				case 0 -> original.set(randomKey(random), random.nextInt(1000));
				case 1 -> original.set(randomKey(random), randomKey(random));
				default -> {
					OrderedMap<String, Object> nested = OrderedMap.stringKeyed();
					nested.merge(randomMap(random, 5));
					original.set(randomKey(random), nested);
				}
			}
		}
		OrderedMap<String, Object> decoded = json.decode(json.encode(original), Object.class);
		assertEquals(original, decoded);
	}

	static OrderedMap<String, Integer> randomMap(Random random, int maxSize) {
		OrderedMap<String, Integer> result = OrderedMap.stringKeyed();
		for (int i = random.nextInt(maxSize); i > 0; i--) {
			result.set(randomKey(random), random.nextInt());
		}
		for (int i = random.nextInt(5); i > 0 && !result.isEmpty(); i--) {
			result.remove(result.keys().get(random.nextInt(result.size())));
		}
		return result;
	}

	/**
	 * Includes characters that are significant in JSON.
	 */
	static String randomKey(Random random) {
		String alphabet = "abcxyz,:{}[]\"\\ é";
		StringBuilder sb = new StringBuilder();
		for (int i = 1 + random.nextInt(6); i > 0; i--) {
			sb.append(alphabet.charAt(random.nextInt(alphabet.length())));
		}
		return sb.toString();
	}

	public static Stream<Arguments> randomSeeds() {
		return new Random(123)
			.longs(50)
			.mapToObj(Arguments::of);
	}
}
