package works.ordermap.jackson;

import com.fasterxml.jackson.core.Version;
import com.fasterxml.jackson.databind.Module;

/**
 * The Jackson {@link Module} produced by {@link OrderedMapJacksonPlugin#module()}.
 * Register it with an {@link com.fasterxml.jackson.databind.ObjectMapper ObjectMapper}
 * to read and write {@link works.ordermap.OrderedMap OrderedMap}s as JSON objects.
 */
public abstract class OrderedMapJacksonModule extends Module {
	@Override
	public String getModuleName() {
		return OrderedMapJacksonModule.class.getSimpleName();
	}

	@Override
	public Version version() {
		return Version.unknownVersion();
	}
}
