package org.javai.tracelog.internal.instrument;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import org.javai.tracelog.internal.bind.ArgumentBindings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.lang.Nullable;

/**
 * Renders bound argument values as step parameters. Collections, maps, arrays
 * and records are written as JSON; everything else uses its own text.
 */
public class ArgumentRepresenter {

	private static final Logger logger = LoggerFactory.getLogger(ArgumentRepresenter.class);

	private final ObjectMapper mapper;

	public ArgumentRepresenter() {
		this(new ObjectMapper().findAndRegisterModules());
	}

	public ArgumentRepresenter(ObjectMapper mapper) {
		this.mapper = mapper;
	}

	public Map<String, String> parameters(ArgumentBindings bindings) {
		Map<String, String> parameters = new LinkedHashMap<>();
		bindings.asMap().forEach((name, value) -> parameters.put(name, represent(value)));
		return parameters;
	}

	public String represent(@Nullable Object value) {
		if (value == null) {
			return "null";
		}
		if (!isStructured(value)) {
			return String.valueOf(value);
		}
		try {
			return mapper.writeValueAsString(value);
		}
		catch (JsonProcessingException e) {
			logger.debug("Could not write {} as JSON, using its text instead", value.getClass().getName(), e);
			return String.valueOf(value);
		}
	}

	private static boolean isStructured(Object value) {
		return value instanceof Collection<?>
				|| value instanceof Map<?, ?>
				|| value.getClass().isArray()
				|| value.getClass().isRecord();
	}
}
