package org.javai.tracelog.internal.instrument;

import static org.assertj.core.api.Assertions.assertThat;
import java.util.List;
import java.util.Map;
import org.javai.tracelog.internal.bind.ArgumentBinder;
import org.javai.tracelog.internal.bind.CallArguments;
import org.javai.tracelog.internal.bind.CallableDescriptor;
import org.junit.jupiter.api.Test;

class ArgumentRepresenterTest {

	public record Point(int x, int y) {
	}

	private final ArgumentRepresenter representer = new ArgumentRepresenter();

	@Test
	void scalarsUseTheirText() {
		assertThat(representer.represent(42)).isEqualTo("42");
		assertThat(representer.represent("alice")).isEqualTo("alice");
		assertThat(representer.represent(null)).isEqualTo("null");
	}

	@Test
	void absentBindingIsReportedAsNull() {
		CallableDescriptor descriptor = CallableDescriptor.builder("find")
				.parameter("name")
				.parameter("limit")
				.build();

		Map<String, String> parameters = representer.parameters(
				ArgumentBinder.bind(descriptor.parameters(), CallArguments.of("tea", null)));

		assertThat(parameters).containsEntry("name", "tea").containsEntry("limit", "null");
	}

	@Test
	void structuredValuesAreJson() {
		assertThat(representer.represent(List.of(1, 2))).isEqualTo("[1,2]");
		assertThat(representer.represent(Map.of("k", "v"))).isEqualTo("{\"k\":\"v\"}");
		assertThat(representer.represent(new int[] { 3 })).isEqualTo("[3]");
		assertThat(representer.represent(new Point(1, 2))).isEqualTo("{\"x\":1,\"y\":2}");
	}

	@Test
	void bindingsKeepParameterOrder() {
		CallableDescriptor descriptor = CallableDescriptor.builder("move")
				.parameter("to")
				.parameter("speed")
				.build();

		Map<String, String> parameters = representer.parameters(
				ArgumentBinder.bind(descriptor.parameters(), CallArguments.of(new Point(0, 1), 3)));

		assertThat(parameters).containsExactly(
				Map.entry("to", "{\"x\":0,\"y\":1}"),
				Map.entry("speed", "3"));
	}
}
