package org.javai.tracelog.internal.template;

import static org.assertj.core.api.Assertions.assertThat;
import java.util.List;
import org.junit.jupiter.api.Test;

class ValueTextTest {

	@Test
	void absentValuesAreEmpty() {
		assertThat(ValueText.of(null)).isEmpty();
		assertThat(ValueText.of("")).isEmpty();
	}

	@Test
	void surroundingQuotesAreStripped() {
		assertThat(ValueText.of("'alice'")).isEqualTo("alice");
		assertThat(ValueText.of("\"bob\"")).isEqualTo("bob");
		assertThat(ValueText.of("it's")).isEqualTo("it's");
	}

	@Test
	void arraysUseTheirElements() {
		assertThat(ValueText.of(new int[] { 1, 2 })).isEqualTo("[1, 2]");
		assertThat(ValueText.of(new String[][] { { "a" }, { "b", "c" } })).isEqualTo("[[a], [b, c]]");
	}

	@Test
	void otherValuesUseTheirText() {
		assertThat(ValueText.of(42)).isEqualTo("42");
		assertThat(ValueText.of(false)).isEqualTo("false");
		assertThat(ValueText.of(List.of(1, 2))).isEqualTo("[1, 2]");
	}
}
