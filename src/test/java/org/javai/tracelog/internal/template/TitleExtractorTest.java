package org.javai.tracelog.internal.template;

import static org.assertj.core.api.Assertions.assertThat;
import org.javai.tracelog.internal.bind.CallableDescriptor;
import org.junit.jupiter.api.Test;

class TitleExtractorTest {

	@Test
	void undocumentedCallableUsesItsName() {
		CallableDescriptor descriptor = CallableDescriptor.builder("logout").build();

		assertThat(TitleExtractor.extract(descriptor)).isEqualTo("logout");
	}

	@Test
	void blankDocumentationCountsAsNone() {
		CallableDescriptor descriptor = CallableDescriptor.builder("logout").documentation("   ").build();

		assertThat(TitleExtractor.extract(descriptor)).isEqualTo("logout");
	}

	@Test
	void textBeforeTheFirstMarkerIsTheTitle() {
		assertThat(TitleExtractor.extract("Logs in as {{user}} @param user the account @return the session"))
				.isEqualTo("Logs in as {{user}}");
		assertThat(TitleExtractor.extract("Saves {{doc}}\n:param doc: the document")).isEqualTo("Saves {{doc}}");
		assertThat(TitleExtractor.extract("Counts rows :return: the count")).isEqualTo("Counts rows");
	}

	@Test
	void linesAreTrimmedAndJoinedWithoutSeparator() {
		String documentation = """
				Opens the page
				   at {{url}}
				@param url where to go
				""";

		assertThat(TitleExtractor.extract(documentation)).isEqualTo("Opens the pageat {{url}}");
	}
}
