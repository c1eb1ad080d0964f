package org.javai.tracelog.internal.bind;

import static org.assertj.core.api.Assertions.assertThat;
import org.javai.tracelog.api.Default;
import org.javai.tracelog.api.Title;
import org.javai.tracelog.api.Untraced;
import org.junit.jupiter.api.Test;

class DescriptorFactoryTest {

	public interface Greeter {

		@Title("Greets {{name}}")
		String greet(String name);
	}

	public static class FriendlyGreeter implements Greeter {

		@Title("Creates a greeter for {{language}}")
		public FriendlyGreeter(@Default("en") String language) {
		}

		@Override
		public String greet(String name) {
			return "hi " + name;
		}

		public static FriendlyGreeter forType(Class<?> type, String language) {
			return new FriendlyGreeter(language);
		}

		@Untraced
		public void reset() {
		}

		public String join(String separator, String... parts) {
			return String.join(separator, parts);
		}
	}

	@Test
	void instanceMethodStartsWithReceiver() throws Exception {
		CallableDescriptor descriptor = DescriptorFactory.forMethod(FriendlyGreeter.class.getMethod("greet", String.class));

		assertThat(descriptor.name()).isEqualTo("greet");
		assertThat(descriptor.ownerType()).isEqualTo(FriendlyGreeter.class);
		assertThat(descriptor.parameters()).extracting(ParameterDescriptor::name).containsExactly("this", "name");
		assertThat(ArgumentClassifier.classify(descriptor)).isEqualTo(CallableRole.INSTANCE_METHOD);
	}

	@Test
	void titleIsInheritedFromTheInterface() throws Exception {
		CallableDescriptor descriptor = DescriptorFactory.forMethod(FriendlyGreeter.class.getMethod("greet", String.class));

		assertThat(descriptor.documentation()).isEqualTo("Greets {{name}}");
	}

	@Test
	void staticMethodWithTypeTokenIsClassMethod() throws Exception {
		CallableDescriptor descriptor = DescriptorFactory.forMethod(
				FriendlyGreeter.class.getMethod("forType", Class.class, String.class));

		assertThat(descriptor.parameters()).extracting(ParameterDescriptor::name).containsExactly("type", "language");
		assertThat(ArgumentClassifier.classify(descriptor)).isEqualTo(CallableRole.CLASS_METHOD);
	}

	@Test
	void untracedAnnotationMarksInternal() throws Exception {
		CallableDescriptor descriptor = DescriptorFactory.forMethod(FriendlyGreeter.class.getMethod("reset"));

		assertThat(descriptor.isInternal()).isTrue();
	}

	@Test
	void varargsParameterIsVariadic() throws Exception {
		CallableDescriptor descriptor = DescriptorFactory.forMethod(
				FriendlyGreeter.class.getMethod("join", String.class, String[].class));

		assertThat(descriptor.parameters().get(2).kind()).isEqualTo(ParameterKind.VAR_POSITIONAL);
		assertThat(descriptor.parameters().get(1).kind()).isEqualTo(ParameterKind.POSITIONAL_OR_KEYWORD);
	}

	@Test
	void constructorCarriesTitleAndDefaults() throws Exception {
		CallableDescriptor descriptor = DescriptorFactory.forConstructor(
				FriendlyGreeter.class.getConstructor(String.class));

		assertThat(descriptor.name()).isEqualTo("FriendlyGreeter");
		assertThat(descriptor.constructor()).isTrue();
		assertThat(descriptor.documentation()).isEqualTo("Creates a greeter for {{language}}");
		assertThat(descriptor.parameters().get(0).defaultValue()).isEqualTo("en");
	}
}
