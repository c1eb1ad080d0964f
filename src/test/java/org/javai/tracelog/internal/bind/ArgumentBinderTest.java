package org.javai.tracelog.internal.bind;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import java.lang.reflect.Method;
import java.util.List;
import java.util.Map;
import org.javai.tracelog.api.Default;
import org.junit.jupiter.api.Test;

class ArgumentBinderTest {

	public static class Inventory {

		public int restock(String item, @Default("10") int quantity) {
			return quantity;
		}

		public String tag(String prefix, String... labels) {
			return prefix + labels.length;
		}

		public long weigh(long grams) {
			return grams;
		}
	}

	private final ArgumentBinder binder = new ArgumentBinder();

	@Test
	void positionalWinsOverNamedAndDefault() {
		List<ParameterDescriptor> parameters = List.of(
				new ParameterDescriptor("a", Object.class, "1", ParameterKind.POSITIONAL_OR_KEYWORD),
				new ParameterDescriptor("b", Object.class, "2", ParameterKind.POSITIONAL_OR_KEYWORD),
				new ParameterDescriptor("c", Object.class, "3", ParameterKind.POSITIONAL_OR_KEYWORD),
				ParameterDescriptor.of("d", Object.class));

		ArgumentBindings bindings = ArgumentBinder.bind(parameters,
				new CallArguments(List.of("x"), Map.of("a", "ignored", "b", "y")));

		assertThat(bindings.value("a")).isEqualTo("x");
		assertThat(bindings.value("b")).isEqualTo("y");
		assertThat(bindings.value("c")).isEqualTo("3");
		assertThat(bindings.contains("d")).isTrue();
		assertThat(bindings.value("d")).isNull();
	}

	@Test
	void varargsBindRemainingValues() {
		CallableDescriptor descriptor = CallableDescriptor.builder("sum")
				.parameter("first")
				.varargs("rest")
				.build();

		ArgumentBindings bindings = ArgumentBinder.bind(descriptor.parameters(), CallArguments.of(1, 2, 3));

		assertThat(bindings.value("first")).isEqualTo(1);
		assertThat(bindings.value("rest")).isEqualTo(List.of(2, 3));
	}

	@Test
	void declaredDefaultIsConvertedForTheCall() throws Exception {
		Method restock = Inventory.class.getMethod("restock", String.class, int.class);
		List<ParameterDescriptor> parameters = withoutReceiver(DescriptorFactory.forMethod(restock));

		Object[] args = binder.invocationArguments(restock, parameters, CallArguments.named(Map.of("item", "apple")));

		assertThat(args).containsExactly("apple", 10);
	}

	@Test
	void missingPrimitiveIsRejected() throws Exception {
		Method weigh = Inventory.class.getMethod("weigh", long.class);
		List<ParameterDescriptor> parameters = withoutReceiver(DescriptorFactory.forMethod(weigh));

		assertThatThrownBy(() -> binder.invocationArguments(weigh, parameters, CallArguments.empty()))
				.isInstanceOf(IllegalArgumentException.class)
				.hasMessage("Missing required argument 'grams' for 'weigh'");
	}

	@Test
	void varargsArePackedIntoAnArray() throws Exception {
		Method tag = Inventory.class.getMethod("tag", String.class, String[].class);
		List<ParameterDescriptor> parameters = withoutReceiver(DescriptorFactory.forMethod(tag));

		Object[] packed = binder.invocationArguments(tag, parameters, CallArguments.of("p", "a", "b"));
		Object[] empty = binder.invocationArguments(tag, parameters, CallArguments.of("p"));

		assertThat((String[]) packed[1]).containsExactly("a", "b");
		assertThat((String[]) empty[1]).isEmpty();
	}

	@Test
	void tooManyArgumentsAreRejected() throws Exception {
		Method weigh = Inventory.class.getMethod("weigh", long.class);
		List<ParameterDescriptor> parameters = withoutReceiver(DescriptorFactory.forMethod(weigh));

		assertThatThrownBy(() -> binder.invocationArguments(weigh, parameters, CallArguments.of(1L, 2L)))
				.isInstanceOf(IllegalArgumentException.class)
				.hasMessageContaining("takes 1 arguments");
	}

	private static List<ParameterDescriptor> withoutReceiver(CallableDescriptor descriptor) {
		return descriptor.templateParameters(CallableRole.INSTANCE_METHOD);
	}
}
