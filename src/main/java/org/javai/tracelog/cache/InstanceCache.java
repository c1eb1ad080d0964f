package org.javai.tracelog.cache;

import java.lang.ref.ReferenceQueue;
import java.lang.ref.WeakReference;
import java.lang.reflect.Constructor;
import java.lang.reflect.InvocationTargetException;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Supplier;
import org.javai.tracelog.internal.bind.ExecutableResolver;

/**
 * Keyed singletons of one type: constructions with the same arguments share a
 * single instance for as long as someone else holds it.
 * <p>
 * The key is the text of every positional argument followed by the name of
 * every named argument, concatenated without a separator, so argument lists
 * with the same text share an instance. The cache only references instances
 * weakly; once the last strong reference is gone the entry disappears and the
 * next call with the same key constructs a fresh instance.
 * <p>
 * Each type has its own cache, obtained through {@link #forType(Class)}.
 *
 * <pre>
 * InstanceCache&lt;Connection&gt; connections = InstanceCache.forType(Connection.class);
 * Connection a = connections.getOrCreate("db-1", 5432);
 * Connection b = connections.getOrCreate("db-1", 5432); // same instance as a
 * </pre>
 */
public final class InstanceCache<T> {

	private static final ClassValue<InstanceCache<?>> CACHES = new ClassValue<>() {
		@Override
		protected InstanceCache<?> computeValue(Class<?> type) {
			return new InstanceCache<>(type);
		}
	};

	private final Class<T> type;
	private final Map<String, KeyedReference<T>> entries = new HashMap<>();
	private final ReferenceQueue<T> released = new ReferenceQueue<>();

	private InstanceCache(Class<T> type) {
		this.type = type;
	}

	@SuppressWarnings("unchecked")
	public static <T> InstanceCache<T> forType(Class<T> type) {
		Objects.requireNonNull(type, "type must not be null");
		return (InstanceCache<T>) CACHES.get(type);
	}

	public Class<T> type() {
		return type;
	}

	/**
	 * Instance for {@code args}, built through the public constructor of the
	 * type that accepts them when the cache holds none.
	 *
	 * @throws InstanceCreationException when no constructor accepts the
	 * arguments or the constructor throws a checked exception
	 */
	public T getOrCreate(Object... args) {
		Object[] values = args != null ? args : new Object[0];
		return getOrCreate(Arrays.asList(values), Map.of(), () -> construct(values));
	}

	/**
	 * Instance for the given arguments, built by {@code factory} when the cache
	 * holds none. Lookup and construction happen under the cache's lock, so
	 * concurrent first calls with one key construct a single instance.
	 */
	public T getOrCreate(List<?> args, Map<String, ?> namedArgs, Supplier<? extends T> factory) {
		Objects.requireNonNull(factory, "factory must not be null");
		String key = keyOf(args, namedArgs);
		synchronized (entries) {
			expungeReleased();
			KeyedReference<T> reference = entries.get(key);
			T instance = reference != null ? reference.get() : null;
			if (instance == null) {
				instance = Objects.requireNonNull(factory.get(), "factory must not return null");
				entries.put(key, new KeyedReference<>(key, instance, released));
			}
			return instance;
		}
	}

	/**
	 * Number of instances still held by someone else.
	 */
	public int size() {
		synchronized (entries) {
			expungeReleased();
			return entries.size();
		}
	}

	static String keyOf(List<?> args, Map<String, ?> namedArgs) {
		StringBuilder key = new StringBuilder();
		if (args != null) {
			args.forEach(arg -> key.append(arg));
		}
		if (namedArgs != null) {
			namedArgs.keySet().forEach(key::append);
		}
		return key.toString();
	}

	private void expungeReleased() {
		Object cleared;
		while ((cleared = released.poll()) != null) {
			KeyedReference<?> reference = (KeyedReference<?>) cleared;
			entries.remove(reference.key, reference);
		}
	}

	private T construct(Object[] args) {
		Constructor<T> constructor;
		try {
			constructor = ExecutableResolver.findConstructor(type, args);
		}
		catch (IllegalArgumentException e) {
			throw new InstanceCreationException("Cannot construct " + type.getName(), e);
		}
		try {
			return constructor.newInstance(args);
		}
		catch (InvocationTargetException e) {
			Throwable cause = e.getCause();
			if (cause instanceof RuntimeException runtime) {
				throw runtime;
			}
			if (cause instanceof Error error) {
				throw error;
			}
			throw new InstanceCreationException("Constructor of " + type.getName() + " failed", cause);
		}
		catch (ReflectiveOperationException e) {
			throw new InstanceCreationException("Cannot construct " + type.getName(), e);
		}
	}

	private static final class KeyedReference<T> extends WeakReference<T> {

		private final String key;

		KeyedReference(String key, T referent, ReferenceQueue<? super T> queue) {
			super(referent, queue);
			this.key = key;
		}
	}
}
