package works.argus.validator;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.jetbrains.annotations.Nullable;
import works.argus.plan.OutputMode;

import static java.util.Objects.requireNonNull;

/**
 * The successful result of {@link CompiledValidator#validate}.
 * <p>
 * Holds exactly one shape, as dictated by the validator's {@link OutputMode}:
 * use {@link #asMap()} for {@link OutputMode#MAPPED MAPPED} output
 * and {@link #asList()} for {@link OutputMode#ORDERED_LIST ORDERED_LIST} output.
 * The by-name and by-position accessors work in either case for declared parameters.
 * <p>
 * Values may be null: an optional parameter with no default that was not supplied
 * is present with a null value.
 */
public final class ValidatedValues {
	private final List<String> declaredNames;
	private final @Nullable Map<String, Object> map;
	private final @Nullable List<Object> list;

	private ValidatedValues(List<String> declaredNames, @Nullable Map<String, Object> map, @Nullable List<Object> list) {
		this.declaredNames = declaredNames;
		this.map = map;
		this.list = list;
	}

	/**
	 * @param map must not be modified after this call
	 */
	static ValidatedValues mapped(List<String> declaredNames, Map<String, Object> map) {
		return new ValidatedValues(declaredNames, Collections.unmodifiableMap(map), null);
	}

	/**
	 * @param list must not be modified after this call
	 */
	static ValidatedValues ordered(List<String> declaredNames, List<Object> list) {
		return new ValidatedValues(declaredNames, null, Collections.unmodifiableList(list));
	}

	public OutputMode outputMode() {
		return (map != null) ? OutputMode.MAPPED : OutputMode.ORDERED_LIST;
	}

	/**
	 * @return values keyed by name, iterating in declaration order, followed by any slurpy extras
	 * @throws IllegalStateException if the output mode is not {@link OutputMode#MAPPED MAPPED}
	 */
	public Map<String, Object> asMap() {
		if (map == null) {
			throw new IllegalStateException("Validator output is an ordered list; use asList()");
		}
		return map;
	}

	/**
	 * @return values in declaration order, followed by any slurpy extras
	 * @throws IllegalStateException if the output mode is not {@link OutputMode#ORDERED_LIST ORDERED_LIST}
	 */
	public List<Object> asList() {
		if (list == null) {
			throw new IllegalStateException("Validator output is a map; use asMap()");
		}
		return list;
	}

	/**
	 * @throws IllegalArgumentException if {@code name} is neither declared nor a slurpy extra
	 */
	public @Nullable Object get(String name) {
		requireNonNull(name);
		if (map != null) {
			if (!map.containsKey(name)) {
				throw new IllegalArgumentException("No value named '" + name + "'");
			}
			return map.get(name);
		}
		int position = declaredNames.indexOf(name);
		if (position < 0) {
			throw new IllegalArgumentException("No parameter named '" + name + "'");
		}
		return requireNonNull(list).get(position);
	}

	public <T> @Nullable T get(String name, Class<T> type) {
		return type.cast(get(name));
	}

	/**
	 * @param position a declared position
	 */
	public @Nullable Object get(int position) {
		if (list != null) {
			return list.get(position);
		}
		return requireNonNull(map).get(declaredNames.get(position));
	}

	public int size() {
		return (map != null) ? map.size() : requireNonNull(list).size();
	}

	@Override
	public boolean equals(Object obj) {
		return obj instanceof ValidatedValues other
			&& Objects.equals(map, other.map)
			&& Objects.equals(list, other.list);
	}

	@Override
	public int hashCode() {
		return Objects.hash(map, list);
	}

	@Override
	public String toString() {
		return String.valueOf((map != null) ? map : list);
	}
}
