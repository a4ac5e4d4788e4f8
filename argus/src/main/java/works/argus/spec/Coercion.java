package works.argus.spec;

import org.jetbrains.annotations.Nullable;

/**
 * Converts a caller-supplied argument before it is checked,
 * for example turning the string {@code "22"} into the integer {@code 22}.
 * <p>
 * A coercion should return its input unchanged when it doesn't apply,
 * leaving the {@link works.argus.capability.TypeCapability TypeCapability} to reject it.
 * Defaults are never coerced.
 */
@FunctionalInterface
public interface Coercion {
	@Nullable Object coerce(@Nullable Object value);
}
