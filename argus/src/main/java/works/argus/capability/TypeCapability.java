package works.argus.capability;

import java.util.Optional;
import org.jetbrains.annotations.Nullable;

/**
 * Decides whether a single argument value is acceptable for a parameter.
 * <p>
 * The contract is small:
 * {@link #check} is mandatory, and {@link #inlineCheck} is optional.
 * A capability that offers an {@link InlineCheck} allows the validator compiler
 * to emit its test directly into a generated validator class;
 * one that doesn't forces the whole validator onto the generic, interpreted path.
 * <p>
 * Implementations must be immutable and thread-safe.
 * Implementations that are records (or otherwise define value-based {@code equals})
 * let structurally identical specifications share one cached validator.
 */
public interface TypeCapability {
	/**
	 * @return a short human-readable name, such as {@code "positive integer"}
	 */
	String name();

	CheckResult check(@Nullable Object value);

	/**
	 * The inline check must accept exactly the values for which
	 * {@link #check} returns {@link CheckResult#isValid() valid}.
	 * When the inline check rejects a value, the compiled validator
	 * calls {@link #check} to obtain the reason.
	 *
	 * @return the inline form of {@link #check}, if this capability offers one
	 */
	default Optional<InlineCheck> inlineCheck() {
		return Optional.empty();
	}
}
