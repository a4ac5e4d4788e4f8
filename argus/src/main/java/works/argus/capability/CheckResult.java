package works.argus.capability;

import org.jetbrains.annotations.Nullable;

import static java.util.Objects.requireNonNull;

/**
 * The outcome of {@link TypeCapability#check}.
 *
 * @param reason null when valid; otherwise a human-readable explanation
 */
public record CheckResult(@Nullable String reason) {
	private static final CheckResult VALID = new CheckResult(null);

	public static CheckResult valid() {
		return VALID;
	}

	public static CheckResult invalid(String reason) {
		return new CheckResult(requireNonNull(reason));
	}

	public static CheckResult of(boolean isValid, String reasonIfInvalid) {
		return isValid ? VALID : invalid(reasonIfInvalid);
	}

	public boolean isValid() {
		return reason == null;
	}
}
