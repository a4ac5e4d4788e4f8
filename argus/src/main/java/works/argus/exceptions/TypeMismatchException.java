package works.argus.exceptions;

import org.jetbrains.annotations.Nullable;

/**
 * A supplied value was rejected by its parameter's {@link works.argus.capability.TypeCapability TypeCapability}.
 */
public final class TypeMismatchException extends ValidationException {
	private final String capabilityName;
	private final transient @Nullable Object rejectedValue;

	public TypeMismatchException(
		String parameterName,
		String capabilityName,
		@Nullable Object rejectedValue,
		String reason,
		@Nullable String validatorName
	) {
		super(parameterName, reason, validatorName);
		this.capabilityName = capabilityName;
		this.rejectedValue = rejectedValue;
	}

	public String capabilityName() {
		return capabilityName;
	}

	public @Nullable Object rejectedValue() {
		return rejectedValue;
	}
}
