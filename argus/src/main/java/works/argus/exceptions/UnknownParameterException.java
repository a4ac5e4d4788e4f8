package works.argus.exceptions;

import org.jetbrains.annotations.Nullable;

/**
 * A named argument was supplied that the specification doesn't declare,
 * and the validator is strict.
 */
public final class UnknownParameterException extends ValidationException {
	public UnknownParameterException(String parameterName, @Nullable String validatorName) {
		super(parameterName, "not a declared parameter", validatorName);
	}
}
