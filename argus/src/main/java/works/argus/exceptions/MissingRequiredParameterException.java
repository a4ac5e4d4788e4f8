package works.argus.exceptions;

import org.jetbrains.annotations.Nullable;

public final class MissingRequiredParameterException extends ValidationException {
	public MissingRequiredParameterException(String parameterName, @Nullable String validatorName) {
		super(parameterName, "required parameter is missing", validatorName);
	}
}
