package works.argus.exceptions;

import org.jetbrains.annotations.Nullable;

/**
 * The arguments passed to a {@link works.argus.validator.CompiledValidator CompiledValidator}
 * do not satisfy its parameter specification.
 * <p>
 * Validation is fail-fast: the exception describes the first violation found,
 * checking parameters in declaration order.
 */
public sealed abstract class ValidationException extends ArgusException permits
	MissingRequiredParameterException,
	UnknownParameterException,
	TypeMismatchException,
	ExtraArgumentsException
{
	private final String parameterName;
	private final String reason;
	private final @Nullable String validatorName;

	protected ValidationException(String parameterName, String reason, @Nullable String validatorName) {
		super(fullMessage(parameterName, reason, validatorName));
		this.parameterName = parameterName;
		this.reason = reason;
		this.validatorName = validatorName;
	}

	/**
	 * @return the name of the offending parameter; for positional arguments
	 * with no declared name, a description of the position such as {@code "#3"}
	 */
	public String parameterName() {
		return parameterName;
	}

	public String reason() {
		return reason;
	}

	public @Nullable String validatorName() {
		return validatorName;
	}

	private static String fullMessage(String parameterName, String reason, @Nullable String validatorName) {
		String message = "Parameter '" + parameterName + "': " + reason;
		if (validatorName == null) {
			return message;
		} else {
			return message + " (validating " + validatorName + ")";
		}
	}
}
