package works.argus.exceptions;

/**
 * The bytecode back end failed to produce a working validator class.
 * <p>
 * This does not indicate a problem with the parameter specification itself,
 * which has already been planned successfully by the time code generation starts.
 * Usually it means an {@link works.argus.capability.InlineCheck InlineCheck} emitted malformed bytecode.
 */
public final class ValidatorCompilationException extends ArgusException {
	public ValidatorCompilationException(String message, Throwable cause) {
		super(message, cause);
	}
}
