package works.argus.exceptions;

/**
 * A parameter specification is inconsistent.
 * <p>
 * Thrown while a {@link works.argus.spec.ParameterSpecSet ParameterSpecSet} is being
 * constructed or planned, never while arguments are being validated.
 * No validator is ever produced for a specification that causes this exception.
 */
public final class SpecDefinitionException extends ArgusException {
	public SpecDefinitionException(String message) {
		super(message);
	}

	public SpecDefinitionException(String message, Throwable cause) {
		super(message, cause);
	}
}
