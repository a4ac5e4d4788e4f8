package works.argus.exceptions;

public sealed abstract class ArgusException extends RuntimeException permits
	SpecDefinitionException,
	ValidationException,
	ValidatorCompilationException
{
	protected ArgusException(String message) {
		super(message);
	}

	protected ArgusException(String message, Throwable cause) {
		super(message, cause);
	}
}
