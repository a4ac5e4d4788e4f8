package works.argus.validator;

import works.argus.exceptions.ValidationException;

/**
 * The executable core of a {@link CompiledValidator}:
 * either a generated class or a plan interpreter.
 * <p>
 * Implementations are immutable and may be called concurrently.
 */
public interface ValidationRoutine {
	/**
	 * @param rawArgs a {@link java.util.Map Map} or {@link java.util.List List},
	 *                according to the plan's {@link works.argus.plan.SourceMode SourceMode}
	 * @return one value per declared parameter, in declaration order.
	 * Extra arguments are not included.
	 * @throws ValidationException at the first violation, in declaration order
	 */
	Object[] run(Object rawArgs);
}
