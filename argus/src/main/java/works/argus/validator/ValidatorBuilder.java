package works.argus.validator;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.argus.exceptions.ValidatorCompilationException;
import works.argus.plan.CompilationPlan;
import works.argus.validator.compiler.PlanCompiler;
import works.argus.validator.interpreter.PlanInterpreter;

/**
 * Produces a {@link CompiledValidator} for a {@link CompilationPlan}
 * using the plan's {@link works.argus.plan.ExecutionStrategy ExecutionStrategy}.
 * <p>
 * There is no fallback: if a {@link works.argus.plan.ExecutionStrategy#SPECIALIZED SPECIALIZED}
 * plan fails to compile, that's a bug in an inline check, and it is reported rather than hidden.
 */
public final class ValidatorBuilder {
	private final PlanCompiler compiler = new PlanCompiler();

	/**
	 * @throws ValidatorCompilationException if code generation fails
	 */
	public CompiledValidator build(CompilationPlan plan) {
		ValidationRoutine routine = switch (plan.strategy()) {
			case SPECIALIZED -> compiler.compile(plan);
			case GENERIC -> new PlanInterpreter(plan);
		};
		LOGGER.debug("Built {}", routine);
		return new CompiledValidator(plan, routine);
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(ValidatorBuilder.class);
}
