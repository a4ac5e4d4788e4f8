package works.argus.validator.compiler;

import java.util.Map;
import works.argus.plan.CompilationPlan;
import works.argus.validator.ArgumentChecks;
import works.argus.validator.ValidationRoutine;

import static java.util.Objects.requireNonNull;

/**
 * Superclass of all generated validator classes.
 * <p>
 * Generated code handles the common path itself and calls back here
 * for anything that isn't worth emitting inline, like building exceptions.
 * Methods that return an exception are meant to be followed by {@code athrow},
 * which keeps the bytecode verifier informed that control doesn't continue.
 */
public abstract class GeneratedValidatorRuntime implements ValidationRoutine {
	protected final CompilationPlan plan;

	protected GeneratedValidatorRuntime(CompilationPlan plan) {
		this.plan = requireNonNull(plan);
	}

	public final void checkNamedShape(Map<?, ?> args) {
		ArgumentChecks.checkNoUnknownKeys(args, plan);
	}

	public final void checkPositionalShape(int size) {
		ArgumentChecks.checkArity(size, plan);
	}

	public final RuntimeException missing(int position) {
		return ArgumentChecks.missing(plan.steps().get(position), plan);
	}

	public final RuntimeException typeMismatch(int position, Object value) {
		return ArgumentChecks.typeMismatch(plan.steps().get(position), value, plan);
	}

	@Override
	public String toString() {
		return getClass().getSimpleName() + "(" + plan.description() + ")";
	}
}
