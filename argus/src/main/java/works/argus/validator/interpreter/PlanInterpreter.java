package works.argus.validator.interpreter;

import java.util.List;
import java.util.Map;
import org.jetbrains.annotations.Nullable;
import works.argus.capability.CheckResult;
import works.argus.plan.CompilationPlan;
import works.argus.plan.FetchStrategy;
import works.argus.plan.SourceMode;
import works.argus.plan.ValidationStep;
import works.argus.spec.Coercion;
import works.argus.validator.ArgumentChecks;
import works.argus.validator.ValidationRoutine;

import static java.util.Objects.requireNonNull;

/**
 * Validates arguments by looping over a {@link CompilationPlan}'s steps.
 * <p>
 * Slower than the generated code, since every step goes through
 * {@link works.argus.capability.TypeCapability#check check} and allocates a {@link CheckResult},
 * but externally indistinguishable from it.
 */
public final class PlanInterpreter implements ValidationRoutine {
	private final CompilationPlan plan;
	private final boolean checkShape;

	public PlanInterpreter(CompilationPlan plan) {
		this.plan = requireNonNull(plan);
		this.checkShape = plan.checksShape();
	}

	@Override
	public Object[] run(Object rawArgs) {
		if (checkShape) {
			checkShape(rawArgs);
		}
		Object[] values = new Object[plan.size()];
		for (ValidationStep step: plan.steps()) {
			values[step.position()] = resolve(step, fetch(step.fetch(), rawArgs));
		}
		return values;
	}

	private void checkShape(Object rawArgs) {
		if (plan.options().sourceMode() == SourceMode.NAMED) {
			ArgumentChecks.checkNoUnknownKeys((Map<?, ?>) rawArgs, plan);
		} else {
			ArgumentChecks.checkArity(((List<?>) rawArgs).size(), plan);
		}
	}

	/**
	 * @return the raw argument, or {@link #ABSENT} if it wasn't supplied
	 */
	private static @Nullable Object fetch(FetchStrategy fetch, Object rawArgs) {
		if (fetch instanceof FetchStrategy.ByName byName) {
			Map<?, ?> args = (Map<?, ?>) rawArgs;
			Object value = args.get(byName.key());
			if (value == null && !args.containsKey(byName.key())) {
				return ABSENT;
			}
			return value;
		} else {
			int index = ((FetchStrategy.ByPosition) fetch).index();
			List<?> args = (List<?>) rawArgs;
			return (index < args.size()) ? args.get(index) : ABSENT;
		}
	}

	private @Nullable Object resolve(ValidationStep step, @Nullable Object raw) {
		Object value;
		if (raw == ABSENT) {
			switch (step.absence()) {
				case FAIL:
					throw ArgumentChecks.missing(step, plan);
				case USE_CONSTANT:
					// Already checked when the ParameterSpecSet was constructed
					return step.constantDefault();
				case LEAVE_EMPTY:
					return null;
				case USE_FACTORY:
					value = step.defaultFactory().supplier().get();
					break;
				default:
					throw new AssertionError("Unexpected absence rule: " + step.absence());
			}
		} else {
			Coercion coercion = step.coercion();
			value = (coercion == null) ? raw : coercion.coerce(raw);
		}
		CheckResult result = step.capability().check(value);
		if (!result.isValid()) {
			throw ArgumentChecks.typeMismatch(step.name(), step.capability(), value, result, plan);
		}
		return value;
	}

	@Override
	public String toString() {
		return "PlanInterpreter(" + plan.description() + ")";
	}

	private static final Object ABSENT = new Object();
}
