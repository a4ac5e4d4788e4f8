package works.argus.validator;

import java.util.Map;
import org.jetbrains.annotations.Nullable;
import works.argus.capability.CheckResult;
import works.argus.capability.TypeCapability;
import works.argus.exceptions.ExtraArgumentsException;
import works.argus.exceptions.MissingRequiredParameterException;
import works.argus.exceptions.TypeMismatchException;
import works.argus.exceptions.UnknownParameterException;
import works.argus.plan.CompilationPlan;
import works.argus.plan.ValidationStep;

/**
 * Call-time checks and failure reporting shared by both execution strategies,
 * so that the two produce identical exceptions.
 */
public final class ArgumentChecks {
	private ArgumentChecks(){}

	/**
	 * @throws UnknownParameterException for the first key, in {@code args}' iteration order,
	 * that isn't a declared parameter
	 */
	public static void checkNoUnknownKeys(Map<?, ?> args, CompilationPlan plan) {
		for (Object key: args.keySet()) {
			if (!(key instanceof String name) || !plan.specs().contains(name)) {
				throw new UnknownParameterException(String.valueOf(key), plan.options().name());
			}
		}
	}

	/**
	 * @throws ExtraArgumentsException if there are more positional arguments than declared parameters
	 */
	public static void checkArity(int actual, CompilationPlan plan) {
		if (actual > plan.size()) {
			throw new ExtraArgumentsException(plan.size(), actual, plan.options().name());
		}
	}

	public static MissingRequiredParameterException missing(ValidationStep step, CompilationPlan plan) {
		return new MissingRequiredParameterException(step.name(), plan.options().name());
	}

	/**
	 * Used when an inline check has rejected {@code value}:
	 * consults the capability's full {@link TypeCapability#check check} to find out why.
	 */
	public static TypeMismatchException typeMismatch(ValidationStep step, @Nullable Object value, CompilationPlan plan) {
		return typeMismatch(step.name(), step.capability(), value, step.capability().check(value), plan);
	}

	public static TypeMismatchException typeMismatch(
		String parameterName,
		TypeCapability capability,
		@Nullable Object value,
		CheckResult result,
		CompilationPlan plan
	) {
		String reason = result.isValid()
			? "rejected by the inline check of " + capability.name() + " but accepted by its full check"
			: result.reason();
		return new TypeMismatchException(parameterName, capability.name(), value, reason, plan.options().name());
	}
}
