package works.argus.validator;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.jetbrains.annotations.Nullable;
import works.argus.capability.CheckResult;
import works.argus.capability.TypeCapability;
import works.argus.exceptions.ValidationException;
import works.argus.plan.CompilationPlan;
import works.argus.plan.ExecutionStrategy;
import works.argus.plan.OutputMode;
import works.argus.plan.SourceMode;
import works.argus.plan.ValidatorOptions;
import works.argus.spec.ParameterSpecSet;

import static java.util.Objects.requireNonNull;

/**
 * A reusable validator for one {@link ParameterSpecSet} and calling convention.
 * Obtain one from {@link ValidatorCache} or {@link works.argus.Validators Validators}.
 * <p>
 * Immutable. {@link #validate} has no side effects and may be called
 * concurrently from any number of threads.
 */
public final class CompiledValidator {
	private final CompilationPlan plan;
	private final ValidationRoutine routine;
	private final List<String> declaredNames;

	CompiledValidator(CompilationPlan plan, ValidationRoutine routine) {
		this.plan = requireNonNull(plan);
		this.routine = requireNonNull(routine);
		this.declaredNames = plan.specs().names();
	}

	/**
	 * For {@link SourceMode#NAMED NAMED} validators.
	 * A key mapped to null counts as supplied; a missing key counts as omitted.
	 *
	 * @throws ValidationException at the first violation, checking parameters in declaration order
	 * @throws IllegalArgumentException if this validator expects positional arguments
	 */
	public ValidatedValues validate(Map<String, ?> rawArgs) {
		requireNonNull(rawArgs);
		if (plan.options().sourceMode() != SourceMode.NAMED) {
			throw new IllegalArgumentException("Validator " + this + " expects positional arguments");
		}
		Object[] values = routine.run(rawArgs);
		return assemble(values, rawArgs, List.of());
	}

	/**
	 * For {@link SourceMode#POSITIONAL POSITIONAL} validators.
	 * Positions at or beyond the size of {@code rawArgs} count as omitted.
	 *
	 * @throws ValidationException at the first violation, checking parameters in declaration order
	 * @throws IllegalArgumentException if this validator expects named arguments
	 */
	public ValidatedValues validate(List<?> rawArgs) {
		requireNonNull(rawArgs);
		if (plan.options().sourceMode() != SourceMode.POSITIONAL) {
			throw new IllegalArgumentException("Validator " + this + " expects named arguments");
		}
		Object[] values = routine.run(rawArgs);
		return assemble(values, Map.of(), rawArgs);
	}

	private ValidatedValues assemble(Object[] values, Map<String, ?> namedArgs, List<?> positionalArgs) {
		TypeCapability slurpy = plan.options().slurpy();
		if (plan.options().outputMode() == OutputMode.MAPPED) {
			var map = new LinkedHashMap<String, Object>();
			for (int i = 0; i < values.length; i++) {
				map.put(declaredNames.get(i), values[i]);
			}
			if (slurpy != null) {
				namedArgs.forEach((name, value) -> {
					if (!plan.specs().contains(name)) {
						map.put(name, checkedExtra(name, slurpy, value));
					}
				});
			}
			return ValidatedValues.mapped(declaredNames, map);
		} else {
			List<Object> list = new ArrayList<>(Arrays.asList(values));
			if (slurpy != null) {
				for (int i = values.length; i < positionalArgs.size(); i++) {
					list.add(checkedExtra("#" + i, slurpy, positionalArgs.get(i)));
				}
			}
			return ValidatedValues.ordered(declaredNames, list);
		}
	}

	private @Nullable Object checkedExtra(String name, TypeCapability slurpy, @Nullable Object value) {
		CheckResult result = slurpy.check(value);
		if (!result.isValid()) {
			throw ArgumentChecks.typeMismatch(name, slurpy, value, result, plan);
		}
		return value;
	}

	public CompilationPlan plan() {
		return plan;
	}

	public ParameterSpecSet specs() {
		return plan.specs();
	}

	public ValidatorOptions options() {
		return plan.options();
	}

	public ExecutionStrategy strategy() {
		return plan.strategy();
	}

	public @Nullable String name() {
		return plan.options().name();
	}

	/**
	 * Exposed for diagnostics: the generated class or interpreter that does the work.
	 */
	public ValidationRoutine routine() {
		return routine;
	}

	@Override
	public String toString() {
		String name = (plan.options().name() == null) ? "" : plan.options().name();
		return "CompiledValidator(" + name + plan.specs() + " " + plan.strategy() + ")";
	}
}
