package works.argus.plan;

import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.argus.exceptions.SpecDefinitionException;
import works.argus.spec.DefaultValue;
import works.argus.spec.ParameterSpec;
import works.argus.spec.ParameterSpecSet;

import static works.argus.plan.ExecutionStrategy.GENERIC;
import static works.argus.plan.ExecutionStrategy.SPECIALIZED;
import static works.argus.plan.OutputMode.MAPPED;
import static works.argus.plan.OutputMode.ORDERED_LIST;
import static works.argus.plan.SourceMode.NAMED;
import static works.argus.plan.SourceMode.POSITIONAL;

/**
 * Turns a {@link ParameterSpecSet} and a calling convention into a {@link CompilationPlan}.
 * <p>
 * One {@link ExecutionStrategy} is chosen for the whole plan:
 * if any parameter's capability can't be inlined, none of them are.
 * That keeps the cost model simple, and means the compiler never has to
 * mix generated code with interpreted steps.
 */
public final class CompilationPlanner {
	/**
	 * @throws SpecDefinitionException if the specs can't be used with the given options
	 */
	public CompilationPlan plan(ParameterSpecSet specs, ValidatorOptions options) {
		checkModes(options);
		if (options.sourceMode() == POSITIONAL) {
			checkPositionalOrder(specs);
		}

		List<ValidationStep> steps = new ArrayList<>(specs.size());
		boolean allInlinable = true;
		for (int position = 0; position < specs.size(); position++) {
			ParameterSpec spec = specs.get(position);
			FetchStrategy fetch = switch (options.sourceMode()) {
				case NAMED -> new FetchStrategy.ByName(spec.name());
				case POSITIONAL -> new FetchStrategy.ByPosition(position);
			};
			var step = new ValidationStep(
				position,
				spec,
				fetch,
				absenceRule(spec),
				spec.capability().inlineCheck().orElse(null));
			allInlinable &= step.isInlinable();
			steps.add(step);
		}

		ExecutionStrategy strategy = (options.compiled() && allInlinable) ? SPECIALIZED : GENERIC;
		var plan = new CompilationPlan(specs, options, steps, strategy);
		if (LOGGER.isDebugEnabled()) {
			LOGGER.debug("Planned {}: {}", nameFor(options), plan.description());
		}
		if (options.compiled() && !allInlinable) {
			LOGGER.debug("Using {} strategy for {} because not every capability offers an inline check", GENERIC, nameFor(options));
		}
		return plan;
	}

	private static void checkModes(ValidatorOptions options) {
		if (options.slurpy() == null) {
			return;
		}
		if (options.sourceMode() == NAMED && options.outputMode() == ORDERED_LIST) {
			throw new SpecDefinitionException("Slurpy named arguments have no position, so they can't be returned as an ordered list");
		}
		if (options.sourceMode() == POSITIONAL && options.outputMode() == MAPPED) {
			throw new SpecDefinitionException("Slurpy positional arguments have no name, so they can't be returned as a map");
		}
	}

	/**
	 * An optional positional parameter can only be omitted if everything after it is omitted too,
	 * so a required parameter following an optional one could never be satisfied without
	 * supplying the optional one.
	 */
	private static void checkPositionalOrder(ParameterSpecSet specs) {
		ParameterSpec firstOptional = null;
		for (ParameterSpec spec: specs) {
			if (!spec.required()) {
				if (firstOptional == null) {
					firstOptional = spec;
				}
			} else if (firstOptional != null) {
				throw new SpecDefinitionException("Required positional parameter '" + spec.name()
					+ "' cannot follow optional parameter '" + firstOptional.name() + "'");
			}
		}
	}

	private static AbsenceRule absenceRule(ParameterSpec spec) {
		if (spec.required()) {
			return AbsenceRule.FAIL;
		}
		DefaultValue defaultValue = spec.defaultValue();
		if (defaultValue == null) {
			return AbsenceRule.LEAVE_EMPTY;
		} else if (defaultValue instanceof DefaultValue.Constant) {
			return AbsenceRule.USE_CONSTANT;
		} else {
			return AbsenceRule.USE_FACTORY;
		}
	}

	private static String nameFor(ValidatorOptions options) {
		return (options.name() == null) ? "unnamed validator" : options.name();
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(CompilationPlanner.class);
}
