package works.argus.plan;

import java.util.List;
import works.argus.spec.ParameterSpecSet;

import static java.util.Objects.requireNonNull;
import static java.util.stream.Collectors.joining;

/**
 * The output of {@link CompilationPlanner}: everything a validator needs to know,
 * in the order it needs to know it.
 *
 * @param steps one per parameter, in declaration order
 */
public record CompilationPlan(
	ParameterSpecSet specs,
	ValidatorOptions options,
	List<ValidationStep> steps,
	ExecutionStrategy strategy
) {
	public CompilationPlan {
		requireNonNull(specs);
		requireNonNull(options);
		requireNonNull(strategy);
		steps = List.copyOf(steps);
	}

	/**
	 * Whether arguments must be checked against the declared set before any parameter is:
	 * undeclared names in strict named mode, and surplus elements in positional mode
	 * whatever the strict flag says. Never when extras go to a slurpy capability.
	 */
	public boolean checksShape() {
		if (options.slurpy() != null) {
			return false;
		}
		return options.strict() || options.sourceMode() == SourceMode.POSITIONAL;
	}

	public int size() {
		return steps.size();
	}

	public String description() {
		return options.sourceMode() + "->" + options.outputMode()
			+ (options.strict() ? " strict" : "")
			+ (options.slurpy() == null ? "" : " slurpy")
			+ " " + strategy
			+ steps.stream().map(s -> s.name() + "/" + s.absence()).collect(joining(", ", " [", "]"));
	}
}
