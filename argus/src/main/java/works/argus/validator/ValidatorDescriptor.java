package works.argus.validator;

import works.argus.plan.ValidatorOptions;
import works.argus.spec.ParameterSpecSet;

import static java.util.Objects.requireNonNull;

/**
 * The cache key for {@link ValidatorCache}: everything that determines
 * the behaviour of a {@link CompiledValidator}.
 */
public record ValidatorDescriptor(ParameterSpecSet specs, ValidatorOptions options) {
	public ValidatorDescriptor {
		requireNonNull(specs);
		requireNonNull(options);
	}
}
