package works.argus;

import works.argus.exceptions.SpecDefinitionException;
import works.argus.exceptions.ValidatorCompilationException;
import works.argus.plan.CompilationPlanner;
import works.argus.plan.ValidatorOptions;
import works.argus.spec.ParameterSpecSet;
import works.argus.validator.CompiledValidator;
import works.argus.validator.ValidatorBuilder;
import works.argus.validator.ValidatorCache;

/**
 * Entry point for defining validators.
 * <p>
 * Typical usage: define the validator once, in a static field,
 * and call {@link CompiledValidator#validate validate} on every invocation of the function it guards.
 *
 * <pre>
 * static final CompiledValidator SLEIGH_ARGS = Validators.define(ParameterSpecSet.of(
 *     ParameterSpec.required("present_name", nonEmptyString),
 *     ParameterSpec.optional("qty", positiveInt).withDefault(1)));
 * </pre>
 */
public final class Validators {
	private Validators(){}

	/**
	 * @return a validator from {@link ValidatorCache#global() the global cache}, compiling it if necessary
	 * @throws SpecDefinitionException if {@code specs} can't be used with {@code options}
	 * @throws ValidatorCompilationException if code generation fails
	 */
	public static CompiledValidator define(ParameterSpecSet specs, ValidatorOptions options) {
		return ValidatorCache.global().getOrCompile(specs, options);
	}

	/**
	 * Named arguments in, map out, strict.
	 *
	 * @see ValidatorOptions#DEFAULT
	 */
	public static CompiledValidator define(ParameterSpecSet specs) {
		return define(specs, ValidatorOptions.DEFAULT);
	}

	/**
	 * Like {@link #define(ParameterSpecSet, ValidatorOptions) define}, but always compiles
	 * a new validator without consulting or populating any cache.
	 */
	public static CompiledValidator compile(ParameterSpecSet specs, ValidatorOptions options) {
		return new ValidatorBuilder().build(new CompilationPlanner().plan(specs, options));
	}
}
