package works.argus.plan;

import org.jetbrains.annotations.Nullable;
import works.argus.capability.TypeCapability;

import static java.util.Objects.requireNonNull;

/**
 * The calling convention and other knobs for a validator.
 * Part of the {@link works.argus.validator.ValidatorDescriptor cache key},
 * so two validators with different options are never shared.
 *
 * @param strict reject undeclared named arguments rather than ignoring them;
 *               has no effect in positional mode, where surplus arguments are always rejected
 *               unless {@code slurpy} is set
 * @param slurpy if not null, arguments beyond the declared ones are accepted,
 *               checked with this capability, and included in the result
 * @param name appears in log lines and exception messages
 * @param compiled if false, always use the {@link ExecutionStrategy#GENERIC generic} strategy,
 *                 even when every check could be inlined
 * @param debug write the generated class file, if any, to a temporary directory
 */
public record ValidatorOptions(
	SourceMode sourceMode,
	OutputMode outputMode,
	boolean strict,
	@Nullable TypeCapability slurpy,
	@Nullable String name,
	boolean compiled,
	boolean debug
) {
	public static final ValidatorOptions DEFAULT = new ValidatorOptions(SourceMode.NAMED, OutputMode.MAPPED, true, null, null, true, false);

	public ValidatorOptions {
		requireNonNull(sourceMode);
		requireNonNull(outputMode);
	}

	public static ValidatorOptions named() {
		return DEFAULT;
	}

	public static ValidatorOptions positional() {
		return DEFAULT.withSourceMode(SourceMode.POSITIONAL).withOutputMode(OutputMode.ORDERED_LIST);
	}

	public ValidatorOptions withSourceMode(SourceMode sourceMode) {
		return new ValidatorOptions(sourceMode, outputMode, strict, slurpy, name, compiled, debug);
	}

	public ValidatorOptions withOutputMode(OutputMode outputMode) {
		return new ValidatorOptions(sourceMode, outputMode, strict, slurpy, name, compiled, debug);
	}

	public ValidatorOptions withStrict(boolean strict) {
		return new ValidatorOptions(sourceMode, outputMode, strict, slurpy, name, compiled, debug);
	}

	public ValidatorOptions withSlurpy(@Nullable TypeCapability slurpy) {
		return new ValidatorOptions(sourceMode, outputMode, strict, slurpy, name, compiled, debug);
	}

	public ValidatorOptions withName(@Nullable String name) {
		return new ValidatorOptions(sourceMode, outputMode, strict, slurpy, name, compiled, debug);
	}

	public ValidatorOptions withCompiled(boolean compiled) {
		return new ValidatorOptions(sourceMode, outputMode, strict, slurpy, name, compiled, debug);
	}

	public ValidatorOptions withDebug(boolean debug) {
		return new ValidatorOptions(sourceMode, outputMode, strict, slurpy, name, compiled, debug);
	}
}
