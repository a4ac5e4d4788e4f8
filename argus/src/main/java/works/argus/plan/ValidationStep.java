package works.argus.plan;

import org.jetbrains.annotations.Nullable;
import works.argus.capability.InlineCheck;
import works.argus.capability.TypeCapability;
import works.argus.spec.Coercion;
import works.argus.spec.DefaultValue;
import works.argus.spec.ParameterSpec;

import static java.util.Objects.requireNonNull;

/**
 * Validation of one parameter.
 *
 * @param position the parameter's declared position, which is also its index in the result
 * @param inlineCheck null if the capability doesn't offer one
 */
public record ValidationStep(
	int position,
	ParameterSpec parameter,
	FetchStrategy fetch,
	AbsenceRule absence,
	@Nullable InlineCheck inlineCheck
) {
	public ValidationStep {
		requireNonNull(parameter);
		requireNonNull(fetch);
		requireNonNull(absence);
	}

	public String name() {
		return parameter.name();
	}

	public TypeCapability capability() {
		return parameter.capability();
	}

	public @Nullable Coercion coercion() {
		return parameter.coercion();
	}

	public boolean isInlinable() {
		return inlineCheck != null;
	}

	/**
	 * @throws IllegalStateException if {@link #absence} is not {@link AbsenceRule#USE_CONSTANT USE_CONSTANT}
	 */
	public @Nullable Object constantDefault() {
		if (parameter.defaultValue() instanceof DefaultValue.Constant c) {
			return c.value();
		}
		throw new IllegalStateException("Parameter '" + name() + "' has no constant default");
	}

	/**
	 * @throws IllegalStateException if {@link #absence} is not {@link AbsenceRule#USE_FACTORY USE_FACTORY}
	 */
	public DefaultValue.Factory defaultFactory() {
		if (parameter.defaultValue() instanceof DefaultValue.Factory f) {
			return f;
		}
		throw new IllegalStateException("Parameter '" + name() + "' has no default factory");
	}
}
