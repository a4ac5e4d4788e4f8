package works.argus.exceptions;

import org.jetbrains.annotations.Nullable;

/**
 * A positional validator received more arguments than it declares.
 */
public final class ExtraArgumentsException extends ValidationException {
	private final int expectedAtMost;
	private final int actual;

	public ExtraArgumentsException(int expectedAtMost, int actual, @Nullable String validatorName) {
		super("#" + expectedAtMost, "got " + actual + " arguments but expected at most " + expectedAtMost, validatorName);
		this.expectedAtMost = expectedAtMost;
		this.actual = actual;
	}

	public int expectedAtMost() {
		return expectedAtMost;
	}

	public int actual() {
		return actual;
	}
}
