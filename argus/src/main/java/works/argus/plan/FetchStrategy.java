package works.argus.plan;

import static java.util.Objects.requireNonNull;

/**
 * Where a {@link ValidationStep} finds its raw argument.
 */
public sealed interface FetchStrategy {
	record ByName(String key) implements FetchStrategy {
		public ByName {
			requireNonNull(key);
		}
	}

	record ByPosition(int index) implements FetchStrategy {
		public ByPosition {
			if (index < 0) {
				throw new IllegalArgumentException("Negative index: " + index);
			}
		}
	}
}
