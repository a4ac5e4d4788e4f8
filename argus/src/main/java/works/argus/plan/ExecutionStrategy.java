package works.argus.plan;

public enum ExecutionStrategy {
	/**
	 * Every check is inlined into one generated class.
	 * Only possible when every parameter's capability offers an
	 * {@link works.argus.capability.InlineCheck InlineCheck}.
	 */
	SPECIALIZED,

	/**
	 * A loop over the plan's steps, calling each capability's
	 * {@link works.argus.capability.TypeCapability#check check} method.
	 */
	GENERIC,
}
