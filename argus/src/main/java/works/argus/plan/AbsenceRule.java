package works.argus.plan;

/**
 * What a {@link ValidationStep} does when its argument was not supplied.
 */
public enum AbsenceRule {
	FAIL,

	/**
	 * Use the constant default, which has already been checked.
	 */
	USE_CONSTANT,

	/**
	 * Call the default factory and check what it returns.
	 */
	USE_FACTORY,

	/**
	 * Optional with no default: the result holds null.
	 */
	LEAVE_EMPTY,
}
