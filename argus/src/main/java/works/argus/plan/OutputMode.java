package works.argus.plan;

/**
 * The shape of a successful validation result.
 */
public enum OutputMode {
	/**
	 * Values keyed by parameter name, iterating in declaration order.
	 */
	MAPPED,

	/**
	 * Values in declaration order, regardless of the order in which they were supplied.
	 */
	ORDERED_LIST,
}
