package works.argus.plan;

/**
 * How raw arguments arrive at a validator.
 */
public enum SourceMode {
	/**
	 * As a {@link java.util.Map Map} from parameter name to value.
	 */
	NAMED,

	/**
	 * As a {@link java.util.List List} matched to parameters by declaration order.
	 */
	POSITIONAL,
}
