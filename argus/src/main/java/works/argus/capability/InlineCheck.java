package works.argus.capability;

/**
 * Emits JVM bytecode that tests the value under validation.
 * <p>
 * The emitted fragment must leave exactly one {@code int} on the operand stack:
 * nonzero if the value passes, zero if it doesn't.
 * It must not leave anything else on the stack, must not throw,
 * and must not branch outside itself.
 * Use {@link CheckEmitter#loadValue()} to obtain the value under test.
 */
@FunctionalInterface
public interface InlineCheck {
	void emit(CheckEmitter emitter);
}
