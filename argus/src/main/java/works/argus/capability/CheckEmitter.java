package works.argus.capability;

import java.lang.reflect.Method;
import org.objectweb.asm.MethodVisitor;

/**
 * The view of a generated validator method that an {@link InlineCheck} gets to see.
 * <p>
 * Methods are named after the bytecode they emit, not what the generated code does.
 */
public interface CheckEmitter {
	/**
	 * For anything the other methods don't cover, like branches.
	 * Code emitted this way must respect the stack discipline described in {@link InlineCheck}.
	 */
	MethodVisitor visitor();

	/**
	 * Pushes the value under test, as an {@link Object}.
	 */
	void loadValue();

	/**
	 * Pushes a constant that can live in the constant pool:
	 * a {@link String}, {@link Integer}, {@link Long}, {@link Float}, or {@link Double}.
	 * Numbers are pushed as the corresponding primitive.
	 */
	void loadConstant(Object constant);

	/**
	 * Pushes an arbitrary object that the generated class captures when it is instantiated.
	 *
	 * @param type the static type of the pushed reference; {@code value} must be an instance
	 */
	void loadCaptured(Object value, Class<?> type);

	/**
	 * Invokes {@code method} with whatever arguments are on the stack,
	 * using the appropriate static, virtual, or interface invocation.
	 * The method must be public and its declaring class must be visible
	 * to the class loader of this library.
	 */
	void invoke(Method method);

	/**
	 * Emits another inline check in place, leaving its {@code int} result on the stack.
	 */
	void emit(InlineCheck nested);
}
