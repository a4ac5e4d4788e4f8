package works.argus.validator.compiler;

/**
 * Loads exactly one generated class, so that the class can be
 * unloaded as soon as its validator is unreachable.
 * <p>
 * Delegates everything else to the loader of this library,
 * which is therefore where any class mentioned by an
 * {@link works.argus.capability.InlineCheck InlineCheck} must be visible.
 */
final class OneOffClassLoader extends ClassLoader {
	OneOffClassLoader() {
		super(OneOffClassLoader.class.getClassLoader());
	}

	Class<?> defineClass(String binaryName, byte[] bytecode) {
		return defineClass(binaryName, bytecode, 0, bytecode.length);
	}
}
