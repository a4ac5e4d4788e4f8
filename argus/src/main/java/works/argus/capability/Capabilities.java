package works.argus.capability;

import java.lang.reflect.Method;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;
import java.util.function.Predicate;
import org.jetbrains.annotations.Nullable;
import org.objectweb.asm.Label;
import org.objectweb.asm.MethodVisitor;

import static java.util.Objects.requireNonNull;
import static java.util.stream.Collectors.joining;
import static org.objectweb.asm.Opcodes.GOTO;
import static org.objectweb.asm.Opcodes.ICONST_0;
import static org.objectweb.asm.Opcodes.ICONST_1;
import static org.objectweb.asm.Opcodes.IFEQ;
import static org.objectweb.asm.Opcodes.IFNONNULL;

/**
 * A handful of general-purpose {@link TypeCapability} implementations.
 * <p>
 * Domain-specific capabilities (positive integers, non-empty strings, and so on)
 * are expected to come from the application; these are the building blocks.
 */
public final class Capabilities {
	private Capabilities(){}

	/**
	 * Accepts anything, including null.
	 */
	public static TypeCapability any() {
		return ANY;
	}

	/**
	 * Accepts non-null instances of {@code type}.
	 */
	public static TypeCapability instanceOf(Class<?> type) {
		return new InstanceOf(type);
	}

	/**
	 * Inline-capable: the compiled validator calls {@code predicate} directly.
	 */
	public static TypeCapability matching(String name, Predicate<Object> predicate) {
		return new Matching(name, predicate);
	}

	/**
	 * Not inline-capable, so any validator using this will take the generic path.
	 */
	public static TypeCapability checkedBy(String name, Function<Object, CheckResult> checker) {
		return new CheckedBy(name, checker);
	}

	/**
	 * Accepts values accepted by every one of {@code parts}.
	 * Inline-capable if all the parts are.
	 */
	public static TypeCapability allOf(TypeCapability... parts) {
		if (parts.length == 0) {
			throw new IllegalArgumentException("allOf requires at least one capability");
		}
		return new AllOf(List.of(parts));
	}

	/**
	 * Accepts null, plus anything {@code inner} accepts.
	 * Inline-capable if {@code inner} is.
	 */
	public static TypeCapability nullable(TypeCapability inner) {
		return new NullOr(requireNonNull(inner));
	}

	/**
	 * @return a short rendering of {@code value} suitable for error messages
	 */
	public static String describe(@Nullable Object value) {
		if (value == null) {
			return "null";
		} else if (value instanceof CharSequence) {
			return "\"" + value + "\"";
		} else {
			return value + " (" + value.getClass().getSimpleName() + ")";
		}
	}

	private static final TypeCapability ANY = new TypeCapability() {
		@Override
		public String name() {
			return "any";
		}

		@Override
		public CheckResult check(@Nullable Object value) {
			return CheckResult.valid();
		}

		@Override
		public Optional<InlineCheck> inlineCheck() {
			return Optional.of(e -> e.visitor().visitInsn(ICONST_1));
		}

		@Override
		public String toString() {
			return "any";
		}
	};

	record InstanceOf(Class<?> type) implements TypeCapability {
		InstanceOf {
			requireNonNull(type);
		}

		@Override
		public String name() {
			return type.getSimpleName();
		}

		@Override
		public CheckResult check(@Nullable Object value) {
			return CheckResult.of(type.isInstance(value), describe(value) + " is not a " + name());
		}

		@Override
		public Optional<InlineCheck> inlineCheck() {
			return Optional.of(e -> {
				e.loadCaptured(type, Class.class);
				e.loadValue();
				e.invoke(CLASS_IS_INSTANCE);
			});
		}
	}

	record Matching(String name, Predicate<Object> predicate) implements TypeCapability {
		Matching {
			requireNonNull(name);
			requireNonNull(predicate);
		}

		@Override
		public CheckResult check(@Nullable Object value) {
			return CheckResult.of(predicate.test(value), describe(value) + " is not " + name);
		}

		@Override
		public Optional<InlineCheck> inlineCheck() {
			return Optional.of(e -> {
				e.loadCaptured(predicate, Predicate.class);
				e.loadValue();
				e.invoke(PREDICATE_TEST);
			});
		}
	}

	record CheckedBy(String name, Function<Object, CheckResult> checker) implements TypeCapability {
		CheckedBy {
			requireNonNull(name);
			requireNonNull(checker);
		}

		@Override
		public CheckResult check(@Nullable Object value) {
			return requireNonNull(checker.apply(value), "checker returned null");
		}
	}

	record AllOf(List<TypeCapability> parts) implements TypeCapability {
		@Override
		public String name() {
			return parts.stream().map(TypeCapability::name).collect(joining(" & "));
		}

		@Override
		public CheckResult check(@Nullable Object value) {
			for (var part: parts) {
				CheckResult result = part.check(value);
				if (!result.isValid()) {
					return result;
				}
			}
			return CheckResult.valid();
		}

		@Override
		public Optional<InlineCheck> inlineCheck() {
			List<InlineCheck> checks = parts.stream()
				.map(TypeCapability::inlineCheck)
				.flatMap(Optional::stream)
				.toList();
			if (checks.size() < parts.size()) {
				return Optional.empty();
			}
			return Optional.of(e -> {
				MethodVisitor mv = e.visitor();
				Label fail = new Label();
				Label end = new Label();
				for (var check: checks.subList(0, checks.size() - 1)) {
					e.emit(check);
					mv.visitJumpInsn(IFEQ, fail);
				}
				e.emit(checks.get(checks.size() - 1));
				mv.visitJumpInsn(GOTO, end);
				mv.visitLabel(fail);
				mv.visitInsn(ICONST_0);
				mv.visitLabel(end);
			});
		}
	}

	record NullOr(TypeCapability inner) implements TypeCapability {
		@Override
		public String name() {
			return "nullable " + inner.name();
		}

		@Override
		public CheckResult check(@Nullable Object value) {
			return (value == null) ? CheckResult.valid() : inner.check(value);
		}

		@Override
		public Optional<InlineCheck> inlineCheck() {
			return inner.inlineCheck().map(innerCheck -> (InlineCheck) e -> {
				MethodVisitor mv = e.visitor();
				Label notNull = new Label();
				Label end = new Label();
				e.loadValue();
				mv.visitJumpInsn(IFNONNULL, notNull);
				mv.visitInsn(ICONST_1);
				mv.visitJumpInsn(GOTO, end);
				mv.visitLabel(notNull);
				e.emit(innerCheck);
				mv.visitLabel(end);
			});
		}
	}

	private static final Method CLASS_IS_INSTANCE = method(Class.class, "isInstance", Object.class);
	private static final Method PREDICATE_TEST = method(Predicate.class, "test", Object.class);

	private static Method method(Class<?> owner, String name, Class<?>... parameterTypes) {
		try {
			return owner.getMethod(name, parameterTypes);
		} catch (NoSuchMethodException e) {
			throw new AssertionError("Method must exist: " + owner.getSimpleName() + "." + name, e);
		}
	}
}
