package works.argus.validator.compiler;

import java.io.IOException;
import java.lang.invoke.MethodHandle;
import java.lang.invoke.MethodHandles;
import java.lang.invoke.MethodType;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Supplier;
import org.objectweb.asm.ClassWriter;
import org.objectweb.asm.Label;
import org.objectweb.asm.MethodVisitor;
import org.objectweb.asm.Type;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.argus.capability.CheckEmitter;
import works.argus.capability.InlineCheck;
import works.argus.exceptions.ValidatorCompilationException;
import works.argus.plan.CompilationPlan;
import works.argus.plan.ExecutionStrategy;
import works.argus.plan.FetchStrategy;
import works.argus.plan.SourceMode;
import works.argus.plan.ValidationStep;
import works.argus.spec.Coercion;
import works.argus.validator.ValidationRoutine;

import static java.util.Objects.requireNonNull;
import static org.objectweb.asm.Opcodes.AALOAD;
import static org.objectweb.asm.Opcodes.AASTORE;
import static org.objectweb.asm.Opcodes.ACC_FINAL;
import static org.objectweb.asm.Opcodes.ACC_PRIVATE;
import static org.objectweb.asm.Opcodes.ACC_PUBLIC;
import static org.objectweb.asm.Opcodes.ACC_SUPER;
import static org.objectweb.asm.Opcodes.ACONST_NULL;
import static org.objectweb.asm.Opcodes.ALOAD;
import static org.objectweb.asm.Opcodes.ANEWARRAY;
import static org.objectweb.asm.Opcodes.ARETURN;
import static org.objectweb.asm.Opcodes.ASTORE;
import static org.objectweb.asm.Opcodes.ATHROW;
import static org.objectweb.asm.Opcodes.BIPUSH;
import static org.objectweb.asm.Opcodes.CHECKCAST;
import static org.objectweb.asm.Opcodes.GETFIELD;
import static org.objectweb.asm.Opcodes.GOTO;
import static org.objectweb.asm.Opcodes.ICONST_0;
import static org.objectweb.asm.Opcodes.IFNE;
import static org.objectweb.asm.Opcodes.IFNONNULL;
import static org.objectweb.asm.Opcodes.IF_ICMPLE;
import static org.objectweb.asm.Opcodes.ILOAD;
import static org.objectweb.asm.Opcodes.INVOKEINTERFACE;
import static org.objectweb.asm.Opcodes.INVOKESPECIAL;
import static org.objectweb.asm.Opcodes.INVOKESTATIC;
import static org.objectweb.asm.Opcodes.INVOKEVIRTUAL;
import static org.objectweb.asm.Opcodes.ISTORE;
import static org.objectweb.asm.Opcodes.PUTFIELD;
import static org.objectweb.asm.Opcodes.RETURN;
import static org.objectweb.asm.Opcodes.SIPUSH;
import static org.objectweb.asm.Opcodes.V17;

/**
 * Compiles a {@link ExecutionStrategy#SPECIALIZED SPECIALIZED} {@link CompilationPlan}
 * into a subclass of {@link GeneratedValidatorRuntime}.
 * <p>
 * The generated {@code run} method does, in straight-line code, exactly what
 * {@link works.argus.validator.interpreter.PlanInterpreter PlanInterpreter} does in a loop.
 * Objects the generated code needs (defaults, coercions, anything an {@link InlineCheck} captures)
 * are passed to the generated constructor in an array and stored in final instance fields.
 */
public final class PlanCompiler {

	/**
	 * @throws IllegalArgumentException if the plan's strategy is not {@link ExecutionStrategy#SPECIALIZED SPECIALIZED}
	 * @throws ValidatorCompilationException if code generation or class loading fails
	 */
	public ValidationRoutine compile(CompilationPlan plan) {
		if (plan.strategy() != ExecutionStrategy.SPECIALIZED) {
			throw new IllegalArgumentException("Plan is not eligible for compilation: " + plan.description());
		}
		String className = "GeneratedValidator_" + CLASS_COUNTER.incrementAndGet();
		LOGGER.debug("Compiling {} as {}", plan.description(), className);

		var captures = new Captures();
		byte[] bytecode;
		try {
			bytecode = generate(className, plan, captures);
		} catch (RuntimeException e) {
			throw new ValidatorCompilationException("Failed to generate " + className + " for " + plan.description(), e);
		}

		if (plan.options().debug() || LOGGER.isTraceEnabled()) {
			dump(className, bytecode);
		}

		MethodHandle ctor;
		try {
			Class<?> generatedClass = new OneOffClassLoader().defineClass(className, bytecode);
			ctor = MethodHandles.lookup().findConstructor(generatedClass, CONSTRUCTOR_TYPE);
		} catch (LinkageError | ReflectiveOperationException e) {
			throw new ValidatorCompilationException("Failed to load generated class " + className, e);
		}
		try {
			return (ValidationRoutine) ctor.invoke(plan, captures.values());
		} catch (Throwable e) {
			throw new ValidatorCompilationException("Failed to instantiate generated class " + className, e);
		}
	}

	private byte[] generate(String className, CompilationPlan plan, Captures captures) {
		ClassWriter cw = new FrameComputingClassWriter();
		cw.visit(V17, ACC_PUBLIC | ACC_FINAL | ACC_SUPER, className, null, RUNTIME, null);

		// Captures are discovered while emitting run, so it goes first
		new RunMethodEmitter(cw, className, plan, captures).emit();
		captures.emitFields(cw);
		emitConstructor(cw, className, captures);

		cw.visitEnd();
		return cw.toByteArray();
	}

	private static void emitConstructor(ClassWriter cw, String className, Captures captures) {
		MethodVisitor mv = cw.visitMethod(ACC_PUBLIC, "<init>", CONSTRUCTOR_TYPE.toMethodDescriptorString(), null, null);
		mv.visitCode();
		mv.visitVarInsn(ALOAD, 0);
		mv.visitVarInsn(ALOAD, 1);
		mv.visitMethodInsn(INVOKESPECIAL, RUNTIME, "<init>", methodDescriptor(void.class, CompilationPlan.class), false);
		for (Captured c: captures.all) {
			mv.visitVarInsn(ALOAD, 0);
			mv.visitVarInsn(ALOAD, 2);
			pushInt(mv, c.index());
			mv.visitInsn(AALOAD);
			mv.visitTypeInsn(CHECKCAST, Type.getInternalName(c.type()));
			mv.visitFieldInsn(PUTFIELD, className, c.fieldName(), Type.getDescriptor(c.type()));
		}
		mv.visitInsn(RETURN);
		mv.visitMaxs(0, 0);
		mv.visitEnd();
	}

	/**
	 * Methods starting with underscore are named after the bytecode they emit,
	 * not what they actually do.
	 */
	private static final class RunMethodEmitter implements CheckEmitter {
		final String className;
		final CompilationPlan plan;
		final Captures captures;
		final MethodVisitor mv;

		RunMethodEmitter(ClassWriter cw, String className, CompilationPlan plan, Captures captures) {
			this.className = className;
			this.plan = plan;
			this.captures = captures;
			this.mv = cw.visitMethod(ACC_PUBLIC | ACC_FINAL, "run", methodDescriptor(Object[].class, Object.class), null, null);
		}

		void emit() {
			SourceMode sourceMode = plan.options().sourceMode();
			boolean checkShape = plan.checksShape();
			mv.visitCode();

			mv.visitVarInsn(ALOAD, RAW_ARGS);
			if (sourceMode == SourceMode.NAMED) {
				mv.visitTypeInsn(CHECKCAST, Type.getInternalName(Map.class));
				mv.visitVarInsn(ASTORE, ARGS);
				if (checkShape) {
					mv.visitVarInsn(ALOAD, THIS);
					mv.visitVarInsn(ALOAD, ARGS);
					_invokeRuntime("checkNamedShape", void.class, Map.class);
				}
			} else {
				mv.visitTypeInsn(CHECKCAST, Type.getInternalName(List.class));
				mv.visitVarInsn(ASTORE, ARGS);
				mv.visitVarInsn(ALOAD, ARGS);
				mv.visitMethodInsn(INVOKEINTERFACE, Type.getInternalName(List.class), "size", methodDescriptor(int.class), true);
				mv.visitVarInsn(ISTORE, SIZE);
				if (checkShape) {
					mv.visitVarInsn(ALOAD, THIS);
					mv.visitVarInsn(ILOAD, SIZE);
					_invokeRuntime("checkPositionalShape", void.class, int.class);
				}
			}

			pushInt(mv, plan.size());
			mv.visitTypeInsn(ANEWARRAY, Type.getInternalName(Object.class));
			mv.visitVarInsn(ASTORE, VALUES);

			plan.steps().forEach(this::emitStep);

			mv.visitVarInsn(ALOAD, VALUES);
			mv.visitInsn(ARETURN);
			mv.visitMaxs(0, 0);
			mv.visitEnd();
		}

		/**
		 * Leaves the validated value in {@link #VALUES} at the step's position.
		 */
		private void emitStep(ValidationStep step) {
			Label present = new Label();
			Label check = new Label();
			Label store = new Label();

			_fetch(step.fetch(), present);

			// Absent
			switch (step.absence()) {
				case FAIL -> {
					mv.visitVarInsn(ALOAD, THIS);
					pushInt(mv, step.position());
					_invokeRuntime("missing", RuntimeException.class, int.class);
					mv.visitInsn(ATHROW);
				}
				case USE_CONSTANT -> {
					Object constant = step.constantDefault();
					if (constant == null) {
						mv.visitInsn(ACONST_NULL);
					} else {
						loadCaptured(constant, Object.class);
					}
					mv.visitVarInsn(ASTORE, VALUE);
					mv.visitJumpInsn(GOTO, store);
				}
				case USE_FACTORY -> {
					loadCaptured(step.defaultFactory().supplier(), Supplier.class);
					mv.visitMethodInsn(INVOKEINTERFACE, Type.getInternalName(Supplier.class), "get", methodDescriptor(Object.class), true);
					mv.visitVarInsn(ASTORE, VALUE);
					mv.visitJumpInsn(GOTO, check);
				}
				case LEAVE_EMPTY -> {
					mv.visitInsn(ACONST_NULL);
					mv.visitVarInsn(ASTORE, VALUE);
					mv.visitJumpInsn(GOTO, store);
				}
			}

			// Present
			mv.visitLabel(present);
			Coercion coercion = step.coercion();
			if (coercion != null) {
				loadCaptured(coercion, Coercion.class);
				mv.visitVarInsn(ALOAD, VALUE);
				mv.visitMethodInsn(INVOKEINTERFACE, Type.getInternalName(Coercion.class), "coerce", methodDescriptor(Object.class, Object.class), true);
				mv.visitVarInsn(ASTORE, VALUE);
			}

			mv.visitLabel(check);
			emit(requireNonNull(step.inlineCheck(), "SPECIALIZED plan has a step with no inline check"));
			mv.visitJumpInsn(IFNE, store);
			mv.visitVarInsn(ALOAD, THIS);
			pushInt(mv, step.position());
			mv.visitVarInsn(ALOAD, VALUE);
			_invokeRuntime("typeMismatch", RuntimeException.class, int.class, Object.class);
			mv.visitInsn(ATHROW);

			mv.visitLabel(store);
			mv.visitVarInsn(ALOAD, VALUES);
			pushInt(mv, step.position());
			mv.visitVarInsn(ALOAD, VALUE);
			mv.visitInsn(AASTORE);
		}

		/**
		 * Leaves the raw argument in {@link #VALUE} and jumps to {@code present} if it was supplied;
		 * otherwise falls through.
		 */
		private void _fetch(FetchStrategy fetch, Label present) {
			if (fetch instanceof FetchStrategy.ByName byName) {
				String mapType = Type.getInternalName(Map.class);
				mv.visitVarInsn(ALOAD, ARGS);
				mv.visitLdcInsn(byName.key());
				mv.visitMethodInsn(INVOKEINTERFACE, mapType, "get", methodDescriptor(Object.class, Object.class), true);
				mv.visitVarInsn(ASTORE, VALUE);
				mv.visitVarInsn(ALOAD, VALUE);
				mv.visitJumpInsn(IFNONNULL, present);
				// Null could mean absent, or present with a null value
				mv.visitVarInsn(ALOAD, ARGS);
				mv.visitLdcInsn(byName.key());
				mv.visitMethodInsn(INVOKEINTERFACE, mapType, "containsKey", methodDescriptor(boolean.class, Object.class), true);
				mv.visitJumpInsn(IFNE, present);
			} else {
				int index = ((FetchStrategy.ByPosition) fetch).index();
				Label absent = new Label();
				mv.visitVarInsn(ILOAD, SIZE);
				pushInt(mv, index);
				mv.visitJumpInsn(IF_ICMPLE, absent);
				mv.visitVarInsn(ALOAD, ARGS);
				pushInt(mv, index);
				mv.visitMethodInsn(INVOKEINTERFACE, Type.getInternalName(List.class), "get", methodDescriptor(Object.class, int.class), true);
				mv.visitVarInsn(ASTORE, VALUE);
				mv.visitJumpInsn(GOTO, present);
				mv.visitLabel(absent);
			}
		}

		private void _invokeRuntime(String name, Class<?> returnType, Class<?>... parameterTypes) {
			mv.visitMethodInsn(INVOKEVIRTUAL, RUNTIME, name, methodDescriptor(returnType, parameterTypes), false);
		}

		@Override
		public MethodVisitor visitor() {
			return mv;
		}

		@Override
		public void loadValue() {
			mv.visitVarInsn(ALOAD, VALUE);
		}

		@Override
		public void loadConstant(Object constant) {
			if (constant instanceof String
				|| constant instanceof Integer
				|| constant instanceof Long
				|| constant instanceof Float
				|| constant instanceof Double
			) {
				mv.visitLdcInsn(constant);
			} else {
				throw new IllegalArgumentException("Not a constant pool value: " + constant);
			}
		}

		@Override
		public void loadCaptured(Object value, Class<?> type) {
			requireNonNull(value);
			if (type.isPrimitive() || !Modifier.isPublic(type.getModifiers())) {
				throw new IllegalArgumentException("Captured values must have a public reference type, not " + type);
			}
			if (!type.isInstance(value)) {
				throw new IllegalArgumentException("Captured value is not an instance of " + type.getName() + ": " + value);
			}
			Captured c = captures.capture(value, type);
			mv.visitVarInsn(ALOAD, THIS);
			mv.visitFieldInsn(GETFIELD, className, c.fieldName(), Type.getDescriptor(type));
		}

		@Override
		public void invoke(Method method) {
			Class<?> owner = method.getDeclaringClass();
			if (!Modifier.isPublic(method.getModifiers()) || !Modifier.isPublic(owner.getModifiers())) {
				throw new IllegalArgumentException("Inline checks can only invoke public methods of public types: " + method);
			}
			int opcode;
			if (Modifier.isStatic(method.getModifiers())) {
				opcode = INVOKESTATIC;
			} else if (owner.isInterface()) {
				opcode = INVOKEINTERFACE;
			} else {
				opcode = INVOKEVIRTUAL;
			}
			mv.visitMethodInsn(opcode, Type.getInternalName(owner), method.getName(), Type.getMethodDescriptor(method), owner.isInterface());
		}

		@Override
		public void emit(InlineCheck nested) {
			nested.emit(this);
		}

		// Local variable slots in the run method
		static final int THIS = 0;
		static final int RAW_ARGS = 1;
		static final int ARGS = 2;
		static final int VALUES = 3;
		static final int VALUE = 4;
		static final int SIZE = 5;
	}

	/**
	 * @param index position in the array passed to the generated constructor
	 */
	record Captured(int index, Object value, Class<?> type) {
		/**
		 * Guaranteed unique within its generated class
		 */
		String fieldName() {
			return "captured_" + index + "_" + type.getSimpleName().replaceAll("[^A-Za-z0-9_]", "_");
		}
	}

	/**
	 * Lets generated code reference arbitrary objects by stashing them in final fields.
	 */
	static final class Captures {
		final List<Captured> all = new ArrayList<>();

		Captured capture(Object value, Class<?> type) {
			for (Captured c: all) {
				if (c.value() == value && c.type() == type) {
					return c;
				}
			}
			Captured result = new Captured(all.size(), value, type);
			all.add(result);
			return result;
		}

		Object[] values() {
			return all.stream().map(Captured::value).toArray();
		}

		void emitFields(ClassWriter cw) {
			for (Captured c: all) {
				cw.visitField(ACC_PRIVATE | ACC_FINAL, c.fieldName(), Type.getDescriptor(c.type()), null, null)
					.visitEnd();
			}
		}
	}

	/**
	 * At every branch target in generated code, each local and stack slot has the same type
	 * along all incoming paths, except where {@link InlineCheck}s use their own labels
	 * and leave only an {@code int}.
	 * Looking up real class hierarchies is therefore never needed, and would require loading
	 * classes through a loader that may not see them.
	 */
	private static final class FrameComputingClassWriter extends ClassWriter {
		FrameComputingClassWriter() {
			super(COMPUTE_FRAMES);
		}

		@Override
		protected String getCommonSuperClass(String type1, String type2) {
			return type1.equals(type2) ? type1 : OBJECT;
		}
	}

	private static void pushInt(MethodVisitor mv, int value) {
		if (-1 <= value && value <= 5) {
			mv.visitInsn(ICONST_0 + value);
		} else if (Byte.MIN_VALUE <= value && value <= Byte.MAX_VALUE) {
			mv.visitIntInsn(BIPUSH, value);
		} else if (Short.MIN_VALUE <= value && value <= Short.MAX_VALUE) {
			mv.visitIntInsn(SIPUSH, value);
		} else {
			mv.visitLdcInsn(value);
		}
	}

	private static String methodDescriptor(Class<?> returnType, Class<?>... parameterTypes) {
		return MethodType.methodType(returnType, parameterTypes).toMethodDescriptorString();
	}

	private static void dump(String className, byte[] bytecode) {
		Path file = DumpDirectory.PATH.resolve(className + ".class");
		try {
			Files.write(file, bytecode);
		} catch (IOException e) {
			throw new ValidatorCompilationException("Unable to write generated class to " + file, e);
		}
		LOGGER.info("Wrote bytecode for {} to {}", className, file);
	}

	private static final class DumpDirectory {
		static final Path PATH;

		static {
			try {
				PATH = Files.createTempDirectory("PlanCompiler_");
				PATH.toFile().deleteOnExit();
			} catch (IOException e) {
				throw new IllegalStateException(e);
			}
		}
	}

	private static final AtomicLong CLASS_COUNTER = new AtomicLong(0);
	private static final String RUNTIME = Type.getInternalName(GeneratedValidatorRuntime.class);
	private static final String OBJECT = Type.getInternalName(Object.class);
	private static final MethodType CONSTRUCTOR_TYPE = MethodType.methodType(void.class, CompilationPlan.class, Object[].class);
	private static final Logger LOGGER = LoggerFactory.getLogger(PlanCompiler.class);
}
