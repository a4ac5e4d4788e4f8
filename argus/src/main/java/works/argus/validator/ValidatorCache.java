package works.argus.validator;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.FutureTask;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.argus.exceptions.SpecDefinitionException;
import works.argus.exceptions.ValidatorCompilationException;
import works.argus.plan.CompilationPlanner;
import works.argus.plan.ValidatorOptions;
import works.argus.spec.ParameterSpecSet;

import static java.util.Objects.requireNonNull;

/**
 * Maps {@link ValidatorDescriptor}s to {@link CompiledValidator}s,
 * compiling each one the first time it's requested.
 * <p>
 * Concurrent requests for the same descriptor share a single compilation:
 * one thread does the work and the others wait for it.
 * A compilation that fails leaves nothing behind, so a later request will try again.
 * Entries are never evicted.
 */
public final class ValidatorCache {
	private final Function<ValidatorDescriptor, CompiledValidator> compiler;
	private final ConcurrentHashMap<ValidatorDescriptor, FutureTask<CompiledValidator>> validators = new ConcurrentHashMap<>();
	private final AtomicLong compilationCount = new AtomicLong(0);

	/**
	 * Everything outside this package shares {@link #global()}.
	 */
	ValidatorCache() {
		this(defaultCompiler());
	}

	ValidatorCache(Function<ValidatorDescriptor, CompiledValidator> compiler) {
		this.compiler = requireNonNull(compiler);
	}

	/**
	 * The process-wide cache used by {@link works.argus.Validators Validators}.
	 */
	public static ValidatorCache global() {
		return GLOBAL;
	}

	public CompiledValidator getOrCompile(ParameterSpecSet specs, ValidatorOptions options) {
		return getOrCompile(new ValidatorDescriptor(specs, options));
	}

	/**
	 * @return the same instance for every call with an equal {@code descriptor},
	 * unless compilation failed
	 * @throws SpecDefinitionException if the descriptor is unusable
	 * @throws ValidatorCompilationException if code generation fails
	 */
	public CompiledValidator getOrCompile(ValidatorDescriptor descriptor) {
		FutureTask<CompiledValidator> task = validators.get(descriptor);
		if (task == null) {
			var newTask = new FutureTask<>(() -> compile(descriptor));
			task = validators.putIfAbsent(descriptor, newTask);
			if (task == null) {
				task = newTask;
				newTask.run();
			}
		}
		try {
			return getUninterruptibly(task);
		} catch (ExecutionException e) {
			validators.remove(descriptor, task);
			Throwable cause = e.getCause();
			if (cause instanceof RuntimeException r) {
				throw r;
			} else if (cause instanceof Error err) {
				throw err;
			} else {
				throw new IllegalStateException("Unexpected exception compiling " + descriptor, cause);
			}
		}
	}

	/**
	 * @return the number of validators currently cached, not counting in-flight or failed compilations
	 */
	public int size() {
		return (int) validators.values().stream()
			.filter(t -> t.isDone() && !isFailed(t))
			.count();
	}

	/**
	 * @return the number of compilations this cache has started, including failed ones
	 */
	public long compilationCount() {
		return compilationCount.get();
	}

	private CompiledValidator compile(ValidatorDescriptor descriptor) {
		compilationCount.incrementAndGet();
		long start = System.nanoTime();
		CompiledValidator result = compiler.apply(descriptor);
		if (LOGGER.isInfoEnabled()) {
			LOGGER.info("Compiled {} in {}us", result, (System.nanoTime() - start) / 1000);
		}
		return result;
	}

	private static boolean isFailed(Future<?> task) {
		try {
			task.get();
			return false;
		} catch (ExecutionException e) {
			return true;
		} catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			return true;
		}
	}

	private static <V> V getUninterruptibly(Future<V> future) throws ExecutionException {
		boolean interrupted = false;
		try {
			while (true) {
				try {
					return future.get();
				} catch (InterruptedException e) {
					interrupted = true;
				}
			}
		} finally {
			if (interrupted) {
				Thread.currentThread().interrupt();
			}
		}
	}

	private static Function<ValidatorDescriptor, CompiledValidator> defaultCompiler() {
		CompilationPlanner planner = new CompilationPlanner();
		ValidatorBuilder builder = new ValidatorBuilder();
		return descriptor -> builder.build(planner.plan(descriptor.specs(), descriptor.options()));
	}

	private static final ValidatorCache GLOBAL = new ValidatorCache();
	private static final Logger LOGGER = LoggerFactory.getLogger(ValidatorCache.class);
}
