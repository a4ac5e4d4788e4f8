package works.argus.validator;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.Test;
import works.argus.Validators;
import works.argus.exceptions.SpecDefinitionException;
import works.argus.plan.CompilationPlanner;
import works.argus.plan.ValidatorOptions;
import works.argus.spec.ParameterSpec;
import works.argus.spec.ParameterSpecSet;
import works.argus.validator.interpreter.PlanInterpreter;

import static java.util.concurrent.TimeUnit.SECONDS;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static works.argus.TestCapabilities.NON_EMPTY_STRING;
import static works.argus.TestCapabilities.POSITIVE_INT;
import static works.argus.TestCapabilities.sleighSpecs;

class ValidatorCacheTest {

	@Test
	void equivalentDescriptorsShareOneValidator() {
		var cache = new ValidatorCache();
		CompiledValidator first = cache.getOrCompile(sleighSpecs(), ValidatorOptions.DEFAULT);
		CompiledValidator second = cache.getOrCompile(sleighSpecs(), ValidatorOptions.named());
		assertSame(first, second);
		assertEquals(1, cache.size());
		assertEquals(1, cache.compilationCount());
		assertEquals(Map.of("present_name", "Doll", "qty", 1), second.validate(Map.of("present_name", "Doll")).asMap());
	}

	@Test
	void differentOptions_differentValidators() {
		var cache = new ValidatorCache();
		CompiledValidator named = cache.getOrCompile(sleighSpecs(), ValidatorOptions.DEFAULT);
		CompiledValidator lenient = cache.getOrCompile(sleighSpecs(), ValidatorOptions.DEFAULT.withStrict(false));
		CompiledValidator positional = cache.getOrCompile(sleighSpecs(), ValidatorOptions.positional());
		assertNotSame(named, lenient);
		assertNotSame(named, positional);
		assertEquals(3, cache.size());
	}

	@Test
	void concurrentRequests_compileOnce() throws Exception {
		var started = new CountDownLatch(1);
		var release = new CountDownLatch(1);
		var compilations = new AtomicInteger(0);
		var planner = new CompilationPlanner();
		var cache = new ValidatorCache(descriptor -> {
			compilations.incrementAndGet();
			started.countDown();
			try {
				assertTrue(release.await(10, SECONDS));
			} catch (InterruptedException e) {
				throw new AssertionError(e);
			}
			var plan = planner.plan(descriptor.specs(), descriptor.options());
			return new CompiledValidator(plan, new PlanInterpreter(plan));
		});

		ExecutorService executor = Executors.newFixedThreadPool(8);
		try {
			List<Future<CompiledValidator>> futures = new ArrayList<>();
			for (int i = 0; i < 8; i++) {
				futures.add(executor.submit(() -> cache.getOrCompile(sleighSpecs(), ValidatorOptions.DEFAULT)));
			}
			assertTrue(started.await(10, SECONDS));
			release.countDown();

			CompiledValidator expected = futures.get(0).get(10, SECONDS);
			for (var future: futures) {
				assertSame(expected, future.get(10, SECONDS));
			}
		} finally {
			executor.shutdownNow();
		}
		assertEquals(1, compilations.get());
		assertEquals(1, cache.compilationCount());
		assertEquals(1, cache.size());
	}

	@Test
	void failedCompilation_notCached() {
		var cache = new ValidatorCache();
		var specs = ParameterSpecSet.of(
			ParameterSpec.optional("qty", POSITIVE_INT),
			ParameterSpec.required("present_name", NON_EMPTY_STRING));
		assertThrows(SpecDefinitionException.class, () -> cache.getOrCompile(specs, ValidatorOptions.positional()));
		assertEquals(0, cache.size());
		assertThrows(SpecDefinitionException.class, () -> cache.getOrCompile(specs, ValidatorOptions.positional()));
		assertEquals(2, cache.compilationCount());

		// The same specs are fine with named arguments
		cache.getOrCompile(specs, ValidatorOptions.named());
		assertEquals(1, cache.size());
	}

	@Test
	void globalCache() {
		assertSame(ValidatorCache.global(), ValidatorCache.global());
		assertEquals(0, ValidatorCache.class.getConstructors().length, "Only the global cache is available outside the package");
		assertSame(Validators.define(sleighSpecs()), ValidatorCache.global().getOrCompile(sleighSpecs(), ValidatorOptions.DEFAULT));
	}
}
