package works.argus;

import java.util.LinkedHashMap;
import java.util.Map;
import org.openjdk.jmh.annotations.Benchmark;
import org.openjdk.jmh.annotations.BenchmarkMode;
import org.openjdk.jmh.annotations.Fork;
import org.openjdk.jmh.annotations.Level;
import org.openjdk.jmh.annotations.Measurement;
import org.openjdk.jmh.annotations.Scope;
import org.openjdk.jmh.annotations.Setup;
import org.openjdk.jmh.annotations.State;
import org.openjdk.jmh.annotations.Warmup;
import works.argus.capability.CheckResult;
import works.argus.exceptions.MissingRequiredParameterException;
import works.argus.exceptions.TypeMismatchException;
import works.argus.plan.ValidatorOptions;
import works.argus.spec.DefaultValue;
import works.argus.spec.ParameterSpec;
import works.argus.spec.ParameterSpecSet;
import works.argus.validator.CompiledValidator;

import static java.util.concurrent.TimeUnit.SECONDS;
import static org.openjdk.jmh.annotations.Mode.Throughput;
import static works.argus.TestCapabilities.sleighSpecs;

/**
 * Compares the generated validator with the interpreter,
 * and with walking the specs directly on every call.
 */
@BenchmarkMode(Throughput)
@State(Scope.Thread)
@Fork(3)
@Warmup(iterations = 8, time = 1)
@Measurement(iterations = 5, time = 1, timeUnit = SECONDS)
public class ValidatorBenchmark {
	private ParameterSpecSet specs;
	private Map<String, Object> args;
	private CompiledValidator compiled;
	private CompiledValidator interpreted;

	@Setup(Level.Iteration)
	public void setup() {
		specs = sleighSpecs();
		args = Map.of("present_name", "Doll", "qty", 3);
		compiled = Validators.compile(specs, ValidatorOptions.DEFAULT);
		interpreted = Validators.compile(specs, ValidatorOptions.DEFAULT.withCompiled(false));
	}

	@Benchmark
	public Object compiled() {
		return compiled.validate(args);
	}

	@Benchmark
	public Object interpreted() {
		return interpreted.validate(args);
	}

	/**
	 * What validation would cost with no planning at all.
	 */
	@Benchmark
	public Object naive() {
		for (String key: args.keySet()) {
			if (!specs.contains(key)) {
				throw new IllegalArgumentException(key);
			}
		}
		var result = new LinkedHashMap<String, Object>();
		for (ParameterSpec spec: specs) {
			Object value;
			if (args.containsKey(spec.name())) {
				value = args.get(spec.name());
			} else if (spec.required()) {
				throw new MissingRequiredParameterException(spec.name(), null);
			} else if (spec.defaultValue() instanceof DefaultValue.Constant c) {
				result.put(spec.name(), c.value());
				continue;
			} else if (spec.defaultValue() instanceof DefaultValue.Factory f) {
				value = f.supplier().get();
			} else {
				result.put(spec.name(), null);
				continue;
			}
			CheckResult check = spec.capability().check(value);
			if (!check.isValid()) {
				throw new TypeMismatchException(spec.name(), spec.capability().name(), value, check.reason(), null);
			}
			result.put(spec.name(), value);
		}
		return result;
	}
}
