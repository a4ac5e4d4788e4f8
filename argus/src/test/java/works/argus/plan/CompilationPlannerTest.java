package works.argus.plan;

import java.util.List;
import org.junit.jupiter.api.Test;
import works.argus.exceptions.SpecDefinitionException;
import works.argus.spec.ParameterSpec;
import works.argus.spec.ParameterSpecSet;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static works.argus.TestCapabilities.NON_EMPTY_STRING;
import static works.argus.TestCapabilities.POSITIVE_INT;
import static works.argus.TestCapabilities.POSITIVE_INT_GENERIC;
import static works.argus.TestCapabilities.sleighSpecs;
import static works.argus.capability.Capabilities.any;
import static works.argus.plan.AbsenceRule.FAIL;
import static works.argus.plan.AbsenceRule.LEAVE_EMPTY;
import static works.argus.plan.AbsenceRule.USE_CONSTANT;
import static works.argus.plan.AbsenceRule.USE_FACTORY;
import static works.argus.plan.ExecutionStrategy.GENERIC;
import static works.argus.plan.ExecutionStrategy.SPECIALIZED;

class CompilationPlannerTest {
	final CompilationPlanner planner = new CompilationPlanner();

	@Test
	void namedSteps() {
		ParameterSpecSet specs = ParameterSpecSet.of(
			ParameterSpec.required("a", any()),
			ParameterSpec.optional("b", POSITIVE_INT).withDefault(1),
			ParameterSpec.optional("c", POSITIVE_INT).withDefaultFrom(() -> 2),
			ParameterSpec.optional("d", POSITIVE_INT));
		CompilationPlan plan = planner.plan(specs, ValidatorOptions.DEFAULT);

		assertEquals(SPECIALIZED, plan.strategy());
		assertEquals(List.of(FAIL, USE_CONSTANT, USE_FACTORY, LEAVE_EMPTY),
			plan.steps().stream().map(ValidationStep::absence).toList());
		assertEquals(new FetchStrategy.ByName("c"), plan.steps().get(2).fetch());
		assertEquals(1, plan.steps().get(1).constantDefault());
		assertThrows(IllegalStateException.class, () -> plan.steps().get(0).constantDefault());
		assertThrows(IllegalStateException.class, () -> plan.steps().get(1).defaultFactory());
		assertTrue(plan.steps().stream().allMatch(ValidationStep::isInlinable));
	}

	@Test
	void positionalSteps() {
		CompilationPlan plan = planner.plan(sleighSpecs(), ValidatorOptions.positional());
		assertEquals(new FetchStrategy.ByPosition(0), plan.steps().get(0).fetch());
		assertEquals(new FetchStrategy.ByPosition(1), plan.steps().get(1).fetch());
	}

	@Test
	void oneNonInlineCapability_wholePlanIsGeneric() {
		ParameterSpecSet specs = ParameterSpecSet.of(
			ParameterSpec.required("present_name", NON_EMPTY_STRING),
			ParameterSpec.optional("qty", POSITIVE_INT_GENERIC));
		CompilationPlan plan = planner.plan(specs, ValidatorOptions.DEFAULT);
		assertEquals(GENERIC, plan.strategy());
		assertTrue(plan.steps().get(0).isInlinable());
		assertFalse(plan.steps().get(1).isInlinable());
	}

	@Test
	void compiledOptionOff_isGeneric() {
		assertEquals(GENERIC, planner.plan(sleighSpecs(), ValidatorOptions.DEFAULT.withCompiled(false)).strategy());
	}

	@Test
	void slurpyCapabilityDoesNotAffectStrategy() {
		var options = ValidatorOptions.DEFAULT.withSlurpy(POSITIVE_INT_GENERIC);
		assertEquals(SPECIALIZED, planner.plan(sleighSpecs(), options).strategy());
	}

	@Test
	void requiredAfterOptional_rejectedForPositional() {
		ParameterSpecSet specs = ParameterSpecSet.of(
			ParameterSpec.optional("qty", POSITIVE_INT),
			ParameterSpec.required("present_name", NON_EMPTY_STRING));
		var e = assertThrows(SpecDefinitionException.class, () -> planner.plan(specs, ValidatorOptions.positional()));
		assertTrue(e.getMessage().contains("present_name"), e.getMessage());

		// Fine for named arguments
		planner.plan(specs, ValidatorOptions.named());
	}

	@Test
	void slurpyOutputShapeMustFit() {
		assertThrows(SpecDefinitionException.class, () -> planner.plan(sleighSpecs(),
			ValidatorOptions.DEFAULT.withSlurpy(any()).withOutputMode(OutputMode.ORDERED_LIST)));
		assertThrows(SpecDefinitionException.class, () -> planner.plan(sleighSpecs(),
			ValidatorOptions.positional().withSlurpy(any()).withOutputMode(OutputMode.MAPPED)));
	}

	@Test
	void shapeCheck() {
		assertTrue(planner.plan(sleighSpecs(), ValidatorOptions.named()).checksShape());
		assertFalse(planner.plan(sleighSpecs(), ValidatorOptions.named().withStrict(false)).checksShape());
		assertTrue(planner.plan(sleighSpecs(), ValidatorOptions.positional()).checksShape());
		assertTrue(planner.plan(sleighSpecs(), ValidatorOptions.positional().withStrict(false)).checksShape());
		assertFalse(planner.plan(sleighSpecs(), ValidatorOptions.positional().withSlurpy(any())).checksShape());
		assertFalse(planner.plan(sleighSpecs(), ValidatorOptions.named().withSlurpy(any())).checksShape());
	}

	@Test
	void description() {
		String description = planner.plan(sleighSpecs(), ValidatorOptions.DEFAULT).description();
		assertEquals("NAMED->MAPPED strict SPECIALIZED [present_name/FAIL, qty/USE_CONSTANT]", description);
	}
}
