/**
 * Generates JVM bytecode to implement {@link works.argus.validator.ValidationRoutine ValidationRoutine}.
 * <p>
 * In compiler terms, this is the back end,
 * translating a {@link works.argus.plan.CompilationPlan CompilationPlan} into one class per validator,
 * with each parameter's {@link works.argus.capability.InlineCheck InlineCheck} emitted in place.
 * The translation is intended to be as direct as possible;
 * all decisions have already been made by the {@link works.argus.plan.CompilationPlanner CompilationPlanner}.
 */
package works.argus.validator.compiler;
