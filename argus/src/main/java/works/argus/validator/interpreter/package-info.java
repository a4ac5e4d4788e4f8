/**
 * Implements {@link works.argus.validator.ValidationRoutine ValidationRoutine} directly by walking
 * the steps of a {@link works.argus.plan.CompilationPlan CompilationPlan}
 * and calling each parameter's {@link works.argus.capability.TypeCapability#check check}.
 * <p>
 * This is the generic fallback, used whenever some capability can't be inlined.
 * It is also the reference against which the {@link works.argus.validator.compiler compiler} is tested.
 */
package works.argus.validator.interpreter;
