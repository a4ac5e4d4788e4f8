package works.argus.capability;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static works.argus.TestCapabilities.NON_EMPTY_STRING;
import static works.argus.TestCapabilities.POSITIVE_INT;
import static works.argus.TestCapabilities.POSITIVE_INT_GENERIC;
import static works.argus.capability.Capabilities.allOf;
import static works.argus.capability.Capabilities.any;
import static works.argus.capability.Capabilities.describe;
import static works.argus.capability.Capabilities.instanceOf;
import static works.argus.capability.Capabilities.nullable;

class CapabilitiesTest {

	@Test
	void any_acceptsEverything() {
		assertTrue(any().check(null).isValid());
		assertTrue(any().check(new Object()).isValid());
		assertTrue(any().inlineCheck().isPresent());
	}

	@Test
	void instanceOf_rejectsNull() {
		TypeCapability strings = instanceOf(String.class);
		assertTrue(strings.check("x").isValid());
		assertEquals("null is not a String", strings.check(null).reason());
		assertEquals("3 (Integer) is not a String", strings.check(3).reason());
	}

	@Test
	void allOf_reportsFirstFailure() {
		TypeCapability cap = allOf(instanceOf(Integer.class), POSITIVE_INT);
		assertEquals("Integer & a positive integer", cap.name());
		assertEquals("\"x\" is not a Integer", cap.check("x").reason());
		assertEquals("0 (Integer) is not a positive integer", cap.check(0).reason());
		assertTrue(cap.check(1).isValid());
		assertThrows(IllegalArgumentException.class, () -> allOf());
	}

	@Test
	void nullable_acceptsNull() {
		TypeCapability cap = nullable(NON_EMPTY_STRING);
		assertTrue(cap.check(null).isValid());
		assertTrue(cap.check("x").isValid());
		assertFalse(cap.check("").isValid());
	}

	@Test
	void inlineAvailability() {
		assertTrue(POSITIVE_INT.inlineCheck().isPresent());
		assertFalse(POSITIVE_INT_GENERIC.inlineCheck().isPresent());
		assertTrue(allOf(instanceOf(Integer.class), POSITIVE_INT).inlineCheck().isPresent());
		assertFalse(allOf(instanceOf(Integer.class), POSITIVE_INT_GENERIC).inlineCheck().isPresent());
		assertTrue(nullable(POSITIVE_INT).inlineCheck().isPresent());
		assertFalse(nullable(POSITIVE_INT_GENERIC).inlineCheck().isPresent());
	}

	@Test
	void describeValues() {
		assertEquals("null", describe(null));
		assertEquals("\"hi\"", describe("hi"));
		assertEquals("2.5 (Double)", describe(2.5));
	}
}
