package works.argus.validator;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import org.junit.jupiter.api.Test;
import works.argus.plan.OutputMode;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

class ValidatedValuesTest {
	static final List<String> NAMES = List.of("present_name", "qty", "note");

	@Test
	void mapped() {
		var map = new LinkedHashMap<String, Object>();
		map.put("present_name", "Doll");
		map.put("qty", 1);
		map.put("note", null);
		map.put("wrapping", "gold");
		ValidatedValues values = ValidatedValues.mapped(NAMES, map);

		assertEquals(OutputMode.MAPPED, values.outputMode());
		assertEquals(4, values.size());
		assertEquals(1, values.get(1));
		assertNull(values.get("note"));
		assertEquals("gold", values.get("wrapping"));
		assertThrows(IllegalArgumentException.class, () -> values.get("colour"));
		assertThrows(IllegalStateException.class, values::asList);
		assertThrows(ClassCastException.class, () -> values.get("qty", String.class));
		assertEquals("{present_name=Doll, qty=1, note=null, wrapping=gold}", values.toString());
	}

	@Test
	void ordered() {
		ValidatedValues values = ValidatedValues.ordered(NAMES, Arrays.<Object>asList("Doll", 1, null, "extra"));

		assertEquals(OutputMode.ORDERED_LIST, values.outputMode());
		assertEquals(4, values.size());
		assertEquals("Doll", values.get("present_name"));
		assertEquals("extra", values.get(3));
		assertThrows(IllegalArgumentException.class, () -> values.get("colour"));
		assertThrows(IllegalStateException.class, values::asMap);
		assertThrows(UnsupportedOperationException.class, () -> values.asList().set(0, "Bike"));
	}
}
