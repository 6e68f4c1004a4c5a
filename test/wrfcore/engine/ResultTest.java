package wrfcore.engine;

import org.junit.jupiter.api.Test;

import java.util.NoSuchElementException;

import static org.junit.jupiter.api.Assertions.*;

class ResultTest {

    @Test
    void okCarriesValue() {
        Result<Integer> r = Result.ok(5);
        assertTrue(r.isOk());
        assertEquals(5, r.get());
        assertEquals(5, r.orElse(7));
        assertNull(r.getError());
        assertEquals(10, r.map(x -> x * 2).get());
    }

    @Test
    void failCarriesKindAndMessage() {
        Result<Integer> r = Result.fail(ErrorKind.OUT_OF_RANGE_INPUT, "E=20");
        assertFalse(r.isOk());
        assertEquals(ErrorKind.OUT_OF_RANGE_INPUT, r.getError());
        assertEquals("E=20", r.getMessage());
        assertEquals(7, r.orElse(7));
        assertThrows(NoSuchElementException.class, r::get);

        Result<String> mapped = r.map(String::valueOf);
        assertEquals(ErrorKind.OUT_OF_RANGE_INPUT, mapped.getError());
        assertTrue(r.toString().contains("OUT_OF_RANGE_INPUT"));
    }
}
