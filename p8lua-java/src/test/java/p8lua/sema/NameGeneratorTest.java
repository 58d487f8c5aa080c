package p8lua.sema;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class NameGeneratorTest {

    @ParameterizedTest
    @CsvSource({"0, a", "1, b", "25, z", "26, aa", "27, ab", "51, az", "52, ba", "701, zz", "702, aaa"})
    void names_in_order(int index, String expected) {
        assertEquals(expected, NameGenerator.name(index));
    }

    @Test
    void first_skips_taken_names() {
        Set<String> taken = Set.of("a", "b", "d");
        assertEquals("c", NameGenerator.first(taken::contains));
    }
}
