package io.github.cyfko.sheetlogic.core.reference;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.*;

class ColumnLettersTest {

    @ParameterizedTest
    @CsvSource({"A,1", "Z,26", "AA,27", "AZ,52", "BA,53", "XFD,16384"})
    @DisplayName("Letters and indices map both ways")
    void bijective(String letters, int index) {
        assertEquals(index, ColumnLetters.toIndex(letters));
        assertEquals(letters, ColumnLetters.toLetters(index));
    }

    @Test
    void lowerCaseIsAccepted() {
        assertEquals(28, ColumnLetters.toIndex("ab"));
    }

    @Test
    void rejectsInvalidInput() {
        assertThrows(IllegalArgumentException.class, () -> ColumnLetters.toIndex("A1"));
        assertThrows(IllegalArgumentException.class, () -> ColumnLetters.toLetters(0));
    }
}
