package org.dxworks.ommltex.symbols;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class SymbolTableTest {

    @Test
    void lookup_FindsSpacedAndBareEntries() {
        assertEquals("\\alpha ", SymbolTable.lookup("α").orElseThrow().toLatex());
        assertEquals("\\sqrt", SymbolTable.lookup("√").orElseThrow().toLatex());
        assertTrue(SymbolTable.lookup("q").isEmpty());
    }

    @Test
    void convert_ReplacesEverySymbolAndCopiesTheRest() {
        assertEquals("x\\in \\mathbb{R} ", SymbolTable.convert("x∈ℝ"));
        assertEquals("90^\\circ", SymbolTable.convert("90°"));
        assertEquals("plain", SymbolTable.convert("plain"));
    }

    @Test
    void convert_HandlesSupplementaryCharacters() {
        assertEquals("\\mathbb{K} ^n", SymbolTable.convert("𝕂^n"));
    }

    @Test
    void convert_OfEmptyIsEmpty() {
        assertEquals("", SymbolTable.convert(""));
        assertEquals("", SymbolTable.convert(null));
    }

    @Test
    void commandNames_AreBareLetterNames() {
        assertTrue(SymbolTable.commandNames().contains("neq"));
        assertTrue(SymbolTable.commandNames().contains("mathbb"));
        assertFalse(SymbolTable.commandNames().contains("circ"));
    }

    @Test
    void sources_AreUnique() {
        assertEquals(SymbolTable.entries().size(), SymbolTable.sources().size());
    }
}
