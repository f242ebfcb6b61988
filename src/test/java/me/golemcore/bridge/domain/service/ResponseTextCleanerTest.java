package me.golemcore.bridge.domain.service;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ResponseTextCleanerTest {

    private final ResponseTextCleaner cleaner = new ResponseTextCleaner();

    @Test
    void removesCitationMarkers() {
        assertEquals("Capybaras are rodents.", cleaner.clean("Capybaras are rodents [1][2]."));
        assertEquals("They swim well.", cleaner.clean("They swim well [3, 4]."));
    }

    @Test
    void removesSourceLines() {
        String text = "Capybaras live in South America.\nSource: wikipedia.org\nSources: a, b";

        assertEquals("Capybaras live in South America.", cleaner.clean(text));
    }

    @Test
    void removesSuperscriptDigits() {
        assertEquals("Water boils at 100 degrees.", cleaner.clean("Water boils at 100 degrees¹²."));
    }

    @Test
    void collapsesSpacesAndBlankLines() {
        String text = "  First   paragraph.\r\n\r\n\r\n\r\nSecond\t\tparagraph.  ";

        assertEquals("First paragraph.\n\nSecond paragraph.", cleaner.clean(text));
    }

    @Test
    void nullBecomesEmpty() {
        assertEquals("", cleaner.clean(null));
    }

    @Test
    void keepsOrdinaryBrackets() {
        assertEquals("Use list[i] here.", cleaner.clean("Use list[i] here."));
    }
}
