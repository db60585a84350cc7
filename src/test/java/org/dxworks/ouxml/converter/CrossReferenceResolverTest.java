package org.dxworks.ouxml.converter;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;

public class CrossReferenceResolverTest {

    private final CrossReferenceResolver resolver = new CrossReferenceResolver(ConversionSettings.of(5, 1));

    @Test
    void blockWithoutNumber_usesDefaultBlock() {
        assertEquals("block5/part2/unitx", resolver.toDocumentPath("Some Block, Part 2, UnitX"));
    }

    @Test
    void fullTarget_isLowercasedWithoutSpaces() {
        assertEquals(List.of("block2", "part3", "unit1"), resolver.resolve("Block 2, Part 3, Unit 1"));
    }

    @Test
    void missingBlockAndPart_areFilledFromSettings() {
        assertEquals("block5/part1/session3", resolver.toDocumentPath("Session 3"));
    }

    @Test
    void partAfterOtherSegments_isKeptAsPathSegment() {
        assertEquals("block5/part1/unit1/part4", resolver.toDocumentPath("Unit 1, Part 4"));
    }

    @Test
    void emptySegments_areSkipped() {
        assertEquals("block7/part1/unit2", resolver.toDocumentPath("Block 7, , Unit 2"));
    }
}
