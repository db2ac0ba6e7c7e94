package com.dcruver.anchorwatch.domain;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class SourceTierTest {

    @Test
    void testResearchCategoriesUseFixedThreshold() {
        assertEquals(SourceTier.TIER_1_FIXED, SourceTier.forCategory("Think Tank"));
        assertEquals(SourceTier.TIER_1_FIXED, SourceTier.forCategory("AI Research"));
        assertEquals(SourceTier.TIER_1_FIXED, SourceTier.forCategory("Business Council"));
    }

    @Test
    void testGovernmentUsesMean() {
        assertEquals(SourceTier.TIER_2_MEAN, SourceTier.forCategory("Government"));
    }

    @Test
    void testNewsCategoriesUseStrictPolicy() {
        assertEquals(SourceTier.TIER_3_STRICT, SourceTier.forCategory("News Media"));
        assertEquals(SourceTier.TIER_3_STRICT, SourceTier.forCategory("News & Media"));
        assertEquals(SourceTier.TIER_3_STRICT, SourceTier.forCategory("Misc. Research"));
    }

    @Test
    void testLookupIgnoresCaseAndPadding() {
        assertEquals(SourceTier.TIER_1_FIXED, SourceTier.forCategory("  think tank "));
        assertEquals(SourceTier.TIER_2_MEAN, SourceTier.forCategory("GOVERNMENT"));
    }

    @Test
    void testUnknownOrMissingCategoryIsStrictest() {
        assertEquals(SourceTier.TIER_3_STRICT, SourceTier.forCategory("Podcast"));
        assertEquals(SourceTier.TIER_3_STRICT, SourceTier.forCategory(null));
    }

    @Test
    void testFromLevel() {
        assertEquals(SourceTier.TIER_2_MEAN, SourceTier.fromLevel(2));
        assertThrows(IllegalArgumentException.class, () -> SourceTier.fromLevel(4));
    }
}
