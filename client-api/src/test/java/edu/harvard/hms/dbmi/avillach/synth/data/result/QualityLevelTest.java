package edu.harvard.hms.dbmi.avillach.synth.data.result;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class QualityLevelTest {

    @Test
    public void classifiesAtBandBoundaries() {
        assertEquals(QualityLevel.EXCELLENT, QualityLevel.classify(0.85));
        assertEquals(QualityLevel.GOOD, QualityLevel.classify(0.8499));
        assertEquals(QualityLevel.GOOD, QualityLevel.classify(0.70));
        assertEquals(QualityLevel.NEEDS_IMPROVEMENT, QualityLevel.classify(0.6999));
        assertEquals(QualityLevel.NEEDS_IMPROVEMENT, QualityLevel.classify(0.0));
    }

    @Test
    public void summaryText() {
        assertEquals("EXCELLENT - Quality score: 0.91 - Production ready", QualityLevel.EXCELLENT.summarize(0.912));
        assertEquals("NEEDS IMPROVEMENT - Quality score: 0.42 - Review parameters", QualityLevel.NEEDS_IMPROVEMENT.summarize(0.42));
    }

    @Test
    public void effectSizeAndRelevanceBands() {
        assertEquals(EffectSizeCategory.NEGLIGIBLE, EffectSizeCategory.of(0.1));
        assertEquals(EffectSizeCategory.SMALL, EffectSizeCategory.of(-0.3));
        assertEquals(EffectSizeCategory.MEDIUM, EffectSizeCategory.of(0.6));
        assertEquals(EffectSizeCategory.LARGE, EffectSizeCategory.of(-1.2));
        assertEquals(ClinicalRelevance.CLINICALLY_SIGNIFICANT, ClinicalRelevance.of(-5.0, true));
        assertEquals(ClinicalRelevance.BORDERLINE, ClinicalRelevance.of(-6.2, false));
        assertEquals(ClinicalRelevance.NOT_CLINICALLY_MEANINGFUL, ClinicalRelevance.of(-4.9, true));
    }
}
