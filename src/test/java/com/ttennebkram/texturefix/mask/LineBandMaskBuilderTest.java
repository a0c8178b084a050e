package com.ttennebkram.texturefix.mask;

import com.ttennebkram.texturefix.config.FilterConfig;
import com.ttennebkram.texturefix.spectrum.ComplexSpectrum;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class LineBandMaskBuilderTest {

    private final LineBandMaskBuilder builder = new LineBandMaskBuilder();

    private static ComplexSpectrum zeros(int rows, int cols) {
        return new ComplexSpectrum(rows, cols, new double[rows * cols], new double[rows * cols]);
    }

    private static FilterConfig config(int lineWidth, double attenuation, int protect) {
        return FilterConfig.builder()
            .policy("lines")
            .lineWidth(lineWidth)
            .attenuation(attenuation)
            .protectCenter(protect)
            .build();
    }

    @Test
    void bandsAttenuateRowsAndColumnsThroughCenter() {
        Mask mask = builder.build(zeros(32, 32), config(2, 0.5, 0));

        // Row band only
        assertEquals(0.5, mask.get(17, 30), 1e-12);
        // Column band only
        assertEquals(0.5, mask.get(1, 14), 1e-12);
        // Falloff beyond lineWidth: reduction 0.5 * (4 - 3) / 2
        assertEquals(0.75, mask.get(19, 0), 1e-12);
        // Band edge at 2 * lineWidth has no reduction
        assertEquals(1.0, mask.get(20, 0), 1e-12);
        assertEquals(1.0, mask.get(5, 5), 1e-12);
    }

    @Test
    void crossingBandsCompound() {
        Mask mask = builder.build(zeros(32, 32), config(2, 0.5, 0));

        assertEquals(0.25, mask.get(17, 17), 1e-12);
        assertEquals(0.5 * 0.75, mask.get(17, 19), 1e-12);
    }

    @Test
    void protectDiscOverridesBands() {
        Mask mask = builder.build(zeros(64, 64), config(2, 0.99, 10));

        assertEquals(1.0, mask.get(32, 32));
        assertEquals(1.0, mask.get(32, 42));
        assertEquals(1.0, mask.get(25, 32));
        assertEquals(0.01, mask.get(32, 43), 1e-12);
    }

    @Test
    void dcIsPassedEvenWithFullAttenuation() {
        for (int protect : new int[]{0, 1, 5}) {
            Mask mask = builder.build(zeros(9, 14), config(3, 1.0, protect));
            assertEquals(1.0, mask.get(4, 7));
            assertEquals(0.0, mask.get(4, 0), 1e-12);
        }
    }

    @Test
    void valuesStayWithinUnitRange() {
        for (int width : new int[]{0, 1, 2, 6}) {
            for (double attenuation : new double[]{0.0, 0.3, 0.99, 1.0}) {
                Mask mask = builder.build(zeros(20, 15), config(width, attenuation, 2));
                assertTrue(mask.min() >= 0.0);
                assertTrue(mask.max() <= 1.0);
            }
        }
    }

    @Test
    void zeroWidthLeavesMaskOpen() {
        Mask mask = builder.build(zeros(10, 10), config(0, 0.99, 0));

        assertEquals(1.0, mask.min());
    }

    @Test
    void reductionNeverIncreasesWithDistance() {
        for (int width : new int[]{1, 2, 3, 7}) {
            double previous = Double.MAX_VALUE;
            for (int dist = 0; dist <= 2 * width + 2; dist++) {
                double reduction = LineBandMaskBuilder.reduction(dist, width, 0.8);
                assertTrue(reduction <= previous, "width=" + width + " dist=" + dist);
                if (dist > width && dist < 2 * width) {
                    assertTrue(reduction < previous, "strictly decreasing inside the falloff");
                }
                assertTrue(reduction >= 0.0);
                previous = reduction;
            }
            assertEquals(0.0, LineBandMaskBuilder.reduction(2 * width, width, 0.8));
        }
    }

    @Test
    void bandsNearGridEdgeAreClipped() {
        double[] factors = LineBandMaskBuilder.bandFactors(3, 4, 0.5);

        assertEquals(3, factors.length);
        for (double f : factors) {
            assertEquals(0.5, f, 1e-12);
        }
    }
}
