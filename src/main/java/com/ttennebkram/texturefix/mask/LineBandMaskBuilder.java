package com.ttennebkram.texturefix.mask;

import com.ttennebkram.texturefix.config.FilterConfig;
import com.ttennebkram.texturefix.spectrum.ComplexSpectrum;

import java.util.Arrays;

/**
 * Line-band policy.
 * Attenuates a horizontal band through the DC row and a vertical band through
 * the DC column, which is where tiling seams show up in the spectrum.
 *
 * Each band reduces by {@code attenuation} within lineWidth of the center line
 * and falls off linearly to no reduction at 2 * lineWidth. The two bands
 * multiply where they cross. The protect-center disc is passed unchanged.
 */
@MaskPolicyInfo(
    name = "lines",
    description = "Attenuate the horizontal and vertical lines through the spectrum center"
)
public class LineBandMaskBuilder implements MaskBuilder {

    @Override
    public String getPolicyName() {
        return "lines";
    }

    @Override
    public Mask build(ComplexSpectrum spectrum, FilterConfig config) {
        int rows = spectrum.rows();
        int cols = spectrum.cols();
        int lineWidth = config.getLineWidth();
        double attenuation = config.getAttenuation();

        // Horizontal band (through the DC row) removes vertical repetition
        Mask rowBand = Mask.fromRowFactors(bandFactors(rows, lineWidth, attenuation), cols);
        // Vertical band (through the DC column) removes horizontal repetition
        Mask colBand = Mask.fromColumnFactors(rows, bandFactors(cols, lineWidth, attenuation));

        return rowBand.times(colBand).withCenterPassed(config.getProtectCenter());
    }

    /**
     * Pass factor (1 - reduction) for each index along one axis.
     */
    static double[] bandFactors(int length, int lineWidth, double attenuation) {
        double[] factors = new double[length];
        Arrays.fill(factors, 1.0);
        if (lineWidth <= 0) {
            return factors;
        }

        int center = length / 2;
        for (int d = -2 * lineWidth; d <= 2 * lineWidth; d++) {
            int index = center + d;
            if (index < 0 || index >= length) continue;
            factors[index] *= 1.0 - reduction(Math.abs(d), lineWidth, attenuation);
        }
        return factors;
    }

    /**
     * Fraction of energy removed at a distance from the band center line.
     */
    static double reduction(int dist, int lineWidth, double attenuation) {
        if (lineWidth <= 0) {
            return 0.0;
        }
        if (dist <= lineWidth) {
            return attenuation;
        }
        if (dist >= 2 * lineWidth) {
            return 0.0;
        }
        return attenuation * (2 * lineWidth - dist) / lineWidth;
    }
}
