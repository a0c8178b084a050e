package com.ttennebkram.texturefix.mask;

import com.ttennebkram.texturefix.config.FilterConfig;
import com.ttennebkram.texturefix.spectrum.ComplexSpectrum;

import java.util.ArrayList;
import java.util.List;

/**
 * Peak-notch policy.
 * Bins whose magnitude is above the configured percentile are treated as
 * periodic pattern peaks and a soft circular notch is cut around each one.
 *
 * Notch falloff is quadratic: factor (d / r)^2 at distance d from the peak,
 * 0 at the peak itself and 1 at the notch radius. Overlapping notches multiply.
 * The DC disc of radius protectCenter is excluded from the percentile
 * statistics, never treated as a peak, and forced back to 1.0 at the end.
 */
@MaskPolicyInfo(
    name = "peaks",
    description = "Notch out frequencies whose magnitude is above the threshold percentile"
)
public class PeakNotchMaskBuilder implements MaskBuilder {

    @Override
    public String getPolicyName() {
        return "peaks";
    }

    @Override
    public Mask build(ComplexSpectrum spectrum, FilterConfig config) {
        int rows = spectrum.rows();
        int cols = spectrum.cols();
        int protect = config.getProtectCenter();

        List<int[]> peaks = findPeaks(spectrum, config.getThresholdPercentile(), protect);
        Mask notches = buildNotches(rows, cols, peaks, config.getNotchRadius());
        return notches.withCenterPassed(protect);
    }

    /**
     * Locate peak bins as {row, col} pairs in row-major order.
     */
    List<int[]> findPeaks(ComplexSpectrum spectrum, double thresholdPercentile, int protectCenter) {
        int rows = spectrum.rows();
        int cols = spectrum.cols();
        double[] magnitude = spectrum.magnitude();

        // DC and its neighbours would dominate the statistics
        double[] forThreshold = magnitude.clone();
        for (int y = 0; y < rows; y++) {
            for (int x = 0; x < cols; x++) {
                if (Mask.isInCenterDisc(rows, cols, y, x, protectCenter)) {
                    forThreshold[y * cols + x] = 0.0;
                }
            }
        }
        double threshold = Percentile.of(forThreshold, thresholdPercentile);

        List<int[]> peaks = new ArrayList<>();
        for (int y = 0; y < rows; y++) {
            for (int x = 0; x < cols; x++) {
                if (magnitude[y * cols + x] > threshold
                        && !Mask.isInCenterDisc(rows, cols, y, x, protectCenter)) {
                    peaks.add(new int[]{y, x});
                }
            }
        }
        return peaks;
    }

    Mask buildNotches(int rows, int cols, List<int[]> peaks, int notchRadius) {
        double[] factors = Mask.ones(rows, cols).toArray();
        int radius = Math.max(notchRadius, 0);

        for (int[] peak : peaks) {
            int py = peak[0];
            int px = peak[1];
            for (int dy = -radius; dy <= radius; dy++) {
                int ny = py + dy;
                if (ny < 0 || ny >= rows) continue;
                for (int dx = -radius; dx <= radius; dx++) {
                    int nx = px + dx;
                    if (nx < 0 || nx >= cols) continue;

                    double dist = Math.sqrt(dy * dy + dx * dx);
                    if (dist <= radius) {
                        factors[ny * cols + nx] *= notchFactor(dist, radius);
                    }
                }
            }
        }
        return Mask.of(rows, cols, factors);
    }

    /**
     * Attenuation factor at a distance from a peak. A radius of 0 removes
     * only the peak bin itself.
     */
    static double notchFactor(double dist, int radius) {
        if (dist <= 0 || radius == 0) {
            return 0.0;
        }
        double ratio = dist / radius;
        return ratio * ratio;
    }
}
