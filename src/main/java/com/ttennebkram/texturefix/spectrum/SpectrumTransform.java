package com.ttennebkram.texturefix.spectrum;

import org.opencv.core.*;

import java.util.ArrayList;
import java.util.List;

/**
 * Forward and inverse 2-D DFT with center-shift.
 * Wraps Core.dft() / Core.idft() on a two-plane CV_64F matrix.
 */
public class SpectrumTransform {

    /**
     * Compute the centered spectrum of a single-channel grid.
     *
     * @param channel single-channel Mat of any numeric depth (not modified)
     * @return spectrum with DC at (rows / 2, cols / 2)
     * @throws IllegalArgumentException if the Mat is empty or has more than one channel
     */
    public ComplexSpectrum forward(Mat channel) {
        Mat centered = forwardComplex(channel);
        try {
            return ComplexSpectrum.fromComplexMat(centered);
        } finally {
            centered.release();
        }
    }

    /**
     * Same as {@link #forward(Mat)} but leaves the result as a CV_64FC2 Mat.
     *
     * @return centered complex spectrum (caller must release)
     */
    public Mat forwardComplex(Mat channel) {
        if (channel == null || channel.empty() || channel.channels() != 1) {
            throw new IllegalArgumentException("invalid input shape: " + describe(channel));
        }

        Mat floatChannel = new Mat();
        channel.convertTo(floatChannel, CvType.CV_64F);

        Mat complexI = new Mat();
        List<Mat> planes = new ArrayList<>();
        planes.add(floatChannel);
        planes.add(Mat.zeros(floatChannel.size(), CvType.CV_64F));
        Core.merge(planes, complexI);
        planes.get(1).release();
        floatChannel.release();

        Core.dft(complexI, complexI);

        Mat centered = roll(complexI, complexI.rows() / 2, complexI.cols() / 2);
        complexI.release();
        return centered;
    }

    /**
     * Undo the center-shift, run the inverse DFT and keep only the real plane.
     * The imaginary residue is discarded and the result is not clipped.
     *
     * @return single-channel CV_64F Mat (caller must release)
     */
    public Mat inverse(ComplexSpectrum spectrum) {
        Mat centered = spectrum.toComplexMat();
        Mat complexI = roll(centered, -spectrum.centerRow(), -spectrum.centerCol());
        centered.release();

        Core.idft(complexI, complexI, Core.DFT_SCALE);

        List<Mat> idftPlanes = new ArrayList<>();
        Core.split(complexI, idftPlanes);
        complexI.release();
        idftPlanes.get(1).release();

        return idftPlanes.get(0);
    }

    /**
     * Circular shift: element (y, x) of the input lands at
     * ((y + dy) mod rows, (x + dx) mod cols). Works for odd sizes, where
     * swapping equal quadrants does not.
     *
     * @return new Mat of the same size and type (caller must release)
     */
    static Mat roll(Mat input, int dy, int dx) {
        int rows = input.rows();
        int cols = input.cols();
        int sy = Math.floorMod(dy, rows);
        int sx = Math.floorMod(dx, cols);

        Mat output = new Mat(input.size(), input.type());

        // {source start, source end, destination start}
        int[][] rowSpans = {{0, rows - sy, sy}, {rows - sy, rows, 0}};
        int[][] colSpans = {{0, cols - sx, sx}, {cols - sx, cols, 0}};

        for (int[] r : rowSpans) {
            if (r[1] <= r[0]) continue;
            for (int[] c : colSpans) {
                if (c[1] <= c[0]) continue;
                Mat from = input.submat(r[0], r[1], c[0], c[1]);
                Mat to = output.submat(r[2], r[2] + r[1] - r[0], c[2], c[2] + c[1] - c[0]);
                from.copyTo(to);
                from.release();
                to.release();
            }
        }
        return output;
    }

    private static String describe(Mat mat) {
        if (mat == null) {
            return "null";
        }
        if (mat.empty()) {
            return "empty " + mat.rows() + "x" + mat.cols();
        }
        return mat.rows() + "x" + mat.cols() + "x" + mat.channels() + " (single channel required)";
    }
}
