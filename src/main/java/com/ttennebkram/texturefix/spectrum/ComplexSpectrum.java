package com.ttennebkram.texturefix.spectrum;

import com.ttennebkram.texturefix.mask.Mask;
import org.opencv.core.Core;
import org.opencv.core.CvType;
import org.opencv.core.Mat;

import java.util.ArrayList;
import java.util.List;

/**
 * Immutable H x W grid of complex frequency values in center-shifted order.
 * The DC term sits at (rows / 2, cols / 2); low frequencies cluster around it
 * and high frequencies lie towards the edges.
 */
public final class ComplexSpectrum {

    private final int rows;
    private final int cols;
    private final double[] real;
    private final double[] imag;

    public ComplexSpectrum(int rows, int cols, double[] real, double[] imag) {
        if (rows <= 0 || cols <= 0) {
            throw new IllegalArgumentException("invalid input shape: " + rows + "x" + cols);
        }
        if (real.length != rows * cols || imag.length != rows * cols) {
            throw new IllegalArgumentException("invalid input shape: expected " + (rows * cols)
                + " values, got " + real.length + " real / " + imag.length + " imaginary");
        }
        this.rows = rows;
        this.cols = cols;
        this.real = real.clone();
        this.imag = imag.clone();
    }

    // Takes ownership of the arrays
    private ComplexSpectrum(double[] real, double[] imag, int rows, int cols) {
        this.rows = rows;
        this.cols = cols;
        this.real = real;
        this.imag = imag;
    }

    /**
     * Copy a centered CV_64FC2 spectrum out of native memory.
     */
    static ComplexSpectrum fromComplexMat(Mat complex) {
        int rows = complex.rows();
        int cols = complex.cols();
        List<Mat> planes = new ArrayList<>();
        Core.split(complex, planes);
        double[] real = new double[rows * cols];
        double[] imag = new double[rows * cols];
        planes.get(0).get(0, 0, real);
        planes.get(1).get(0, 0, imag);
        for (Mat p : planes) p.release();
        return new ComplexSpectrum(real, imag, rows, cols);
    }

    public int rows() {
        return rows;
    }

    public int cols() {
        return cols;
    }

    public int centerRow() {
        return rows / 2;
    }

    public int centerCol() {
        return cols / 2;
    }

    public double getReal(int row, int col) {
        return real[row * cols + col];
    }

    public double getImag(int row, int col) {
        return imag[row * cols + col];
    }

    public double magnitudeAt(int row, int col) {
        int i = row * cols + col;
        return Math.hypot(real[i], imag[i]);
    }

    /**
     * Magnitude of every bin, row-major.
     */
    public double[] magnitude() {
        Mat magnitude = magnitudeMat();
        double[] mag = new double[rows * cols];
        magnitude.get(0, 0, mag);
        magnitude.release();
        return mag;
    }

    /**
     * @return single-channel CV_64F magnitude grid (caller must release)
     */
    private Mat magnitudeMat() {
        Mat re = plane(real);
        Mat im = plane(imag);
        Mat magnitude = new Mat();
        Core.magnitude(re, im, magnitude);
        re.release();
        im.release();
        return magnitude;
    }

    /**
     * Element-wise complex-by-real product with an attenuation mask.
     *
     * @param mask mask of the same shape as this spectrum
     * @return a new spectrum; this one is left untouched
     */
    public ComplexSpectrum multiply(Mask mask) {
        if (mask.rows() != rows || mask.cols() != cols) {
            throw new IllegalArgumentException("invalid input shape: mask " + mask.rows() + "x" + mask.cols()
                + " does not match spectrum " + rows + "x" + cols);
        }
        Mat factors = plane(mask.toArray());
        Mat re = plane(real);
        Mat im = plane(imag);
        Core.multiply(re, factors, re);
        Core.multiply(im, factors, im);
        factors.release();

        double[] outReal = new double[real.length];
        double[] outImag = new double[imag.length];
        re.get(0, 0, outReal);
        im.get(0, 0, outImag);
        re.release();
        im.release();
        return new ComplexSpectrum(outReal, outImag, rows, cols);
    }

    /**
     * @return this spectrum as a CV_64FC2 Mat (caller must release)
     */
    Mat toComplexMat() {
        List<Mat> planes = new ArrayList<>();
        planes.add(plane(real));
        planes.add(plane(imag));
        Mat complex = new Mat();
        Core.merge(planes, complex);
        for (Mat p : planes) p.release();
        return complex;
    }

    private Mat plane(double[] values) {
        Mat mat = new Mat(rows, cols, CvType.CV_64F);
        mat.put(0, 0, values);
        return mat;
    }
}
