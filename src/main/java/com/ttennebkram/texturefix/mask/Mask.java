package com.ttennebkram.texturefix.mask;

import java.util.Arrays;

/**
 * Immutable grid of multiplicative attenuation factors, one per frequency bin.
 * 1.0 passes a bin unchanged, 0.0 removes it. Every operation returns a new Mask.
 */
public final class Mask {

    private final int rows;
    private final int cols;
    private final double[] values;

    private Mask(int rows, int cols, double[] values) {
        this.rows = rows;
        this.cols = cols;
        this.values = values;
    }

    public static Mask ones(int rows, int cols) {
        double[] values = new double[rows * cols];
        Arrays.fill(values, 1.0);
        return new Mask(rows, cols, values);
    }

    /**
     * @param values row-major factors; copied
     */
    public static Mask of(int rows, int cols, double[] values) {
        if (values.length != rows * cols) {
            throw new IllegalArgumentException("invalid input shape: expected " + (rows * cols)
                + " values, got " + values.length);
        }
        return new Mask(rows, cols, values.clone());
    }

    /**
     * Mask whose row r is scaled by rowFactors[r], all columns alike.
     */
    public static Mask fromRowFactors(double[] rowFactors, int cols) {
        int rows = rowFactors.length;
        double[] values = new double[rows * cols];
        for (int y = 0; y < rows; y++) {
            Arrays.fill(values, y * cols, (y + 1) * cols, rowFactors[y]);
        }
        return new Mask(rows, cols, values);
    }

    /**
     * Mask whose column c is scaled by colFactors[c], all rows alike.
     */
    public static Mask fromColumnFactors(int rows, double[] colFactors) {
        int cols = colFactors.length;
        double[] values = new double[rows * cols];
        for (int y = 0; y < rows; y++) {
            System.arraycopy(colFactors, 0, values, y * cols, cols);
        }
        return new Mask(rows, cols, values);
    }

    public int rows() {
        return rows;
    }

    public int cols() {
        return cols;
    }

    public double get(int row, int col) {
        return values[row * cols + col];
    }

    public double[] toArray() {
        return values.clone();
    }

    /**
     * Element-wise product. Overlapping attenuations compound, they never add.
     */
    public Mask times(Mask other) {
        if (other.rows != rows || other.cols != cols) {
            throw new IllegalArgumentException("invalid input shape: " + other.rows + "x" + other.cols
                + " vs " + rows + "x" + cols);
        }
        double[] product = new double[values.length];
        for (int i = 0; i < values.length; i++) {
            product[i] = values[i] * other.values[i];
        }
        return new Mask(rows, cols, product);
    }

    /**
     * Copy of this mask with the disc of the given radius around the DC bin
     * (rows / 2, cols / 2) forced to 1.0, whatever attenuation was there.
     */
    public Mask withCenterPassed(int radius) {
        double[] passed = values.clone();
        int cy = rows / 2;
        int cx = cols / 2;
        long r2 = (long) radius * radius;
        for (int y = 0; y < rows; y++) {
            long dy = y - cy;
            for (int x = 0; x < cols; x++) {
                long dx = x - cx;
                if (dy * dy + dx * dx <= r2) {
                    passed[y * cols + x] = 1.0;
                }
            }
        }
        return new Mask(rows, cols, passed);
    }

    /**
     * True when (row, col) lies within radius of the DC bin.
     */
    public static boolean isInCenterDisc(int rows, int cols, int row, int col, int radius) {
        long dy = row - rows / 2;
        long dx = col - cols / 2;
        return dy * dy + dx * dx <= (long) radius * radius;
    }

    public double min() {
        return Arrays.stream(values).min().orElse(1.0);
    }

    public double max() {
        return Arrays.stream(values).max().orElse(1.0);
    }
}
