package com.ttennebkram.texturefix.io;

import org.opencv.core.CvType;
import org.opencv.core.Mat;
import org.opencv.imgcodecs.Imgcodecs;

import java.io.File;
import java.io.IOException;

/**
 * Loads textures as floating-point grids and saves them as 8-bit images.
 * Channel order is whatever OpenCV decodes (BGR / BGRA); the filters treat
 * every channel alike, so it round-trips unchanged.
 */
public final class TextureImageIO {

    private TextureImageIO() {
    }

    /**
     * @return CV_64F Mat with the file's channel count (caller must release)
     * @throws IOException if the file is missing or cannot be decoded
     */
    public static Mat load(String path) throws IOException {
        File file = new File(path);
        if (!file.isFile()) {
            throw new IOException("Input file not found: " + path);
        }
        Mat loaded = Imgcodecs.imread(path, Imgcodecs.IMREAD_UNCHANGED);
        if (loaded == null || loaded.empty()) {
            throw new IOException("Could not decode image: " + path);
        }
        Mat image = new Mat();
        loaded.convertTo(image, CvType.CV_64F);
        loaded.release();
        return image;
    }

    /**
     * Clip, quantize and write an image. The format follows the file extension.
     *
     * @throws IOException if OpenCV cannot write the file
     */
    public static void save(Mat image, String path) throws IOException {
        Mat eightBit = ImageQuantizer.toEightBit(image);
        try {
            boolean written;
            try {
                written = Imgcodecs.imwrite(path, eightBit);
            } catch (Exception e) {
                // OpenCV throws CvException for unknown extensions
                throw new IOException("Could not write image " + path + ": " + e.getMessage(), e);
            }
            if (!written) {
                throw new IOException("Could not write image: " + path);
            }
        } finally {
            eightBit.release();
        }
        System.out.println("Saved: " + path);
    }
}
