package com.ttennebkram.texturefix.io;

import org.opencv.core.CvType;
import org.opencv.core.Mat;

/**
 * Converts filter output back to 8-bit samples.
 * Values are clipped to [0, 255] and then truncated toward zero, so 254.9
 * becomes 254 rather than rounding up.
 */
public final class ImageQuantizer {

    private ImageQuantizer() {
    }

    /**
     * @param image Mat of any depth and channel count (not modified)
     * @return CV_8U Mat with the same shape (caller must release)
     */
    public static Mat toEightBit(Mat image) {
        Mat floatImage = new Mat();
        image.convertTo(floatImage, CvType.CV_64F);

        int channels = image.channels();
        double[] samples = new double[(int) floatImage.total() * channels];
        floatImage.get(0, 0, samples);
        floatImage.release();

        byte[] bytes = new byte[samples.length];
        for (int i = 0; i < samples.length; i++) {
            bytes[i] = (byte) quantize(samples[i]);
        }

        Mat output = new Mat(image.rows(), image.cols(), CvType.makeType(CvType.CV_8U, channels));
        output.put(0, 0, bytes);
        return output;
    }

    static int quantize(double value) {
        if (Double.isNaN(value) || value <= 0) {
            return 0;
        }
        if (value >= 255) {
            return 255;
        }
        return (int) value;
    }
}
