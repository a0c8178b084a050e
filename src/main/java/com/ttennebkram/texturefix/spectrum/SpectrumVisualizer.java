package com.ttennebkram.texturefix.spectrum;

import org.opencv.core.*;

import java.util.ArrayList;
import java.util.List;

/**
 * Renders the log-magnitude spectrum of an image for debugging.
 * Not part of the filtering path.
 */
public class SpectrumVisualizer {

    private final SpectrumTransform transform;

    public SpectrumVisualizer() {
        this(new SpectrumTransform());
    }

    public SpectrumVisualizer(SpectrumTransform transform) {
        this.transform = transform;
    }

    /**
     * Multi-channel input is averaged to grayscale first.
     *
     * @param image input image (not modified)
     * @return single-channel CV_64F Mat of log(1 + |F|) normalized to [0, 255]
     */
    public Mat visualize(Mat image) {
        Mat gray = toGrayscale(image);
        Mat centered;
        try {
            centered = transform.forwardComplex(gray);
        } finally {
            gray.release();
        }

        List<Mat> planes = new ArrayList<>();
        Core.split(centered, planes);
        centered.release();

        Mat magnitude = new Mat();
        Core.magnitude(planes.get(0), planes.get(1), magnitude);
        for (Mat p : planes) p.release();

        // Log scale
        Mat logMag = new Mat();
        Core.add(magnitude, new Scalar(1), logMag);
        Core.log(logMag, logMag);
        magnitude.release();

        Core.normalize(logMag, logMag, 0, 255, Core.NORM_MINMAX);
        return logMag;
    }

    private Mat toGrayscale(Mat image) {
        if (image == null || image.empty() || image.channels() == 1) {
            Mat copy = new Mat();
            if (image != null) {
                image.convertTo(copy, CvType.CV_64F);
            }
            return copy;
        }

        List<Mat> channels = new ArrayList<>();
        Core.split(image, channels);
        Mat sum = Mat.zeros(image.rows(), image.cols(), CvType.CV_64F);
        Mat floatChannel = new Mat();
        for (Mat channel : channels) {
            channel.convertTo(floatChannel, CvType.CV_64F);
            Core.add(sum, floatChannel, sum);
            channel.release();
        }
        floatChannel.release();
        Core.multiply(sum, new Scalar(1.0 / channels.size()), sum);
        return sum;
    }
}
