package com.ttennebkram.texturefix.filter;

import com.ttennebkram.texturefix.config.FilterConfig;
import com.ttennebkram.texturefix.mask.MaskBuilder;
import com.ttennebkram.texturefix.mask.PeakNotchMaskBuilder;
import com.ttennebkram.texturefix.processing.ImageProcessor;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.opencv.core.Core;
import org.opencv.core.CvType;
import org.opencv.core.Mat;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class ImageFilterOrchestratorTest {

    private static final FilterConfig PEAKS = FilterConfig.builder()
        .thresholdPercentile(95).notchRadius(2).protectCenter(3).build();
    private static final FilterConfig LINES = FilterConfig.builder()
        .policy("lines").lineWidth(1).attenuation(0.9).protectCenter(2).build();

    @BeforeAll
    static void loadOpenCv() {
        nu.pattern.OpenCV.loadLocally();
    }

    private static Mat randomChannel(int rows, int cols, long seed) {
        Random random = new Random(seed);
        double[] data = new double[rows * cols];
        for (int i = 0; i < data.length; i++) {
            data[i] = random.nextInt(256);
        }
        Mat mat = new Mat(rows, cols, CvType.CV_64F);
        mat.put(0, 0, data);
        return mat;
    }

    private static Mat colorImage(int rows, int cols, int channels) {
        List<Mat> planes = new ArrayList<>();
        for (int c = 0; c < channels; c++) {
            planes.add(randomChannel(rows, cols, 100 + c));
        }
        Mat image = new Mat();
        Core.merge(planes, image);
        return image;
    }

    @Test
    void grayscaleShapeIsPreserved() {
        Mat gray = randomChannel(12, 18, 1);

        Mat output = new ImageFilterOrchestrator().filterImage(gray, PEAKS);

        assertEquals(12, output.rows());
        assertEquals(18, output.cols());
        assertEquals(1, output.channels());
    }

    @Test
    void colorShapeIsPreserved() {
        for (int channels : new int[]{3, 4}) {
            Mat color = colorImage(9, 14, channels);

            Mat output = new ImageFilterOrchestrator().filterImage(color, LINES);

            assertEquals(9, output.rows());
            assertEquals(14, output.cols());
            assertEquals(channels, output.channels());
            assertEquals(CvType.CV_64F, output.depth());
        }
    }

    @Test
    void channelsAreFilteredIndependently() {
        Mat color = colorImage(16, 16, 3);
        ChannelFilter channelFilter = new ChannelFilter();

        Mat output = new ImageFilterOrchestrator(channelFilter, 1)
            .filterImage(color, PEAKS, new PeakNotchMaskBuilder());

        for (int c = 0; c < 3; c++) {
            Mat input = new Mat();
            Core.extractChannel(color, input, c);
            Mat alone = channelFilter.filterChannel(input, PEAKS, new PeakNotchMaskBuilder());
            Mat fromImage = new Mat();
            Core.extractChannel(output, fromImage, c);

            assertEquals(0.0, Core.norm(alone, fromImage, Core.NORM_INF), 1e-9, "channel " + c);
        }
    }

    @Test
    void parallelMatchesSequential() {
        Mat color = colorImage(20, 24, 4);

        Mat sequential = new ImageFilterOrchestrator(new ChannelFilter(), 1).filterImage(color, PEAKS);
        Mat parallel = new ImageFilterOrchestrator(new ChannelFilter(), 4).filterImage(color, PEAKS);

        assertEquals(0.0, Core.norm(sequential, parallel, Core.NORM_INF), 1e-12);
    }

    @Test
    void imageProcessorUsesConfiguredPolicy() {
        Mat color = colorImage(10, 10, 3);
        ImageFilterOrchestrator orchestrator = new ImageFilterOrchestrator();

        ImageProcessor processor = orchestrator.createImageProcessor(LINES);
        Mat viaProcessor = processor.process(color);
        Mat direct = orchestrator.filterImage(color, LINES);

        assertEquals(0.0, Core.norm(viaProcessor, direct, Core.NORM_INF), 1e-12);
    }

    @Test
    void inputIsNotModified() {
        Mat color = colorImage(8, 8, 3);
        Mat copy = color.clone();

        new ImageFilterOrchestrator().filterImage(color, PEAKS);

        assertEquals(0.0, Core.norm(color, copy, Core.NORM_INF));
    }

    @Test
    void parallelismIsAtLeastOne() {
        assertEquals(1, new ImageFilterOrchestrator(new ChannelFilter(), 0).getParallelism());
    }

    @Test
    void unknownPolicyIsRejected() {
        FilterConfig config = FilterConfig.builder().policy("median").build();
        Mat gray = randomChannel(4, 4, 2);

        assertThrows(IllegalArgumentException.class,
            () -> new ImageFilterOrchestrator().filterImage(gray, config));
    }

    @Test
    void failedChannelReleasesTheOthers() {
        List<Mat> produced = Collections.synchronizedList(new ArrayList<>());
        AtomicInteger calls = new AtomicInteger();
        ChannelFilter failingSecondCall = new ChannelFilter() {
            @Override
            public Mat filterChannel(Mat channel, FilterConfig config, MaskBuilder policy) {
                if (calls.incrementAndGet() == 2) {
                    throw new IllegalStateException("channel failed");
                }
                Mat result = super.filterChannel(channel, config, policy);
                produced.add(result);
                return result;
            }
        };
        Mat color = colorImage(8, 8, 4);

        IllegalStateException e = assertThrows(IllegalStateException.class,
            () -> new ImageFilterOrchestrator(failingSecondCall, 4).filterImage(color, PEAKS));

        assertEquals("channel failed", e.getMessage());
        assertEquals(3, produced.size());
        for (Mat m : produced) {
            assertTrue(m.empty());
        }
    }
}
