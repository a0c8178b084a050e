package com.ttennebkram.texturefix.filter;

import com.ttennebkram.texturefix.config.FilterConfig;
import com.ttennebkram.texturefix.mask.MaskBuilder;
import com.ttennebkram.texturefix.mask.MaskBuilderRegistry;
import com.ttennebkram.texturefix.processing.ImageProcessor;
import org.opencv.core.Core;
import org.opencv.core.Mat;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Runs ChannelFilter over every channel of an image and merges the results.
 * Channels are filtered independently with identical parameters; one channel
 * never influences another's mask.
 *
 * With parallelism above 1 the channels are filtered on a fixed thread pool.
 * The output is the same as the sequential path.
 */
public class ImageFilterOrchestrator {

    private final ChannelFilter channelFilter;
    private final int parallelism;

    public ImageFilterOrchestrator() {
        this(new ChannelFilter(), 1);
    }

    public ImageFilterOrchestrator(ChannelFilter channelFilter, int parallelism) {
        this.channelFilter = channelFilter;
        this.parallelism = Math.max(1, parallelism);
    }

    /**
     * Filter with the builder registered under {@link FilterConfig#getPolicy()}.
     */
    public Mat filterImage(Mat image, FilterConfig config) {
        return filterImage(image, config, MaskBuilderRegistry.createBuilder(config.getPolicy()));
    }

    /**
     * @param image H x W x C image (not modified)
     * @return CV_64F image with the same shape and channel count, not clipped
     *         (caller must release)
     */
    public Mat filterImage(Mat image, FilterConfig config, MaskBuilder policy) {
        if (image == null || image.empty() || image.channels() == 1) {
            return channelFilter.filterChannel(image, config, policy);
        }

        List<Mat> channels = new ArrayList<>();
        Core.split(image, channels);

        try {
            List<Mat> filteredChannels = new ArrayList<>();
            try {
                if (parallelism > 1) {
                    filterInParallel(channels, config, policy, filteredChannels);
                } else {
                    for (int c = 0; c < channels.size(); c++) {
                        System.out.println("Processing channel " + (c + 1) + "/" + channels.size() + "...");
                        filteredChannels.add(channelFilter.filterChannel(channels.get(c), config, policy));
                    }
                }

                Mat output = new Mat();
                Core.merge(filteredChannels, output);
                return output;
            } finally {
                for (Mat m : filteredChannels) {
                    m.release();
                }
            }
        } finally {
            for (Mat m : channels) {
                m.release();
            }
        }
    }

    private void filterInParallel(List<Mat> channels, FilterConfig config, MaskBuilder policy,
                                  List<Mat> filteredChannels) {
        ExecutorService executor = Executors.newFixedThreadPool(Math.min(parallelism, channels.size()));
        try {
            List<Future<Mat>> futures = new ArrayList<>();
            for (Mat channel : channels) {
                futures.add(executor.submit(() -> channelFilter.filterChannel(channel, config, policy)));
            }
            // Collect in channel order so the merge keeps the layout
            RuntimeException failure = null;
            for (int c = 0; c < futures.size(); c++) {
                try {
                    Mat result = futures.get(c).get();
                    if (failure == null) {
                        filteredChannels.add(result);
                    } else {
                        result.release();
                    }
                } catch (ExecutionException e) {
                    if (failure == null) {
                        failure = channelFailure(c, e.getCause());
                    }
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    if (failure == null) {
                        failure = new IllegalStateException("Interrupted while filtering channel " + (c + 1), e);
                    }
                    // Channels still running are not waited for
                    break;
                }
            }
            if (failure != null) {
                throw failure;
            }
        } finally {
            executor.shutdownNow();
        }
    }

    private static RuntimeException channelFailure(int channel, Throwable cause) {
        if (cause instanceof RuntimeException) {
            return (RuntimeException) cause;
        }
        return new IllegalStateException("Channel " + (channel + 1) + " failed", cause);
    }

    /**
     * Wrap this orchestrator as an ImageProcessor with a fixed config.
     */
    public ImageProcessor createImageProcessor(FilterConfig config) {
        MaskBuilder policy = MaskBuilderRegistry.createBuilder(config.getPolicy());
        return input -> filterImage(input, config, policy);
    }

    public int getParallelism() {
        return parallelism;
    }
}
