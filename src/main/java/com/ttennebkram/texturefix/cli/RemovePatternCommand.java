package com.ttennebkram.texturefix.cli;

import com.ttennebkram.texturefix.TextureFixLauncher;
import com.ttennebkram.texturefix.config.FilterConfig;
import com.ttennebkram.texturefix.filter.ChannelFilter;
import com.ttennebkram.texturefix.filter.ImageFilterOrchestrator;
import com.ttennebkram.texturefix.io.ImageQuantizer;
import com.ttennebkram.texturefix.io.OutputPaths;
import com.ttennebkram.texturefix.io.TextureImageIO;
import com.ttennebkram.texturefix.processing.ImageProcessor;
import com.ttennebkram.texturefix.spectrum.SpectrumVisualizer;
import org.opencv.core.Mat;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Loads a texture, removes periodic patterns and saves the result.
 */
public class RemovePatternCommand {

    private final SpectrumVisualizer visualizer = new SpectrumVisualizer();

    /**
     * @return process exit status
     */
    public int run(String[] args) {
        RemovePatternOptions options;
        FilterConfig config;
        try {
            options = RemovePatternOptions.parse(args);
            if (options.isHelp()) {
                System.out.println(RemovePatternOptions.usage());
                return TextureFixLauncher.EXIT_OK;
            }
            config = options.resolveConfig().validate();
        } catch (CommandLineException | IllegalArgumentException e) {
            System.err.println("[RemovePattern] " + e.getMessage());
            System.err.println();
            System.err.println(RemovePatternOptions.usage());
            return TextureFixLauncher.EXIT_USAGE;
        } catch (IOException e) {
            System.err.println("[RemovePattern] " + e.getMessage());
            return TextureFixLauncher.EXIT_FAILURE;
        }

        try {
            run(options, config);
            return TextureFixLauncher.EXIT_OK;
        } catch (IOException e) {
            System.err.println("[RemovePattern] " + e.getMessage());
            return TextureFixLauncher.EXIT_FAILURE;
        }
    }

    void run(RemovePatternOptions options, FilterConfig config) throws IOException {
        Path inputPath = options.getInputPath();
        Path outputPath = options.getOutputPath();

        System.out.println("Loading: " + inputPath);
        Mat image = TextureImageIO.load(inputPath.toString());
        try {
            System.out.println("Image shape: " + describeShape(image));

            if (options.isVisualizeFft()) {
                saveSpectrum(image, OutputPaths.spectrumBefore(inputPath));
            }

            System.out.println("Applying FFT-based pattern removal...");
            System.out.println("  Method: " + config.getPolicy());
            if ("lines".equals(config.getPolicy())) {
                System.out.println("  Line width: " + config.getLineWidth());
                System.out.println("  Attenuation: " + config.getAttenuation());
            } else {
                System.out.println("  Threshold percentile: " + config.getThresholdPercentile());
                System.out.println("  Notch radius: " + config.getNotchRadius());
            }
            System.out.println("  Protected center radius: " + config.getProtectCenter());

            ImageFilterOrchestrator orchestrator =
                new ImageFilterOrchestrator(new ChannelFilter(), options.getThreads());
            ImageProcessor processor = orchestrator.createImageProcessor(config);

            Mat filtered = processor.process(image);
            try {
                if (options.isVisualizeFft()) {
                    // Spectrum of what actually gets saved
                    Mat saved = ImageQuantizer.toEightBit(filtered);
                    try {
                        saveSpectrum(saved, OutputPaths.spectrumAfter(inputPath));
                    } finally {
                        saved.release();
                    }
                }
                TextureImageIO.save(filtered, outputPath.toString());
            } finally {
                filtered.release();
            }
        } finally {
            image.release();
        }
        System.out.println("Done!");
    }

    private void saveSpectrum(Mat image, Path path) throws IOException {
        Mat spectrum = visualizer.visualize(image);
        try {
            TextureImageIO.save(spectrum, path.toString());
            System.out.println("FFT visualization saved: " + path);
        } finally {
            spectrum.release();
        }
    }

    static String describeShape(Mat image) {
        if (image.channels() == 1) {
            return "(" + image.rows() + ", " + image.cols() + ")";
        }
        return "(" + image.rows() + ", " + image.cols() + ", " + image.channels() + ")";
    }
}
