package com.ttennebkram.texturefix.cli;

import com.ttennebkram.texturefix.config.FilterConfig;
import com.ttennebkram.texturefix.config.FilterConfigSerializer;
import com.ttennebkram.texturefix.io.OutputPaths;
import com.ttennebkram.texturefix.mask.MaskBuilderRegistry;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Options of the pattern removal command.
 * Filter flags override values from --config, which override the defaults.
 */
public class RemovePatternOptions {

    private String input;
    private String output;
    private String configFile;
    private boolean visualizeFft;
    private boolean help;
    private int threads = 1;

    // Null when not given on the command line
    private String method;
    private Double threshold;
    private Integer notchRadius;
    private Integer protectCenter;
    private Integer lineWidth;
    private Double attenuation;

    public static RemovePatternOptions parse(String[] args) throws CommandLineException {
        RemovePatternOptions options = new RemovePatternOptions();
        ArgumentReader reader = new ArgumentReader(args);

        while (reader.nextFlag()) {
            if (reader.is("--help", "-h")) {
                reader.rejectValue();
                options.help = true;
            } else if (reader.is("--input", "-i")) {
                options.input = reader.stringValue();
            } else if (reader.is("--output", "-o")) {
                options.output = reader.stringValue();
            } else if (reader.is("--config", "-c")) {
                options.configFile = reader.stringValue();
            } else if (reader.is("--threshold", "-t")) {
                options.threshold = reader.doubleValue();
            } else if (reader.is("--notch-radius", "-n")) {
                options.notchRadius = reader.intValue();
            } else if (reader.is("--protect-center", "-p")) {
                options.protectCenter = reader.intValue();
            } else if (reader.is("--method", "-m")) {
                String value = reader.stringValue();
                if (!MaskBuilderRegistry.hasPolicy(value)) {
                    throw new CommandLineException("Invalid method '" + value + "', choose from "
                        + MaskBuilderRegistry.getRegisteredPolicies());
                }
                options.method = value;
            } else if (reader.is("--line-width", "-l")) {
                options.lineWidth = reader.intValue();
            } else if (reader.is("--attenuation", "-a")) {
                options.attenuation = reader.doubleValue();
            } else if (reader.is("--visualize-fft", null)) {
                reader.rejectValue();
                options.visualizeFft = true;
            } else if (reader.is("--threads", null)) {
                options.threads = reader.intValue();
                if (options.threads < 1) {
                    throw new CommandLineException("--threads must be at least 1");
                }
            } else {
                throw new CommandLineException("Unknown option: " + reader.flag());
            }
        }

        if (!options.help && options.input == null) {
            throw new CommandLineException("Missing required option --input");
        }
        return options;
    }

    /**
     * Defaults, then the config file if given, then command-line flags.
     *
     * @throws IOException if the config file cannot be read
     */
    public FilterConfig resolveConfig() throws IOException {
        FilterConfig base = configFile != null ? FilterConfigSerializer.load(configFile) : FilterConfig.defaults();
        FilterConfig.Builder builder = base.toBuilder();
        if (method != null) builder.policy(method);
        if (threshold != null) builder.thresholdPercentile(threshold);
        if (notchRadius != null) builder.notchRadius(notchRadius);
        if (protectCenter != null) builder.protectCenter(protectCenter);
        if (lineWidth != null) builder.lineWidth(lineWidth);
        if (attenuation != null) builder.attenuation(attenuation);
        return builder.build();
    }

    public Path getInputPath() {
        return Path.of(input);
    }

    public Path getOutputPath() {
        return output != null ? Path.of(output) : OutputPaths.fixed(getInputPath());
    }

    public boolean isVisualizeFft() {
        return visualizeFft;
    }

    public boolean isHelp() {
        return help;
    }

    public int getThreads() {
        return threads;
    }

    public static String usage() {
        StringBuilder sb = new StringBuilder();
        sb.append("Remove repeating patterns from textures using FFT filtering\n\n");
        sb.append("Usage: texture-fix [remove] --input <file> [options]\n\n");
        sb.append("  -i, --input <file>          Input texture file path (required)\n");
        sb.append("  -o, --output <file>         Output file path (default: <input>_fixed.<ext>)\n");
        sb.append("  -c, --config <file>         JSON filter config; flags below override it\n");
        sb.append("  -m, --method <name>         Filtering method (default: ").append(FilterConfig.DEFAULT_POLICY).append(")\n");
        for (String policy : MaskBuilderRegistry.getRegisteredPolicies()) {
            sb.append("                                ").append(policy).append(": ")
                .append(MaskBuilderRegistry.getDescription(policy)).append("\n");
        }
        sb.append("  -t, --threshold <pct>       Percentile threshold for peak detection (default: ")
            .append(FilterConfig.DEFAULT_THRESHOLD_PERCENTILE).append(")\n");
        sb.append("  -n, --notch-radius <px>     Radius of notch filter around detected peaks (default: ")
            .append(FilterConfig.DEFAULT_NOTCH_RADIUS).append(")\n");
        sb.append("  -p, --protect-center <px>   Radius around center to protect (default: ")
            .append(FilterConfig.DEFAULT_PROTECT_CENTER).append(")\n");
        sb.append("  -l, --line-width <px>       Width of filter around center lines, 'lines' method (default: ")
            .append(FilterConfig.DEFAULT_LINE_WIDTH).append(")\n");
        sb.append("  -a, --attenuation <0..1>    Attenuation strength, 'lines' method (default: ")
            .append(FilterConfig.DEFAULT_ATTENUATION).append(")\n");
        sb.append("      --visualize-fft         Save FFT magnitude visualization (before and after)\n");
        sb.append("      --threads <n>           Filter channels on n threads (default: 1)\n");
        return sb.toString();
    }
}
