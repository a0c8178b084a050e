package com.ttennebkram.texturefix.io;

import java.nio.file.Path;

/**
 * Default file names derived from the input path. Outputs land next to the input.
 */
public final class OutputPaths {

    private OutputPaths() {
    }

    /** {@code dir/name.png -> dir/name_fixed.png} */
    public static Path fixed(Path input) {
        return sibling(input, "_fixed", extension(input));
    }

    /** {@code dir/name.png -> dir/name_repeated.png} */
    public static Path repeated(Path input) {
        return sibling(input, "_repeated", extension(input));
    }

    public static Path spectrumBefore(Path input) {
        return sibling(input, "_fft_before", ".png");
    }

    public static Path spectrumAfter(Path input) {
        return sibling(input, "_fft_after", ".png");
    }

    static String stem(Path input) {
        String name = input.getFileName().toString();
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(0, dot) : name;
    }

    static String extension(Path input) {
        String name = input.getFileName().toString();
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(dot) : "";
    }

    private static Path sibling(Path input, String suffix, String extension) {
        String fileName = stem(input) + suffix + extension;
        Path parent = input.getParent();
        return parent == null ? Path.of(fileName) : parent.resolve(fileName);
    }
}
