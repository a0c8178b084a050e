package com.ttennebkram.texturefix.cli;

import com.ttennebkram.texturefix.TextureFixLauncher;
import com.ttennebkram.texturefix.io.OutputPaths;
import com.ttennebkram.texturefix.io.TextureImageIO;
import com.ttennebkram.texturefix.tiling.TiledTextureBuilder;
import org.opencv.core.Mat;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Writes a tiled (optionally mirrored) copy of a texture to check how it repeats.
 */
public class TileTextureCommand {

    private String input;
    private String output;
    private int tilesX = TiledTextureBuilder.DEFAULT_TILES;
    private int tilesY = TiledTextureBuilder.DEFAULT_TILES;
    private boolean mirror = true;
    private boolean help;

    void parse(String[] args) throws CommandLineException {
        ArgumentReader reader = new ArgumentReader(args);
        while (reader.nextFlag()) {
            if (reader.is("--help", "-h")) {
                reader.rejectValue();
                help = true;
            } else if (reader.is("--input", "-i")) {
                input = reader.stringValue();
            } else if (reader.is("--output", "-o")) {
                output = reader.stringValue();
            } else if (reader.is("--tiles-x", "-x")) {
                tilesX = reader.intValue();
            } else if (reader.is("--tiles-y", "-y")) {
                tilesY = reader.intValue();
            } else if (reader.is("--no-mirror", null)) {
                reader.rejectValue();
                mirror = false;
            } else {
                throw new CommandLineException("Unknown option: " + reader.flag());
            }
        }
        if (help) {
            return;
        }
        if (input == null) {
            throw new CommandLineException("Missing required option --input");
        }
        if (tilesX < 1 || tilesY < 1) {
            throw new CommandLineException("Tile counts must be at least 1");
        }
    }

    /**
     * @return process exit status
     */
    public int run(String[] args) {
        try {
            parse(args);
        } catch (CommandLineException e) {
            System.err.println("[TileTexture] " + e.getMessage());
            System.err.println();
            System.err.println(usage());
            return TextureFixLauncher.EXIT_USAGE;
        }
        if (help) {
            System.out.println(usage());
            return TextureFixLauncher.EXIT_OK;
        }

        try {
            Path inputPath = Path.of(input);
            Path outputPath = output != null ? Path.of(output) : OutputPaths.repeated(inputPath);

            System.out.println("Loading: " + inputPath);
            Mat image = TextureImageIO.load(inputPath.toString());
            try {
                System.out.println("Image shape: " + RemovePatternCommand.describeShape(image));
                System.out.println("Creating " + tilesX + "x" + tilesY + " tiled version...");
                System.out.println("Mirroring: " + mirror);

                Mat tiled = new TiledTextureBuilder().tile(image, tilesX, tilesY, mirror);
                try {
                    System.out.println("Result shape: " + RemovePatternCommand.describeShape(tiled));
                    TextureImageIO.save(tiled, outputPath.toString());
                } finally {
                    tiled.release();
                }
            } finally {
                image.release();
            }
            System.out.println("Done!");
            return TextureFixLauncher.EXIT_OK;
        } catch (IOException e) {
            System.err.println("[TileTexture] " + e.getMessage());
            return TextureFixLauncher.EXIT_FAILURE;
        }
    }

    public static String usage() {
        return "Create a tiled version of a texture with optional mirroring\n\n"
            + "Usage: texture-fix tile --input <file> [options]\n\n"
            + "  -i, --input <file>     Input texture file path (required)\n"
            + "  -o, --output <file>    Output file path (default: <input>_repeated.<ext>)\n"
            + "  -x, --tiles-x <n>      Number of tiles horizontally (default: 4)\n"
            + "  -y, --tiles-y <n>      Number of tiles vertically (default: 4)\n"
            + "      --no-mirror        Disable mirroring (just repeat the same tile)\n";
    }

    int getTilesX() {
        return tilesX;
    }

    int getTilesY() {
        return tilesY;
    }

    boolean isMirror() {
        return mirror;
    }
}
