package com.ttennebkram.texturefix;

import com.ttennebkram.texturefix.cli.RemovePatternCommand;
import com.ttennebkram.texturefix.cli.TileTextureCommand;

import java.util.Arrays;

/**
 * Command-line entry point.
 *
 * <pre>
 *   texture-fix [remove] --input brick.png --method lines
 *   texture-fix tile --input brick_fixed.png --tiles-x 3
 * </pre>
 */
public class TextureFixLauncher {

    public static final int EXIT_OK = 0;
    public static final int EXIT_FAILURE = 1;
    public static final int EXIT_USAGE = 2;

    public static void main(String[] args) {
        // Load OpenCV native library
        nu.pattern.OpenCV.loadLocally();

        System.exit(run(args));
    }

    /**
     * Dispatch to a subcommand. Expects OpenCV to be loaded.
     *
     * @return process exit status
     */
    public static int run(String[] args) {
        if (args.length > 0 && "tile".equals(args[0])) {
            return new TileTextureCommand().run(Arrays.copyOfRange(args, 1, args.length));
        }
        if (args.length > 0 && "remove".equals(args[0])) {
            return new RemovePatternCommand().run(Arrays.copyOfRange(args, 1, args.length));
        }
        return new RemovePatternCommand().run(args);
    }
}
