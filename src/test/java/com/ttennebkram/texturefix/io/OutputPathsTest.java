package com.ttennebkram.texturefix.io;

import org.junit.jupiter.api.Test;

import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class OutputPathsTest {

    @Test
    void fixedKeepsDirectoryAndExtension() {
        assertEquals(Path.of("textures", "rock_fixed.png"), OutputPaths.fixed(Path.of("textures", "rock.png")));
    }

    @Test
    void repeatedUsesOnlyLastExtension() {
        assertEquals(Path.of("a", "moon.v2_repeated.jpg"), OutputPaths.repeated(Path.of("a", "moon.v2.jpg")));
    }

    @Test
    void spectrumDumpsAreAlwaysPng() {
        Path input = Path.of("in", "rock.jpg");

        assertEquals(Path.of("in", "rock_fft_before.png"), OutputPaths.spectrumBefore(input));
        assertEquals(Path.of("in", "rock_fft_after.png"), OutputPaths.spectrumAfter(input));
    }

    @Test
    void bareFileName() {
        assertEquals(Path.of("rock_fixed.tga"), OutputPaths.fixed(Path.of("rock.tga")));
        assertEquals(Path.of("noext_fixed"), OutputPaths.fixed(Path.of("noext")));
        assertEquals(Path.of(".hidden_fixed"), OutputPaths.fixed(Path.of(".hidden")));
    }
}
