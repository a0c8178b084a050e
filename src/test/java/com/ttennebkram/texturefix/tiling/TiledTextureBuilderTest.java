package com.ttennebkram.texturefix.tiling;

import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.opencv.core.CvType;
import org.opencv.core.Mat;

import static org.junit.jupiter.api.Assertions.*;

class TiledTextureBuilderTest {

    private final TiledTextureBuilder builder = new TiledTextureBuilder();

    @BeforeAll
    static void loadOpenCv() {
        nu.pattern.OpenCV.loadLocally();
    }

    /**
     * 2 x 3 texture:
     * <pre>
     * 1 2 3
     * 4 5 6
     * </pre>
     */
    private static Mat texture() {
        Mat mat = new Mat(2, 3, CvType.CV_64F);
        mat.put(0, 0, 1, 2, 3, 4, 5, 6);
        return mat;
    }

    private static double at(Mat mat, int row, int col) {
        return mat.get(row, col)[0];
    }

    @Test
    void mirroredTilesFormCheckerboard() {
        Mat tiled = builder.tile(texture(), 2, 2, true);

        assertEquals(4, tiled.rows());
        assertEquals(6, tiled.cols());
        // Top-left tile is the original
        assertEquals(1, at(tiled, 0, 0));
        assertEquals(6, at(tiled, 1, 2));
        // Top-right tile is flipped horizontally
        assertEquals(3, at(tiled, 0, 3));
        assertEquals(1, at(tiled, 0, 5));
        // Bottom-left tile is flipped vertically
        assertEquals(4, at(tiled, 2, 0));
        assertEquals(1, at(tiled, 3, 0));
        // Bottom-right tile is flipped both ways
        assertEquals(6, at(tiled, 2, 3));
        assertEquals(1, at(tiled, 3, 5));
    }

    @Test
    void plainRepeatWithoutMirroring() {
        Mat tiled = builder.tile(texture(), 3, 2, false);

        assertEquals(4, tiled.rows());
        assertEquals(9, tiled.cols());
        for (int ty = 0; ty < 2; ty++) {
            for (int tx = 0; tx < 3; tx++) {
                assertEquals(1, at(tiled, ty * 2, tx * 3));
                assertEquals(6, at(tiled, ty * 2 + 1, tx * 3 + 2));
            }
        }
    }

    @Test
    void keepsTypeAndChannels() {
        Mat color = new Mat(3, 3, CvType.CV_8UC4);

        Mat tiled = builder.tile(color, 4, 4, true);

        assertEquals(CvType.CV_8UC4, tiled.type());
        assertEquals(12, tiled.rows());
        assertEquals(12, tiled.cols());
    }

    @Test
    void rejectsNonPositiveTileCounts() {
        assertThrows(IllegalArgumentException.class, () -> builder.tile(texture(), 0, 2, true));
        assertThrows(IllegalArgumentException.class, () -> builder.tile(texture(), 2, -1, false));
    }

    @Test
    void rejectsEmptyImage() {
        assertThrows(IllegalArgumentException.class, () -> builder.tile(new Mat(), 2, 2, true));
    }
}
