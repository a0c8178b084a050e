package com.ttennebkram.texturefix.tiling;

import org.opencv.core.Core;
import org.opencv.core.Mat;
import org.opencv.core.Rect;

/**
 * Repeats a texture on a grid to preview how it tiles.
 * With mirroring on, odd columns are flipped horizontally and odd rows
 * vertically (checkerboard), which hides the seams a plain repeat shows.
 */
public class TiledTextureBuilder {

    public static final int DEFAULT_TILES = 4;

    /**
     * @param image texture (not modified)
     * @return (rows * tilesY) x (cols * tilesX) Mat of the same type (caller must release)
     */
    public Mat tile(Mat image, int tilesX, int tilesY, boolean mirror) {
        if (tilesX <= 0 || tilesY <= 0) {
            throw new IllegalArgumentException("tile counts must be positive, got " + tilesX + "x" + tilesY);
        }
        if (image == null || image.empty()) {
            throw new IllegalArgumentException("invalid input shape: empty image");
        }

        int h = image.rows();
        int w = image.cols();
        Mat result = new Mat(h * tilesY, w * tilesX, image.type());

        Mat flippedH = null;
        Mat flippedV = null;
        Mat flippedBoth = null;
        if (mirror) {
            flippedH = new Mat();
            flippedV = new Mat();
            flippedBoth = new Mat();
            Core.flip(image, flippedH, 1);
            Core.flip(image, flippedV, 0);
            Core.flip(image, flippedBoth, -1);
        }

        try {
            for (int ty = 0; ty < tilesY; ty++) {
                for (int tx = 0; tx < tilesX; tx++) {
                    boolean mirrorH = mirror && tx % 2 == 1;
                    boolean mirrorV = mirror && ty % 2 == 1;

                    Mat tile;
                    if (mirrorH && mirrorV) {
                        tile = flippedBoth;
                    } else if (mirrorH) {
                        tile = flippedH;
                    } else if (mirrorV) {
                        tile = flippedV;
                    } else {
                        tile = image;
                    }

                    Mat target = result.submat(new Rect(tx * w, ty * h, w, h));
                    tile.copyTo(target);
                    target.release();
                }
            }
        } finally {
            if (mirror) {
                flippedH.release();
                flippedV.release();
                flippedBoth.release();
            }
        }
        return result;
    }
}
