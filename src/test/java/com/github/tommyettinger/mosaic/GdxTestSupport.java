package com.github.tommyettinger.mosaic;

import com.badlogic.gdx.graphics.Pixmap;
import com.badlogic.gdx.utils.GdxNativesLoader;

/**
 * Loads the libGDX natives that Pixmap needs, and builds small Pixmaps for tests.
 */
final class GdxTestSupport {
    static {
        GdxNativesLoader.load();
    }

    private GdxTestSupport() {
    }

    static void loadNatives() {
        GdxNativesLoader.load();
    }

    static Pixmap solid(int width, int height, int rgba) {
        Pixmap pixmap = new Pixmap(width, height, Pixmap.Format.RGBA8888);
        pixmap.setBlending(Pixmap.Blending.None);
        pixmap.setColor(rgba);
        pixmap.fill();
        return pixmap;
    }

    /**
     * @param rgba row-major RGBA8888 colors; there must be exactly width * height of them
     */
    static Pixmap of(int width, int height, int... rgba) {
        if (rgba.length != width * height)
            throw new IllegalArgumentException("expected " + width * height + " colors, got " + rgba.length);
        return Pixels.write(rgba, width, height);
    }

    static int countOpaque(Pixmap pixmap) {
        int count = 0;
        for (int y = 0; y < pixmap.getHeight(); y++) {
            for (int x = 0; x < pixmap.getWidth(); x++) {
                if ((pixmap.getPixel(x, y) & 0xFF) == 0xFF)
                    count++;
            }
        }
        return count;
    }
}
