package com.github.tommyettinger.mosaic;

import com.badlogic.gdx.graphics.Pixmap;
import com.badlogic.gdx.utils.IntSet;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

class PixmapFilterTest {

    @BeforeAll
    static void loadNatives() {
        GdxTestSupport.loadNatives();
    }

    private static IntSet distinctColors(Pixmap pixmap) {
        IntSet colors = new IntSet();
        for (int y = 0; y < pixmap.getHeight(); y++) {
            for (int x = 0; x < pixmap.getWidth(); x++) {
                colors.add(pixmap.getPixel(x, y));
            }
        }
        return colors;
    }

    @Test
    void blurShouldLeaveFlatImagesAlone() {
        Pixmap flat = GdxTestSupport.solid(9, 7, 0x336699FF);
        Pixmap blurred = new GaussianBlur().apply(flat);
        assertEquals(9, blurred.getWidth());
        assertEquals(7, blurred.getHeight());
        for (int y = 0; y < 7; y++) {
            for (int x = 0; x < 9; x++) {
                assertEquals(0x336699FF, blurred.getPixel(x, y));
            }
        }
        blurred.dispose();
        flat.dispose();
    }

    @Test
    void blurShouldSoftenEdges() {
        Pixmap edge = GdxTestSupport.of(4, 1, 0x000000FF, 0x000000FF, 0xFFFFFFFF, 0xFFFFFFFF);
        Pixmap blurred = new GaussianBlur(1f).apply(edge);
        int left = blurred.getPixel(1, 0) >>> 24, right = blurred.getPixel(2, 0) >>> 24;
        assertTrue(left > 0 && left < 128, "left of edge was " + left);
        assertTrue(right > 128 && right < 255, "right of edge was " + right);
        assertEquals(0xFF, blurred.getPixel(1, 0) & 0xFF);
        blurred.dispose();
        edge.dispose();
    }

    @Test
    void blurShouldRejectNonPositiveSigma() {
        assertThrows(IllegalArgumentException.class, () -> new GaussianBlur(0f));
    }

    @Test
    void medianShouldRemoveSpeckles() {
        int g = 0x808080FF;
        Pixmap speckled = GdxTestSupport.of(3, 3,
                g, g, g,
                g, 0xFFFFFFFF, g,
                g, g, g);
        Pixmap cleaned = new MedianFilter(1, 1).apply(speckled);
        assertEquals(g, cleaned.getPixel(1, 1));
        assertEquals(g, cleaned.getPixel(0, 0));
        // the input is untouched
        assertEquals(0xFFFFFFFF, speckled.getPixel(1, 1));
        cleaned.dispose();
        speckled.dispose();
    }

    @Test
    void medianShouldKeepStraightEdges() {
        int b = 0x000000FF, w = 0xFFFFFFFF;
        Pixmap edge = GdxTestSupport.of(4, 3,
                b, b, w, w,
                b, b, w, w,
                b, b, w, w);
        Pixmap filtered = new MedianFilter().apply(edge);
        for (int y = 0; y < 3; y++) {
            for (int x = 0; x < 4; x++) {
                assertEquals(edge.getPixel(x, y), filtered.getPixel(x, y), "at " + x + "," + y);
            }
        }
        filtered.dispose();
        edge.dispose();
    }

    @Test
    void quantizerShouldLimitColors() {
        Random random = new Random(7L);
        int w = 32, h = 32;
        int[] pixels = new int[w * h];
        for (int i = 0; i < pixels.length; i++) {
            pixels[i] = random.nextInt() | 0xFF;
        }
        Pixmap noisy = GdxTestSupport.of(w, h, pixels);
        Pixmap reduced = new PaletteQuantizer(16).apply(noisy);
        assertEquals(w, reduced.getWidth());
        assertEquals(h, reduced.getHeight());
        assertTrue(distinctColors(reduced).size <= 16, "had " + distinctColors(reduced).size + " colors");
        reduced.dispose();
        noisy.dispose();
    }

    @Test
    void quantizerShouldKeepDistinctRegionsApart() {
        int r = 0xC81E1EFF, b = 0x1E1EC8FF;
        Pixmap twoTone = GdxTestSupport.of(4, 2,
                r, r, b, b,
                r, r, b, b);
        Pixmap reduced = new PaletteQuantizer().apply(twoTone);
        assertEquals(reduced.getPixel(0, 0), reduced.getPixel(1, 1));
        assertEquals(reduced.getPixel(2, 0), reduced.getPixel(3, 1));
        assertNotEquals(reduced.getPixel(0, 0), reduced.getPixel(3, 0));
        reduced.dispose();
        twoTone.dispose();
    }

    @Test
    void quantizerShouldRejectBadLimits() {
        assertThrows(IllegalArgumentException.class, () -> new PaletteQuantizer(1));
        assertThrows(IllegalArgumentException.class, () -> new PaletteQuantizer(257));
    }

    @Test
    void quantizerShouldCheckLimitBeforeBuildingItsReducer() {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class, () -> new PaletteQuantizer(0, 100));
        assertTrue(e.getMessage().contains("0"), e.getMessage());
        assertEquals(256, new PaletteQuantizer().getLimit());
    }
}
