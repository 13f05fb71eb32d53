package com.github.tommyettinger.mosaic;

import com.badlogic.gdx.files.FileHandle;
import com.badlogic.gdx.graphics.Pixmap;
import com.badlogic.gdx.graphics.PixmapIO;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.File;

import static org.junit.jupiter.api.Assertions.*;

class MosaicPipelineTest {
    private static final int RED = 0xC81E1EFF, BLUE = 0x1E1EC8FF;

    @TempDir
    File tempDir;

    @BeforeAll
    static void loadNatives() {
        GdxTestSupport.loadNatives();
    }

    private static Pixmap twoBlocks(int width, int height) {
        int[] pixels = new int[width * height];
        for (int y = 0, i = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                pixels[i++] = x < width / 2 ? RED : BLUE;
            }
        }
        return GdxTestSupport.of(width, height, pixels);
    }

    @Test
    void pipelineWithoutFiltersShouldMatchPlainSynthesis() {
        SampleLibrary library = SampleLibrary.of(
                new ColorSample(0xCD1C1D, GdxTestSupport.solid(1, 1, 0x111111FF)),
                new ColorSample(0x1E1EC8, GdxTestSupport.solid(1, 1, 0x222222FF)));
        Pixmap photo = twoBlocks(6, 4);
        MosaicResult result = new MosaicPipeline(new MosaicSynthesizer(library)).process(photo).join();
        assertEquals(2, result.getRegions().size);
        assertEquals(0x111111FF, result.getPixmap().getPixel(0, 0));
        assertEquals(0x222222FF, result.getPixmap().getPixel(5, 3));
        // the photo still belongs to the caller
        assertEquals(RED, photo.getPixel(0, 0));
        result.dispose();
        photo.dispose();
        library.dispose();
    }

    @Test
    void standardPipelineShouldFillEverything() {
        SampleLibrary library = SampleLibrary.of(
                new ColorSample(0xCD1C1D, GdxTestSupport.solid(2, 2, 0x111111FF)),
                new ColorSample(0x1E1EC8, GdxTestSupport.solid(2, 2, 0x222222FF)));
        Pixmap photo = twoBlocks(24, 16);
        MosaicPipeline pipeline = MosaicPipeline.standard(library, 32);
        assertEquals(3, pipeline.getFilters().size);
        MosaicResult result = pipeline.process(photo).join();
        assertTrue(result.isComplete());
        assertEquals(24, result.getWidth());
        assertEquals(16, result.getHeight());
        assertEquals(0x111111FF, result.getPixmap().getPixel(0, 0));
        assertEquals(0x222222FF, result.getPixmap().getPixel(23, 15));
        result.dispose();
        photo.dispose();
        library.dispose();
    }

    @Test
    void toolShouldWriteMosaicPng() {
        FileHandle dir = new FileHandle(tempDir);
        FileHandle samples = dir.child("samples");
        samples.mkdirs();
        FileSampleSourceTest.writeTile(samples.child("cd1c1d.png"), 2, 2, 0x101010FF);
        FileSampleSourceTest.writeTile(samples.child("1e1ec8.png"), 2, 2, 0x202020FF);
        Pixmap photo = twoBlocks(20, 10);
        FileHandle input = dir.child("photo.png");
        PixmapIO.writePNG(input, photo);
        photo.dispose();
        FileHandle output = dir.child("output.png");

        MosaicResult result = MosaicTool.process(input, samples, output, 16);
        assertTrue(result.isComplete());
        result.dispose();

        assertTrue(output.exists());
        Pixmap written = new Pixmap(output);
        assertEquals(20, written.getWidth());
        assertEquals(10, written.getHeight());
        assertEquals(0x101010FF, written.getPixel(0, 0));
        assertEquals(0x202020FF, written.getPixel(19, 9));
        written.dispose();
    }
}
