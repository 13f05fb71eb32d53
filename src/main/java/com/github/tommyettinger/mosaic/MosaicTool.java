/*
 * Copyright (c) 2024  Tommy Ettinger
 *
 *  Licensed under the Apache License, Version 2.0 (the "License");
 *  you may not use this file except in compliance with the License.
 *  You may obtain a copy of the License at
 *
 *      http://www.apache.org/licenses/LICENSE-2.0
 *
 *  Unless required by applicable law or agreed to in writing, software
 *  distributed under the License is distributed on an "AS IS" BASIS,
 *  WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 *  See the License for the specific language governing permissions and
 *  limitations under the License.
 *
 *
 */

package com.github.tommyettinger.mosaic;

import com.badlogic.gdx.ApplicationAdapter;
import com.badlogic.gdx.Gdx;
import com.badlogic.gdx.backends.headless.HeadlessApplication;
import com.badlogic.gdx.backends.headless.HeadlessApplicationConfiguration;
import com.badlogic.gdx.files.FileHandle;
import com.badlogic.gdx.graphics.Pixmap;
import com.badlogic.gdx.graphics.PixmapIO;
import com.badlogic.gdx.utils.GdxRuntimeException;
import com.badlogic.gdx.utils.IntArray;

import java.util.concurrent.CompletionException;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Makes a mosaic from the command line, without opening a window:
 * <pre>
 * java com.github.tommyettinger.mosaic.MosaicTool photo.jpg [output.png] [samples] [colors]
 * </pre>
 * The samples directory holds one image per anchor, named by its six hex digits, like {@code samples/cd1c1d.jpg}.
 * The mosaic is written as a PNG; any pixels that couldn't be filled are transparent in it.
 */
public class MosaicTool extends ApplicationAdapter {
    private static final Logger LOGGER = Logger.getLogger(MosaicTool.class.getName());

    private final String[] args;

    public MosaicTool(String[] args) {
        this.args = args;
    }

    @Override
    public void create() {
        if (args.length < 1) {
            LOGGER.log(Level.SEVERE, "Usage: MosaicTool input [output.png] [samplesDir] [colors]");
            Gdx.app.exit();
            return;
        }
        FileHandle input = Gdx.files.local(args[0]);
        FileHandle output = Gdx.files.local(args.length > 1 ? args[1] : "output.png");
        FileHandle samples = Gdx.files.local(args.length > 2 ? args[2] : "samples");
        long startTime = System.currentTimeMillis();
        try {
            int colors = args.length > 3 ? Integer.parseInt(args[3]) : 256;
            MosaicResult result = process(input, samples, output, colors);
            LOGGER.log(Level.INFO, "Wrote " + output.path() + " in " + (System.currentTimeMillis() - startTime)
                    + " ms; " + result.getUnfilledCount() + " pixels unfilled");
            result.dispose();
        } catch (GdxRuntimeException | IllegalArgumentException e) {
            LOGGER.log(Level.SEVERE, "Could not make a mosaic from " + input.path(), e);
        }
        Gdx.app.exit();
    }

    /**
     * Reads {@code input}, builds a mosaic with {@link MosaicPipeline#standard(SampleLibrary, int)} using the tiles
     * in {@code samplesDir}, and writes it to {@code output} as a PNG. This waits for the mosaic to finish.
     * @param input a photo libGDX can decode
     * @param samplesDir a directory of tiles named like {@code rrggbb.jpg}
     * @param output where the PNG goes; overwritten if present
     * @param colors the most colors the quantized photo may have, between 2 and 256
     * @return the finished result, which the caller must dispose
     */
    public static MosaicResult process(FileHandle input, FileHandle samplesDir, FileHandle output, int colors) {
        FileSampleSource source = new FileSampleSource(samplesDir);
        IntArray anchors = source.listAnchors();
        LOGGER.log(Level.INFO, "Found " + anchors.size + " samples in " + samplesDir.path());
        SampleLibrary library = new SampleLibrary(source, anchors);
        Pixmap photo = new Pixmap(input);
        try {
            MosaicResult result = MosaicPipeline.standard(library, colors).process(photo).join();
            PixmapIO.writePNG(output, result.getPixmap());
            return result;
        } catch (CompletionException e) {
            throw e.getCause() instanceof GdxRuntimeException ? (GdxRuntimeException) e.getCause()
                    : new GdxRuntimeException("Mosaic synthesis failed", e.getCause());
        } finally {
            photo.dispose();
            library.dispose();
        }
    }

    public static void main(String[] args) {
        new HeadlessApplication(new MosaicTool(args), new HeadlessApplicationConfiguration());
    }
}
