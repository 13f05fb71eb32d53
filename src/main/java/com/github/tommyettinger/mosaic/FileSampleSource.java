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

import com.badlogic.gdx.files.FileHandle;
import com.badlogic.gdx.graphics.Pixmap;
import com.badlogic.gdx.utils.GdxRuntimeException;
import com.badlogic.gdx.utils.IntArray;

import java.util.Arrays;
import java.util.Comparator;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.ForkJoinPool;

/**
 * Loads tiles from a directory where each image file is named after its anchor, such as {@code samples/cd1c1d.jpg}.
 * Files are decoded with {@link Pixmap#Pixmap(FileHandle)} on an {@link Executor}, so anything libGDX can decode
 * works; JPEG and PNG are looked for by default.
 */
public class FileSampleSource implements SampleSource {
    private static final String[] EXTENSIONS = {"jpg", "jpeg", "png"};

    private final FileHandle directory;
    private final Executor executor;

    /**
     * Decodes on the common {@link ForkJoinPool}.
     * @param directory a directory holding files named like {@code rrggbb.jpg}
     */
    public FileSampleSource(FileHandle directory) {
        this(directory, ForkJoinPool.commonPool());
    }

    /**
     * @param directory a directory holding files named like {@code rrggbb.jpg}
     * @param executor runs the decoding work
     */
    public FileSampleSource(FileHandle directory, Executor executor) {
        this.directory = directory;
        this.executor = executor;
    }

    /**
     * Lists every anchor that has a file in the directory, sorted by file name so the order (and with it, how ties
     * are broken during matching) doesn't depend on the file system. Files whose names aren't six hex digits are
     * skipped.
     * @return the RGB888 anchors found, without repeats
     */
    public IntArray listAnchors() {
        if (!directory.isDirectory())
            throw new GdxRuntimeException("Sample directory not found: " + directory.path());
        FileHandle[] files = directory.list();
        Arrays.sort(files, Comparator.comparing(FileHandle::name));
        IntArray anchors = new IntArray(files.length);
        for (FileHandle file : files) {
            if (file.isDirectory() || !isImage(file))
                continue;
            int anchor = ColorSample.parseIdentifier(file.nameWithoutExtension());
            if (anchor >= 0 && !anchors.contains(anchor))
                anchors.add(anchor);
        }
        return anchors;
    }

    @Override
    public CompletableFuture<Pixmap> fetch(String identifier) {
        final FileHandle file = find(identifier);
        if (file == null)
            return CompletableFuture.failedFuture(
                    new GdxRuntimeException("No sample file for " + identifier + " in " + directory.path()));
        return CompletableFuture.supplyAsync(() -> new Pixmap(file), executor);
    }

    private FileHandle find(String identifier) {
        for (String extension : EXTENSIONS) {
            FileHandle file = directory.child(identifier + "." + extension);
            if (file.exists())
                return file;
            file = directory.child(identifier.toUpperCase() + "." + extension);
            if (file.exists())
                return file;
        }
        return null;
    }

    private static boolean isImage(FileHandle file) {
        String extension = file.extension().toLowerCase();
        for (String e : EXTENSIONS) {
            if (e.equals(extension))
                return true;
        }
        return false;
    }
}
