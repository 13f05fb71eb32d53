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

import com.badlogic.gdx.graphics.Pixmap;
import com.badlogic.gdx.utils.Disposable;

/**
 * A small reference photograph (the tile) along with the color it stands for (the anchor). Two samples are equal
 * when their anchors are equal; tile contents are not compared.
 * <br>
 * A ColorSample owns its tile Pixmap, and disposing the sample disposes the tile.
 */
public class ColorSample implements Disposable {
    private final int anchor;
    private final Pixmap tile;

    /**
     * @param anchor an RGB888 color, {@code 0xRRGGBB}; any bits above the low 24 are dropped
     * @param tile a non-null Pixmap with non-zero size; this sample takes ownership of it
     */
    public ColorSample(int anchor, Pixmap tile) {
        if (tile == null)
            throw new IllegalArgumentException("tile cannot be null");
        if (tile.getWidth() <= 0 || tile.getHeight() <= 0)
            throw new InvalidImageDimensionsException(tile.getWidth(), tile.getHeight());
        this.anchor = anchor & 0xFFFFFF;
        this.tile = tile;
    }

    public int getAnchor() {
        return anchor;
    }

    public Pixmap getTile() {
        return tile;
    }

    /**
     * Gets the tile's pixel at a position that repeats infinitely in both directions, so any int coordinates are
     * valid, negative ones included.
     * @param x any x position
     * @param y any y position
     * @return the RGBA8888 tile color at x and y, wrapped into the tile's bounds
     */
    public int getWrappedPixel(int x, int y) {
        return tile.getPixel(Math.floorMod(x, tile.getWidth()), Math.floorMod(y, tile.getHeight()));
    }

    /**
     * @return the six-hex-digit identifier of this sample's anchor, such as {@code "cd1c1d"}
     */
    public String getIdentifier() {
        return toIdentifier(anchor);
    }

    /**
     * Converts an RGB888 anchor to the lowercase six-hex-digit form used to name sample files.
     * @param anchor an RGB888 color
     * @return a String like {@code "ff8000"}
     */
    public static String toIdentifier(int anchor) {
        String hex = Integer.toHexString(anchor & 0xFFFFFF);
        return "000000".substring(hex.length()) + hex;
    }

    /**
     * Reads an identifier written by {@link #toIdentifier(int)}; case does not matter.
     * @param identifier exactly six hex digits
     * @return the RGB888 anchor, or -1 if {@code identifier} is not six hex digits
     */
    public static int parseIdentifier(String identifier) {
        if (identifier == null || identifier.length() != 6)
            return -1;
        int anchor = 0;
        for (int i = 0; i < 6; i++) {
            int digit = Character.digit(identifier.charAt(i), 16);
            if (digit < 0)
                return -1;
            anchor = anchor << 4 | digit;
        }
        return anchor;
    }

    @Override
    public void dispose() {
        tile.dispose();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return anchor == ((ColorSample) o).anchor;
    }

    @Override
    public int hashCode() {
        return anchor;
    }

    @Override
    public String toString() {
        return "ColorSample{" +
                "anchor=" + getIdentifier() +
                ", tile=" + tile.getWidth() + "x" + tile.getHeight() +
                '}';
    }
}
