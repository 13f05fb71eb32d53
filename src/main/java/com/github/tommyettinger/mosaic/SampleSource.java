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

import java.util.concurrent.CompletableFuture;

/**
 * Somewhere tile images can be fetched from and decoded, such as a directory of files or a web server.
 * <br>
 * {@link SampleLibrary} calls this at most once per anchor for as long as it lives, so implementations don't need
 * their own caching.
 */
public interface SampleSource {
    /**
     * Starts fetching and decoding the tile for one anchor. This should return quickly; the work itself belongs on
     * another thread or in a callback. A failure should complete the future exceptionally rather than throw.
     * @param identifier the anchor as six lowercase hex digits, as made by {@link ColorSample#toIdentifier(int)}
     * @return a future that completes with a newly-allocated Pixmap the caller will own
     */
    CompletableFuture<Pixmap> fetch(String identifier);
}
