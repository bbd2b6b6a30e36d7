/*
 *    Copyright 2022 University of Michigan
 *
 *    Licensed under the Apache License, Version 2.0 (the "License");
 *    you may not use this file except in compliance with the License.
 *    You may obtain a copy of the License at
 *
 *        http://www.apache.org/licenses/LICENSE-2.0
 *
 *    Unless required by applicable law or agreed to in writing, software
 *    distributed under the License is distributed on an "AS IS" BASIS,
 *    WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 *    See the License for the specific language governing permissions and
 *    limitations under the License.
 */

package edu.umich.andykong.shiftlocalizer.utils;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import edu.umich.andykong.shiftlocalizer.localization.FragmentTolerance;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads the fragment tolerance out of a Sage search configuration.
 */
public class SageConfig {

    private SageConfig() {
    }

    public static FragmentTolerance readFragmentTolerance(Path path) throws IOException {
        try (Reader in = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            return readFragmentTolerance(in);
        }
    }

    public static FragmentTolerance readFragmentTolerance(Reader in) throws IOException {
        JsonElement root;
        try {
            root = JsonParser.parseReader(in);
        } catch (JsonParseException e) {
            throw new IOException("Malformed Sage configuration: " + e.getMessage(), e);
        }
        if (!root.isJsonObject())
            throw new IOException("Sage configuration is not a JSON object");
        JsonObject conf = root.getAsJsonObject();
        if (!conf.has("fragment_tol") || !conf.get("fragment_tol").isJsonObject())
            throw new IOException("Sage configuration has no fragment_tol section");
        JsonObject fragTol = conf.getAsJsonObject("fragment_tol");
        if (!fragTol.has("ppm")) {
            if (fragTol.has("da"))
                throw new IOException("Only ppm fragment tolerances are supported, found fragment_tol.da");
            throw new IOException("Sage configuration has no fragment_tol.ppm");
        }
        JsonElement ppm = fragTol.get("ppm");
        if (!ppm.isJsonArray() || ppm.getAsJsonArray().size() != 2)
            throw new IOException("fragment_tol.ppm must be a [low, high] pair");
        JsonArray bounds = ppm.getAsJsonArray();
        try {
            return new FragmentTolerance(bounds.get(0).getAsDouble(), bounds.get(1).getAsDouble());
        } catch (IllegalArgumentException | UnsupportedOperationException | IllegalStateException e) {
            throw new IOException("fragment_tol.ppm must hold two numbers, low <= high, got " + bounds, e);
        }
    }
}
