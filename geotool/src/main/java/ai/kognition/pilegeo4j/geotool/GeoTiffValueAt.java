/*
 * Copyright 2022 Jim Carroll
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package ai.kognition.pilegeo4j.geotool;

import java.io.File;
import java.io.IOException;
import java.io.PrintStream;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ai.kognition.pilegeo4j.geotiff.GeoTiff;
import ai.kognition.pilegeo4j.geotiff.GeoTiffConfig;
import ai.kognition.pilegeo4j.geotiff.geometry.SimplePoint;
import ai.kognition.pilegeo4j.util.CommandLineParser;

/**
 * Prints the sample of a GeoTIFF at a model coordinate.
 */
public class GeoTiffValueAt {
    private static final Logger LOGGER = LoggerFactory.getLogger(GeoTiffValueAt.class);

    public static final String OUTSIDE = "outside";

    private String inputFilename;
    private double x;
    private double y;
    private int sample;

    public static void main(final String[] args) throws IOException {
        final GeoTiffValueAt valueAt = new GeoTiffValueAt();
        if(!valueAt.commandLine(args))
            System.exit(-1);

        valueAt.run(System.out);
    }

    static private void usage() {
        System.out.println("usage: java [javaargs] " + GeoTiffValueAt.class.getName() + " -i inputFilename -x modelX -y modelY [-s sample]");
    }

    boolean commandLine(final String[] args) {
        final CommandLineParser cl = new CommandLineParser(args);

        // see if we are asking for help
        if(cl.getProperty("help") != null || cl.getProperty("-help") != null) {
            usage();
            return false;
        }

        inputFilename = cl.getProperty("i");
        if(inputFilename == null || !cl.isSet("x") || !cl.isSet("y")) {
            usage();
            return false;
        }

        if(!new File(inputFilename).isFile()) {
            LOGGER.error("\"{}\" doesn't exist or isn't a file.", inputFilename);
            usage();
            return false;
        }

        try {
            x = cl.getDouble("x");
            y = cl.getDouble("y");
            sample = cl.getInt("s", 0);
        } catch(final IllegalArgumentException iae) {
            LOGGER.error(iae.getMessage());
            usage();
            return false;
        }

        return true;
    }

    void run(final PrintStream out) throws IOException {
        final GeoTiff tiff = GeoTiff.read(new File(inputFilename), GeoTiffConfig.load());
        if(sample < 0 || sample >= tiff.getNumSamples()) {
            out.println("sample " + sample + " is out of range, the image has " + tiff.getNumSamples() + " sample(s) per pixel");
            return;
        }

        final Optional<Number> value = tiff.getValueAt(new SimplePoint(x, y), sample);
        LOGGER.debug("Value at ({}, {}) sample {} is {}", x, y, sample, value);
        out.println(value.map(Object::toString).orElse(OUTSIDE));
    }
}
