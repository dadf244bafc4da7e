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
import java.util.Map;

import org.apache.commons.io.FilenameUtils;
import org.locationtech.jts.geom.Envelope;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ai.kognition.pilegeo4j.geotiff.GeoTiff;
import ai.kognition.pilegeo4j.geotiff.GeoTiffConfig;
import ai.kognition.pilegeo4j.geotiff.geokey.GeoKey;
import ai.kognition.pilegeo4j.geotiff.geokey.GeoKeyDirectory;
import ai.kognition.pilegeo4j.util.CommandLineParser;
import ai.kognition.pilegeo4j.util.Timer;

/**
 * Prints the georeferencing metadata of a GeoTIFF.
 */
public class GeoTiffInfo {
    private static final Logger LOGGER = LoggerFactory.getLogger(GeoTiffInfo.class);

    private String inputFilename;

    public static void main(final String[] args) throws IOException {
        final GeoTiffInfo info = new GeoTiffInfo();
        if(!info.commandLine(args))
            System.exit(-1);

        info.run(System.out);
    }

    static private void usage() {
        System.out.println("usage: java [javaargs] " + GeoTiffInfo.class.getName() + " -i inputFilename");
    }

    boolean commandLine(final String[] args) {
        final CommandLineParser cl = new CommandLineParser(args);

        // see if we are asking for help
        if(cl.getProperty("help") != null || cl.getProperty("-help") != null) {
            usage();
            return false;
        }

        inputFilename = cl.getProperty("i");
        if(inputFilename == null) {
            usage();
            return false;
        }

        if(!new File(inputFilename).isFile()) {
            LOGGER.error("\"{}\" doesn't exist or isn't a file.", inputFilename);
            usage();
            return false;
        }

        return true;
    }

    void run(final PrintStream out) throws IOException {
        final Timer timer = Timer.started();
        final GeoTiff tiff = GeoTiff.read(new File(inputFilename), GeoTiffConfig.load());
        final String loadTime = timer.stop();

        out.println("file: " + FilenameUtils.getName(inputFilename));
        out.println("size: " + tiff.getRasterWidth() + " x " + tiff.getRasterHeight() + ", " + tiff.getNumSamples() + " sample(s) per pixel");

        final GeoKeyDirectory keys = tiff.getGeoKeyDirectory();
        out.println("geo keys: version " + keys.getKeyDirectoryVersion() + ", revision " + keys.getKeyRevision() + "." + keys.getMinorRevision());
        for(final Map.Entry<GeoKey, Object> e: keys.getValues().entrySet())
            out.println("  " + e.getKey() + " = " + e.getValue());
        out.println("raster type: " + keys.getRasterType());

        out.println("transform: " + tiff.getCoordinateTransform().map(Object::toString).orElse("none (raster space is model space)"));

        final Envelope extent = tiff.getModelExtent();
        out.println("model extent: x [" + extent.getMinX() + ", " + extent.getMaxX() + "], y [" + extent.getMinY() + ", " + extent.getMaxY() + "]");
        out.println("loaded in " + loadTime);
    }
}
