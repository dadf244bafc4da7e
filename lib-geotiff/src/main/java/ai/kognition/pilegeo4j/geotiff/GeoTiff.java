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

package ai.kognition.pilegeo4j.geotiff;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.util.List;
import java.util.Optional;

import org.locationtech.jts.geom.Envelope;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ai.kognition.pilegeo4j.geotiff.geokey.GeoKeyDirectory;
import ai.kognition.pilegeo4j.geotiff.geokey.RasterType;
import ai.kognition.pilegeo4j.geotiff.geometry.Point;
import ai.kognition.pilegeo4j.geotiff.geometry.SimplePoint;
import ai.kognition.pilegeo4j.geotiff.raster.RasterData;
import ai.kognition.pilegeo4j.geotiff.transform.CoordinateTransform;
import mil.nga.tiff.FileDirectory;
import mil.nga.tiff.TIFFImage;
import mil.nga.tiff.TiffReader;
import mil.nga.tiff.util.TiffException;

/**
 * A decoded GeoTIFF image: its geo keys, the mapping between raster and model space and
 * its samples, which can be looked up by model coordinate.
 */
public class GeoTiff {
    private static final Logger LOGGER = LoggerFactory.getLogger(GeoTiff.class);

    private final GeoKeyDirectory geoKeyDirectory;
    private final CoordinateTransform coordinateTransform;
    private final RasterData raster;
    private final int rasterWidth;
    private final int rasterHeight;
    private final int numSamples;

    /**
     * @param coordinateTransform {@code null} when the raster isn't georeferenced, in which case
     *            model coordinates are raster coordinates.
     */
    public GeoTiff(final GeoKeyDirectory geoKeyDirectory, final CoordinateTransform coordinateTransform, final RasterData raster) {
        this.geoKeyDirectory = geoKeyDirectory;
        this.coordinateTransform = coordinateTransform;
        this.raster = raster;
        this.rasterWidth = raster.getWidth();
        this.rasterHeight = raster.getHeight();
        this.numSamples = raster.getSamplesPerPixel();
    }

    public static GeoTiff read(final File file) throws IOException {
        return read(file, GeoTiffConfig.getDefault());
    }

    public static GeoTiff read(final File file, final GeoTiffConfig config) throws IOException {
        LOGGER.debug("Reading {}", file);
        return decode(readTiff(() -> TiffReader.readTiff(file)), config);
    }

    public static GeoTiff read(final InputStream is) throws IOException {
        return read(is, GeoTiffConfig.getDefault());
    }

    public static GeoTiff read(final InputStream is, final GeoTiffConfig config) throws IOException {
        return decode(readTiff(() -> TiffReader.readTiff(is)), config);
    }

    public static GeoTiff read(final byte[] bytes) throws IOException {
        return read(bytes, GeoTiffConfig.getDefault());
    }

    public static GeoTiff read(final byte[] bytes, final GeoTiffConfig config) throws IOException {
        return decode(readTiff(() -> TiffReader.readTiff(bytes)), config);
    }

    @FunctionalInterface
    private static interface TiffSource {
        TIFFImage read() throws IOException;
    }

    private static TIFFImage readTiff(final TiffSource source) throws IOException {
        try {
            return source.read();
        } catch(final TiffException te) {
            throw new GeoTiffFormatException("Failed to decode the TIFF: " + te.getMessage(), te);
        }
    }

    private static GeoTiff decode(final TIFFImage image, final GeoTiffConfig config) {
        final List<FileDirectory> directories = image.getFileDirectories();
        final int index = config.getImageIndex();
        if(index >= directories.size())
            throw new GeoTiffFormatException("The TIFF has " + directories.size() + " image(s). There's no image at index " + index);

        final FileDirectory directory = directories.get(index);
        final GeoTiffTags tags = GeoTiffTags.from(directory);
        final GeoKeyDirectory geoKeys = tags.geoKeyDirectory();
        final CoordinateTransform transform = tags.coordinateTransform(config).orElse(null);

        final RasterData raster;
        try {
            raster = new RasterData(directory.readRasters());
        } catch(final TiffException te) {
            throw new GeoTiffFormatException("Failed to decode the samples of image " + index + ": " + te.getMessage(), te);
        }

        final GeoTiff ret = new GeoTiff(geoKeys, transform, raster);
        LOGGER.debug("Decoded image {}: {}x{} with {} sample(s) per pixel, {}", index, ret.rasterWidth, ret.rasterHeight, ret.numSamples,
            transform == null ? "not georeferenced" : transform);
        return ret;
    }

    public GeoKeyDirectory getGeoKeyDirectory() {
        return geoKeyDirectory;
    }

    public Optional<CoordinateTransform> getCoordinateTransform() {
        return Optional.ofNullable(coordinateTransform);
    }

    public RasterData getRaster() {
        return raster;
    }

    public int getRasterWidth() {
        return rasterWidth;
    }

    public int getRasterHeight() {
        return rasterHeight;
    }

    public int getNumSamples() {
        return numSamples;
    }

    private double rasterOffset() {
        return geoKeyDirectory.getRasterType().offset();
    }

    public Point toModel(final Point raster) {
        return coordinateTransform == null ? raster : coordinateTransform.toModel(raster);
    }

    public Point toRaster(final Point model) {
        return coordinateTransform == null ? model : coordinateTransform.toRaster(model);
    }

    /**
     * The model space box spanned by the raster's corners. For {@link RasterType#PixelIsPoint}
     * the corners are shifted by half a pixel.
     */
    public Envelope getModelExtent() {
        final double offset = rasterOffset();
        final Point a = toModel(new SimplePoint(offset, offset));
        final Point b = toModel(new SimplePoint(rasterWidth + offset, rasterHeight + offset));
        return new Envelope(a.x(), b.x(), a.y(), b.y());
    }

    /**
     * The value of {@code sample} at the pixel covering the model coordinate, or empty when the
     * coordinate is outside of the raster.
     *
     * @throws IllegalArgumentException if {@code sample} isn't a valid sample index for this image.
     */
    public Optional<Number> getValueAt(final Point model, final int sample) {
        if(sample < 0 || sample >= numSamples)
            throw new IllegalArgumentException("Sample index " + sample + " is out of range. The image has " + numSamples + " sample(s) per pixel.");

        final Point r = toRaster(model);
        final double offset = rasterOffset();
        final double x = r.x() - offset;
        final double y = r.y() - offset;

        if(!(x >= 0.0 && x < rasterWidth && y >= 0.0 && y < rasterHeight)) {
            LOGGER.trace("{} maps to raster {} which is outside of the image", model, r);
            return Optional.empty();
        }

        final long index = RasterData.index((int)Math.floor(x), (int)Math.floor(y), sample, rasterWidth, numSamples);
        return Optional.of(raster.get(index));
    }

    @Override
    public String toString() {
        return "GeoTiff [" + rasterWidth + "x" + rasterHeight + ", samples=" + numSamples + ", transform=" + coordinateTransform + "]";
    }
}
