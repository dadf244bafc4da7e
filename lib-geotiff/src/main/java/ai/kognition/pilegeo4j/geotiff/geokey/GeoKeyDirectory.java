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

package ai.kognition.pilegeo4j.geotiff.geokey;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ai.kognition.pilegeo4j.geotiff.GeoTiffFormatException;
import ai.kognition.pilegeo4j.geotiff.GeoTiffTags;

/**
 * The contents of a GeoKeyDirectoryTag with the DOUBLE and ASCII values resolved from the
 * GeoDoubleParamsTag and GeoAsciiParamsTag.
 */
public class GeoKeyDirectory {
    private static final Logger LOGGER = LoggerFactory.getLogger(GeoKeyDirectory.class);

    public static final int HEADER_LENGTH = 4;
    public static final int ENTRY_LENGTH = 4;

    /**
     * Terminates each string in a GeoAsciiParamsTag.
     */
    public static final char ASCII_TERMINATOR = '|';

    private final int keyDirectoryVersion;
    private final int keyRevision;
    private final int minorRevision;
    private final Map<GeoKey, Object> values;

    private GeoKeyDirectory(final int keyDirectoryVersion, final int keyRevision, final int minorRevision, final Map<GeoKey, Object> values) {
        this.keyDirectoryVersion = keyDirectoryVersion;
        this.keyRevision = keyRevision;
        this.minorRevision = minorRevision;
        this.values = Collections.unmodifiableMap(values);
    }

    /**
     * An empty GeoTIFF 1.1 directory.
     */
    public static GeoKeyDirectory defaults() {
        return new GeoKeyDirectory(1, 1, 1, new EnumMap<>(GeoKey.class));
    }

    /**
     * @param directory the GeoKeyDirectoryTag values. {@code null} gives {@link #defaults()}.
     * @param doubleParams the GeoDoubleParamsTag values, may be {@code null}.
     * @param asciiParams the GeoAsciiParamsTag value, may be {@code null}.
     * @throws GeoTiffFormatException on a malformed directory or a key whose value can't be resolved.
     */
    public static GeoKeyDirectory fromTagData(final int[] directory, final double[] doubleParams, final String asciiParams) {
        if(directory == null)
            return defaults();

        if(directory.length < HEADER_LENGTH)
            throw new GeoTiffFormatException("Unexpected length of directory data: must be at least " + HEADER_LENGTH + ".");

        final int numberOfKeys = directory[3];
        if(directory.length - HEADER_LENGTH != ENTRY_LENGTH * numberOfKeys)
            throw new GeoTiffFormatException("Unexpected length of directory data: number of keys (" + numberOfKeys
                + ") does not match length of directory data (" + directory.length + ").");

        final double[] doubles = doubleParams == null ? new double[0] : doubleParams;
        final String ascii = asciiParams == null ? "" : asciiParams;

        final Map<GeoKey, Object> values = new EnumMap<>(GeoKey.class);
        for(int off = HEADER_LENGTH; off < directory.length; off += ENTRY_LENGTH) {
            final int keyId = directory[off];
            final int location = directory[off + 1];
            final int count = directory[off + 2];
            final int valueOrOffset = directory[off + 3];

            final GeoKey key = GeoKey.byId(keyId);
            if(key == null) {
                LOGGER.debug("Skipping the unknown geo key {}", keyId);
                continue;
            }

            switch(key.valueType) {
                case SHORT:
                    values.put(key, getShort(key, location, count, valueOrOffset));
                    break;
                case DOUBLE:
                    values.put(key, getDouble(doubles, key, location, count, valueOrOffset));
                    break;
                case ASCII:
                    values.put(key, getString(ascii, key, location, count, valueOrOffset));
                    break;
            }
        }

        final Object rasterType = values.get(GeoKey.RasterType);
        if(rasterType != null && RasterType.byCode((Integer)rasterType) == null)
            throw new GeoTiffFormatException("Unknown raster type: " + rasterType);

        return new GeoKeyDirectory(directory[0], directory[1], directory[2], values);
    }

    private static Integer getShort(final GeoKey key, final int location, final int count, final int value) {
        // a TIFFTagLocation of 0 means the value is the SHORT in the entry itself
        if(location != 0)
            throw new GeoTiffFormatException("Key `" + key + "` did not have the expected SHORT value type.");
        checkCount(count);
        return value;
    }

    private static Double getDouble(final double[] data, final GeoKey key, final int location, final int count, final int offset) {
        if(location != GeoTiffTags.GEO_DOUBLE_PARAMS)
            throw new GeoTiffFormatException("Key `" + key + "` did not have the expected DOUBLE value type.");
        checkCount(count);
        if(offset >= data.length)
            throw new GeoTiffFormatException("Offset out of bounds: the length is " + data.length + " but the offset is " + offset);
        return data[offset];
    }

    private static String getString(final String data, final GeoKey key, final int location, final int count, final int offset) {
        if(location != GeoTiffTags.GEO_ASCII_PARAMS)
            throw new GeoTiffFormatException("Key `" + key + "` did not have the expected ASCII value type.");

        final int len = data.length();
        if(offset >= len)
            throw new GeoTiffFormatException("Start offset out of bounds: the length is " + len + " but the offset is " + offset + ".");

        if(count < 1)
            throw new GeoTiffFormatException("Unexpected count for key `" + key + "`: expected at least 1, got " + count + ".");

        // count includes the terminator, which a decoder may already have dropped from the end
        final int end = offset + count - 1;
        if(end > len)
            throw new GeoTiffFormatException("End offset out of bounds: the length is " + len + " but the offset is " + offset
                + " and the count is " + count + ".");

        final String ret = data.substring(offset, end);
        return ret.length() > 0 && ret.charAt(ret.length() - 1) == ASCII_TERMINATOR ? ret.substring(0, ret.length() - 1) : ret;
    }

    private static void checkCount(final int count) {
        if(count != 1)
            throw new GeoTiffFormatException("Unexpected count: expected 1, got " + count + ".");
    }

    public int getKeyDirectoryVersion() {
        return keyDirectoryVersion;
    }

    public int getKeyRevision() {
        return keyRevision;
    }

    public int getMinorRevision() {
        return minorRevision;
    }

    public Map<GeoKey, Object> getValues() {
        return values;
    }

    public boolean contains(final GeoKey key) {
        return values.containsKey(key);
    }

    public Optional<Integer> getShort(final GeoKey key) {
        return get(key, GeoKey.ValueType.SHORT, Integer.class);
    }

    public Optional<Double> getDouble(final GeoKey key) {
        return get(key, GeoKey.ValueType.DOUBLE, Double.class);
    }

    public Optional<String> getString(final GeoKey key) {
        return get(key, GeoKey.ValueType.ASCII, String.class);
    }

    private <T> Optional<T> get(final GeoKey key, final GeoKey.ValueType type, final Class<T> clazz) {
        if(key.valueType != type)
            throw new IllegalArgumentException("The geo key " + key + " holds a " + key.valueType + " value, not a " + type);
        return Optional.ofNullable(clazz.cast(values.get(key)));
    }

    /**
     * The RasterType key, {@link RasterType#PixelIsArea} when it's absent.
     */
    public RasterType getRasterType() {
        return getShort(GeoKey.RasterType).map(RasterType::byCode).orElse(RasterType.PixelIsArea);
    }

    @Override
    public String toString() {
        return "GeoKeyDirectory [version=" + keyDirectoryVersion + ", revision=" + keyRevision + "." + minorRevision + ", values=" + values + "]";
    }
}
