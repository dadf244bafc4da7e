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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertThrows;
import static org.junit.Assert.assertTrue;

import java.util.Optional;

import org.junit.Test;

import ai.kognition.pilegeo4j.geotiff.GeoTiffFormatException;

public class GeoKeyDirectoryTest {
    private static final String ASCII = "WGS 84|NAD83|";

    private static String failure(final int[] directory, final double[] doubles, final String ascii) {
        return assertThrows(GeoTiffFormatException.class, () -> GeoKeyDirectory.fromTagData(directory, doubles, ascii)).getMessage();
    }

    @Test
    public void testDefaults() {
        final GeoKeyDirectory gkd = GeoKeyDirectory.fromTagData(null, null, null);
        assertEquals(1, gkd.getKeyDirectoryVersion());
        assertEquals(1, gkd.getKeyRevision());
        assertEquals(1, gkd.getMinorRevision());
        assertTrue(gkd.getValues().isEmpty());
        assertEquals(RasterType.PixelIsArea, gkd.getRasterType());
    }

    @Test
    public void testAllValueTypes() {
        final GeoKeyDirectory gkd = GeoKeyDirectory.fromTagData(new int[] {
            1,1,0,6,
            1024,0,1,2,
            1025,0,1,2,
            2048,0,1,4326,
            2049,34737,7,0,
            3073,34737,6,7,
            2057,34736,1,1
        }, new double[] {0.0,6378137.0}, ASCII);

        assertEquals(1, gkd.getKeyDirectoryVersion());
        assertEquals(0, gkd.getMinorRevision());
        assertEquals(Optional.of(2), gkd.getShort(GeoKey.ModelType));
        assertEquals(Optional.of(4326), gkd.getShort(GeoKey.GeographicType));
        assertEquals(RasterType.PixelIsPoint, gkd.getRasterType());
        assertEquals(Optional.of("WGS 84"), gkd.getString(GeoKey.GeogCitation));
        assertEquals(Optional.of("NAD83"), gkd.getString(GeoKey.ProjCitation));
        assertEquals(6378137.0, gkd.getDouble(GeoKey.GeogSemiMajorAxis).get(), 0.0);
        assertFalse(gkd.getDouble(GeoKey.GeogSemiMinorAxis).isPresent());
        assertFalse(gkd.contains(GeoKey.Vertical));
    }

    @Test
    public void testTerminatorAlreadyDropped() {
        // a count that reaches one past the end of the params
        final GeoKeyDirectory gkd = GeoKeyDirectory.fromTagData(new int[] {1,1,0,1,1026,34737,7,0}, null, "UTM 10");
        assertEquals(Optional.of("UTM 10"), gkd.getString(GeoKey.Citation));
    }

    @Test
    public void testUnknownKeysAreSkipped() {
        final GeoKeyDirectory gkd = GeoKeyDirectory.fromTagData(new int[] {1,1,0,2,9999,0,1,5,1024,0,1,1}, null, null);
        assertEquals(1, gkd.getValues().size());
        assertEquals(Optional.of(1), gkd.getShort(GeoKey.ModelType));
    }

    @Test
    public void testBadLengths() {
        assertEquals("Unexpected length of directory data: must be at least 4.", failure(new int[] {1,1,0}, null, null));
        assertTrue(failure(new int[] {1,1,0,2,1024,0,1,1}, null, null).startsWith("Unexpected length of directory data: number of keys"));
    }

    @Test
    public void testWrongLocations() {
        assertEquals("Key `ModelType` did not have the expected SHORT value type.", failure(new int[] {1,1,0,1,1024,34736,1,0}, null, null));
        assertEquals("Key `GeogSemiMajorAxis` did not have the expected DOUBLE value type.",
            failure(new int[] {1,1,0,1,2057,0,1,0}, new double[] {1.0}, null));
        assertEquals("Key `GeogCitation` did not have the expected ASCII value type.", failure(new int[] {1,1,0,1,2049,34736,3,0}, null, ASCII));
    }

    @Test
    public void testOutOfRange() {
        assertEquals("Unexpected count: expected 1, got 2.", failure(new int[] {1,1,0,1,1024,0,2,1}, null, null));
        assertEquals("Offset out of bounds: the length is 1 but the offset is 3", failure(new int[] {1,1,0,1,2057,34736,1,3}, new double[] {1.0}, null));
        assertTrue(failure(new int[] {1,1,0,1,2049,34737,2,20}, null, ASCII).startsWith("Start offset out of bounds"));
        assertTrue(failure(new int[] {1,1,0,1,2049,34737,20,0}, null, ASCII).startsWith("End offset out of bounds"));
        assertTrue(failure(new int[] {1,1,0,1,2049,34737,1,0}, null, null).startsWith("Start offset out of bounds"));
    }

    @Test
    public void testUnknownRasterType() {
        assertEquals("Unknown raster type: 3", failure(new int[] {1,1,0,1,1025,0,1,3}, null, null));
    }

    @Test
    public void testTypedAccessMismatch() {
        final GeoKeyDirectory gkd = GeoKeyDirectory.defaults();
        assertThrows(IllegalArgumentException.class, () -> gkd.getDouble(GeoKey.ModelType));
    }
}
