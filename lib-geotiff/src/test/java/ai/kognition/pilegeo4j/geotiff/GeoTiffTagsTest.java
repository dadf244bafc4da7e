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

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertThrows;
import static org.junit.Assert.assertTrue;

import java.util.Arrays;

import org.junit.Test;

public class GeoTiffTagsTest {
    private static final GeoTiffConfig CONFIG = new GeoTiffConfig(true, 0);

    @Test
    public void testNoTransformTags() {
        final GeoTiffTags tags = new GeoTiffTags(null, null, null, null, null, null);
        assertFalse(tags.hasTransformTags());
        assertFalse(tags.coordinateTransform(CONFIG).isPresent());
        assertEquals(1, tags.geoKeyDirectory().getKeyDirectoryVersion());
    }

    @Test
    public void testInvalidTransformTagsFail() {
        final GeoTiffTags tags = new GeoTiffTags(new double[] {1,1,0}, null, null, null, null, null);
        assertTrue(tags.hasTransformTags());
        assertThrows(GeoTiffFormatException.class, () -> tags.coordinateTransform(CONFIG));
    }

    @Test
    public void testValueConversions() {
        assertArrayEquals(new double[] {1.5}, GeoTiffTags.toDoubles(Double.valueOf(1.5)), 0.0);
        assertArrayEquals(new double[] {1,2,3}, GeoTiffTags.toDoubles(Arrays.asList(1, 2L, 3.0f)), 0.0);
        assertArrayEquals(new int[] {1,1,0,1}, GeoTiffTags.toInts(Arrays.asList(1, 1, 0, 1)));
        assertThrows(GeoTiffFormatException.class, () -> GeoTiffTags.toDoubles("nope"));
    }

    @Test
    public void testAsciiPiecesAreRejoined() {
        assertEquals("WGS 84|", GeoTiffTags.toAscii("WGS 84|"));
        assertEquals("WGS 84|\0NAD83|", GeoTiffTags.toAscii(Arrays.asList("WGS 84|", "NAD83|")));
    }
}
