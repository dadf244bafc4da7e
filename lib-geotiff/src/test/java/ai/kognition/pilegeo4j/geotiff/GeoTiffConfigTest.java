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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertThrows;
import static org.junit.Assert.assertTrue;

import java.util.Properties;

import org.junit.After;
import org.junit.Test;

public class GeoTiffConfigTest {

    @After
    public void clearOverrides() {
        System.clearProperty(GeoTiffConfig.TIE_POINTS_ENABLED);
        System.clearProperty(GeoTiffConfig.IMAGE_INDEX);
    }

    @Test
    public void testDefaultsFromClasspath() {
        final GeoTiffConfig config = GeoTiffConfig.load();
        assertTrue(config.isTiePointsEnabled());
        assertEquals(0, config.getImageIndex());
    }

    @Test
    public void testSystemPropertiesOverride() {
        System.setProperty(GeoTiffConfig.TIE_POINTS_ENABLED, "false");
        System.setProperty(GeoTiffConfig.IMAGE_INDEX, "2");
        final GeoTiffConfig config = GeoTiffConfig.load();
        assertFalse(config.isTiePointsEnabled());
        assertEquals(2, config.getImageIndex());
    }

    @Test
    public void testDefaultIsLoadedOnce() {
        final GeoTiffConfig first = GeoTiffConfig.getDefault();
        System.setProperty(GeoTiffConfig.IMAGE_INDEX, "5");
        assertSame(first, GeoTiffConfig.getDefault());
        assertEquals(0, GeoTiffConfig.getDefault().getImageIndex());
    }

    @Test
    public void testFromProperties() {
        final Properties props = new Properties();
        assertTrue(new GeoTiffConfig(props).isTiePointsEnabled());

        props.setProperty(GeoTiffConfig.IMAGE_INDEX, "-1");
        assertThrows(IllegalArgumentException.class, () -> new GeoTiffConfig(props));
    }

    @Test
    public void testWithers() {
        final GeoTiffConfig config = new GeoTiffConfig(true, 0).withTiePointsEnabled(false).withImageIndex(3);
        assertFalse(config.isTiePointsEnabled());
        assertEquals(3, config.getImageIndex());
    }
}
