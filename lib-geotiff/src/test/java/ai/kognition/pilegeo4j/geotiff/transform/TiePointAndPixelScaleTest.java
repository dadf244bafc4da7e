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

package ai.kognition.pilegeo4j.geotiff.transform;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertThrows;
import static org.junit.Assert.assertTrue;

import org.junit.Test;

import ai.kognition.pilegeo4j.geotiff.geometry.Point;
import ai.kognition.pilegeo4j.geotiff.geometry.SimplePoint;

public class TiePointAndPixelScaleTest {

    @Test
    public void testToModel() {
        final CoordinateTransform transform = CoordinateTransform.fromTagData(new double[] {2,2,0}, new double[] {0,0,0,100,200,0}, null);
        assertTrue(transform instanceof TiePointAndPixelScale);

        final Point model = transform.toModel(new SimplePoint(10, 10));
        assertEquals(120.0, model.x(), 0.00000000001);
        assertEquals(180.0, model.y(), 0.00000000001);
    }

    @Test
    public void testToRaster() {
        final TiePointAndPixelScale transform = new TiePointAndPixelScale(new SimplePoint(5, 7), new SimplePoint(-120.0, 45.0),
            new SimplePoint(0.25, 0.5));

        final Point raster = transform.toRaster(new SimplePoint(-119.0, 44.0));
        assertEquals(9.0, raster.x(), 0.00000000001);
        assertEquals(9.0, raster.y(), 0.00000000001);

        final Point model = transform.toModel(raster);
        assertEquals(-119.0, model.x(), 0.00000000001);
        assertEquals(44.0, model.y(), 0.00000000001);
    }

    @Test
    public void testControlPointIsExact() {
        final CoordinateTransform transform = CoordinateTransform.fromTagData(new double[] {30,30,0},
            new double[] {0.5,0.5,0,440720,3751320,0}, null);
        final Point model = transform.toModel(new SimplePoint(0.5, 0.5));
        assertEquals(440720.0, model.x(), 0.0);
        assertEquals(3751320.0, model.y(), 0.0);
    }

    @Test
    public void testNullArgs() {
        assertThrows(NullPointerException.class, () -> new TiePointAndPixelScale(null, new SimplePoint(0, 0), new SimplePoint(1, 1)));
    }
}
