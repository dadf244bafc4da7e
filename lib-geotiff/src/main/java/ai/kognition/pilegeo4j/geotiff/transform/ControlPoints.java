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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import ai.kognition.pilegeo4j.geotiff.GeoTiffFormatException;
import ai.kognition.pilegeo4j.geotiff.geometry.Point;
import ai.kognition.pilegeo4j.geotiff.geometry.SimplePoint;

public class ControlPoints {
    /**
     * Values per tie point in a ModelTiePointTag: raster x, y, z then model x, y, z.
     */
    public static final int VALUES_PER_TIE_POINT = 6;

    public final ControlPoint[] controlPoints;

    public ControlPoints(final ControlPoint[] controlPoints) {
        this.controlPoints = controlPoints;
    }

    /**
     * Split a ModelTiePointTag payload into control points. The z components are ignored.
     */
    public static ControlPoints fromTiePoints(final double[] tiePoints) {
        if(tiePoints.length == 0 || tiePoints.length % VALUES_PER_TIE_POINT != 0)
            throw new GeoTiffFormatException("Number of values in ModelTiePointTag must be a positive multiple of " + VALUES_PER_TIE_POINT
                + " but was " + tiePoints.length);

        final ControlPoint[] cps = new ControlPoint[tiePoints.length / VALUES_PER_TIE_POINT];
        for(int i = 0; i < cps.length; i++) {
            final int off = i * VALUES_PER_TIE_POINT;
            cps[i] = new ControlPoint(new SimplePoint(tiePoints[off], tiePoints[off + 1]), new SimplePoint(tiePoints[off + 3], tiePoints[off + 4]));
        }
        return new ControlPoints(cps);
    }

    public int size() {
        return controlPoints.length;
    }

    public List<Point> rasterPoints() {
        final List<Point> ret = new ArrayList<>(controlPoints.length);
        for(final ControlPoint cp: controlPoints)
            ret.add(cp.rasterPoint);
        return Collections.unmodifiableList(ret);
    }

    public List<Point> modelPoints() {
        final List<Point> ret = new ArrayList<>(controlPoints.length);
        for(final ControlPoint cp: controlPoints)
            ret.add(cp.modelPoint);
        return Collections.unmodifiableList(ret);
    }
}
