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

import ai.kognition.pilegeo4j.geotiff.geometry.Point;
import ai.kognition.pilegeo4j.geotiff.geometry.SimplePoint;

/**
 * One tie point plus a per axis pixel scale. There's no rotation. Raster rows grow downward
 * while model y grows upward so the y scale is applied negated.
 */
public final class TiePointAndPixelScale extends CoordinateTransform {
    private final Point rasterPoint;
    private final Point modelPoint;
    private final Point pixelScale;

    public TiePointAndPixelScale(final Point rasterPoint, final Point modelPoint, final Point pixelScale) {
        this.rasterPoint = sanitize("rasterPoint", rasterPoint);
        this.modelPoint = sanitize("modelPoint", modelPoint);
        this.pixelScale = sanitize("pixelScale", pixelScale);
    }

    static TiePointAndPixelScale fromTagData(final double[] tiePoints, final double[] pixelScale) {
        return new TiePointAndPixelScale(new SimplePoint(tiePoints[0], tiePoints[1]), new SimplePoint(tiePoints[3], tiePoints[4]),
            new SimplePoint(pixelScale[0], pixelScale[1]));
    }

    private static Point sanitize(final String what, final Point p) {
        if(p == null)
            throw new NullPointerException("Cannot pass a null " + what + " to " + TiePointAndPixelScale.class.getSimpleName());
        return p;
    }

    @Override
    public Point toModel(final Point raster) {
        return new SimplePoint(
            (raster.x() - rasterPoint.x()) * pixelScale.x() + modelPoint.x(),
            (raster.y() - rasterPoint.y()) * -pixelScale.y() + modelPoint.y());
    }

    @Override
    public Point toRaster(final Point model) {
        return new SimplePoint(
            (model.x() - modelPoint.x()) / pixelScale.x() + rasterPoint.x(),
            (model.y() - modelPoint.y()) / -pixelScale.y() + rasterPoint.y());
    }

    public Point getRasterPoint() {
        return rasterPoint;
    }

    public Point getModelPoint() {
        return modelPoint;
    }

    public Point getPixelScale() {
        return pixelScale;
    }

    @Override
    public String toString() {
        return "TiePointAndPixelScale [rasterPoint=" + rasterPoint + ", modelPoint=" + modelPoint + ", pixelScale=" + pixelScale + "]";
    }
}
