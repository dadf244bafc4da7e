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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ai.kognition.pilegeo4j.geotiff.geometry.Point;
import ai.kognition.pilegeo4j.geotiff.transform.mesh.Face;
import ai.kognition.pilegeo4j.geotiff.transform.mesh.Mesh;
import ai.kognition.pilegeo4j.geotiff.transform.mesh.MeshBuilder;

/**
 * Piecewise linear mapping through a Delaunay triangulation of the raster tie points. The model
 * mesh reuses the raster triangulation's topology so face {@code i} of one corresponds to face
 * {@code i} of the other. Points beyond the convex hull fall into the unbounded wedge faces on
 * the hull and are extrapolated from the adjacent triangle. Where the model hull is concave the
 * gaps are assigned to faces on the hull the same way.
 * <p>
 * Tie points whose model coordinates fold the mesh over itself have no proper inverse. For those
 * {@link #toRaster(Point)} still answers, using the nearest model face wherever none contains the point.
 * </p>
 */
public final class TiePointTransform extends CoordinateTransform {
    private static final Logger LOGGER = LoggerFactory.getLogger(TiePointTransform.class);

    private final Mesh rasterMesh;
    private final Mesh modelMesh;

    public TiePointTransform(final ControlPoints controlPoints) {
        final MeshBuilder builder = new MeshBuilder(controlPoints.rasterPoints());
        rasterMesh = builder.build(controlPoints.rasterPoints());
        modelMesh = builder.build(controlPoints.modelPoints());
        LOGGER.debug("Built a tie point transform from {} control points with {} faces", controlPoints.size(), rasterMesh.size());
    }

    private static Point transform(final Mesh source, final Mesh target, final Point point) {
        final int index = source.locate(point);
        final double[] uv = source.getFace(index).barycentric(point);
        final Face to = target.getFace(index);
        if(LOGGER.isTraceEnabled())
            LOGGER.trace("{} is in face {} with (u, v) = ({}, {})", point, index, uv[0], uv[1]);
        return to.interpolate(uv[0], uv[1]);
    }

    @Override
    public Point toModel(final Point raster) {
        return transform(rasterMesh, modelMesh, raster);
    }

    @Override
    public Point toRaster(final Point model) {
        return transform(modelMesh, rasterMesh, model);
    }

    public Mesh getRasterMesh() {
        return rasterMesh;
    }

    public Mesh getModelMesh() {
        return modelMesh;
    }

    @Override
    public String toString() {
        return "TiePointTransform [faces=" + rasterMesh.size() + "]";
    }
}
