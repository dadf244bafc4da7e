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

/**
 * A tie point: a raster location and the model location it's known to correspond to.
 */
public class ControlPoint {
    public final Point rasterPoint;
    public final Point modelPoint;

    public ControlPoint(final Point rasterPoint, final Point modelPoint) {
        this.rasterPoint = rasterPoint;
        this.modelPoint = modelPoint;
    }

    @Override
    public String toString() {
        return "ControlPoint [rasterPoint=" + rasterPoint + ", modelPoint=" + modelPoint + "]";
    }
}
