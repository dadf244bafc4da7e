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

/**
 * Thrown when the georeferencing tags of a TIFF directory are malformed, inconsistent,
 * or describe a transform this reader has been configured not to build.
 */
public class GeoTiffFormatException extends RuntimeException {
    private static final long serialVersionUID = 5170915232361431146L;

    public GeoTiffFormatException(final String message) {
        super(message);
    }

    public GeoTiffFormatException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
