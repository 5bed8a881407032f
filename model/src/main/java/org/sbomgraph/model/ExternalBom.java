/*
 * This file is part of SBOM-Graph.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * SPDX-License-Identifier: Apache-2.0
 * Copyright (c) OWASP Foundation. All Rights Reserved.
 */
package org.sbomgraph.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import org.jspecify.annotations.Nullable;

/**
 * An existing CycloneDX document that was scanned instead of a regular artifact.
 * <p>
 * Only the declared metadata component is retained; it becomes the root of the component graph.
 *
 * @since 1.0.0
 */
public record ExternalBom(@JsonProperty("metadata") @Nullable BomMetadata metadata) {

    public record BomMetadata(@JsonProperty("component") @Nullable ExternalComponent component) {
    }

    public @Nullable ExternalComponent metadataComponent() {
        return metadata != null ? metadata.component() : null;
    }

    public static ExternalBom of(final ExternalComponent component) {
        return new ExternalBom(new BomMetadata(component));
    }

}
