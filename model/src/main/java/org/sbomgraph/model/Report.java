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

import java.util.List;

import static java.util.Objects.requireNonNullElse;

/**
 * Output of a single scan.
 *
 * @param schemaVersion Version of the report schema
 * @param artifactName  Name of the scanned artifact
 * @param artifactType  Type of the scanned artifact
 * @param metadata      Artifact-level metadata
 * @param results       Per-target results, in scan order
 * @param cycloneDx     The scanned CycloneDX document, when {@code artifactType} is {@link ArtifactType#CYCLONEDX}
 * @since 1.0.0
 */
public record Report(
        @JsonProperty("SchemaVersion") int schemaVersion,
        @JsonProperty("ArtifactName") String artifactName,
        @JsonProperty("ArtifactType") @Nullable ArtifactType artifactType,
        @JsonProperty("Metadata") Metadata metadata,
        @JsonProperty("Results") List<Result> results,
        @JsonProperty("CycloneDX") @Nullable ExternalBom cycloneDx) {

    public Report {
        metadata = requireNonNullElse(metadata, Metadata.EMPTY);
        results = List.copyOf(requireNonNullElse(results, List.of()));
    }

}
