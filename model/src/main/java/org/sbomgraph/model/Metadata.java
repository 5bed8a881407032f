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
 * Artifact-level metadata of a {@link Report}.
 *
 * @param size        Size of the artifact in bytes, {@code 0} when unknown
 * @param os          Detected operating system, if any
 * @param imageId     ID of the container image
 * @param diffIds     Layer diff IDs of the container image
 * @param repoTags    Repository tags of the container image
 * @param repoDigests Repository digests of the container image
 * @param imageConfig Configuration of the container image, if any
 * @since 1.0.0
 */
public record Metadata(
        @JsonProperty("Size") long size,
        @JsonProperty("OS") @Nullable OperatingSystem os,
        @JsonProperty("ImageID") @Nullable String imageId,
        @JsonProperty("DiffIDs") List<String> diffIds,
        @JsonProperty("RepoTags") List<String> repoTags,
        @JsonProperty("RepoDigests") List<String> repoDigests,
        @JsonProperty("ImageConfig") @Nullable ImageConfig imageConfig) {

    public static final Metadata EMPTY = new Metadata(0, null, null, null, null, null, null);

    public Metadata {
        diffIds = List.copyOf(requireNonNullElse(diffIds, List.of()));
        repoTags = List.copyOf(requireNonNullElse(repoTags, List.of()));
        repoDigests = List.copyOf(requireNonNullElse(repoDigests, List.of()));
    }

}
