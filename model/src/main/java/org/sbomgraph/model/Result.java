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
 * A single scanned target within an artifact, e.g. one lock file or the OS package database.
 *
 * @param target          Name of the target, usually a file path
 * @param resultClass     Classification of the target
 * @param type            Package ecosystem of the target, e.g. {@code npm} or {@code alpine}
 * @param packages        Packages found in the target
 * @param vulnerabilities Vulnerabilities matched against the packages
 * @since 1.0.0
 */
public record Result(
        @JsonProperty("Target") String target,
        @JsonProperty("Class") @Nullable ResultClass resultClass,
        @JsonProperty("Type") @Nullable String type,
        @JsonProperty("Packages") List<Package> packages,
        @JsonProperty("Vulnerabilities") List<DetectedVulnerability> vulnerabilities) {

    public Result {
        packages = List.copyOf(requireNonNullElse(packages, List.of()));
        vulnerabilities = List.copyOf(requireNonNullElse(vulnerabilities, List.of()));
    }

}
