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

import java.time.Instant;
import java.util.List;

import static java.util.Objects.requireNonNullElse;

/**
 * A vulnerability that was matched against a {@link Package}.
 * <p>
 * Matching happens upstream; this record is carried through to the component graph as-is.
 *
 * @since 1.0.0
 */
public record DetectedVulnerability(
        @JsonProperty("VulnerabilityID") String vulnerabilityId,
        @JsonProperty("PkgID") @Nullable String pkgId,
        @JsonProperty("PkgName") String pkgName,
        @JsonProperty("InstalledVersion") @Nullable String installedVersion,
        @JsonProperty("FixedVersion") @Nullable String fixedVersion,
        @JsonProperty("Severity") @Nullable String severity,
        @JsonProperty("SeveritySource") @Nullable String severitySource,
        @JsonProperty("Title") @Nullable String title,
        @JsonProperty("Description") @Nullable String description,
        @JsonProperty("PrimaryURL") @Nullable String primaryUrl,
        @JsonProperty("References") List<String> references,
        @JsonProperty("CweIDs") List<String> cweIds,
        @JsonProperty("PublishedDate") @Nullable Instant publishedDate,
        @JsonProperty("LastModifiedDate") @Nullable Instant lastModifiedDate,
        @JsonProperty("DataSource") @Nullable DataSource dataSource) {

    public DetectedVulnerability {
        references = List.copyOf(requireNonNullElse(references, List.of()));
        cweIds = List.copyOf(requireNonNullElse(cweIds, List.of()));
    }

    /**
     * @return The ID of the package this vulnerability was matched against,
     * or {@code name@installedVersion} if no package ID was recorded
     */
    public String packageKey() {
        if (pkgId != null && !pkgId.isEmpty()) {
            return pkgId;
        }

        return "%s@%s".formatted(pkgName, requireNonNullElse(installedVersion, ""));
    }

    public static DetectedVulnerability of(
            final String vulnerabilityId,
            final String pkgId,
            final String pkgName,
            final String installedVersion,
            final String severity) {
        return new DetectedVulnerability(vulnerabilityId, pkgId, pkgName, installedVersion,
                null, severity, null, null, null, null, null, null, null, null, null);
    }

}
