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
 * A component as declared in an existing CycloneDX document.
 *
 * @param type       CycloneDX component type, e.g. {@code application}
 * @param name       Name of the component
 * @param group      Group of the component
 * @param version    Version of the component
 * @param purl       Package URL of the component in its string representation
 * @param properties Custom properties of the component
 * @since 1.0.0
 */
public record ExternalComponent(
        @JsonProperty("type") @Nullable String type,
        @JsonProperty("name") String name,
        @JsonProperty("group") @Nullable String group,
        @JsonProperty("version") @Nullable String version,
        @JsonProperty("purl") @Nullable String purl,
        @JsonProperty("properties") List<ExternalProperty> properties) {

    public record ExternalProperty(
            @JsonProperty("name") String name,
            @JsonProperty("value") String value) {
    }

    public ExternalComponent {
        properties = List.copyOf(requireNonNullElse(properties, List.of()));
    }

}
