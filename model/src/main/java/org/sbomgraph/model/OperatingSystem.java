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

/**
 * Operating system detected in an artifact.
 *
 * @param family OS family, e.g. {@code alpine} or {@code debian}
 * @param name   OS release, e.g. {@code 3.15.0}
 * @param eosl   Whether the release has reached its end of service life
 * @since 1.0.0
 */
public record OperatingSystem(
        @JsonProperty("Family") String family,
        @JsonProperty("Name") String name,
        @JsonProperty("EOSL") boolean eosl) {
}
