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

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Kind of artifact a {@link Report} was produced for.
 *
 * @since 1.0.0
 */
public enum ArtifactType {

    CONTAINER_IMAGE("container_image"),
    FILESYSTEM("filesystem"),
    REPOSITORY("repository"),
    CYCLONEDX("cyclonedx"),
    SPDX("spdx"),
    VM("vm");

    private final String value;

    ArtifactType(final String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

}
