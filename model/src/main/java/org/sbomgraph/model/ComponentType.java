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

import org.jspecify.annotations.Nullable;

/**
 * Kind of a {@link Component}.
 *
 * @since 1.0.0
 */
public enum ComponentType {

    APPLICATION("application"),
    CONTAINER("container"),
    DEVICE("device"),
    FILE("file"),
    FIRMWARE("firmware"),
    FRAMEWORK("framework"),
    LIBRARY("library"),
    OPERATING_SYSTEM("operating-system"),
    PLATFORM("platform");

    private final String cycloneDxName;

    ComponentType(final String cycloneDxName) {
        this.cycloneDxName = cycloneDxName;
    }

    public String cycloneDxName() {
        return cycloneDxName;
    }

    /**
     * @param cycloneDxName The CycloneDX name of a component type, e.g. {@code operating-system}
     * @return The matching {@link ComponentType}, or {@code null} when there is none
     */
    public static @Nullable ComponentType fromCycloneDxName(final @Nullable String cycloneDxName) {
        if (cycloneDxName == null) {
            return null;
        }

        for (final ComponentType type : values()) {
            if (type.cycloneDxName.equalsIgnoreCase(cycloneDxName)) {
                return type;
            }
        }

        return null;
    }

}
