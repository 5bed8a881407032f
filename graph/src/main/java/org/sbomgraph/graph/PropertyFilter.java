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
package org.sbomgraph.graph;

import org.sbomgraph.model.Property;

import java.util.List;

/**
 * Removes properties that carry no information.
 * <p>
 * A property is dropped when its value is empty, or when it is the source epoch
 * of a package with value {@code 0}, which means that the package has no epoch.
 * The order of the remaining properties is retained.
 *
 * @since 1.0.0
 */
public final class PropertyFilter {

    private static final String NO_EPOCH = "0";

    private PropertyFilter() {
    }

    public static List<Property> filter(final List<Property> properties) {
        return properties.stream()
                .filter(PropertyFilter::isMeaningful)
                .toList();
    }

    static boolean isMeaningful(final Property property) {
        if (property.value().isEmpty()) {
            return false;
        }

        return !(PropertyNames.SRC_EPOCH.equals(property.name()) && NO_EPOCH.equals(property.value()));
    }

}
