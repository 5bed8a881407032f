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

import static java.util.Objects.requireNonNull;

/**
 * A name / value pair attached to a {@link Component}.
 *
 * @param namespace Namespace of the property; {@code null} means the tool's own namespace
 * @param name      Name of the property, without namespace
 * @param value     Value of the property
 * @since 1.0.0
 */
public record Property(@Nullable String namespace, String name, String value) {

    public Property {
        requireNonNull(name, "name must not be null");
        if (value == null) {
            value = "";
        }
    }

    public static Property of(final String name, final @Nullable String value) {
        return new Property(null, name, value);
    }

}
