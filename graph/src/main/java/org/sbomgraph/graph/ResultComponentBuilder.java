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

import org.jspecify.annotations.Nullable;
import org.sbomgraph.model.Component;
import org.sbomgraph.model.ComponentType;
import org.sbomgraph.model.OperatingSystem;
import org.sbomgraph.model.Property;
import org.sbomgraph.model.Result;
import org.sbomgraph.model.ResultClass;

import java.util.List;
import java.util.Set;

/**
 * Shapes the components of a single {@link Result}.
 * <p>
 * Depending on the result, its packages are either listed directly below the
 * artifact, or grouped below an intermediate component:
 * <pre>
 * Container (alpine:3.15)
 * ├── Operating System (alpine 3.15)     os-pkgs
 * │   └── Library (bash 4.12)
 * ├── Application (/app/package-lock.json)  lang-pkgs
 * │   └── Library (express 4.17.3)
 * └── Library (django 4.0.2)              python-pkg
 * </pre>
 *
 * @since 1.0.0
 */
public final class ResultComponentBuilder {

    /**
     * Language package types that are detected from installed packages rather
     * than from lock files. Their packages are not grouped by file.
     */
    static final Set<String> UNGROUPED_PACKAGE_TYPES = Set.of(
            "node-pkg",
            "python-pkg",
            "gemspec",
            "jar",
            "conda-pkg");

    private ResultComponentBuilder() {
    }

    /**
     * @param result The {@link Result} to build components for
     * @param os     The operating system detected in the artifact, if any
     * @return The components to attach to the artifact's root component
     */
    public static List<Component> build(final Result result, final @Nullable OperatingSystem os) {
        if (result.type() != null && UNGROUPED_PACKAGE_TYPES.contains(result.type())) {
            return PackageGraphBuilder.build(result);
        }

        if (result.resultClass() != ResultClass.OS_PKGS && result.resultClass() != ResultClass.LANG_PKGS) {
            return List.of();
        }

        final Component resultComponent = createResultComponent(result, os);
        resultComponent.addChildren(PackageGraphBuilder.build(result));
        return List.of(resultComponent);
    }

    private static Component createResultComponent(final Result result, final @Nullable OperatingSystem os) {
        final var component = new Component();
        component.setName(result.target());
        component.setProperties(PropertyFilter.filter(List.of(
                Property.of(PropertyNames.TYPE, result.type()),
                Property.of(PropertyNames.CLASS, result.resultClass().value()))));

        if (result.resultClass() == ResultClass.OS_PKGS) {
            component.setType(ComponentType.OPERATING_SYSTEM);
            if (os != null) {
                component.setName(os.family());
                component.setVersion(os.name());
            }
        } else {
            component.setType(ComponentType.APPLICATION);
        }

        return component;
    }

}
