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

import com.github.packageurl.MalformedPackageURLException;
import com.github.packageurl.PackageURL;
import org.jspecify.annotations.Nullable;
import org.sbomgraph.model.Component;
import org.sbomgraph.model.ComponentType;
import org.sbomgraph.model.DetectedVulnerability;
import org.sbomgraph.model.Hash;
import org.sbomgraph.model.Layer;
import org.sbomgraph.model.Package;
import org.sbomgraph.model.PackageIdentifier;
import org.sbomgraph.model.Property;
import org.sbomgraph.model.Result;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static java.util.stream.Collectors.groupingBy;
import static org.apache.commons.lang3.StringUtils.trimToNull;

/**
 * Reconstructs the dependency forest of the packages of a {@link Result}.
 * <p>
 * Every package of the result is converted into exactly one {@link Component}.
 * Components that are depended upon by multiple packages are shared by all of them.
 * Dependency cycles are broken by registering a component before its dependencies are visited.
 * <p>
 * Instances are not thread-safe, and hold state for a single result only.
 * Use {@link #build(Result)}.
 *
 * @since 1.0.0
 */
public final class PackageGraphBuilder {

    private static final Logger LOGGER = LoggerFactory.getLogger(PackageGraphBuilder.class);

    private final Result result;
    private final Map<String, Package> packageById;
    private final Map<String, List<DetectedVulnerability>> vulnsByPackageId;
    private final Map<String, Component> componentById = new HashMap<>();
    private final Set<String> skippedPackageIds = new HashSet<>();

    private PackageGraphBuilder(final Result result) {
        this.result = result;
        this.packageById = new LinkedHashMap<>();
        for (final Package pkg : result.packages()) {
            packageById.put(pkg.effectiveId(), pkg);
        }
        this.vulnsByPackageId = result.vulnerabilities().stream()
                .collect(groupingBy(DetectedVulnerability::packageKey));
    }

    /**
     * @param result The {@link Result} to build the dependency forest for
     * @return The root {@link Component}s of the forest, in the order of their packages in {@code result}
     */
    public static List<Component> build(final Result result) {
        return new PackageGraphBuilder(result).buildForest();
    }

    /**
     * Determine the packages that depend on each package.
     *
     * @param packages The packages to inspect
     * @return IDs of dependent packages, keyed by the ID of the package they depend on
     */
    static Map<String, Set<String>> parentIdsById(final List<Package> packages) {
        final var parentIdsById = new HashMap<String, Set<String>>();
        for (final Package pkg : packages) {
            for (final String dependencyId : pkg.dependsOn()) {
                parentIdsById
                        .computeIfAbsent(dependencyId, ignored -> new LinkedHashSet<>())
                        .add(pkg.effectiveId());
            }
        }

        return parentIdsById;
    }

    private List<Component> buildForest() {
        final Map<String, Set<String>> parentIdsById = parentIdsById(result.packages());

        final var roots = new ArrayList<Component>();
        for (final Map.Entry<String, Package> entry : packageById.entrySet()) {
            final String packageId = entry.getKey();
            final Package pkg = entry.getValue();

            // Indirect dependencies are reached through their parents.
            // They only become roots when no package of this result depends on them.
            if (pkg.indirect() && !parentIdsById.getOrDefault(packageId, Collections.emptySet()).isEmpty()) {
                continue;
            }

            final Component component = buildComponent(packageId, pkg);
            if (component != null) {
                roots.add(component);
            }
        }

        LOGGER.debug("Built {} components with {} roots for target {}",
                componentById.size(), roots.size(), result.target());
        return roots;
    }

    private @Nullable Component buildComponent(final String packageId, final Package pkg) {
        final Component existingComponent = componentById.get(packageId);
        if (existingComponent != null) {
            return existingComponent;
        }
        if (skippedPackageIds.contains(packageId)) {
            return null;
        }

        final Component component;
        try {
            component = convert(packageId, pkg);
        } catch (MalformedPackageURLException e) {
            LOGGER.warn("Skipping package {} of target {}: invalid package URL {}",
                    packageId, result.target(), pkg.purl(), e);
            skippedPackageIds.add(packageId);
            return null;
        }

        // Must happen before visiting dependencies, otherwise cycles would never terminate.
        componentById.put(packageId, component);

        // A dependency listed more than once is still a single child.
        for (final String dependencyId : new LinkedHashSet<>(pkg.dependsOn())) {
            final Package dependency = packageById.get(dependencyId);
            if (dependency == null) {
                continue;
            }

            final Component dependencyComponent = buildComponent(dependencyId, dependency);
            if (dependencyComponent != null) {
                component.addChild(dependencyComponent);
            }
        }

        return component;
    }

    private Component convert(final String packageId, final Package pkg) throws MalformedPackageURLException {
        final PackageURL purl = pkg.purl() != null && !pkg.purl().isBlank()
                ? new PackageURL(pkg.purl())
                : null;
        final ComponentIdentity identity = ComponentIdentity.of(pkg, purl);

        final var component = new Component();
        component.setType(ComponentType.LIBRARY);
        component.setName(identity.name());
        component.setGroup(trimToNull(identity.namespace()));
        component.setVersion(trimToNull(identity.version()));
        if (purl != null) {
            component.setPackageIdentifier(new PackageIdentifier(purl, trimToNull(pkg.filePath())));
        }
        component.setSupplier(trimToNull(pkg.maintainer()));
        component.setLicenses(pkg.licenses());

        final Hash hash = Hash.parse(pkg.digest());
        component.setHashes(hash != null ? List.of(hash) : List.of());

        final Layer layer = pkg.layer() != null ? pkg.layer() : new Layer(null, null);
        component.setProperties(PropertyFilter.filter(List.of(
                Property.of(PropertyNames.PKG_ID, packageId),
                Property.of(PropertyNames.PKG_TYPE, result.type()),
                Property.of(PropertyNames.FILE_PATH, pkg.filePath()),
                Property.of(PropertyNames.SRC_NAME, pkg.srcName()),
                Property.of(PropertyNames.SRC_VERSION, pkg.srcVersion()),
                Property.of(PropertyNames.SRC_RELEASE, pkg.srcRelease()),
                Property.of(PropertyNames.SRC_EPOCH, String.valueOf(pkg.srcEpoch())),
                Property.of(PropertyNames.MODULARITYLABEL, pkg.modularitylabel()),
                Property.of(PropertyNames.LAYER_DIGEST, layer.digest()),
                Property.of(PropertyNames.LAYER_DIFF_ID, layer.diffId()))));

        component.setVulnerabilities(vulnsByPackageId.getOrDefault(packageId, List.of()));
        return component;
    }

}
