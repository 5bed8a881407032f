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
import org.sbomgraph.model.ArtifactType;
import org.sbomgraph.model.Component;
import org.sbomgraph.model.ComponentType;
import org.sbomgraph.model.ExternalBom;
import org.sbomgraph.model.ExternalComponent;
import org.sbomgraph.model.Metadata;
import org.sbomgraph.model.PackageIdentifier;
import org.sbomgraph.model.Property;
import org.sbomgraph.model.Report;

import java.util.ArrayList;
import java.util.List;

import static java.util.Objects.requireNonNull;
import static org.apache.commons.lang3.StringUtils.isNotBlank;
import static org.apache.commons.lang3.StringUtils.trimToNull;

/**
 * Builds the root {@link Component} of the graph, representing the scanned artifact itself.
 *
 * @since 1.0.0
 */
public final class RootComponentBuilder {

    private final String propertyNamespace;

    /**
     * @param propertyNamespace Prefix of property names written by this tool
     */
    public RootComponentBuilder(final String propertyNamespace) {
        this.propertyNamespace = requireNonNull(propertyNamespace, "propertyNamespace must not be null");
    }

    /**
     * @param report The {@link Report} to build the root component for
     * @return The root {@link Component}, without children
     * @throws ComponentGraphException When the package URL of the artifact cannot be constructed
     */
    public Component build(final Report report) throws ComponentGraphException {
        requireNonNull(report, "report must not be null");

        if (report.artifactType() == ArtifactType.CYCLONEDX) {
            return convertExternalBom(report);
        }

        final var component = new Component();
        component.setName(report.artifactName());
        component.setType(componentType(report.artifactType()));

        final Metadata metadata = report.metadata();
        final var properties = new ArrayList<Property>();
        properties.add(Property.of(PropertyNames.SCHEMA_VERSION, String.valueOf(report.schemaVersion())));

        if (report.artifactType() == ArtifactType.CONTAINER_IMAGE) {
            properties.add(Property.of(PropertyNames.IMAGE_ID, metadata.imageId()));

            final PackageURL purl;
            try {
                purl = OciPackageUrls.fromMetadata(metadata);
            } catch (MalformedPackageURLException e) {
                throw new ComponentGraphException(
                        "Failed to construct package URL for container image " + report.artifactName(), e);
            }
            if (purl != null) {
                component.setPackageIdentifier(PackageIdentifier.of(purl));
            }
        }

        if (metadata.size() != 0) {
            properties.add(Property.of(PropertyNames.SIZE, String.valueOf(metadata.size())));
        }
        properties.add(Property.of(PropertyNames.REPO_DIGEST, String.join(",", metadata.repoDigests())));
        properties.add(Property.of(PropertyNames.DIFF_ID, String.join(",", metadata.diffIds())));
        properties.add(Property.of(PropertyNames.REPO_TAG, String.join(",", metadata.repoTags())));

        component.setProperties(PropertyFilter.filter(properties));
        return component;
    }

    private static @Nullable ComponentType componentType(final @Nullable ArtifactType artifactType) {
        if (artifactType == null) {
            return null;
        }

        return switch (artifactType) {
            case CONTAINER_IMAGE, VM -> ComponentType.CONTAINER;
            case FILESYSTEM, REPOSITORY -> ComponentType.APPLICATION;
            default -> null;
        };
    }

    /**
     * Adopt the metadata component of a scanned CycloneDX document as root.
     * <p>
     * Properties previously written by this tool have their namespace split off,
     * so that it is not applied twice when the graph is exported again.
     */
    private Component convertExternalBom(final Report report) throws ComponentGraphException {
        final ExternalBom externalBom = report.cycloneDx();
        final ExternalComponent externalComponent = externalBom != null ? externalBom.metadataComponent() : null;
        if (externalComponent == null) {
            throw new ComponentGraphException(
                    "Report for %s does not contain a CycloneDX metadata component".formatted(report.artifactName()));
        }

        final var component = new Component();
        component.setType(ComponentType.fromCycloneDxName(externalComponent.type()));
        component.setName(externalComponent.name());
        component.setGroup(trimToNull(externalComponent.group()));
        component.setVersion(trimToNull(externalComponent.version()));

        if (isNotBlank(externalComponent.purl())) {
            try {
                component.setPackageIdentifier(PackageIdentifier.of(new PackageURL(externalComponent.purl())));
            } catch (MalformedPackageURLException e) {
                throw new ComponentGraphException(
                        "Invalid package URL of CycloneDX metadata component: " + externalComponent.purl(), e);
            }
        }

        final List<Property> properties = externalComponent.properties().stream()
                .map(this::convertProperty)
                .toList();
        component.setProperties(PropertyFilter.filter(properties));
        return component;
    }

    private Property convertProperty(final ExternalComponent.ExternalProperty property) {
        if (property.name().startsWith(propertyNamespace)) {
            return new Property(
                    propertyNamespace,
                    property.name().substring(propertyNamespace.length()),
                    property.value());
        }

        return Property.of(property.name(), property.value());
    }

}
