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
package org.sbomgraph.cyclonedx;

import org.cyclonedx.model.Bom;
import org.cyclonedx.model.Dependency;
import org.cyclonedx.model.License;
import org.cyclonedx.model.LicenseChoice;
import org.cyclonedx.model.Metadata;
import org.cyclonedx.model.OrganizationalEntity;
import org.cyclonedx.model.Tool;
import org.cyclonedx.model.vulnerability.Vulnerability;
import org.jspecify.annotations.Nullable;
import org.sbomgraph.config.SbomGraphConfig;
import org.sbomgraph.graph.ComponentGraphAssembler;
import org.sbomgraph.graph.ComponentGraphException;
import org.sbomgraph.model.Component;
import org.sbomgraph.model.ComponentType;
import org.sbomgraph.model.DataSource;
import org.sbomgraph.model.DetectedVulnerability;
import org.sbomgraph.model.Hash;
import org.sbomgraph.model.Property;
import org.sbomgraph.model.Report;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Date;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.UUID;

import static java.util.Objects.requireNonNull;
import static org.apache.commons.lang3.StringUtils.isNotBlank;
import static org.apache.commons.lang3.StringUtils.trimToNull;

/**
 * Converts component graphs into CycloneDX {@link Bom}s.
 * <p>
 * The resulting BOM is flat: every node of the graph is listed exactly once in
 * {@link Bom#getComponents()}, and the edges of the graph are expressed as
 * {@link Bom#getDependencies()}. The root of the graph becomes the metadata component.
 *
 * @since 1.0.0
 */
public final class CycloneDxMarshaler {

    private static final Logger LOGGER = LoggerFactory.getLogger(CycloneDxMarshaler.class);

    private static final String CWE_PREFIX = "CWE-";

    private final SbomGraphConfig config;
    private final ComponentGraphAssembler assembler;
    private final Clock clock;

    CycloneDxMarshaler(final SbomGraphConfig config, final Clock clock) {
        this.config = requireNonNull(config, "config must not be null");
        this.assembler = new ComponentGraphAssembler(config);
        this.clock = requireNonNull(clock, "clock must not be null");
    }

    public CycloneDxMarshaler(final SbomGraphConfig config) {
        this(config, Clock.systemUTC());
    }

    public CycloneDxMarshaler() {
        this(SbomGraphConfig.fromDefaultConfig());
    }

    /**
     * Assemble the component graph of a {@link Report} and convert it into a {@link Bom}.
     *
     * @param report The {@link Report} to marshal
     * @return The {@link Bom}
     * @throws ComponentGraphException When the component graph could not be assembled
     */
    public Bom marshal(final Report report) throws ComponentGraphException {
        return toBom(assembler.assemble(report));
    }

    /**
     * @param root Root of the component graph
     * @return The {@link Bom}
     */
    public Bom toBom(final Component root) {
        requireNonNull(root, "root must not be null");
        return new BomAssembly(root).build();
    }

    /**
     * State of the conversion of a single graph.
     */
    private final class BomAssembly {

        private final Component root;
        private final Map<Component, String> bomRefByComponent = new IdentityHashMap<>();
        private final Map<String, org.cyclonedx.model.Component> componentByBomRef = new TreeMap<>();
        private final Map<String, Set<String>> dependencyRefsByBomRef = new TreeMap<>();
        private final Map<String, Vulnerability> vulnById = new TreeMap<>();
        private final Map<String, Set<String>> affectedRefsByVulnId = new TreeMap<>();
        private org.cyclonedx.model.Component rootComponent;

        private BomAssembly(final Component root) {
            this.root = root;
        }

        private Bom build() {
            visit(root);

            final var metadata = new Metadata();
            metadata.setTimestamp(Date.from(clock.instant()));
            metadata.setTools(List.of(createTool()));
            metadata.setComponent(rootComponent);

            final var bom = new Bom();
            bom.setSerialNumber("urn:uuid:" + UUID.randomUUID());
            bom.setMetadata(metadata);
            bom.setComponents(new ArrayList<>(componentByBomRef.values()));
            bom.setDependencies(createDependencies());
            bom.setVulnerabilities(createVulnerabilities());

            LOGGER.debug("Created BOM with {} components and {} vulnerabilities",
                    bom.getComponents().size(), bom.getVulnerabilities().size());
            return bom;
        }

        private String visit(final Component component) {
            final String existingBomRef = bomRefByComponent.get(component);
            if (existingBomRef != null) {
                return existingBomRef;
            }

            final String bomRef = bomRefOf(component);
            bomRefByComponent.put(component, bomRef);

            final org.cyclonedx.model.Component cdxComponent = convertComponent(component, bomRef);
            if (component == root) {
                rootComponent = cdxComponent;
            } else if (componentByBomRef.putIfAbsent(bomRef, cdxComponent) != null) {
                LOGGER.debug("Merging component {} into previously visited component with same BOM ref", component);
            }

            final Set<String> dependencyRefs = dependencyRefsByBomRef.computeIfAbsent(bomRef, ignored -> new TreeSet<>());
            for (final Component child : component.getChildren()) {
                dependencyRefs.add(visit(child));
            }

            for (final DetectedVulnerability vuln : component.getVulnerabilities()) {
                vulnById.computeIfAbsent(vuln.vulnerabilityId(), ignored -> convertVulnerability(vuln));
                affectedRefsByVulnId
                        .computeIfAbsent(vuln.vulnerabilityId(), ignored -> new TreeSet<>())
                        .add(bomRef);
            }

            return bomRef;
        }

        private List<Dependency> createDependencies() {
            final var dependencies = new ArrayList<Dependency>(dependencyRefsByBomRef.size());
            for (final Map.Entry<String, Set<String>> entry : dependencyRefsByBomRef.entrySet()) {
                final var dependency = new Dependency(entry.getKey());
                for (final String dependencyRef : entry.getValue()) {
                    dependency.addDependency(new Dependency(dependencyRef));
                }
                dependencies.add(dependency);
            }

            return dependencies;
        }

        private List<Vulnerability> createVulnerabilities() {
            final var vulnerabilities = new ArrayList<Vulnerability>(vulnById.size());
            for (final Map.Entry<String, Vulnerability> entry : vulnById.entrySet()) {
                final Vulnerability cdxVuln = entry.getValue();

                final var affects = new ArrayList<Vulnerability.Affect>();
                for (final String affectedRef : affectedRefsByVulnId.get(entry.getKey())) {
                    final var affect = new Vulnerability.Affect();
                    affect.setRef(affectedRef);
                    affects.add(affect);
                }
                cdxVuln.setAffects(affects);

                vulnerabilities.add(cdxVuln);
            }

            return vulnerabilities;
        }

    }

    private Tool createTool() {
        final var tool = new Tool();
        tool.setVendor(config.toolVendor());
        tool.setName(config.toolName());
        tool.setVersion(config.toolVersion());
        return tool;
    }

    static String bomRefOf(final Component component) {
        if (component.getPackageIdentifier() != null) {
            return component.getPackageIdentifier().bomRef();
        }

        return UUID.randomUUID().toString();
    }

    private org.cyclonedx.model.Component convertComponent(final Component component, final String bomRef) {
        final var cdxComponent = new org.cyclonedx.model.Component();
        cdxComponent.setBomRef(bomRef);
        cdxComponent.setType(convertType(component.getType()));
        cdxComponent.setGroup(trimToNull(component.getGroup()));
        cdxComponent.setName(component.getName());
        cdxComponent.setVersion(trimToNull(component.getVersion()));
        if (component.getPackageIdentifier() != null) {
            cdxComponent.setPurl(component.getPackageIdentifier().purl().canonicalize());
        }

        if (isNotBlank(component.getSupplier())) {
            final var supplier = new OrganizationalEntity();
            supplier.setName(component.getSupplier());
            cdxComponent.setSupplier(supplier);
        }

        if (!component.getLicenses().isEmpty()) {
            final var licenseChoice = new LicenseChoice();
            for (final String licenseName : component.getLicenses()) {
                final var license = new License();
                license.setName(licenseName);
                licenseChoice.addLicense(license);
            }
            cdxComponent.setLicenses(licenseChoice);
        }

        final List<org.cyclonedx.model.Hash> hashes = component.getHashes().stream()
                .map(CycloneDxMarshaler::convertHash)
                .filter(Objects::nonNull)
                .toList();
        if (!hashes.isEmpty()) {
            cdxComponent.setHashes(new ArrayList<>(hashes));
        }

        final List<org.cyclonedx.model.Property> properties = component.getProperties().stream()
                .map(this::convertProperty)
                .sorted(Comparator
                        .comparing(org.cyclonedx.model.Property::getName)
                        .thenComparing(org.cyclonedx.model.Property::getValue))
                .toList();
        if (!properties.isEmpty()) {
            cdxComponent.setProperties(new ArrayList<>(properties));
        }

        return cdxComponent;
    }

    private static org.cyclonedx.model.Component.Type convertType(final @Nullable ComponentType type) {
        if (type == null) {
            return org.cyclonedx.model.Component.Type.LIBRARY;
        }

        return org.cyclonedx.model.Component.Type.valueOf(type.name());
    }

    private static org.cyclonedx.model.@Nullable Hash convertHash(final Hash hash) {
        final org.cyclonedx.model.Hash.Algorithm algorithm = switch (hash.algorithm()) {
            case "md5" -> org.cyclonedx.model.Hash.Algorithm.MD5;
            case "sha1" -> org.cyclonedx.model.Hash.Algorithm.SHA1;
            case "sha256" -> org.cyclonedx.model.Hash.Algorithm.SHA_256;
            default -> null;
        };
        if (algorithm == null) {
            LOGGER.debug("Skipping hash with unsupported algorithm: {}", hash.algorithm());
            return null;
        }

        return new org.cyclonedx.model.Hash(algorithm, hash.value());
    }

    private org.cyclonedx.model.Property convertProperty(final Property property) {
        final String namespace = property.namespace() != null
                ? property.namespace()
                : config.propertyNamespace();

        final var cdxProperty = new org.cyclonedx.model.Property();
        cdxProperty.setName(namespace + property.name());
        cdxProperty.setValue(property.value());
        return cdxProperty;
    }

    private static Vulnerability convertVulnerability(final DetectedVulnerability vuln) {
        final var cdxVuln = new Vulnerability();
        cdxVuln.setId(vuln.vulnerabilityId());

        final DataSource dataSource = vuln.dataSource();
        if (dataSource != null) {
            final var source = new Vulnerability.Source();
            source.setName(dataSource.id() != null ? dataSource.id() : dataSource.name());
            source.setUrl(trimToNull(dataSource.url()));
            cdxVuln.setSource(source);
        }

        if (isNotBlank(vuln.severity())) {
            final var rating = new Vulnerability.Rating();
            rating.setSeverity(convertSeverity(vuln.severity()));
            if (isNotBlank(vuln.severitySource())) {
                final var ratingSource = new Vulnerability.Source();
                ratingSource.setName(vuln.severitySource());
                rating.setSource(ratingSource);
            }
            cdxVuln.setRatings(new ArrayList<>(List.of(rating)));
        }

        final var cwes = new ArrayList<Integer>();
        for (final String cweId : vuln.cweIds()) {
            final Integer cwe = parseCwe(cweId);
            if (cwe != null) {
                cwes.add(cwe);
            }
        }
        if (!cwes.isEmpty()) {
            cdxVuln.setCwes(cwes);
        }

        cdxVuln.setDescription(trimToNull(vuln.description()));
        if (isNotBlank(vuln.fixedVersion())) {
            cdxVuln.setRecommendation("Upgrade %s to version %s".formatted(vuln.pkgName(), vuln.fixedVersion()));
        }

        if (!vuln.references().isEmpty()) {
            final var advisories = new ArrayList<Vulnerability.Advisory>();
            for (final String reference : vuln.references()) {
                final var advisory = new Vulnerability.Advisory();
                advisory.setUrl(reference);
                advisories.add(advisory);
            }
            cdxVuln.setAdvisories(advisories);
        }

        cdxVuln.setPublished(toDate(vuln.publishedDate()));
        cdxVuln.setUpdated(toDate(vuln.lastModifiedDate()));
        return cdxVuln;
    }

    static Vulnerability.Rating.Severity convertSeverity(final String severity) {
        return switch (severity.toUpperCase(Locale.ROOT)) {
            case "CRITICAL" -> Vulnerability.Rating.Severity.CRITICAL;
            case "HIGH" -> Vulnerability.Rating.Severity.HIGH;
            case "MEDIUM" -> Vulnerability.Rating.Severity.MEDIUM;
            case "LOW" -> Vulnerability.Rating.Severity.LOW;
            case "INFO" -> Vulnerability.Rating.Severity.INFO;
            case "NONE" -> Vulnerability.Rating.Severity.NONE;
            default -> Vulnerability.Rating.Severity.UNKNOWN;
        };
    }

    static @Nullable Integer parseCwe(final String cweId) {
        final String number = cweId.regionMatches(true, 0, CWE_PREFIX, 0, CWE_PREFIX.length())
                ? cweId.substring(CWE_PREFIX.length())
                : cweId;
        try {
            return Integer.valueOf(number);
        } catch (NumberFormatException e) {
            LOGGER.debug("Skipping malformed CWE ID: {}", cweId);
            return null;
        }
    }

    private static @Nullable Date toDate(final @Nullable Instant instant) {
        return instant != null ? Date.from(instant) : null;
    }

}
