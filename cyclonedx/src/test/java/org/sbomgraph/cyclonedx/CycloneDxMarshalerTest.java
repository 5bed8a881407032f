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

import com.github.packageurl.PackageURL;
import org.cyclonedx.model.Bom;
import org.cyclonedx.model.Dependency;
import org.cyclonedx.model.vulnerability.Vulnerability;
import org.junit.jupiter.api.Test;
import org.sbomgraph.model.Component;
import org.sbomgraph.model.ComponentType;
import org.sbomgraph.model.DetectedVulnerability;
import org.sbomgraph.model.Hash;
import org.sbomgraph.model.PackageIdentifier;
import org.sbomgraph.model.Property;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Date;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;
import static org.sbomgraph.cyclonedx.TestReports.ACCEPTS_REF;
import static org.sbomgraph.cyclonedx.TestReports.EXPRESS_REF;

class CycloneDxMarshalerTest {

    private static final Instant NOW = Instant.parse("2024-05-02T10:15:30Z");

    private final CycloneDxMarshaler marshaler = new CycloneDxMarshaler(
            TestReports.config(), Clock.fixed(NOW, ZoneOffset.UTC));

    private static List<String> dependencyRefs(final Bom bom, final String ref) {
        final Dependency dependency = bom.getDependencies().stream()
                .filter(dep -> ref.equals(dep.getRef()))
                .findFirst()
                .orElseThrow();
        if (dependency.getDependencies() == null) {
            return List.of();
        }

        return dependency.getDependencies().stream().map(Dependency::getRef).toList();
    }

    private static org.cyclonedx.model.Component component(final Bom bom, final String name) {
        return bom.getComponents().stream()
                .filter(component -> name.equals(component.getName()))
                .findFirst()
                .orElseThrow();
    }

    @Test
    void shouldMarshalNpmReport() throws Exception {
        final Bom bom = marshaler.marshal(TestReports.npmReport());

        assertThat(bom.getSerialNumber()).startsWith("urn:uuid:");
        assertThat(bom.getMetadata().getTimestamp()).isEqualTo(Date.from(NOW));
        assertThat(bom.getMetadata().getComponent().getName()).isEqualTo("/app");
        assertThat(bom.getMetadata().getComponent().getType()).isEqualTo(org.cyclonedx.model.Component.Type.APPLICATION);

        assertThat(bom.getComponents())
                .extracting(org.cyclonedx.model.Component::getName)
                .containsExactlyInAnyOrder("/app/package-lock.json", "express", "accepts");
        assertThat(bom.getComponents())
                .extracting(org.cyclonedx.model.Component::getBomRef)
                .isSorted();

        final org.cyclonedx.model.Component application = component(bom, "/app/package-lock.json");
        assertThat(application.getPurl()).isNull();
        assertThat(application.getProperties())
                .extracting(org.cyclonedx.model.Property::getName, org.cyclonedx.model.Property::getValue)
                .containsExactly(
                        tuple("acme:Class", "lang-pkgs"),
                        tuple("acme:Type", "npm"));

        final org.cyclonedx.model.Component express = component(bom, "express");
        assertThat(express.getBomRef()).isEqualTo(EXPRESS_REF);
        assertThat(express.getPurl()).isEqualTo(EXPRESS_REF);
        assertThat(express.getVersion()).isEqualTo("4.17.3");
        assertThat(express.getType()).isEqualTo(org.cyclonedx.model.Component.Type.LIBRARY);
        assertThat(express.getProperties())
                .extracting(org.cyclonedx.model.Property::getName)
                .containsExactly("acme:PkgID", "acme:PkgType");

        final String rootRef = bom.getMetadata().getComponent().getBomRef();
        assertThat(dependencyRefs(bom, rootRef)).containsExactly(application.getBomRef());
        assertThat(dependencyRefs(bom, application.getBomRef())).containsExactly(EXPRESS_REF);
        assertThat(dependencyRefs(bom, EXPRESS_REF)).containsExactly(ACCEPTS_REF);
        assertThat(dependencyRefs(bom, ACCEPTS_REF)).isEmpty();
        assertThat(bom.getDependencies()).hasSize(4);

        assertThat(bom.getVulnerabilities()).singleElement().satisfies(vuln -> {
            assertThat(vuln.getId()).isEqualTo("CVE-2022-24999");
            assertThat(vuln.getSource().getName()).isEqualTo("ghsa");
            assertThat(vuln.getSource().getUrl()).isEqualTo("https://github.com/advisories");
            assertThat(vuln.getRatings()).singleElement().satisfies(rating -> {
                assertThat(rating.getSeverity()).isEqualTo(Vulnerability.Rating.Severity.HIGH);
                assertThat(rating.getSource().getName()).isEqualTo("ghsa");
            });
            assertThat(vuln.getCwes()).containsExactly(1321);
            assertThat(vuln.getRecommendation()).isEqualTo("Upgrade accepts to version 1.3.9");
            assertThat(vuln.getAdvisories())
                    .extracting(Vulnerability.Advisory::getUrl)
                    .containsExactly("https://github.com/advisories/GHSA-hrpp-h998-j3pp");
            assertThat(vuln.getPublished()).isEqualTo(Date.from(Instant.parse("2022-11-26T22:15:00Z")));
            assertThat(vuln.getUpdated()).isEqualTo(Date.from(Instant.parse("2023-01-10T18:15:00Z")));
            assertThat(vuln.getAffects())
                    .extracting(Vulnerability.Affect::getRef)
                    .containsExactly(ACCEPTS_REF);
        });
    }

    @Test
    void shouldListSharedComponentsOnce() throws Exception {
        final Component root = library("root", "pkg:npm/root@1.0.0");
        final Component a = library("a", "pkg:npm/a@1.0.0");
        final Component b = library("b", "pkg:npm/b@1.0.0");
        final Component shared = library("shared", "pkg:npm/shared@1.0.0");
        root.addChildren(List.of(a, b));
        a.addChild(shared);
        b.addChild(shared);

        final Bom bom = marshaler.toBom(root);

        assertThat(bom.getComponents())
                .extracting(org.cyclonedx.model.Component::getName)
                .containsExactly("a", "b", "shared");
        assertThat(dependencyRefs(bom, "pkg:npm/a@1.0.0")).containsExactly("pkg:npm/shared@1.0.0");
        assertThat(dependencyRefs(bom, "pkg:npm/b@1.0.0")).containsExactly("pkg:npm/shared@1.0.0");
    }

    @Test
    void shouldMarshalCyclicGraph() throws Exception {
        final Component root = library("root", "pkg:npm/root@1.0.0");
        final Component a = library("a", "pkg:npm/a@1.0.0");
        final Component b = library("b", "pkg:npm/b@1.0.0");
        root.addChild(a);
        a.addChild(b);
        b.addChild(a);

        final Bom bom = marshaler.toBom(root);

        assertThat(bom.getComponents()).hasSize(2);
        assertThat(dependencyRefs(bom, "pkg:npm/a@1.0.0")).containsExactly("pkg:npm/b@1.0.0");
        assertThat(dependencyRefs(bom, "pkg:npm/b@1.0.0")).containsExactly("pkg:npm/a@1.0.0");
    }

    @Test
    void shouldAggregateVulnerabilitiesById() throws Exception {
        final Component root = library("root", "pkg:npm/root@1.0.0");
        final Component a = library("a", "pkg:npm/a@1.0.0");
        final Component b = library("b", "pkg:npm/b@1.0.0");
        a.setVulnerabilities(List.of(DetectedVulnerability.of("CVE-2024-0002", "a@1.0.0", "a", "1.0.0", "LOW")));
        b.setVulnerabilities(List.of(
                DetectedVulnerability.of("CVE-2024-0002", "b@1.0.0", "b", "1.0.0", "LOW"),
                DetectedVulnerability.of("CVE-2024-0001", "b@1.0.0", "b", "1.0.0", "bogus")));
        root.addChildren(List.of(b, a));

        final Bom bom = marshaler.toBom(root);

        assertThat(bom.getVulnerabilities())
                .extracting(Vulnerability::getId)
                .containsExactly("CVE-2024-0001", "CVE-2024-0002");
        assertThat(bom.getVulnerabilities().get(0).getRatings())
                .extracting(Vulnerability.Rating::getSeverity)
                .containsExactly(Vulnerability.Rating.Severity.UNKNOWN);
        assertThat(bom.getVulnerabilities().get(1).getAffects())
                .extracting(Vulnerability.Affect::getRef)
                .containsExactly("pkg:npm/a@1.0.0", "pkg:npm/b@1.0.0");
    }

    @Test
    void shouldConvertComponentDetails() throws Exception {
        final Component root = library("root", "pkg:npm/root@1.0.0");
        final var library = new Component();
        library.setType(ComponentType.LIBRARY);
        library.setGroup("com.acme");
        library.setName("lib");
        library.setVersion("2.3.0");
        library.setPackageIdentifier(new PackageIdentifier(
                new PackageURL("pkg:maven/com.acme/lib@2.3.0"), "app/lib-2.3.0.jar"));
        library.setSupplier("ACME Corp.");
        library.setLicenses(List.of("Apache-2.0", "MIT"));
        library.setHashes(List.of(
                new Hash("sha1", "a94a8fe5ccb19ba61c4c0873d391e987982fbbd3"),
                new Hash("sha512", "ffff")));
        library.setProperties(List.of(
                Property.of("SrcName", "lib"),
                new Property("custom:", "Owner", "team-a"),
                Property.of("FilePath", "app/lib-2.3.0.jar")));
        root.addChild(library);

        final Bom bom = marshaler.toBom(root);

        assertThat(bom.getComponents()).singleElement().satisfies(component -> {
            assertThat(new PackageURL(component.getBomRef()).getQualifiers())
                    .containsEntry("file_path", "app/lib-2.3.0.jar");
            assertThat(component.getPurl()).isEqualTo("pkg:maven/com.acme/lib@2.3.0");
            assertThat(component.getGroup()).isEqualTo("com.acme");
            assertThat(component.getSupplier().getName()).isEqualTo("ACME Corp.");
            assertThat(component.getLicenses().getLicenses())
                    .extracting(org.cyclonedx.model.License::getName)
                    .containsExactly("Apache-2.0", "MIT");
            assertThat(component.getHashes()).singleElement().satisfies(hash -> {
                assertThat(hash.getAlgorithm()).isEqualTo(org.cyclonedx.model.Hash.Algorithm.SHA1.getSpec());
                assertThat(hash.getValue()).isEqualTo("a94a8fe5ccb19ba61c4c0873d391e987982fbbd3");
            });
            assertThat(component.getProperties())
                    .extracting(org.cyclonedx.model.Property::getName)
                    .containsExactly("acme:FilePath", "acme:SrcName", "custom:Owner");
        });
    }

    @Test
    void shouldAssignRandomBomRefsToComponentsWithoutPurl() {
        final var component = new Component();
        component.setName("local");

        final String bomRef = CycloneDxMarshaler.bomRefOf(component);

        assertThat(bomRef).isNotBlank();
        assertThat(CycloneDxMarshaler.bomRefOf(component)).isNotEqualTo(bomRef);
    }

    @Test
    void shouldParseCweIds() {
        assertThat(CycloneDxMarshaler.parseCwe("CWE-79")).isEqualTo(79);
        assertThat(CycloneDxMarshaler.parseCwe("cwe-1321")).isEqualTo(1321);
        assertThat(CycloneDxMarshaler.parseCwe("NVD-CWE-Other")).isNull();
    }

    private static Component library(final String name, final String purl) throws Exception {
        final var component = new Component();
        component.setType(ComponentType.LIBRARY);
        component.setName(name);
        component.setVersion("1.0.0");
        component.setPackageIdentifier(PackageIdentifier.of(new PackageURL(purl)));
        return component;
    }

}
