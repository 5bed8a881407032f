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

import org.junit.jupiter.api.Test;
import org.sbomgraph.model.Component;
import org.sbomgraph.model.ComponentType;
import org.sbomgraph.model.OperatingSystem;
import org.sbomgraph.model.Package;
import org.sbomgraph.model.Property;
import org.sbomgraph.model.Result;
import org.sbomgraph.model.ResultClass;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ResultComponentBuilderTest {

    @Test
    void shouldGroupLanguagePackagesBelowApplication() {
        final Result result = new Result("/app/package-lock.json", ResultClass.LANG_PKGS, "npm", List.of(
                Package.builder()
                        .id("express@4.17.3")
                        .name("express")
                        .version("4.17.3")
                        .purl("pkg:npm/express@4.17.3")
                        .dependsOn("accepts@1.3.8")
                        .build(),
                Package.builder()
                        .id("accepts@1.3.8")
                        .name("accepts")
                        .version("1.3.8")
                        .purl("pkg:npm/accepts@1.3.8")
                        .indirect(true)
                        .build()), List.of());

        final List<Component> components = ResultComponentBuilder.build(result, null);

        assertThat(components).singleElement().satisfies(application -> {
            assertThat(application.getType()).isEqualTo(ComponentType.APPLICATION);
            assertThat(application.getName()).isEqualTo("/app/package-lock.json");
            assertThat(application.getProperties()).containsExactly(
                    Property.of(PropertyNames.TYPE, "npm"),
                    Property.of(PropertyNames.CLASS, "lang-pkgs"));
            assertThat(application.getChildren()).singleElement().satisfies(express -> {
                assertThat(express.getName()).isEqualTo("express");
                assertThat(express.getVersion()).isEqualTo("4.17.3");
                assertThat(express.getChildren()).singleElement().satisfies(accepts -> {
                    assertThat(accepts.getName()).isEqualTo("accepts");
                    assertThat(accepts.getVersion()).isEqualTo("1.3.8");
                });
            });
        });
    }

    @Test
    void shouldGroupOsPackagesBelowOperatingSystem() {
        final Result result = new Result("alpine:3.15 (alpine 3.15)", ResultClass.OS_PKGS, "alpine", List.of(
                Package.builder()
                        .name("bash")
                        .version("4.12")
                        .build()), List.of());

        final List<Component> components = ResultComponentBuilder.build(
                result, new OperatingSystem("alpine", "3.15", false));

        assertThat(components).singleElement().satisfies(os -> {
            assertThat(os.getType()).isEqualTo(ComponentType.OPERATING_SYSTEM);
            assertThat(os.getName()).isEqualTo("alpine");
            assertThat(os.getVersion()).isEqualTo("3.15");
            assertThat(os.getProperties()).containsExactly(
                    Property.of(PropertyNames.TYPE, "alpine"),
                    Property.of(PropertyNames.CLASS, "os-pkgs"));
            assertThat(os.getChildren()).singleElement().satisfies(bash -> {
                assertThat(bash.getName()).isEqualTo("bash");
                assertThat(bash.getVersion()).isEqualTo("4.12");
            });
        });
    }

    @Test
    void shouldNameOperatingSystemAfterTargetWhenOsIsUnknown() {
        final Result result = new Result("debian", ResultClass.OS_PKGS, "debian", List.of(), List.of());

        final List<Component> components = ResultComponentBuilder.build(result, null);

        assertThat(components).singleElement().satisfies(os -> {
            assertThat(os.getName()).isEqualTo("debian");
            assertThat(os.getVersion()).isNull();
            assertThat(os.getChildren()).isEmpty();
        });
    }

    @Test
    void shouldNotGroupUngroupedPackageTypes() {
        final Result result = new Result("Java", ResultClass.LANG_PKGS, "jar", List.of(
                Package.builder()
                        .name("org.apache.logging.log4j:log4j-core")
                        .version("2.17.1")
                        .purl("pkg:maven/org.apache.logging.log4j/log4j-core@2.17.1")
                        .filePath("app/log4j-core-2.17.1.jar")
                        .build()), List.of());

        final List<Component> components = ResultComponentBuilder.build(result, null);

        assertThat(components).singleElement().satisfies(library -> {
            assertThat(library.getType()).isEqualTo(ComponentType.LIBRARY);
            assertThat(library.getGroup()).isEqualTo("org.apache.logging.log4j");
            assertThat(library.getName()).isEqualTo("log4j-core");
        });
    }

    @Test
    void shouldIgnoreOtherResultClasses() {
        final Result result = new Result("Dockerfile", ResultClass.CONFIG, "dockerfile", List.of(), List.of());

        assertThat(ResultComponentBuilder.build(result, null)).isEmpty();
    }

}
