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
package org.sbomgraph.config;

import org.eclipse.microprofile.config.Config;
import org.eclipse.microprofile.config.ConfigProvider;

import static java.util.Objects.requireNonNull;

/**
 * Typed access to the configuration of the component graph and its CycloneDX export.
 *
 * @since 1.0.0
 */
public final class SbomGraphConfig {

    static final String PROPERTY_NAMESPACE = "sbom-graph.property.namespace";
    static final String TOOL_VENDOR = "sbom-graph.tool.vendor";
    static final String TOOL_NAME = "sbom-graph.tool.name";
    static final String TOOL_VERSION = "sbom-graph.tool.version";
    static final String CYCLONEDX_SPEC_VERSION = "sbom-graph.cyclonedx.spec-version";
    static final String CYCLONEDX_PRETTY_PRINT = "sbom-graph.cyclonedx.pretty-print";

    private final Config config;

    public SbomGraphConfig(final Config config) {
        this.config = requireNonNull(config, "config must not be null");
    }

    /**
     * @return A {@link SbomGraphConfig} over the {@link Config} built by {@link SbomGraphConfigFactory}
     */
    public static SbomGraphConfig fromDefaultConfig() {
        return new SbomGraphConfig(ConfigProvider.getConfig());
    }

    /**
     * @return Prefix of the names of properties written by this tool, e.g. {@code sbom-graph:}
     */
    public String propertyNamespace() {
        return config.getValue(PROPERTY_NAMESPACE, String.class);
    }

    public String toolVendor() {
        return config.getValue(TOOL_VENDOR, String.class);
    }

    public String toolName() {
        return config.getValue(TOOL_NAME, String.class);
    }

    public String toolVersion() {
        return config.getValue(TOOL_VERSION, String.class);
    }

    /**
     * @return Version of the CycloneDX specification to export, e.g. {@code 1.6}
     */
    public String cycloneDxSpecVersion() {
        return config.getValue(CYCLONEDX_SPEC_VERSION, String.class);
    }

    public boolean cycloneDxPrettyPrint() {
        return config.getValue(CYCLONEDX_PRETTY_PRINT, Boolean.class);
    }

}
