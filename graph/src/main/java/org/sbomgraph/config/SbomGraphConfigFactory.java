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

import io.smallrye.config.ExpressionConfigSourceInterceptor;
import io.smallrye.config.ProfileConfigSourceInterceptor;
import io.smallrye.config.SmallRyeConfig;
import io.smallrye.config.SmallRyeConfigBuilder;
import io.smallrye.config.SmallRyeConfigFactory;
import io.smallrye.config.SmallRyeConfigProviderResolver;

import java.util.List;
import java.util.Map;

import static org.sbomgraph.config.SbomGraphConfig.CYCLONEDX_PRETTY_PRINT;
import static org.sbomgraph.config.SbomGraphConfig.CYCLONEDX_SPEC_VERSION;
import static org.sbomgraph.config.SbomGraphConfig.PROPERTY_NAMESPACE;
import static org.sbomgraph.config.SbomGraphConfig.TOOL_NAME;
import static org.sbomgraph.config.SbomGraphConfig.TOOL_VENDOR;
import static org.sbomgraph.config.SbomGraphConfig.TOOL_VERSION;

/**
 * Builds the {@link org.eclipse.microprofile.config.Config} returned by
 * {@link org.eclipse.microprofile.config.ConfigProvider#getConfig()}.
 * <p>
 * The {@code sbom-graph.*} defaults have the lowest priority, so any system property,
 * environment variable or {@code application.properties} entry overrides them.
 * <p>
 * Registered via {@code META-INF/services/io.smallrye.config.SmallRyeConfigFactory}.
 *
 * @since 1.0.0
 */
public final class SbomGraphConfigFactory extends SmallRyeConfigFactory {

    static final Map<String, String> DEFAULT_VALUES = Map.ofEntries(
            Map.entry(PROPERTY_NAMESPACE, "sbom-graph:"),
            Map.entry(TOOL_VENDOR, "OWASP"),
            Map.entry(TOOL_NAME, "sbom-graph"),
            Map.entry(TOOL_VERSION, "dev"),
            Map.entry(CYCLONEDX_SPEC_VERSION, "1.6"),
            Map.entry(CYCLONEDX_PRETTY_PRINT, "true"));

    // Selected via the smallrye.config.profile property, e.g. %test.sbom-graph.tool.version=1.0.0
    static final List<String> PROFILES = List.of("prod", "dev", "test");

    @Override
    public SmallRyeConfig getConfigFor(
            final SmallRyeConfigProviderResolver configProviderResolver,
            final ClassLoader classLoader) {
        return newConfigBuilder()
                .forClassLoader(classLoader)
                .addDefaultSources()
                .addDiscoveredSources()
                .addDiscoveredCustomizers()
                .build();
    }

    /**
     * Create a {@link SmallRyeConfigBuilder} that knows the {@code sbom-graph.*} defaults
     * and resolves {@code ${...}} expressions, but has no sources yet.
     * <p>
     * Default values added to the returned builder replace the built-in ones.
     *
     * @return A new {@link SmallRyeConfigBuilder}
     */
    public static SmallRyeConfigBuilder newConfigBuilder() {
        return new SmallRyeConfigBuilder()
                .withDefaultValues(DEFAULT_VALUES)
                .withInterceptors(new ExpressionConfigSourceInterceptor())
                .withInterceptors(new ProfileConfigSourceInterceptor(PROFILES));
    }

}
