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

import org.sbomgraph.config.SbomGraphConfig;
import org.sbomgraph.model.Component;
import org.sbomgraph.model.Report;
import org.sbomgraph.model.Result;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static java.util.Objects.requireNonNull;

/**
 * Assembles the component graph of a {@link Report}.
 * <p>
 * The returned root component represents the scanned artifact. Its children are the
 * components of the report's results, in the order of the results. This also holds for
 * reports of CycloneDX documents, whose root is the document's metadata component.
 * <p>
 * Instances are stateless and may be shared across threads.
 *
 * @since 1.0.0
 */
public final class ComponentGraphAssembler {

    private static final Logger LOGGER = LoggerFactory.getLogger(ComponentGraphAssembler.class);

    private final RootComponentBuilder rootComponentBuilder;

    public ComponentGraphAssembler(final SbomGraphConfig config) {
        requireNonNull(config, "config must not be null");
        this.rootComponentBuilder = new RootComponentBuilder(config.propertyNamespace());
    }

    public ComponentGraphAssembler() {
        this(SbomGraphConfig.fromDefaultConfig());
    }

    /**
     * @param report The {@link Report} to assemble the graph for
     * @return The root {@link Component} of the graph
     * @throws ComponentGraphException When the root component could not be built
     */
    public Component assemble(final Report report) throws ComponentGraphException {
        requireNonNull(report, "report must not be null");

        final Component root = rootComponentBuilder.build(report);
        for (final Result result : report.results()) {
            root.addChildren(ResultComponentBuilder.build(result, report.metadata().os()));
        }

        LOGGER.debug("Assembled graph for {} with {} top-level components",
                report.artifactName(), root.getChildren().size());
        return root;
    }

}
