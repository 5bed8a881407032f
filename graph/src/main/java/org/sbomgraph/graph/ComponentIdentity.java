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

import com.github.packageurl.PackageURL;
import org.jspecify.annotations.Nullable;
import org.sbomgraph.model.Package;

/**
 * Name, namespace and version under which a {@link Package} is listed in the component graph.
 *
 * @param name      Name of the component
 * @param namespace Group of the component, or {@code null} if it has none
 * @param version   Version of the component
 * @since 1.0.0
 */
public record ComponentIdentity(String name, @Nullable String namespace, @Nullable String version) {

    /**
     * Derive the identity of a package.
     * <p>
     * When a package URL is available, its version takes precedence over the declared
     * version of the package. Maven packages use the group ID as namespace, npm packages
     * use their scope. Packages of all other ecosystems keep their name as-is, and have
     * no namespace.
     *
     * @param pkg  The {@link Package} to derive the identity for
     * @param purl The parsed package URL of {@code pkg}, if any
     * @return The {@link ComponentIdentity}
     */
    public static ComponentIdentity of(final Package pkg, final @Nullable PackageURL purl) {
        if (purl == null) {
            // Packages without PURL, e.g. local Go modules.
            return new ComponentIdentity(pkg.name(), null, pkg.version());
        }

        if (hasGroupingNamespace(purl)) {
            return new ComponentIdentity(purl.getName(), purl.getNamespace(), purl.getVersion());
        }

        return new ComponentIdentity(pkg.name(), null, purl.getVersion());
    }

    private static boolean hasGroupingNamespace(final PackageURL purl) {
        return PackageURL.StandardTypes.MAVEN.equals(purl.getType())
                || PackageURL.StandardTypes.NPM.equals(purl.getType());
    }

}
