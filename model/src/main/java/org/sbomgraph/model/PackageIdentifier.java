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
package org.sbomgraph.model;

import com.github.packageurl.MalformedPackageURLException;
import com.github.packageurl.PackageURL;
import com.github.packageurl.PackageURLBuilder;
import org.jspecify.annotations.Nullable;

import java.util.Map;

import static java.util.Objects.requireNonNull;

/**
 * Package URL of a {@link Component}, together with the file it was found in.
 * <p>
 * The same package may be present multiple times in one artifact, e.g. the same JAR
 * at different paths. The file path keeps BOM references of such components unique.
 *
 * @param purl     The package URL
 * @param filePath Path of the file the package was found in, if any
 * @since 1.0.0
 */
public record PackageIdentifier(PackageURL purl, @Nullable String filePath) {

    static final String QUALIFIER_FILE_PATH = "file_path";

    public PackageIdentifier {
        requireNonNull(purl, "purl must not be null");
    }

    public static PackageIdentifier of(final PackageURL purl) {
        return new PackageIdentifier(purl, null);
    }

    /**
     * @return The canonical package URL, extended with a {@code file_path} qualifier when a file path is known
     */
    public String bomRef() {
        if (filePath == null || filePath.isEmpty()) {
            return purl.canonicalize();
        }

        final PackageURLBuilder builder = PackageURLBuilder.aPackageURL()
                .withType(purl.getType())
                .withNamespace(purl.getNamespace())
                .withName(purl.getName())
                .withVersion(purl.getVersion())
                .withSubpath(purl.getSubpath());
        final Map<String, String> qualifiers = purl.getQualifiers();
        if (qualifiers != null) {
            qualifiers.forEach(builder::withQualifier);
        }
        builder.withQualifier(QUALIFIER_FILE_PATH, filePath);

        try {
            return builder.build().canonicalize();
        } catch (MalformedPackageURLException e) {
            throw new IllegalStateException("Failed to add file path %s to %s".formatted(filePath, purl), e);
        }
    }

}
