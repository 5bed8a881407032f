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

import org.cyclonedx.Version;
import org.cyclonedx.exception.GeneratorException;
import org.cyclonedx.generators.BomGeneratorFactory;
import org.cyclonedx.model.Bom;
import org.sbomgraph.config.SbomGraphConfig;

import java.io.IOException;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;

import static java.util.Objects.requireNonNull;

/**
 * Serializes {@link Bom}s at the configured CycloneDX version.
 *
 * @since 1.0.0
 */
public final class CycloneDxWriter {

    private final Version version;
    private final boolean prettyPrint;

    /**
     * @param config The {@link SbomGraphConfig} to read the CycloneDX version and formatting from
     * @throws IllegalStateException When the configured CycloneDX version is not supported
     */
    public CycloneDxWriter(final SbomGraphConfig config) {
        requireNonNull(config, "config must not be null");
        this.version = resolveVersion(config.cycloneDxSpecVersion());
        this.prettyPrint = config.cycloneDxPrettyPrint();
    }

    public Version version() {
        return version;
    }

    /**
     * @throws IllegalStateException When the CycloneDX generator fails
     */
    public String write(final Bom bom, final BomFormat format) {
        requireNonNull(bom, "bom must not be null");
        requireNonNull(format, "format must not be null");

        return serialize(format, version, () -> switch (format) {
            case JSON -> BomGeneratorFactory.createJson(version, bom).toJsonString(prettyPrint);
            case XML -> BomGeneratorFactory.createXml(version, bom).toXmlString();
        });
    }

    public void write(final Bom bom, final BomFormat format, final OutputStream outputStream) {
        requireNonNull(outputStream, "outputStream must not be null");

        final String serializedBom = write(bom, format);
        try {
            outputStream.write(serializedBom.getBytes(StandardCharsets.UTF_8));
            outputStream.flush();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write BOM", e);
        }
    }

    static String serialize(final BomFormat format, final Version version, final Serializer serializer) {
        try {
            return serializer.serialize();
        } catch (GeneratorException e) {
            throw new IllegalStateException(
                    "Failed to serialize BOM as %s with spec version %s".formatted(format, version.getVersionString()), e);
        }
    }

    static Version resolveVersion(final String versionString) {
        for (final Version version : Version.values()) {
            if (version.getVersionString().equals(versionString)) {
                return version;
            }
        }

        throw new IllegalStateException("Unsupported CycloneDX spec version: " + versionString);
    }

    @FunctionalInterface
    interface Serializer {

        String serialize() throws GeneratorException;

    }

}
