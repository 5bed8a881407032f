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
package org.sbomgraph.parser.report;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.sbomgraph.model.Report;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static java.util.Objects.requireNonNull;

/**
 * Reads {@link Report}s from their JSON representation.
 * <p>
 * Properties and enum constants that are not modelled are ignored.
 *
 * @since 1.0.0
 */
public final class ReportParser {

    private static final JsonMapper JSON_MAPPER = JsonMapper.builder()
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .enable(DeserializationFeature.READ_UNKNOWN_ENUM_VALUES_AS_NULL)
            .addModule(new JavaTimeModule())
            .build();

    public Report parse(final String json) {
        requireNonNull(json, "json must not be null");

        try {
            return JSON_MAPPER.readValue(json, Report.class);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to parse report", e);
        }
    }

    public Report parse(final InputStream inputStream) {
        requireNonNull(inputStream, "inputStream must not be null");

        try {
            return JSON_MAPPER.readValue(inputStream, Report.class);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to parse report", e);
        }
    }

    public Report parse(final Path path) {
        requireNonNull(path, "path must not be null");

        try (final InputStream inputStream = Files.newInputStream(path)) {
            return JSON_MAPPER.readValue(inputStream, Report.class);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to parse report from " + path, e);
        }
    }

}
