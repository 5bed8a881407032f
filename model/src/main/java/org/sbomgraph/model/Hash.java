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

import org.jspecify.annotations.Nullable;

import java.util.Locale;

/**
 * Content digest of a {@link Component}.
 *
 * @param algorithm Lower-case name of the digest algorithm, e.g. {@code sha256}; empty if unknown
 * @param value     Hex-encoded digest
 * @since 1.0.0
 */
public record Hash(String algorithm, String value) {

    /**
     * @param digest A digest in {@code algorithm:hex} notation
     * @return The parsed {@link Hash}, or {@code null} when {@code digest} is empty
     */
    public static @Nullable Hash parse(final @Nullable String digest) {
        if (digest == null || digest.isEmpty()) {
            return null;
        }

        final int separatorIndex = digest.indexOf(':');
        if (separatorIndex < 0) {
            return new Hash("", digest);
        }

        return new Hash(
                digest.substring(0, separatorIndex).toLowerCase(Locale.ROOT),
                digest.substring(separatorIndex + 1));
    }

}
