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

import com.fasterxml.jackson.annotation.JsonProperty;
import org.jspecify.annotations.Nullable;

import java.util.ArrayList;
import java.util.List;

import static java.util.Objects.requireNonNullElse;

/**
 * A single inventoried unit, as reported by a lock file parser or an OS package database.
 *
 * @param id              Natural ID of the package; may be empty, see {@link #effectiveId()}
 * @param name            Name of the package
 * @param version         Declared version of the package
 * @param release         Release of an OS package
 * @param epoch           Epoch of an OS package
 * @param arch            Architecture of an OS package
 * @param identifier      Structured identifier of the package, if one could be built
 * @param srcName         Name of the source package an OS package was built from
 * @param srcVersion      Version of the source package
 * @param srcRelease      Release of the source package
 * @param srcEpoch        Epoch of the source package
 * @param modularitylabel Modularity label of RPM packages
 * @param maintainer      Maintainer of the package
 * @param filePath        Path of the file the package was found in
 * @param layer           Image layer the package was found in
 * @param licenses        Licenses declared by the package
 * @param digest          Content digest in {@code algorithm:hex} notation
 * @param dependsOn       IDs of packages this package depends on
 * @param indirect        Whether the package is only present because another package depends on it
 * @since 1.0.0
 */
public record Package(
        @JsonProperty("ID") @Nullable String id,
        @JsonProperty("Name") String name,
        @JsonProperty("Version") @Nullable String version,
        @JsonProperty("Release") @Nullable String release,
        @JsonProperty("Epoch") int epoch,
        @JsonProperty("Arch") @Nullable String arch,
        @JsonProperty("Identifier") @Nullable Identifier identifier,
        @JsonProperty("SrcName") @Nullable String srcName,
        @JsonProperty("SrcVersion") @Nullable String srcVersion,
        @JsonProperty("SrcRelease") @Nullable String srcRelease,
        @JsonProperty("SrcEpoch") int srcEpoch,
        @JsonProperty("Modularitylabel") @Nullable String modularitylabel,
        @JsonProperty("Maintainer") @Nullable String maintainer,
        @JsonProperty("FilePath") @Nullable String filePath,
        @JsonProperty("Layer") @Nullable Layer layer,
        @JsonProperty("Licenses") List<String> licenses,
        @JsonProperty("Digest") @Nullable String digest,
        @JsonProperty("DependsOn") List<String> dependsOn,
        @JsonProperty("Indirect") boolean indirect) {

    /**
     * @param purl Package URL of the package in its string representation
     */
    public record Identifier(@JsonProperty("PURL") @Nullable String purl) {
    }

    public Package {
        licenses = List.copyOf(requireNonNullElse(licenses, List.of()));
        dependsOn = List.copyOf(requireNonNullElse(dependsOn, List.of()));
    }

    /**
     * @return The ID of this package, or {@code name@version} if the package has no natural ID
     */
    public String effectiveId() {
        if (id != null && !id.isEmpty()) {
            return id;
        }

        return "%s@%s".formatted(name, formattedVersion());
    }

    /**
     * @return The version of this package including its epoch and release, if any
     */
    public String formattedVersion() {
        String formatted = requireNonNullElse(version, "");
        if (release != null && !release.isEmpty()) {
            formatted = "%s-%s".formatted(formatted, release);
        }
        if (epoch != 0) {
            formatted = "%d:%s".formatted(epoch, formatted);
        }

        return formatted;
    }

    public @Nullable String purl() {
        return identifier != null ? identifier.purl() : null;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {

        private String id;
        private String name;
        private String version;
        private String release;
        private int epoch;
        private String arch;
        private String purl;
        private String srcName;
        private String srcVersion;
        private String srcRelease;
        private int srcEpoch;
        private String modularitylabel;
        private String maintainer;
        private String filePath;
        private Layer layer;
        private final List<String> licenses = new ArrayList<>();
        private String digest;
        private final List<String> dependsOn = new ArrayList<>();
        private boolean indirect;

        private Builder() {
        }

        public Builder id(final String id) {
            this.id = id;
            return this;
        }

        public Builder name(final String name) {
            this.name = name;
            return this;
        }

        public Builder version(final String version) {
            this.version = version;
            return this;
        }

        public Builder release(final String release) {
            this.release = release;
            return this;
        }

        public Builder epoch(final int epoch) {
            this.epoch = epoch;
            return this;
        }

        public Builder arch(final String arch) {
            this.arch = arch;
            return this;
        }

        public Builder purl(final String purl) {
            this.purl = purl;
            return this;
        }

        public Builder srcName(final String srcName) {
            this.srcName = srcName;
            return this;
        }

        public Builder srcVersion(final String srcVersion) {
            this.srcVersion = srcVersion;
            return this;
        }

        public Builder srcRelease(final String srcRelease) {
            this.srcRelease = srcRelease;
            return this;
        }

        public Builder srcEpoch(final int srcEpoch) {
            this.srcEpoch = srcEpoch;
            return this;
        }

        public Builder modularitylabel(final String modularitylabel) {
            this.modularitylabel = modularitylabel;
            return this;
        }

        public Builder maintainer(final String maintainer) {
            this.maintainer = maintainer;
            return this;
        }

        public Builder filePath(final String filePath) {
            this.filePath = filePath;
            return this;
        }

        public Builder layer(final String digest, final String diffId) {
            this.layer = new Layer(digest, diffId);
            return this;
        }

        public Builder licenses(final String... licenses) {
            this.licenses.addAll(List.of(licenses));
            return this;
        }

        public Builder digest(final String digest) {
            this.digest = digest;
            return this;
        }

        public Builder dependsOn(final String... ids) {
            this.dependsOn.addAll(List.of(ids));
            return this;
        }

        public Builder indirect(final boolean indirect) {
            this.indirect = indirect;
            return this;
        }

        public Package build() {
            return new Package(id, name, version, release, epoch, arch,
                    purl != null ? new Identifier(purl) : null,
                    srcName, srcVersion, srcRelease, srcEpoch, modularitylabel, maintainer,
                    filePath, layer, licenses, digest, dependsOn, indirect);
        }

    }

}
