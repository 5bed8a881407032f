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

import com.github.packageurl.MalformedPackageURLException;
import com.github.packageurl.PackageURL;
import org.junit.jupiter.api.Test;
import org.sbomgraph.model.ImageConfig;
import org.sbomgraph.model.Metadata;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatExceptionOfType;

class OciPackageUrlsTest {

    private static final String DIGEST = "sha256:21a3deaa0d32a8057914f36584b5288d2e5ecc984380bc0118285c70fa8c9300";

    private static Metadata metadata(final List<String> repoDigests, final String architecture) {
        return new Metadata(0, null, null, null, null, repoDigests, new ImageConfig(architecture, "linux"));
    }

    @Test
    void shouldBuildPurlForDockerHubImage() throws Exception {
        final PackageURL purl = OciPackageUrls.fromMetadata(metadata(List.of("alpine@" + DIGEST), "amd64"));

        assertThat(purl).isNotNull();
        assertThat(purl.getType()).isEqualTo("oci");
        assertThat(purl.getNamespace()).isNull();
        assertThat(purl.getName()).isEqualTo("alpine");
        assertThat(purl.getVersion()).isEqualTo(DIGEST);
        assertThat(purl.getQualifiers())
                .containsEntry("arch", "amd64")
                .containsEntry("repository_url", "index.docker.io/library/alpine");
    }

    @Test
    void shouldBuildPurlForCustomRegistry() throws Exception {
        final PackageURL purl = OciPackageUrls.fromMetadata(
                metadata(List.of("ghcr.io/acme/tools/scanner:1.0@" + DIGEST), null));

        assertThat(purl).isNotNull();
        assertThat(purl.getName()).isEqualTo("scanner");
        assertThat(purl.getQualifiers())
                .containsOnlyKeys("repository_url")
                .containsEntry("repository_url", "ghcr.io/acme/tools/scanner");
    }

    @Test
    void shouldUseFirstRepoDigest() throws Exception {
        final PackageURL purl = OciPackageUrls.fromMetadata(metadata(List.of(
                "docker.io/library/nginx@" + DIGEST,
                "quay.io/acme/nginx@sha256:" + "0".repeat(64)), "arm64"));

        assertThat(purl).isNotNull();
        assertThat(purl.getVersion()).isEqualTo(DIGEST);
        assertThat(purl.getQualifiers()).containsEntry("repository_url", "index.docker.io/library/nginx");
    }

    @Test
    void shouldBuildPurlForRegistryWithPort() throws Exception {
        final PackageURL purl = OciPackageUrls.fromMetadata(
                metadata(List.of("localhost:5000/acme/app@" + DIGEST), "amd64"));

        assertThat(purl).isNotNull();
        assertThat(purl.getName()).isEqualTo("app");
        assertThat(purl.getQualifiers()).containsEntry("repository_url", "localhost:5000/acme/app");
    }

    @Test
    void shouldRejectUpperCaseRepository() {
        assertThatExceptionOfType(MalformedPackageURLException.class)
                .isThrownBy(() -> OciPackageUrls.fromMetadata(metadata(List.of("Alpine@" + DIGEST), "amd64")))
                .withMessageContaining("Alpine@" + DIGEST)
                .withCauseInstanceOf(IllegalArgumentException.class);
        assertThatExceptionOfType(MalformedPackageURLException.class)
                .isThrownBy(() -> OciPackageUrls.fromMetadata(
                        metadata(List.of("ghcr.io/Acme/Scanner@" + DIGEST), "amd64")));
    }

    @Test
    void shouldReturnNullWithoutRepoDigests() throws Exception {
        assertThat(OciPackageUrls.fromMetadata(metadata(List.of(), "amd64"))).isNull();
    }

    @Test
    void shouldThrowForMalformedRepoDigest() {
        assertThatExceptionOfType(MalformedPackageURLException.class)
                .isThrownBy(() -> OciPackageUrls.fromMetadata(metadata(List.of("alpine"), "amd64")));
        assertThatExceptionOfType(MalformedPackageURLException.class)
                .isThrownBy(() -> OciPackageUrls.fromMetadata(metadata(List.of("alpine@sha256:xyz"), "amd64")));
        assertThatExceptionOfType(MalformedPackageURLException.class)
                .isThrownBy(() -> OciPackageUrls.fromMetadata(metadata(List.of("a@b@" + DIGEST), "amd64")));
        assertThatExceptionOfType(MalformedPackageURLException.class)
                .isThrownBy(() -> OciPackageUrls.fromMetadata(
                        metadata(List.of("alpine@sha256:" + "A".repeat(64)), "amd64")));
    }

}
