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
import com.github.packageurl.PackageURLBuilder;
import org.jspecify.annotations.Nullable;
import org.sbomgraph.model.ImageConfig;
import org.sbomgraph.model.Metadata;
import org.testcontainers.utility.DockerImageName;

import java.util.Locale;
import java.util.regex.Pattern;

import static org.apache.commons.lang3.StringUtils.isNotBlank;

/**
 * Construction of {@code pkg:oci} package URLs for container images.
 *
 * @see <a href="https://github.com/package-url/purl-spec/blob/master/PURL-TYPES.rst#oci">PURL type oci</a>
 * @since 1.0.0
 */
public final class OciPackageUrls {

    static final String TYPE_OCI = "oci";
    static final String QUALIFIER_ARCH = "arch";
    static final String QUALIFIER_REPOSITORY_URL = "repository_url";

    static final String DEFAULT_REGISTRY = "index.docker.io";
    private static final String DOCKER_HUB_REGISTRY = "docker.io";
    private static final String DEFAULT_NAMESPACE = "library";

    private static final String DIGEST_ALGORITHM_PREFIX = "sha256:";
    private static final Pattern DIGEST_HEX_PATTERN = Pattern.compile("^[a-f0-9]{64}$");

    private OciPackageUrls() {
    }

    /**
     * Create the package URL of a container image, based on its first repository digest.
     *
     * @param metadata Metadata of the container image
     * @return The package URL, or {@code null} when the image has no repository digest
     * @throws MalformedPackageURLException When the repository digest is malformed
     */
    public static @Nullable PackageURL fromMetadata(final Metadata metadata) throws MalformedPackageURLException {
        if (metadata.repoDigests().isEmpty()) {
            return null;
        }

        final RepoDigest repoDigest = RepoDigest.parse(metadata.repoDigests().get(0));

        final String repository = repoDigest.repository();
        final String name = repository.substring(repository.lastIndexOf('/') + 1).toLowerCase(Locale.ROOT);

        final PackageURLBuilder builder = PackageURLBuilder.aPackageURL()
                .withType(TYPE_OCI)
                .withName(name)
                .withVersion(repoDigest.digest())
                .withQualifier(QUALIFIER_REPOSITORY_URL, repoDigest.registry() + "/" + repoDigest.repository());

        final ImageConfig imageConfig = metadata.imageConfig();
        if (imageConfig != null && isNotBlank(imageConfig.architecture())) {
            builder.withQualifier(QUALIFIER_ARCH, imageConfig.architecture());
        }

        return builder.build();
    }

    /**
     * A repository digest in {@code [registry/]repository[:tag]@sha256:hex} notation,
     * with Docker Hub references expanded to {@code index.docker.io/library/...}.
     */
    record RepoDigest(String registry, String repository, String digest) {

        static RepoDigest parse(final String repoDigest) throws MalformedPackageURLException {
            final DockerImageName imageName;
            try {
                imageName = DockerImageName.parse(stripTag(repoDigest));
                imageName.assertValid();
            } catch (IllegalArgumentException e) {
                final var exception = new MalformedPackageURLException("Invalid repository digest: " + repoDigest);
                exception.initCause(e);
                throw exception;
            }

            final String digest = imageName.getVersionPart();
            if (!digest.startsWith(DIGEST_ALGORITHM_PREFIX)
                    || !DIGEST_HEX_PATTERN.matcher(digest.substring(DIGEST_ALGORITHM_PREFIX.length())).matches()) {
                throw new MalformedPackageURLException(
                        "Repository digest %s does not reference a sha256 digest".formatted(repoDigest));
            }

            String registry = imageName.getRegistry();
            if (registry.isEmpty() || DOCKER_HUB_REGISTRY.equals(registry)) {
                registry = DEFAULT_REGISTRY;
            }

            String repository = imageName.getRepository();
            if (DEFAULT_REGISTRY.equals(registry) && repository.indexOf('/') < 0) {
                repository = DEFAULT_NAMESPACE + "/" + repository;
            }

            return new RepoDigest(registry, repository, digest);
        }

        // A tag next to the digest is redundant, e.g. alpine:3.15@sha256:...
        private static String stripTag(final String repoDigest) {
            final int digestIndex = repoDigest.indexOf('@');
            if (digestIndex < 0) {
                return repoDigest;
            }

            final String reference = repoDigest.substring(0, digestIndex);
            final int tagIndex = reference.lastIndexOf(':');
            if (tagIndex > reference.lastIndexOf('/')) {
                return reference.substring(0, tagIndex) + repoDigest.substring(digestIndex);
            }

            return repoDigest;
        }

    }

}
