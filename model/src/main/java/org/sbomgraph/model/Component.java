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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Node of the component graph.
 * <p>
 * A component may be the child of more than one parent, in which case all parents
 * reference the same instance. Components compare by identity.
 *
 * @since 1.0.0
 */
public class Component {

    private @Nullable ComponentType type;
    private String name;
    private @Nullable String group;
    private @Nullable String version;
    private @Nullable PackageIdentifier packageIdentifier;
    private @Nullable String supplier;
    private List<String> licenses = Collections.emptyList();
    private List<Hash> hashes = Collections.emptyList();
    private List<Property> properties = Collections.emptyList();
    private List<DetectedVulnerability> vulnerabilities = Collections.emptyList();
    private final List<Component> children = new ArrayList<>();

    public @Nullable ComponentType getType() {
        return type;
    }

    public void setType(final @Nullable ComponentType type) {
        this.type = type;
    }

    public String getName() {
        return name;
    }

    public void setName(final String name) {
        this.name = name;
    }

    public @Nullable String getGroup() {
        return group;
    }

    public void setGroup(final @Nullable String group) {
        this.group = group;
    }

    public @Nullable String getVersion() {
        return version;
    }

    public void setVersion(final @Nullable String version) {
        this.version = version;
    }

    public @Nullable PackageIdentifier getPackageIdentifier() {
        return packageIdentifier;
    }

    public void setPackageIdentifier(final @Nullable PackageIdentifier packageIdentifier) {
        this.packageIdentifier = packageIdentifier;
    }

    public @Nullable String getSupplier() {
        return supplier;
    }

    public void setSupplier(final @Nullable String supplier) {
        this.supplier = supplier;
    }

    public List<String> getLicenses() {
        return licenses;
    }

    public void setLicenses(final List<String> licenses) {
        this.licenses = List.copyOf(licenses);
    }

    public List<Hash> getHashes() {
        return hashes;
    }

    public void setHashes(final List<Hash> hashes) {
        this.hashes = List.copyOf(hashes);
    }

    public List<Property> getProperties() {
        return properties;
    }

    public void setProperties(final List<Property> properties) {
        this.properties = List.copyOf(properties);
    }

    public List<DetectedVulnerability> getVulnerabilities() {
        return vulnerabilities;
    }

    public void setVulnerabilities(final List<DetectedVulnerability> vulnerabilities) {
        this.vulnerabilities = List.copyOf(vulnerabilities);
    }

    /**
     * @return Unmodifiable view of the children of this component, in insertion order
     */
    public List<Component> getChildren() {
        return Collections.unmodifiableList(children);
    }

    public void addChild(final Component child) {
        children.add(child);
    }

    public void addChildren(final List<Component> children) {
        this.children.addAll(children);
    }

    @Override
    public String toString() {
        return "Component{type=%s, group=%s, name=%s, version=%s}".formatted(type, group, name, version);
    }

}
