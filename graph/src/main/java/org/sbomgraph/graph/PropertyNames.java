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

/**
 * Names of the properties written to components of the graph.
 *
 * @since 1.0.0
 */
public final class PropertyNames {

    public static final String SCHEMA_VERSION = "SchemaVersion";
    public static final String TYPE = "Type";
    public static final String CLASS = "Class";

    // Artifact
    public static final String SIZE = "Size";
    public static final String IMAGE_ID = "ImageID";
    public static final String REPO_DIGEST = "RepoDigest";
    public static final String DIFF_ID = "DiffID";
    public static final String REPO_TAG = "RepoTag";

    // Package
    public static final String PKG_ID = "PkgID";
    public static final String PKG_TYPE = "PkgType";
    public static final String SRC_NAME = "SrcName";
    public static final String SRC_VERSION = "SrcVersion";
    public static final String SRC_RELEASE = "SrcRelease";
    public static final String SRC_EPOCH = "SrcEpoch";
    public static final String MODULARITYLABEL = "Modularitylabel";
    public static final String FILE_PATH = "FilePath";
    public static final String LAYER_DIGEST = "LayerDigest";
    public static final String LAYER_DIFF_ID = "LayerDiffID";

    private PropertyNames() {
    }

}
