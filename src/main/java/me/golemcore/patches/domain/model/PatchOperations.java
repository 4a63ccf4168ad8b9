package me.golemcore.patches.domain.model;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

/**
 * Operation types recorded by the built-in tools. The set is open: storage
 * treats the value as an opaque string, only {@link #DELETE} changes capture
 * semantics.
 */
public final class PatchOperations {

    public static final String WRITE = "write";
    public static final String EDIT = "edit";
    public static final String LINE_EDIT = "line_edit";
    public static final String DELETE = "delete";

    private PatchOperations() {
    }
}
