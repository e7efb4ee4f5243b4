package me.golemcore.agentloop.port.outbound;

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

import java.util.concurrent.CompletableFuture;

/**
 * Port for append-only persistent storage. Abstracts storage backends (local
 * filesystem, etc.) used by telemetry sinks.
 */
public interface StoragePort {

    /**
     * Appends text content to an object, creating it and its directory if
     * absent. Concurrent appends never interleave within one call's content.
     */
    CompletableFuture<Void> appendText(String directory, String path, String content);
}
