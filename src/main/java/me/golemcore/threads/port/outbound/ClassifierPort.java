package me.golemcore.threads.port.outbound;

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

import me.golemcore.threads.domain.model.ClassificationRequest;
import me.golemcore.threads.domain.model.ClassificationResult;

import java.util.concurrent.CompletableFuture;

/**
 * External message classifier: decides whether a message should be answered,
 * kept as context or dropped, and reports security signals.
 */
public interface ClassifierPort {

    /**
     * Returns false when no classifier is configured; callers then use the
     * local fallback directly.
     */
    boolean isAvailable();

    CompletableFuture<ClassificationResult> classify(ClassificationRequest request);
}
