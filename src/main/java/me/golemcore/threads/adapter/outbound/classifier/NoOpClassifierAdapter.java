package me.golemcore.threads.adapter.outbound.classifier;

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
import me.golemcore.threads.port.outbound.ClassifierPort;
import org.springframework.stereotype.Component;

import java.util.concurrent.CompletableFuture;

/**
 * Default classifier when no external one is wired: reports itself
 * unavailable so every message goes through the local relevance model.
 */
@Component
public class NoOpClassifierAdapter implements ClassifierPort {

    @Override
    public boolean isAvailable() {
        return false;
    }

    @Override
    public CompletableFuture<ClassificationResult> classify(ClassificationRequest request) {
        return CompletableFuture.failedFuture(new IllegalStateException("No classifier configured"));
    }
}
