package me.golemcore.threads.domain.model;

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

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Classification of one inbound message, either from the external classifier
 * or from the local fallback.
 */
@Value
@Builder(toBuilder = true)
public class ClassificationResult {

    MessageClassification classification;
    double confidence;
    String reason;
    @Singular
    List<SecurityFlag> securityFlags;
    boolean fallbackUsed;

    /**
     * A high-severity flag mutes the sender.
     */
    public boolean shouldAutoMute() {
        return securityFlags.stream().anyMatch(flag -> flag.getSeverity() == SecurityFlag.Severity.HIGH);
    }

    public static ClassificationResult of(MessageClassification classification, double confidence,
            String reason) {
        return ClassificationResult.builder()
                .classification(classification)
                .confidence(confidence)
                .reason(reason)
                .build();
    }
}
