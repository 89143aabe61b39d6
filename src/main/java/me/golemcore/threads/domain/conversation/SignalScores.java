package me.golemcore.threads.domain.conversation;

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
 * Per-signal breakdown of an assignment-affinity score. Every component is
 * non-negative, so the total never drops when a signal is added.
 */
public record SignalScores(double replyChain, double mentionAffinity, double temporal, double speakerContinuity,
        double lexicalOverlap) {

    public static final SignalScores NONE = new SignalScores(0.0, 0.0, 0.0, 0.0, 0.0);

    public double total() {
        return replyChain + mentionAffinity + temporal + speakerContinuity + lexicalOverlap;
    }
}
