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

/**
 * Lifecycle state of a conversation thread.
 *
 * <p>
 * Threads move {@code ACTIVE -> STALE -> DEAD}. A stale thread that receives
 * new traffic goes back to {@code ACTIVE}. A closing phrase resolves an active
 * or stale thread, and resolved threads die like stale ones.
 */
public enum ThreadState {

    ACTIVE("active"), STALE("stale"), RESOLVED("resolved"), DEAD("dead");

    private final String label;

    ThreadState(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    public static ThreadState fromLabel(String label) {
        for (ThreadState state : values()) {
            if (state.label.equalsIgnoreCase(label)) {
                return state;
            }
        }
        throw new IllegalArgumentException("Unknown thread state: " + label);
    }

    /**
     * Live threads take part in assignment and respond-thread selection.
     */
    public boolean isLive() {
        return this == ACTIVE || this == STALE;
    }

    public boolean canTransitionTo(ThreadState target) {
        return switch (this) {
        case ACTIVE -> target == STALE || target == RESOLVED;
        case STALE -> target == ACTIVE || target == RESOLVED || target == DEAD;
        case RESOLVED -> target == DEAD;
        case DEAD -> false;
        };
    }
}
