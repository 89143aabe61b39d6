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

import me.golemcore.threads.domain.model.FocusDirective;

import java.util.Optional;

/**
 * Tells the reply side which thread and person a per-thread reply is about.
 * The pipeline sets the focus before each per-thread reply and always clears
 * it afterwards.
 */
public interface FocusPort {

    void setFocus(FocusDirective directive);

    Optional<FocusDirective> currentFocus(String conversationKey);

    void clearFocus(String conversationKey);
}
