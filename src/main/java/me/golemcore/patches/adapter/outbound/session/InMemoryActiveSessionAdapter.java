package me.golemcore.patches.adapter.outbound.session;

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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.patches.port.outbound.ActiveSessionPort;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Holds the active session id in memory. The host sets it when a conversation
 * is started or resumed and then notifies the undo subsystem via
 * {@code UndoPort.onSessionChange()}.
 */
@Component
@Slf4j
public class InMemoryActiveSessionAdapter implements ActiveSessionPort {

    private final AtomicReference<String> activeSessionId = new AtomicReference<>();

    @Override
    public Optional<String> getActiveSessionId() {
        return Optional.ofNullable(activeSessionId.get());
    }

    public void activate(String sessionId) {
        if (sessionId == null || sessionId.isBlank()) {
            throw new IllegalArgumentException("sessionId must not be blank");
        }
        String previous = activeSessionId.getAndSet(sessionId);
        log.info("[Session] Active session: {} -> {}", previous, sessionId);
    }

    public void deactivate() {
        String previous = activeSessionId.getAndSet(null);
        if (previous != null) {
            log.info("[Session] Session {} deactivated", previous);
        }
    }
}
