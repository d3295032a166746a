package me.golemcore.tunebot.domain.service;

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

import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.tunebot.domain.model.MetadataSession;
import me.golemcore.tunebot.infrastructure.config.BotProperties;
import me.golemcore.tunebot.port.outbound.MetadataException;
import me.golemcore.tunebot.port.outbound.MetadataPort;
import org.springframework.stereotype.Service;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Owns the process-wide metadata session.
 *
 * <p>
 * The session is immutable and swapped atomically. Callers read
 * {@link #current()} once per attempt and hand the instance they read back to
 * {@link #reauthenticate(MetadataSession)}; a request against a session that
 * was already replaced is ignored, so concurrent failures cause one swap.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class MetadataSessionHolder {

    private final MetadataPort metadataPort;
    private final BotProperties properties;
    private final Clock clock;

    private final AtomicReference<MetadataSession> current = new AtomicReference<>();

    @PostConstruct
    public void init() {
        try {
            current.set(establish());
        } catch (MetadataException e) {
            log.warn("[Metadata] Could not establish session at startup, using anonymous: {}", e.getMessage());
            current.set(MetadataSession.anonymous(clock.instant()));
        }
    }

    public MetadataSession current() {
        MetadataSession session = current.get();
        if (session == null) {
            session = MetadataSession.anonymous(clock.instant());
            if (!current.compareAndSet(null, session)) {
                session = current.get();
            }
        }
        return session;
    }

    /**
     * Replaces {@code stale} with a freshly established session, falling back to
     * an anonymous one when the credentials no longer work.
     */
    public synchronized void reauthenticate(MetadataSession stale) throws MetadataException {
        if (stale != null && current.get() != stale) {
            log.debug("[Metadata] Session already replaced, skipping re-authentication");
            return;
        }
        MetadataSession fresh = establish();
        current.set(fresh);
        log.info("[Metadata] Session replaced (authenticated={})", fresh.isAuthenticated());
    }

    private MetadataSession establish() throws MetadataException {
        Path authFile = BotProperties.expandPath(properties.getMetadata().getAuthFile());
        if (Files.isRegularFile(authFile)) {
            try {
                MetadataSession session = metadataPort.authenticate(authFile);
                log.info("[Metadata] Authenticated session established from {}", authFile);
                return session;
            } catch (MetadataException e) {
                log.warn("[Metadata] Authentication with {} failed ({}), falling back to anonymous session",
                        authFile, e.getMessage());
            }
        } else {
            log.debug("[Metadata] No auth file at {}, using anonymous session", authFile);
        }
        return metadataPort.authenticate(null);
    }
}
