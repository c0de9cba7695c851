package dev.mars.vigil.credential;

/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
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
 */


import dev.mars.vigil.core.exceptions.CredentialException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumMap;
import java.util.Map;

/**
 * Picks the {@link CredentialSource} for a credential by its kind.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public class CredentialSourceRegistry {
    private static final Logger logger = LoggerFactory.getLogger(CredentialSourceRegistry.class);

    private final Map<CredentialKind, CredentialSource> sources = new EnumMap<>(CredentialKind.class);

    /**
     * Registry with the local store registered.
     */
    public CredentialSourceRegistry() {
        register(new LocalCredentialStore());
    }

    public void register(CredentialSource source) {
        for (CredentialKind kind : source.getSupportedKinds()) {
            sources.put(kind, source);
        }
        logger.debug("Registered credential source {} for {}", source.getClass().getSimpleName(),
                source.getSupportedKinds());
    }

    public boolean isSupported(CredentialKind kind) {
        return sources.containsKey(kind);
    }

    public CredentialSource sourceFor(ScanCredential credential) throws CredentialException {
        CredentialSource source = sources.get(credential.getKind());
        if (source == null) {
            throw new CredentialException(credential.getId(),
                    "No credential source configured for type " + credential.getKind().getCode());
        }
        return source;
    }

    public AuthData fetch(ScanCredential credential) throws CredentialException {
        return sourceFor(credential).fetch(credential);
    }
}
