package dev.mars.vigil.manager.launch;

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


import dev.mars.vigil.config.VigilConfiguration;
import dev.mars.vigil.core.ScanConfig;
import dev.mars.vigil.core.ScanTarget;
import dev.mars.vigil.core.ScanTask;
import dev.mars.vigil.core.UserHostAccess;
import dev.mars.vigil.core.exceptions.CredentialException;
import dev.mars.vigil.core.exceptions.ScanException;
import dev.mars.vigil.scanner.ScanStartRequest;
import dev.mars.vigil.scanner.TargetCredential;
import dev.mars.vigil.scanner.VtSelection;
import dev.mars.vigil.storage.ScanStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.StringJoiner;

/**
 * Builds the start request for a scan from its task, target and scan config.
 *
 * <p>Hosts already finished by a resumed report are excluded. Server preferences with
 * yes/no values are sent as 1/0 and {@code timeout.*} preferences are not sent. VT
 * preferences are stored as {@code oid:prefId:type:name} and are normalised by type:
 * checkboxes become 1/0, radio buttons send their first option, file values are sent
 * base64 encoded.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public class ScanRequestAssembler {

    private static final Logger logger = LoggerFactory.getLogger(ScanRequestAssembler.class);

    public static final String EMPTY_VT_LIST = "Exiting because VT list is empty (e.g. feed not synced yet)";

    static final String OPTION_MAX_CHECKS = "max_checks";
    static final String OPTION_MAX_HOSTS = "max_hosts";
    static final String OPTION_HOSTS_ORDERING = "hosts_ordering";
    static final String OPTION_HOSTS_ALLOW = "hosts_allow";
    static final String OPTION_HOSTS_DENY = "hosts_deny";

    private final ScanStore store;
    private final TargetCredentialAssembler credentialAssembler;
    private final VigilConfiguration config;

    public ScanRequestAssembler(ScanStore store, TargetCredentialAssembler credentialAssembler,
                                VigilConfiguration config) {
        this.store = store;
        this.credentialAssembler = credentialAssembler;
        this.config = config;
    }

    public ScanStartRequest assemble(ScanTask task, ScanTarget target, String scanId,
                                     Collection<String> finishedHosts) throws ScanException {
        ScanConfig scanConfig = store.findConfig(task.getConfigId())
                .orElseThrow(() -> new ScanException(scanId, "Scan config " + task.getConfigId() + " not found"));
        if (scanConfig.getVtOids().isEmpty()) {
            throw new ScanException(scanId, EMPTY_VT_LIST);
        }

        ScanStartRequest.Builder request = ScanStartRequest.builder()
                .scanId(scanId)
                .hosts(target.getHosts())
                .ports(target.getPortRange())
                .excludeHosts(joinHosts(target.getExcludeHosts(), finishedHosts))
                .finishedHosts(joinHosts("", finishedHosts))
                .aliveTests(target.getAliveTests().orElse(null))
                .reverseLookupOnly(target.isReverseLookupOnly())
                .reverseLookupUnify(target.isReverseLookupUnify());

        try {
            for (TargetCredential credential : credentialAssembler.forTarget(target)) {
                request.credential(credential);
            }
        } catch (CredentialException e) {
            throw new ScanException(scanId, e.getMessage(), e);
        }

        for (VtSelection vt : selectVts(scanConfig).values()) {
            request.vt(vt);
        }

        addServerPreferences(request, scanConfig.getServerPreferences());
        addHostAccess(request, task.getOwnerId());

        request.scannerOption(OPTION_MAX_CHECKS,
                task.getPreference(ScanTask.PREF_MAX_CHECKS).orElse(String.valueOf(config.getMaxChecks())));
        request.scannerOption(OPTION_MAX_HOSTS,
                task.getPreference(ScanTask.PREF_MAX_HOSTS).orElse(String.valueOf(config.getMaxHosts())));
        Optional<String> ordering = task.getHostsOrdering();
        ordering.ifPresent(value -> request.scannerOption(OPTION_HOSTS_ORDERING, value));

        return request.build();
    }

    private Map<String, VtSelection> selectVts(ScanConfig scanConfig) {
        Map<String, VtSelection> vts = new LinkedHashMap<>();
        for (String oid : scanConfig.getVtOids()) {
            vts.put(oid, new VtSelection(oid));
        }

        for (Map.Entry<String, String> preference : scanConfig.getVtPreferences().entrySet()) {
            String[] parts = preference.getKey().split(":", 4);
            if (parts.length < 4) {
                logger.warn("Skipping VT preference with malformed key '{}'", preference.getKey());
                continue;
            }
            VtSelection vt = vts.get(parts[0]);
            if (vt == null) {
                continue;
            }
            vt.putPreference(parts[1], normaliseVtPreference(parts[2], preference.getValue()));
        }
        return vts;
    }

    static String normaliseVtPreference(String type, String value) {
        String raw = value != null ? value : "";
        switch (type) {
            case "checkbox":
                return "yes".equals(raw) ? "1" : "0";
            case "radio":
                int separator = raw.indexOf(';');
                return separator >= 0 ? raw.substring(0, separator) : raw;
            case "file":
                return Base64.getEncoder().encodeToString(raw.getBytes(StandardCharsets.UTF_8));
            default:
                return raw;
        }
    }

    private void addServerPreferences(ScanStartRequest.Builder request, Map<String, String> preferences) {
        for (Map.Entry<String, String> preference : preferences.entrySet()) {
            String name = preference.getKey();
            if (name.startsWith("timeout.")) {
                logger.warn("Not sending scanner preference '{}'", name);
                continue;
            }
            request.scannerOption(name, normaliseServerPreference(preference.getValue()));
        }
    }

    static String normaliseServerPreference(String value) {
        if ("yes".equals(value)) {
            return "1";
        }
        if ("no".equals(value)) {
            return "0";
        }
        return value != null ? value : "";
    }

    private void addHostAccess(ScanStartRequest.Builder request, String ownerId) {
        if (ownerId == null) {
            return;
        }
        Optional<UserHostAccess> access = store.findUserHostAccess(ownerId);
        if (access.isPresent() && !access.get().getHosts().isEmpty()) {
            request.scannerOption(access.get().isAllow() ? OPTION_HOSTS_ALLOW : OPTION_HOSTS_DENY,
                    access.get().getHosts());
        }
    }

    private static String joinHosts(String base, Collection<String> extra) {
        StringJoiner joiner = new StringJoiner(",");
        if (base != null && !base.isBlank()) {
            joiner.add(base);
        }
        for (String host : extra) {
            joiner.add(host);
        }
        return joiner.toString();
    }
}
