package dev.mars.vigil.storage;

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


import dev.mars.vigil.core.ReportHost;
import dev.mars.vigil.core.ResultType;
import dev.mars.vigil.core.RunStatus;
import dev.mars.vigil.core.ScanConfig;
import dev.mars.vigil.core.ScanReport;
import dev.mars.vigil.core.ScanResult;
import dev.mars.vigil.core.ScanTarget;
import dev.mars.vigil.core.ScanTask;
import dev.mars.vigil.core.ScannerRecord;
import dev.mars.vigil.core.UserHostAccess;
import dev.mars.vigil.credential.ScanCredential;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * {@link ScanStore} kept in memory. Suitable for tests and single-process deployments
 * that do not need the state to survive a restart.
 *
 * <p>Status updates that touch task and report together are serialized on the store so
 * the pair is never observed half-written.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public class InMemoryScanStore implements ScanStore {
    private static final Logger logger = LoggerFactory.getLogger(InMemoryScanStore.class);

    private final Map<String, ScanTask> tasks = new ConcurrentHashMap<>();
    private final Map<String, ScanTarget> targets = new ConcurrentHashMap<>();
    private final Map<String, ScannerRecord> scanners = new ConcurrentHashMap<>();
    private final Map<String, ScanConfig> configs = new ConcurrentHashMap<>();
    private final Map<String, ScanCredential> credentials = new ConcurrentHashMap<>();
    private final Map<String, UserHostAccess> hostAccess = new ConcurrentHashMap<>();
    private final Map<String, ScanReport> reports = new ConcurrentHashMap<>();
    private final Map<String, List<String>> reportsByTask = new ConcurrentHashMap<>();
    private final Map<String, Map<String, String>> assets = new ConcurrentHashMap<>();
    private final Map<String, QueuedScan> queue = new LinkedHashMap<>();

    // Population

    public void saveTask(ScanTask task) {
        tasks.put(task.getId(), task);
    }

    public void saveTarget(ScanTarget target) {
        targets.put(target.getId(), target);
    }

    public void saveScanner(ScannerRecord scanner) {
        scanners.put(scanner.getId(), scanner);
    }

    public void saveConfig(ScanConfig config) {
        configs.put(config.getId(), config);
    }

    public void saveCredential(ScanCredential credential) {
        credentials.put(credential.getId(), credential);
    }

    public void saveUserHostAccess(String ownerId, UserHostAccess access) {
        hostAccess.put(ownerId, access);
    }

    /**
     * Asset hosts imported so far, keyed by host address.
     */
    public Map<String, Map<String, String>> getAssetHosts() {
        return Collections.unmodifiableMap(assets);
    }

    // Lookups

    @Override
    public Optional<ScanTask> findTask(String taskId) {
        return Optional.ofNullable(taskId).map(tasks::get);
    }

    @Override
    public Optional<ScanTarget> findTarget(String targetId) {
        return Optional.ofNullable(targetId).map(targets::get);
    }

    @Override
    public Optional<ScannerRecord> findScanner(String scannerId) {
        return Optional.ofNullable(scannerId).map(scanners::get);
    }

    @Override
    public Optional<ScanConfig> findConfig(String configId) {
        return Optional.ofNullable(configId).map(configs::get);
    }

    @Override
    public Optional<ScanCredential> findCredential(String credentialId) {
        return Optional.ofNullable(credentialId).map(credentials::get);
    }

    @Override
    public Optional<ScanReport> findReport(String reportId) {
        return Optional.ofNullable(reportId).map(reports::get);
    }

    @Override
    public Optional<UserHostAccess> findUserHostAccess(String ownerId) {
        return Optional.ofNullable(ownerId).map(hostAccess::get);
    }

    // Run status and times

    @Override
    public RunStatus getTaskRunStatus(String taskId) {
        return task(taskId).getRunStatus();
    }

    @Override
    public synchronized void setRunStatus(String taskId, String reportId, RunStatus status) {
        ScanTask task = task(taskId);
        ScanReport report = report(reportId);
        task.setRunStatus(status);
        report.setRunStatus(status);
        logger.debug("Task {} / report {} -> {}", taskId, reportId, status);
    }

    @Override
    public synchronized void setTaskRunStatus(String taskId, RunStatus status) {
        task(taskId).setRunStatus(status);
    }

    @Override
    public void setTaskStartTime(String taskId, Instant time) {
        task(taskId).setStartTime(time);
    }

    @Override
    public void setTaskEndTime(String taskId, Instant time) {
        task(taskId).setEndTime(time);
    }

    @Override
    public void setReportScanStart(String reportId, Instant time) {
        report(reportId).setScanStart(time);
    }

    @Override
    public void setReportScanEnd(String reportId, Instant time) {
        report(reportId).setScanEnd(time);
    }

    // Reports

    @Override
    public Optional<ScanReport> findLastResumableReport(String taskId) {
        List<String> ids = reportsByTask.getOrDefault(taskId, Collections.emptyList());
        synchronized (ids) {
            for (int i = ids.size() - 1; i >= 0; i--) {
                ScanReport report = reports.get(ids.get(i));
                if (report != null && report.getRunStatus().isResumable()) {
                    return Optional.of(report);
                }
            }
        }
        return Optional.empty();
    }

    @Override
    public ScanReport createReport(String taskId, RunStatus status) {
        ScanTask task = task(taskId);
        ScanReport report = new ScanReport(UUID.randomUUID().toString(), taskId, status);
        reports.put(report.getId(), report);
        List<String> ids = reportsByTask.computeIfAbsent(taskId, id -> Collections.synchronizedList(new ArrayList<>()));
        ids.add(report.getId());
        task.setCurrentReportId(report.getId());
        logger.debug("Created report {} for task {}", report.getId(), taskId);
        return report;
    }

    @Override
    public void setCurrentReport(String taskId, String reportId) {
        report(reportId);
        task(taskId).setCurrentReportId(reportId);
    }

    @Override
    public void setReportProgress(String reportId, int progress) {
        report(reportId).setProgress(progress);
    }

    @Override
    public void addResult(String reportId, ScanResult result) {
        ScanReport report = report(reportId);
        report.addResult(result);
        if (!result.getHost().isEmpty()) {
            ReportHost host = report.host(result.getHost());
            if (!result.getHostname().isEmpty()) {
                host.putDetail("hostname", result.getHostname());
            }
        }
    }

    @Override
    public void addHostDetail(String reportId, String host, String name, String value) {
        report(reportId).host(host).putDetail(name, value);
    }

    @Override
    public void setHostStart(String reportId, String host, Instant time) {
        report(reportId).host(host).setStartTime(time);
    }

    @Override
    public void addFinishedHosts(String reportId, Collection<String> hosts) {
        ScanReport report = report(reportId);
        for (String host : hosts) {
            report.addFinishedHost(host);
        }
    }

    @Override
    public Set<String> getFinishedHosts(String reportId) {
        return report(reportId).getFinishedHosts();
    }

    @Override
    public void trimPartialReport(String reportId) {
        report(reportId).trimUnfinishedHosts();
        logger.debug("Trimmed unfinished hosts from report {}", reportId);
    }

    // Host post-processing

    @Override
    public void identifyHosts(String reportId) {
        for (ReportHost host : report(reportId).getHosts().values()) {
            host.putIdentifier("ip", host.getHost());
            Map<String, String> details = host.getDetails();
            for (String name : List.of("hostname", "MAC", "OS")) {
                String value = details.get(name);
                if (value != null && !value.isEmpty()) {
                    host.putIdentifier(name, value);
                }
            }
        }
    }

    @Override
    public void aggregateHostSeverity(String reportId) {
        ScanReport report = report(reportId);
        Map<String, Double> max = new LinkedHashMap<>();
        for (ScanResult result : report.getResults()) {
            if (result.getHost().isEmpty() || result.getType() == ResultType.ERROR) {
                continue;
            }
            max.merge(result.getHost(), result.getSeverity(), Math::max);
        }
        for (ReportHost host : report.getHosts().values()) {
            host.setMaxSeverity(max.getOrDefault(host.getHost(), ReportHost.NO_SEVERITY));
        }
    }

    @Override
    public void enrichHostDetails(String reportId) {
        for (ReportHost host : report(reportId).getHosts().values()) {
            String os = host.getDetails().get("OS");
            if (os != null && os.startsWith("cpe:")) {
                host.putDetail("best_os_cpe", os);
            }
            host.setDetailsEnriched(true);
        }
    }

    @Override
    public void setReportProcessingRequired(String reportId, boolean required, boolean inAssets) {
        report(reportId).setProcessingRequired(required, inAssets);
    }

    @Override
    public List<String> findReportsRequiringProcessing() {
        List<String> pending = new ArrayList<>();
        for (ScanReport report : reports.values()) {
            if (report.isProcessingRequired()) {
                pending.add(report.getId());
            }
        }
        pending.sort((a, b) -> compareScanEnd(reports.get(a), reports.get(b)));
        return pending;
    }

    @Override
    public void importReportAssets(String reportId) {
        ScanReport report = report(reportId);
        if (report.isInAssets()) {
            for (ReportHost host : report.getHosts().values()) {
                Map<String, String> asset = new LinkedHashMap<>(host.getIdentifiers());
                asset.put("max_severity", String.valueOf(host.getMaxSeverity()));
                assets.put(host.getHost(), asset);
            }
        }
        report.setProcessingRequired(false, report.isInAssets());
    }

    // Scan queue

    @Override
    public void enqueueScan(QueuedScan entry) {
        synchronized (queue) {
            queue.put(entry.getReportId(), entry);
        }
    }

    @Override
    public List<QueuedScan> listQueuedScans() {
        synchronized (queue) {
            return new ArrayList<>(queue.values());
        }
    }

    @Override
    public void updateQueuedScan(QueuedScan entry) {
        synchronized (queue) {
            if (queue.containsKey(entry.getReportId())) {
                queue.put(entry.getReportId(), entry);
            }
        }
    }

    @Override
    public void requeueScan(String reportId) {
        synchronized (queue) {
            QueuedScan entry = queue.remove(reportId);
            if (entry != null) {
                queue.put(reportId, entry.requeued(Instant.now()));
            }
        }
    }

    @Override
    public void removeQueuedScan(String reportId) {
        synchronized (queue) {
            queue.remove(reportId);
        }
    }

    private ScanTask task(String taskId) {
        ScanTask task = taskId == null ? null : tasks.get(taskId);
        if (task == null) {
            throw new IllegalArgumentException("Unknown task: " + taskId);
        }
        return task;
    }

    private ScanReport report(String reportId) {
        ScanReport report = reportId == null ? null : reports.get(reportId);
        if (report == null) {
            throw new IllegalArgumentException("Unknown report: " + reportId);
        }
        return report;
    }

    private static int compareScanEnd(ScanReport a, ScanReport b) {
        Instant ea = a.getScanEnd() == null ? Instant.MAX : a.getScanEnd();
        Instant eb = b.getScanEnd() == null ? Instant.MAX : b.getScanEnd();
        return ea.compareTo(eb);
    }
}
