package dev.mars.vigil.gate;

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


import dev.mars.vigil.core.exceptions.ResourceGateException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.channels.OverlappingFileLockException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Properties;
import java.util.concurrent.TimeUnit;

/**
 * Resource gate shared by every process that opens the same state directory.
 *
 * <h3>Layout</h3>
 * <pre>
 * &lt;state-dir&gt;/gate.manifest                  resource capacities the slots were built for
 * &lt;state-dir&gt;/&lt;resource&gt;/slot-&lt;n&gt;.lock       one file per unit of capacity
 * </pre>
 *
 * <p>A holder owns a unit of capacity while it holds an exclusive {@link FileLock} on one
 * slot file. The operating system drops file locks when the owning process exits, so a
 * crashed scan handler never keeps capacity away from the others.</p>
 *
 * <p>The manager calls {@link #create} once at start-up, which rebuilds the slots when the
 * manifest is missing or describes other capacities. Workers call {@link #attach}, which
 * fails when the manifest is missing or does not match. Removing the state directory
 * while the gate is in use makes every further acquire and release fail.</p>
 *
 * <p>File locks belong to the whole JVM, so only one gate instance per state directory
 * should be open in a process at a time.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public class SharedFileResourceGate implements ResourceGate {
    private static final Logger logger = LoggerFactory.getLogger(SharedFileResourceGate.class);

    static final String MANIFEST_FILE = "gate.manifest";
    private static final String MANIFEST_VERSION = "1";
    private static final long POLL_INTERVAL_MS = 50;

    private final Path stateDirectory;
    private final GateCapacities capacities;
    private final Map<ResourceType, SlotSet> slotSets = new EnumMap<>(ResourceType.class);
    private volatile boolean closed;

    private SharedFileResourceGate(Path stateDirectory, GateCapacities capacities) {
        this.stateDirectory = stateDirectory;
        this.capacities = capacities;
    }

    /**
     * Opens the gate under {@code stateDirectory}, building or rebuilding its slot files
     * when they do not match {@code capacities}.
     */
    public static SharedFileResourceGate create(Path stateDirectory, GateCapacities capacities)
            throws ResourceGateException {
        try {
            Files.createDirectories(stateDirectory);
            if (!capacities.equals(readManifest(stateDirectory))) {
                logger.info("Building resource gate at {} for {}", stateDirectory, capacities);
                rebuild(stateDirectory, capacities);
            }
        } catch (IOException e) {
            throw new ResourceGateException("Failed to create resource gate at " + stateDirectory, e);
        }
        return open(stateDirectory, capacities);
    }

    /**
     * Opens a gate previously built by {@link #create}.
     *
     * @throws ResourceGateException if the gate does not exist or was built for other capacities
     */
    public static SharedFileResourceGate attach(Path stateDirectory, GateCapacities capacities)
            throws ResourceGateException {
        GateCapacities existing;
        try {
            existing = readManifest(stateDirectory);
        } catch (IOException e) {
            throw new ResourceGateException("Failed to read resource gate manifest at " + stateDirectory, e);
        }
        if (existing == null) {
            throw new ResourceGateException("No resource gate found at " + stateDirectory);
        }
        if (!existing.equals(capacities)) {
            throw new ResourceGateException("Resource gate at " + stateDirectory + " was built for "
                    + existing + ", expected " + capacities);
        }
        return open(stateDirectory, capacities);
    }

    private static SharedFileResourceGate open(Path stateDirectory, GateCapacities capacities)
            throws ResourceGateException {
        SharedFileResourceGate gate = new SharedFileResourceGate(stateDirectory, capacities);
        try {
            for (ResourceType type : ResourceType.values()) {
                int capacity = capacities.get(type);
                if (capacity > 0) {
                    gate.slotSets.put(type, SlotSet.open(resourceDirectory(stateDirectory, type), capacity));
                }
            }
        } catch (IOException e) {
            gate.close();
            throw new ResourceGateException("Failed to open resource gate at " + stateDirectory, e);
        }
        logger.debug("Opened resource gate at {} with {}", stateDirectory, capacities);
        return gate;
    }

    @Override
    public AcquireStatus acquire(ResourceType resource, long timeoutSeconds) throws ResourceGateException {
        SlotSet slots = slotSets.get(resource);
        if (slots == null) {
            return AcquireStatus.ACQUIRED;
        }
        ensureOpen(resource);
        boolean bounded = timeoutSeconds > 0;
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(Math.max(timeoutSeconds, 0));
        while (true) {
            if (slots.tryClaim(resource)) {
                return AcquireStatus.ACQUIRED;
            }
            if (bounded && System.nanoTime() - deadline >= 0) {
                return AcquireStatus.TIMED_OUT;
            }
            try {
                Thread.sleep(POLL_INTERVAL_MS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new ResourceGateException("Interrupted while waiting for " + resource.getKey(), e);
            }
        }
    }

    @Override
    public void release(ResourceType resource) throws ResourceGateException {
        SlotSet slots = slotSets.get(resource);
        if (slots == null) {
            return;
        }
        ensureOpen(resource);
        slots.releaseOne(resource);
    }

    @Override
    public int getCapacity(ResourceType resource) {
        return capacities.get(resource);
    }

    public Path getStateDirectory() {
        return stateDirectory;
    }

    /**
     * Number of slots of {@code resource} held through this gate instance.
     */
    public int heldSlots(ResourceType resource) {
        SlotSet slots = slotSets.get(resource);
        return slots == null ? 0 : slots.heldCount();
    }

    @Override
    public void close() {
        closed = true;
        for (SlotSet slots : slotSets.values()) {
            slots.close();
        }
    }

    private void ensureOpen(ResourceType resource) throws ResourceGateException {
        if (closed) {
            throw new ResourceGateException("Resource gate for " + resource.getKey() + " has been closed");
        }
    }

    static Path resourceDirectory(Path stateDirectory, ResourceType type) {
        return stateDirectory.resolve(type.getKey());
    }

    private static GateCapacities readManifest(Path stateDirectory) throws IOException {
        Path manifest = stateDirectory.resolve(MANIFEST_FILE);
        if (!Files.isRegularFile(manifest)) {
            return null;
        }
        Properties properties = new Properties();
        try (InputStream input = Files.newInputStream(manifest)) {
            properties.load(input);
        }
        if (!MANIFEST_VERSION.equals(properties.getProperty("version"))) {
            return null;
        }
        GateCapacities.Builder builder = GateCapacities.builder();
        for (ResourceType type : ResourceType.values()) {
            String value = properties.getProperty(type.getKey() + ".capacity");
            if (value == null) {
                return null;
            }
            try {
                builder.capacity(type, Integer.parseInt(value.trim()));
            } catch (IllegalArgumentException e) {
                logger.warn("Ignoring malformed resource gate manifest {}: {}", manifest, e.getMessage());
                return null;
            }
        }
        return builder.build();
    }

    private static void rebuild(Path stateDirectory, GateCapacities capacities) throws IOException {
        for (ResourceType type : ResourceType.values()) {
            // A disabled resource keeps a single slot so the directory shape stays fixed.
            int slotCount = Math.max(capacities.get(type), 1);
            Path directory = resourceDirectory(stateDirectory, type);
            Files.createDirectories(directory);
            for (int i = 0; i < slotCount; i++) {
                Path slot = SlotSet.slotFile(directory, i);
                if (!Files.exists(slot)) {
                    Files.createFile(slot);
                }
            }
            for (int i = slotCount; Files.exists(SlotSet.slotFile(directory, i)); i++) {
                Files.delete(SlotSet.slotFile(directory, i));
            }
        }

        Properties manifest = new Properties();
        manifest.setProperty("version", MANIFEST_VERSION);
        for (ResourceType type : ResourceType.values()) {
            manifest.setProperty(type.getKey() + ".capacity", String.valueOf(capacities.get(type)));
        }
        Path temp = stateDirectory.resolve(MANIFEST_FILE + ".tmp");
        try (OutputStream output = Files.newOutputStream(temp)) {
            manifest.store(output, "Vigil resource gate");
        }
        Files.move(temp, stateDirectory.resolve(MANIFEST_FILE),
                StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
    }

    /**
     * The slot files of one resource and the locks this instance holds on them.
     */
    private static final class SlotSet {
        private final Path directory;
        private final List<Slot> slots;

        private SlotSet(Path directory, List<Slot> slots) {
            this.directory = directory;
            this.slots = slots;
        }

        static Path slotFile(Path directory, int index) {
            return directory.resolve("slot-" + index + ".lock");
        }

        static SlotSet open(Path directory, int capacity) throws IOException {
            List<Slot> slots = new ArrayList<>(capacity);
            try {
                for (int i = 0; i < capacity; i++) {
                    FileChannel channel = FileChannel.open(slotFile(directory, i),
                            StandardOpenOption.READ, StandardOpenOption.WRITE);
                    slots.add(new Slot(channel));
                }
            } catch (IOException e) {
                for (Slot slot : slots) {
                    slot.channel.close();
                }
                throw e;
            }
            return new SlotSet(directory, slots);
        }

        synchronized boolean tryClaim(ResourceType resource) throws ResourceGateException {
            checkPresent(resource);
            for (Slot slot : slots) {
                if (slot.lock != null) {
                    continue;
                }
                try {
                    FileLock lock = slot.channel.tryLock();
                    if (lock != null) {
                        slot.lock = lock;
                        slot.ownerThreadId = Thread.currentThread().getId();
                        return true;
                    }
                } catch (OverlappingFileLockException e) {
                    // held by another gate instance in this JVM
                } catch (IOException e) {
                    throw new ResourceGateException("Failed to lock a " + resource.getKey() + " slot", e);
                }
            }
            return false;
        }

        synchronized void releaseOne(ResourceType resource) throws ResourceGateException {
            checkPresent(resource);
            long threadId = Thread.currentThread().getId();
            Slot target = null;
            for (Slot slot : slots) {
                if (slot.lock != null && (target == null || slot.ownerThreadId == threadId)) {
                    target = slot;
                    if (slot.ownerThreadId == threadId) {
                        break;
                    }
                }
            }
            if (target == null) {
                logger.warn("Release of {} requested but no slot is held", resource.getKey());
                return;
            }
            try {
                target.lock.release();
            } catch (IOException e) {
                throw new ResourceGateException("Failed to unlock a " + resource.getKey() + " slot", e);
            } finally {
                target.lock = null;
            }
        }

        synchronized int heldCount() {
            int held = 0;
            for (Slot slot : slots) {
                if (slot.lock != null) {
                    held++;
                }
            }
            return held;
        }

        synchronized void close() {
            for (Slot slot : slots) {
                try {
                    slot.lock = null;
                    slot.channel.close();
                } catch (IOException e) {
                    logger.warn("Failed to close gate slot in {}: {}", directory, e.getMessage());
                }
            }
        }

        private void checkPresent(ResourceType resource) throws ResourceGateException {
            if (!Files.isDirectory(directory)) {
                throw new ResourceGateException("Resource gate state for " + resource.getKey()
                        + " is gone", new NoSuchFileException(directory.toString()));
            }
        }
    }

    private static final class Slot {
        private final FileChannel channel;
        private FileLock lock;
        private long ownerThreadId;

        Slot(FileChannel channel) {
            this.channel = channel;
        }
    }
}
