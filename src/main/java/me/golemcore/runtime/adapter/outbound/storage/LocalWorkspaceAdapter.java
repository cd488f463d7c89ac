package me.golemcore.runtime.adapter.outbound.storage;

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

import me.golemcore.runtime.domain.model.OperationException;
import me.golemcore.runtime.infrastructure.config.RuntimeProperties;
import me.golemcore.runtime.port.outbound.WorkspacePort;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.UnaryOperator;
import java.util.stream.Stream;

/**
 * Local filesystem implementation of {@link WorkspacePort}.
 *
 * <p>
 * Layout under the workspace root:
 * <ul>
 * <li>memory/ - long-term facts (MEMORY.md) and append-only history
 * (HISTORY.md)
 * <li>skills/ - one subdirectory per skill with a SKILL.md
 * <li>cron/ - the durable job store (jobs.json)
 * <li>HEARTBEAT.md - the heartbeat checklist
 * <li>.locks/ - lock files, hidden from listings
 * </ul>
 *
 * <p>
 * Each file is guarded by an in-process {@link ReentrantLock} (threads) and an
 * OS file lock on a sidecar file under {@code .locks/} (other processes, e.g.
 * the CLI adding a job while the daemon ticks). Whole-file writes go through a
 * fsynced temp file and an atomic rename.
 *
 * <p>
 * Root configured via {@code runtime.workspace.path}, defaults to
 * {@code ${user.home}/.golemcore/workspace}.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class LocalWorkspaceAdapter implements WorkspacePort {

    private static final String LOCK_DIR = ".locks";
    private static final String DIR_SUFFIX = "/";

    private final RuntimeProperties properties;

    private final Map<Path, ReentrantLock> locks = new ConcurrentHashMap<>();
    private Path root;

    @PostConstruct
    public void init() {
        String rootStr = properties.getWorkspace().getPath();
        this.root = Paths.get(rootStr.replace("${user.home}", System.getProperty("user.home")))
                .toAbsolutePath().normalize();

        try {
            Files.createDirectories(root);
            for (String dir : List.of("memory", properties.getWorkspace().getSkillsDirectory(), "cron", LOCK_DIR)) {
                Files.createDirectories(root.resolve(dir));
            }
            log.info("[Workspace] Initialized at: {}", root);
        } catch (IOException e) {
            throw OperationException.infrastructure("Workspace unreachable: " + root, e);
        }
    }

    @Override
    public Path getRoot() {
        return root;
    }

    @Override
    public Path resolve(String path) {
        String relative = path == null || path.isBlank() ? "." : path;
        Path resolved = root.resolve(relative).normalize();
        if (!resolved.startsWith(root)) {
            throw OperationException.validation("path", "Path outside workspace: " + path);
        }
        if (resolved.startsWith(root.resolve(LOCK_DIR))) {
            throw OperationException.validation("path", "Reserved path: " + path);
        }
        return resolved;
    }

    @Override
    public String read(String path) {
        Path file = resolve(path);
        return withLock(file, () -> readUnlocked(file));
    }

    @Override
    public void append(String path, String text) {
        Path file = resolve(path);
        byte[] bytes = text.getBytes(StandardCharsets.UTF_8);
        withLock(file, () -> {
            createParent(file);
            try (FileChannel channel = FileChannel.open(file,
                    StandardOpenOption.CREATE, StandardOpenOption.WRITE, StandardOpenOption.APPEND)) {
                ByteBuffer buffer = ByteBuffer.wrap(bytes);
                while (buffer.hasRemaining()) {
                    channel.write(buffer);
                }
                channel.force(false);
            } catch (IOException e) {
                throw OperationException.infrastructure("Append failed: " + path, e);
            }
            return null;
        });
    }

    @Override
    public void write(String path, String content) {
        readModifyWrite(path, current -> content);
    }

    @Override
    public String readModifyWrite(String path, UnaryOperator<String> transform) {
        Path file = resolve(path);
        return withLock(file, () -> {
            String current = readUnlocked(file);
            String updated = transform.apply(current);
            if (updated == current) { // NOSONAR - identity check: same instance means unchanged
                return current;
            }
            if (updated == null) {
                throw OperationException.validation("content", "Transform returned null for " + path);
            }
            writeAtomic(file, updated);
            return updated;
        });
    }

    @Override
    public boolean exists(String path) {
        return Files.exists(resolve(path));
    }

    @Override
    public boolean isDirectory(String path) {
        return Files.isDirectory(resolve(path));
    }

    @Override
    public List<String> list(String directory) {
        Path dir = resolve(directory);
        if (!Files.isDirectory(dir)) {
            return List.of();
        }
        try (Stream<Path> entries = Files.list(dir)) {
            return entries
                    .filter(p -> !p.getFileName().toString().equals(LOCK_DIR))
                    .filter(p -> !p.getFileName().toString().endsWith(".tmp"))
                    .map(p -> Files.isDirectory(p)
                            ? p.getFileName() + DIR_SUFFIX
                            : p.getFileName().toString())
                    .sorted()
                    .toList();
        } catch (IOException e) {
            throw OperationException.infrastructure("List failed: " + directory, e);
        }
    }

    private String readUnlocked(Path file) {
        try {
            return Files.readString(file, StandardCharsets.UTF_8);
        } catch (NoSuchFileException e) {
            return null;
        } catch (IOException e) {
            throw OperationException.infrastructure("Read failed: " + root.relativize(file), e);
        }
    }

    private void writeAtomic(Path target, String content) {
        Path tempPath = target.resolveSibling(target.getFileName() + ".tmp");
        try {
            createParent(target);

            byte[] bytes = content.getBytes(StandardCharsets.UTF_8);
            try (FileChannel channel = FileChannel.open(tempPath,
                    StandardOpenOption.CREATE, StandardOpenOption.WRITE, StandardOpenOption.TRUNCATE_EXISTING)) {
                ByteBuffer buffer = ByteBuffer.wrap(bytes);
                while (buffer.hasRemaining()) {
                    channel.write(buffer);
                }
                channel.force(true); // fsync: metadata + data
            }

            try {
                Files.move(tempPath, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                log.warn("[Workspace] Atomic move not supported, using regular move");
                Files.move(tempPath, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            try {
                Files.deleteIfExists(tempPath);
            } catch (IOException cleanupEx) {
                log.warn("[Workspace] Failed to cleanup temp file: {}", tempPath);
            }
            throw OperationException.infrastructure("Atomic write failed: " + root.relativize(target), e);
        }
    }

    private void createParent(Path file) {
        Path parent = file.getParent();
        if (parent == null) {
            return;
        }
        try {
            Files.createDirectories(parent);
        } catch (IOException e) {
            throw OperationException.infrastructure("Failed to create directory: " + parent, e);
        }
    }

    private <T> T withLock(Path file, LockedAction<T> action) {
        Path lockFile = lockFileFor(file);
        // keyed by lock file: two paths sharing one must not both try to lock it
        ReentrantLock lock = locks.computeIfAbsent(lockFile, k -> new ReentrantLock());
        lock.lock();
        try (FileChannel lockChannel = FileChannel.open(lockFile,
                StandardOpenOption.CREATE, StandardOpenOption.WRITE);
                FileLock ignored = lockChannel.lock()) {
            return action.run();
        } catch (IOException e) {
            throw OperationException.infrastructure("Failed to lock " + root.relativize(file), e);
        } finally {
            lock.unlock();
        }
    }

    private Path lockFileFor(Path file) {
        String name = root.relativize(file).toString().replace('/', '_').replace('\\', '_');
        return root.resolve(LOCK_DIR).resolve(name + ".lock");
    }

    @FunctionalInterface
    private interface LockedAction<T> {
        T run();
    }
}
