package me.golemcore.sentinel.adapter.outbound.storage;

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

import me.golemcore.sentinel.infrastructure.config.SentinelProperties;
import me.golemcore.sentinel.port.outbound.StoragePort;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.stream.Stream;

/**
 * Local filesystem implementation of StoragePort.
 *
 * <p>
 * Stores everything under a workspace directory; the feedback store writes to
 * {@code feedback/} with date-partitioned logs, daily reports under
 * {@code feedback/reports/} and the rolling learning insights document.
 *
 * <p>
 * Base path configured via {@code sentinel.storage.local.base-path}, defaults
 * to {@code ${user.home}/.golemcore/sentinel}.
 *
 * @see me.golemcore.sentinel.port.outbound.StoragePort
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class LocalStorageAdapter implements StoragePort {

    private final SentinelProperties properties;

    private Path basePath;

    @PostConstruct
    public void init() {
        String basePathStr = properties.getStorage().getLocal().getBasePath();
        this.basePath = Paths.get(basePathStr.replace("${user.home}", System.getProperty("user.home")))
                .toAbsolutePath().normalize();

        try {
            Files.createDirectories(basePath.resolve(properties.getFeedback().getDirectory()));
            log.info("[Storage] Local storage initialized at: {}", basePath);
        } catch (IOException e) {
            log.error("[Storage] Failed to create storage directory", e);
        }
    }

    @Override
    public CompletableFuture<Void> putText(String directory, String path, String content) {
        return run("write", directory, path, file -> {
            createParent(file);
            Files.writeString(file, content, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING);
            return null;
        });
    }

    @Override
    public CompletableFuture<String> getText(String directory, String path) {
        return run("read", directory, path,
                file -> Files.exists(file) ? Files.readString(file, StandardCharsets.UTF_8) : null);
    }

    @Override
    public CompletableFuture<Void> deleteObject(String directory, String path) {
        return run("delete", directory, path, file -> {
            Files.deleteIfExists(file);
            return null;
        });
    }

    @Override
    public CompletableFuture<List<String>> listObjects(String directory, String prefix) {
        String relative = prefix == null ? "" : prefix;
        return run("list", directory, relative, start -> {
            Path root = resolvePath(directory, "");
            if (!Files.exists(start)) {
                return Collections.<String>emptyList();
            }
            try (Stream<Path> walk = Files.walk(start)) {
                return walk.filter(Files::isRegularFile)
                        .map(file -> root.relativize(file).toString().replace('\\', '/'))
                        .sorted()
                        .toList();
            }
        });
    }

    @Override
    public CompletableFuture<Void> appendText(String directory, String path, String content) {
        return run("append", directory, path, file -> {
            createParent(file);
            Files.writeString(file, content, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND);
            return null;
        });
    }

    @Override
    public CompletableFuture<Void> putTextAtomic(String directory, String path, String content, boolean backup) {
        return run("atomically write", directory, path, target -> {
            createParent(target);
            Path staging = target.resolveSibling(target.getFileName() + ".tmp");
            try {
                try (FileChannel channel = FileChannel.open(staging, StandardOpenOption.CREATE,
                        StandardOpenOption.WRITE, StandardOpenOption.TRUNCATE_EXISTING)) {
                    ByteBuffer buffer = ByteBuffer.wrap(content.getBytes(StandardCharsets.UTF_8));
                    while (buffer.hasRemaining()) {
                        channel.write(buffer);
                    }
                    channel.force(true);
                }
                if (backup && Files.exists(target)) {
                    Files.copy(target, target.resolveSibling(target.getFileName() + ".bak"),
                            StandardCopyOption.REPLACE_EXISTING);
                }
                moveIntoPlace(staging, target);
                return null;
            } catch (IOException e) {
                discard(staging);
                throw e;
            }
        });
    }

    private void moveIntoPlace(Path staging, Path target) throws IOException {
        try {
            Files.move(staging, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            log.warn("[Storage] Atomic move unsupported for {}, falling back to plain move", target);
            Files.move(staging, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private void discard(Path staging) {
        try {
            Files.deleteIfExists(staging);
        } catch (IOException e) {
            log.warn("[Storage] Could not remove staging file {}: {}", staging, e.getMessage());
        }
    }

    private <T> CompletableFuture<T> run(String operation, String directory, String path, FileTask<T> task) {
        return CompletableFuture.supplyAsync(() -> {
            Path file = resolvePath(directory, path);
            try {
                return task.apply(file);
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to " + operation + " " + directory + "/" + path, e);
            }
        });
    }

    @FunctionalInterface
    private interface FileTask<T> {
        T apply(Path file) throws IOException;
    }

    private void createParent(Path filePath) throws IOException {
        Path parent = filePath.getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
    }

    private Path resolvePath(String directory, String path) {
        Path resolved = basePath.resolve(directory).resolve(path).normalize();
        if (!resolved.startsWith(basePath)) {
            throw new IllegalArgumentException("Path traversal blocked: " + directory + "/" + path);
        }
        return resolved;
    }
}
