package me.golemcore.discovery.adapter.outbound.storage;

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

import me.golemcore.discovery.infrastructure.config.DiscoveryProperties;
import me.golemcore.discovery.port.outbound.StoragePort;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.concurrent.CompletableFuture;

/**
 * Local filesystem implementation of StoragePort.
 *
 * <p>
 * Base path configured via {@code discovery.storage.local.base-path}, defaults
 * to {@code ${user.home}/.golemcore/discovery}. The state directory holding
 * the orchestrator snapshot is created on startup.
 *
 * @see me.golemcore.discovery.port.outbound.StoragePort
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class LocalStorageAdapter implements StoragePort {

    private final DiscoveryProperties properties;

    private Path basePath;

    @PostConstruct
    public void init() {
        String configured = properties.getStorage().getLocal().getBasePath();
        this.basePath = Paths.get(configured.replace("${user.home}", System.getProperty("user.home")))
                .toAbsolutePath().normalize();

        try {
            Files.createDirectories(basePath.resolve(properties.getStorage().getStateDirectory()));
            log.info("[Storage] Local storage initialized at: {}", basePath);
        } catch (IOException e) {
            log.error("[Storage] Failed to create storage directory", e);
        }
    }

    @Override
    public CompletableFuture<String> getText(String directory, String path) {
        return CompletableFuture.supplyAsync(() -> {
            Path source = resolvePath(directory, path);
            if (!Files.exists(source)) {
                return null;
            }
            try {
                return Files.readString(source, StandardCharsets.UTF_8);
            } catch (IOException e) {
                throw new RuntimeException("Failed to read file: " + directory + "/" + path, e);
            }
        });
    }

    @Override
    public CompletableFuture<Boolean> exists(String directory, String path) {
        return CompletableFuture.supplyAsync(() -> Files.exists(resolvePath(directory, path)));
    }

    @Override
    public CompletableFuture<Void> putTextAtomic(String directory, String path, String content, boolean backup) {
        return CompletableFuture.runAsync(() -> {
            Path target = resolvePath(directory, path);
            Path temp = target.resolveSibling(target.getFileName() + ".tmp");
            Path previous = target.resolveSibling(target.getFileName() + ".bak");

            try {
                createParent(target);
                writeSynced(temp, content.getBytes(StandardCharsets.UTF_8));

                if (backup && Files.exists(target)) {
                    Files.copy(target, previous, StandardCopyOption.REPLACE_EXISTING);
                    log.debug("[Storage] Created backup: {}", previous);
                }

                moveIntoPlace(temp, target);
                log.debug("[Storage] Atomic write completed: {}/{}", directory, path);
            } catch (IOException e) {
                try {
                    Files.deleteIfExists(temp);
                } catch (IOException cleanupEx) {
                    log.warn("[Storage] Failed to cleanup temp file: {}", temp);
                }
                throw new RuntimeException("Atomic write failed: " + directory + "/" + path, e);
            }
        });
    }

    private static void writeSynced(Path file, byte[] bytes) throws IOException {
        try (OutputStream os = Files.newOutputStream(file,
                StandardOpenOption.CREATE,
                StandardOpenOption.TRUNCATE_EXISTING,
                StandardOpenOption.SYNC);
                FileChannel channel = FileChannel.open(file, StandardOpenOption.WRITE)) {
            os.write(bytes);
            os.flush();
            channel.force(true);
        }
        if (Files.size(file) != bytes.length) {
            throw new IOException("Verification failed: size mismatch for " + file);
        }
    }

    private static void moveIntoPlace(Path temp, Path target) throws IOException {
        try {
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            log.warn("[Storage] Atomic move not supported, using regular move");
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private static void createParent(Path file) throws IOException {
        Path parent = file.getParent();
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
