/************************************************************************
 Copyright 2018 eBay Inc.
 Author/Developer: Brendan McCarthy

 Licensed under the Apache License, Version 2.0 (the "License");
 you may not use this file except in compliance with the License.
 You may obtain a copy of the License at

 https://www.apache.org/licenses/LICENSE-2.0

 Unless required by applicable law or agreed to in writing, software
 distributed under the License is distributed on an "AS IS" BASIS,
 WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 See the License for the specific language governing permissions and
 limitations under the License.
 **************************************************************************/
package com.ebay.bascomflow.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.Semaphore;
import java.util.stream.Stream;

/**
 * File-system cache with one directory per task under a root: {@code root/entity/stage[/variant]}. An output
 * is present when it is a non-empty regular file or a non-empty directory. Content is not otherwise validated,
 * so a truncated file of non-zero size counts as present.
 *
 * @author Brendan McCarthy
 */
public class DirectoryTaskCache implements TaskCache {
    private static final Logger LOG = LoggerFactory.getLogger(DirectoryTaskCache.class);

    static final String LOCK_FILE = ".lock";

    // FileChannel locks are held per JVM, so threads of this process are excluded separately. Entries are
    // removed once no thread holds or awaits them.
    private static final ConcurrentMap<Path, LocalLock> LOCAL_LOCKS = new ConcurrentHashMap<>();

    private static final class LocalLock {
        final Semaphore semaphore = new Semaphore(1);
        int users = 0;
    }

    private final Path root;

    public DirectoryTaskCache(Path root) {
        this.root = root.toAbsolutePath().normalize();
    }

    public Path getRoot() {
        return root;
    }

    @Override
    public Path directoryOf(TaskKey key) {
        return root.resolve(key.relativePath());
    }

    @Override
    public boolean shouldRun(TaskKey key, List<String> declaredOutputs) {
        Path dir = directoryOf(key);
        if (!Files.isDirectory(dir)) {
            return true;
        }
        for (String next : declaredOutputs) {
            if (!isPresent(resolveOutput(dir, next))) {
                LOG.debug("{} missing output {}", key, next);
                return true;
            }
        }
        return false;
    }

    static Path resolveOutput(Path dir, String output) {
        Path path = dir.resolve(output).normalize();
        if (!path.startsWith(dir)) {
            throw new IllegalArgumentException("Declared output escapes its task directory: " + output);
        }
        return path;
    }

    static boolean isPresent(Path path) {
        try {
            if (Files.isRegularFile(path)) {
                return Files.size(path) > 0;
            }
            if (Files.isDirectory(path)) {
                try (Stream<Path> entries = Files.list(path)) {
                    return entries.findAny().isPresent();
                }
            }
        } catch (IOException e) {
            LOG.debug("Treating unreadable {} as absent: {}", path, e.getMessage());
        }
        return false;
    }

    @Override
    public Path prepare(TaskKey key) throws IOException {
        return Files.createDirectories(directoryOf(key));
    }

    @Override
    public TaskLock lock(TaskKey key) throws IOException {
        Path dir = prepare(key);
        LocalLock local = LOCAL_LOCKS.compute(dir, (k, v) -> {
            LocalLock lock = v == null ? new LocalLock() : v;
            lock.users++;
            return lock;
        });
        try {
            local.semaphore.acquire();
        } catch (InterruptedException e) {
            leave(dir);
            Thread.currentThread().interrupt();
            throw new InterruptedIOException("Interrupted waiting for lock on " + key);
        }
        FileChannel channel = null;
        try {
            channel = FileChannel.open(dir.resolve(LOCK_FILE), StandardOpenOption.CREATE, StandardOpenOption.WRITE);
            FileLock fileLock = channel.lock();
            LOG.debug("Locked {}", dir);
            return new DirectoryLock(dir, local, channel, fileLock);
        } catch (IOException | RuntimeException e) {
            if (channel != null) {
                channel.close();
            }
            local.semaphore.release();
            leave(dir);
            throw e;
        }
    }

    private static void leave(Path dir) {
        LOCAL_LOCKS.computeIfPresent(dir, (k, v) -> --v.users == 0 ? null : v);
    }

    static boolean isTrackedLocally(Path dir) {
        return LOCAL_LOCKS.containsKey(dir);
    }

    private static class DirectoryLock implements TaskLock {
        private final Path dir;
        private final LocalLock local;
        private final FileChannel channel;
        private final FileLock fileLock;
        private boolean closed = false;

        DirectoryLock(Path dir, LocalLock local, FileChannel channel, FileLock fileLock) {
            this.dir = dir;
            this.local = local;
            this.channel = channel;
            this.fileLock = fileLock;
        }

        @Override
        public synchronized void close() throws IOException {
            if (!closed) {
                closed = true;
                try {
                    fileLock.release();
                    channel.close();
                } finally {
                    local.semaphore.release();
                    leave(dir);
                }
            }
        }
    }

    @Override
    public String toString() {
        return "DirectoryTaskCache(" + root + ")";
    }
}
