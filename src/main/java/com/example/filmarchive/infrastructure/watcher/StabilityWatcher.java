package com.example.filmarchive.infrastructure.watcher;

import com.example.filmarchive.common.exception.TransientIoException;
import com.example.filmarchive.common.util.ImageFileTypes;
import com.example.filmarchive.domain.model.WatchedFile;
import java.io.IOException;
import java.nio.file.ClosedWatchServiceException;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardWatchEventKinds;
import java.nio.file.WatchEvent;
import java.nio.file.WatchKey;
import java.nio.file.WatchService;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Watches one directory tree and reports scan files once they stop growing.
 * <p>
 * Creation events only register a file as pending. A periodic poll compares each pending
 * file's size with the previous poll; a file whose size has held for the debounce window is
 * handed to the stable callback exactly once and forgotten. Deletion events go straight to
 * the deletion callback.
 */
public class StabilityWatcher {

    private static final Logger log = LoggerFactory.getLogger(StabilityWatcher.class);

    private final Path watchDir;
    private final Consumer<Path> stableCallback;
    private final Consumer<Path> deletionCallback;
    private final long debounceMillis;
    private final long pollIntervalMillis;
    private final ScheduledExecutorService scheduler;
    private final Clock clock;

    private final Map<Path, WatchedFile> pending = new ConcurrentHashMap<>();
    private final Map<WatchKey, Path> keyDirs = new ConcurrentHashMap<>();
    private final Object pollLock = new Object();

    private volatile WatchService watchService;
    private volatile Thread eventThread;
    private volatile ScheduledFuture<?> pollTask;
    private volatile boolean running;

    public StabilityWatcher(Path watchDir,
                            Consumer<Path> stableCallback,
                            Consumer<Path> deletionCallback,
                            Duration debounce,
                            Duration pollInterval,
                            ScheduledExecutorService scheduler,
                            Clock clock) {
        this.watchDir = watchDir;
        this.stableCallback = stableCallback;
        this.deletionCallback = deletionCallback;
        this.debounceMillis = debounce.toMillis();
        this.pollIntervalMillis = Math.max(1L, pollInterval.toMillis());
        this.scheduler = scheduler;
        this.clock = clock;
    }

    public Path getWatchDir() {
        return watchDir;
    }

    public boolean isRunning() {
        return running;
    }

    public int pendingCount() {
        return pending.size();
    }

    /**
     * Creates the directory if needed, registers it recursively and starts the poll loop.
     *
     * @throws TransientIoException when the directory cannot be prepared; callers retry later
     */
    public synchronized void start() {
        if (running) {
            return;
        }
        WatchService service;
        try {
            Files.createDirectories(watchDir);
            service = FileSystems.getDefault().newWatchService();
        } catch (IOException e) {
            throw new TransientIoException("Cannot prepare watch directory " + watchDir, e);
        }
        this.watchService = service;
        try {
            registerTree(watchDir, false);
        } catch (IOException e) {
            closeQuietly(service);
            this.watchService = null;
            throw new TransientIoException("Cannot register watch directory " + watchDir, e);
        }
        running = true;
        Thread thread = new Thread(this::eventLoop, "watcher-events-" + watchDir.getFileName());
        thread.setDaemon(true);
        this.eventThread = thread;
        thread.start();
        this.pollTask = scheduler.scheduleWithFixedDelay(this::safePoll,
                pollIntervalMillis, pollIntervalMillis, TimeUnit.MILLISECONDS);
        log.info("WATCHER_STARTED dir={} debounceMs={} pollMs={}", watchDir, debounceMillis, pollIntervalMillis);
    }

    public synchronized void stop() {
        if (!running) {
            return;
        }
        running = false;
        ScheduledFuture<?> task = pollTask;
        if (task != null) {
            task.cancel(false);
        }
        WatchService service = watchService;
        if (service != null) {
            closeQuietly(service);
        }
        Thread thread = eventThread;
        if (thread != null) {
            try {
                thread.join(TimeUnit.SECONDS.toMillis(5));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
        synchronized (pollLock) {
            pending.clear();
            keyDirs.clear();
        }
        log.info("WATCHER_STOPPED dir={}", watchDir);
    }

    /**
     * Feeds every matching file already under the directory through the stable callback,
     * in path order.
     */
    public int scanExisting() {
        if (!Files.isDirectory(watchDir)) {
            return 0;
        }
        List<Path> existing;
        try (Stream<Path> walk = Files.walk(watchDir)) {
            existing = walk.filter(Files::isRegularFile)
                    .filter(ImageFileTypes::isScanFile)
                    .sorted()
                    .collect(Collectors.toList());
        } catch (IOException e) {
            throw new TransientIoException("Cannot list " + watchDir, e);
        }
        for (Path path : existing) {
            log.info("WATCHER_EXISTING_FILE file={}", path.getFileName());
            fireStable(path);
        }
        return existing.size();
    }

    void track(Path path) {
        if (!ImageFileTypes.isScanFile(path)) {
            return;
        }
        pending.put(path, new WatchedFile(path, 0L, clock.millis()));
        log.debug("WATCHER_FILE_DETECTED file={}", path.getFileName());
    }

    void pollOnce() {
        synchronized (pollLock) {
            if (pending.isEmpty()) {
                return;
            }
            long now = clock.millis();
            List<Path> stable = new ArrayList<>();
            for (WatchedFile file : new ArrayList<>(pending.values())) {
                Path path = file.getPath();
                long size;
                try {
                    size = Files.size(path);
                } catch (NoSuchFileException e) {
                    pending.remove(path);
                    log.debug("WATCHER_FILE_VANISHED file={}", path.getFileName());
                    continue;
                } catch (IOException e) {
                    log.warn("WATCHER_SIZE_CHECK_FAILED file={} reason={}", path.getFileName(), e.getMessage());
                    continue;
                }
                if (size == file.getLastSize()) {
                    if (now - file.getLastChangeMillis() >= debounceMillis) {
                        pending.remove(path);
                        stable.add(path);
                    }
                } else {
                    file.setLastSize(size);
                    file.setLastChangeMillis(now);
                }
            }
            for (Path path : stable) {
                log.info("WATCHER_FILE_STABLE file={}", path.getFileName());
                fireStable(path);
            }
        }
    }

    void onDeleted(Path path) {
        if (!ImageFileTypes.isScanFile(path)) {
            return;
        }
        pending.remove(path);
        log.info("WATCHER_FILE_DELETED file={}", path.getFileName());
        if (deletionCallback == null) {
            return;
        }
        try {
            deletionCallback.accept(path);
        } catch (RuntimeException e) {
            log.error("WATCHER_DELETE_CALLBACK_FAILED file={}", path.getFileName(), e);
        }
    }

    private void safePoll() {
        try {
            pollOnce();
        } catch (RuntimeException e) {
            // an exception escaping here would cancel the schedule
            log.error("WATCHER_POLL_FAILED dir={}", watchDir, e);
        }
    }

    private void fireStable(Path path) {
        try {
            stableCallback.accept(path);
        } catch (RuntimeException e) {
            log.error("WATCHER_STABLE_CALLBACK_FAILED file={}", path.getFileName(), e);
        }
    }

    private void eventLoop() {
        WatchService service = watchService;
        while (running) {
            WatchKey key;
            try {
                key = service.take();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            } catch (ClosedWatchServiceException e) {
                return;
            }
            Path dir = keyDirs.get(key);
            if (dir != null) {
                for (WatchEvent<?> event : key.pollEvents()) {
                    handleEvent(dir, event);
                }
            }
            if (!key.reset()) {
                keyDirs.remove(key);
            }
        }
    }

    private void handleEvent(Path dir, WatchEvent<?> event) {
        WatchEvent.Kind<?> kind = event.kind();
        if (kind == StandardWatchEventKinds.OVERFLOW) {
            log.warn("WATCHER_EVENT_OVERFLOW dir={}", dir);
            return;
        }
        Path child = dir.resolve((Path) event.context());
        if (kind == StandardWatchEventKinds.ENTRY_CREATE) {
            if (Files.isDirectory(child)) {
                try {
                    registerTree(child, true);
                } catch (IOException e) {
                    log.warn("WATCHER_REGISTER_FAILED dir={} reason={}", child, e.getMessage());
                }
            } else {
                track(child);
            }
        } else if (kind == StandardWatchEventKinds.ENTRY_DELETE) {
            onDeleted(child);
        }
    }

    private void registerTree(Path root, boolean trackFiles) throws IOException {
        try (Stream<Path> walk = Files.walk(root)) {
            List<Path> entries = walk.collect(Collectors.toList());
            for (Path entry : entries) {
                if (Files.isDirectory(entry)) {
                    WatchKey key = entry.register(watchService,
                            StandardWatchEventKinds.ENTRY_CREATE,
                            StandardWatchEventKinds.ENTRY_DELETE);
                    keyDirs.put(key, entry);
                } else if (trackFiles) {
                    track(entry);
                }
            }
        }
    }

    private static void closeQuietly(WatchService service) {
        try {
            service.close();
        } catch (IOException e) {
            log.warn("WATCHER_CLOSE_FAILED reason={}", e.getMessage());
        }
    }
}
