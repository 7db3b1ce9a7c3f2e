package com.example.filmarchive.application.service;

import com.example.filmarchive.common.config.AppDuplicateProperties;
import com.example.filmarchive.common.exception.ImageDecodeException;
import com.example.filmarchive.common.exception.PipelineException;
import com.example.filmarchive.common.exception.TransientIoException;
import com.example.filmarchive.common.util.HashUtil;
import com.example.filmarchive.common.util.ImageFileTypes;
import com.example.filmarchive.domain.enumtype.DuplicateType;
import com.example.filmarchive.domain.model.DuplicateGroup;
import com.example.filmarchive.domain.model.DuplicateMatch;
import com.example.filmarchive.domain.model.DuplicateScanStatus;
import com.example.filmarchive.domain.model.InboundDuplicateRecord;
import com.example.filmarchive.domain.model.InboundDuplicateReport;
import com.example.filmarchive.infrastructure.image.PerceptualHasher;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReentrantLock;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Finds repeated frames by perceptual hash, both inside one corpus and between newly
 * scanned frames and the archive.
 */
@Service
public class DuplicateDetectionService {

    private static final Logger log = LoggerFactory.getLogger(DuplicateDetectionService.class);

    private final PerceptualHasher perceptualHasher;
    private final AppDuplicateProperties appDuplicateProperties;
    private final ExecutorService imageTaskExecutor;
    private final Clock clock;

    /** Append-only; an empty string marks a frame that failed to decode. */
    private final Map<Path, String> hashCache = new ConcurrentHashMap<>();
    private final ReentrantLock scanLock = new ReentrantLock();
    private final AtomicInteger scanCurrent = new AtomicInteger();
    private volatile int scanTotal;
    private volatile String scanPhase = "idle";
    private volatile Instant scanStartedAt;
    private volatile Instant scanFinishedAt;

    public DuplicateDetectionService(PerceptualHasher perceptualHasher,
                                     AppDuplicateProperties appDuplicateProperties,
                                     @Qualifier("imageTaskExecutor") ExecutorService imageTaskExecutor,
                                     Clock clock) {
        this.perceptualHasher = perceptualHasher;
        this.appDuplicateProperties = appDuplicateProperties;
        this.imageTaskExecutor = imageTaskExecutor;
        this.clock = clock;
    }

    public String computeHash(Path path) {
        String cached = hashCache.get(path);
        if (cached != null) {
            return cached;
        }
        String hash;
        try {
            hash = perceptualHasher.hash(path);
        } catch (ImageDecodeException e) {
            log.warn("DUPLICATE_HASH_FAILED file={} reason={}", path.getFileName(), e.getMessage());
            hash = "";
        }
        String previous = hashCache.putIfAbsent(path, hash);
        return previous != null ? previous : hash;
    }

    /**
     * 1 - hamming / bits, in [0, 1]. Empty or mismatched hashes are never similar.
     */
    public double similarity(String hashA, String hashB) {
        if (hashA == null || hashB == null || hashA.isEmpty() || hashB.isEmpty()) {
            return 0.0D;
        }
        int distance = HashUtil.hammingDistanceHex(hashA, hashB);
        if (distance < 0) {
            return 0.0D;
        }
        double similarity = 1.0D - distance / (hashA.length() * 4.0D);
        return Math.max(0.0D, Math.min(1.0D, similarity));
    }

    public List<DuplicateGroup> findDuplicates(Path directory) {
        return findDuplicates(listImages(directory));
    }

    /**
     * Groups images around the first-seen member: each image not yet grouped collects every
     * later ungrouped image at or above the threshold. Groups of one are dropped.
     */
    public List<DuplicateGroup> findDuplicates(List<Path> images) {
        double threshold = appDuplicateProperties.getThreshold();
        if (images.size() < 2) {
            log.info("DUPLICATE_SCAN_SKIPPED reason=too_few_images count={}", images.size());
            return Collections.emptyList();
        }
        beginScan(images.size());
        try {
            Map<Path, String> hashes = hashAll(images);
            scanPhase = "comparing";
            List<Path> ordered = new ArrayList<>(hashes.keySet());
            Set<Path> consumed = new HashSet<>();
            List<DuplicateGroup> groups = new ArrayList<>();
            for (Path seed : ordered) {
                if (consumed.contains(seed)) {
                    continue;
                }
                consumed.add(seed);
                String seedHash = hashes.get(seed);
                DuplicateGroup group = new DuplicateGroup();
                group.setSeed(seed.toString());
                for (Path other : ordered) {
                    if (consumed.contains(other)) {
                        continue;
                    }
                    double similarity = similarity(seedHash, hashes.get(other));
                    if (similarity >= threshold) {
                        group.getMatches().add(new DuplicateMatch(other.toString(), similarity));
                        consumed.add(other);
                    }
                }
                if (!group.getMatches().isEmpty()) {
                    double mean = group.getMatches().stream()
                            .mapToDouble(DuplicateMatch::getSimilarity)
                            .average()
                            .orElse(1.0D);
                    DuplicateType type = DuplicateType.classify(mean, threshold);
                    group.setMeanSimilarity(mean);
                    group.setType(type);
                    group.setAction(type.getAction());
                    groups.add(group);
                }
            }
            log.info("DUPLICATE_SCAN_DONE images={} hashed={} groups={}", images.size(), hashes.size(), groups.size());
            return groups;
        } finally {
            endScan();
        }
    }

    public InboundDuplicateReport scanInbound(Path inputDir, Path archivedDir) {
        return scanInbound(listImages(inputDir), listImages(archivedDir));
    }

    /**
     * Checks every inbound frame against the archive in order and stops at the first match:
     * at or above 0.99 the frame can be skipped, at or above the threshold it is flagged.
     */
    public InboundDuplicateReport scanInbound(List<Path> inbound, List<Path> archived) {
        double threshold = appDuplicateProperties.getThreshold();
        InboundDuplicateReport report = new InboundDuplicateReport();
        report.setTotalInput(inbound.size());
        if (inbound.isEmpty() || archived.isEmpty()) {
            return report;
        }
        List<Path> all = new ArrayList<>(inbound);
        all.addAll(archived);
        beginScan(all.size());
        try {
            Map<Path, String> hashes = hashAll(all);
            scanPhase = "comparing";
            for (Path candidate : inbound) {
                String candidateHash = hashes.get(candidate);
                if (candidateHash == null) {
                    continue;
                }
                for (Path existing : archived) {
                    String existingHash = hashes.get(existing);
                    if (existingHash == null || existing.equals(candidate)) {
                        continue;
                    }
                    double similarity = similarity(candidateHash, existingHash);
                    if (similarity < threshold && similarity < DuplicateType.EXACT_SIMILARITY) {
                        continue;
                    }
                    DuplicateType type = DuplicateType.classify(similarity, threshold);
                    report.getRecords().add(new InboundDuplicateRecord(type, candidate.toString(),
                            existing.toString(), similarity, type.getAction()));
                    if (type == DuplicateType.EXACT) {
                        report.setSkipCount(report.getSkipCount() + 1);
                    } else {
                        report.setAlertCount(report.getAlertCount() + 1);
                    }
                    break;
                }
            }
            log.info("DUPLICATE_INBOUND_DONE inbound={} archived={} skip={} alert={}",
                    inbound.size(), archived.size(), report.getSkipCount(), report.getAlertCount());
            return report;
        } finally {
            endScan();
        }
    }

    public DuplicateScanStatus getScanStatus() {
        boolean running = scanLock.isLocked();
        return new DuplicateScanStatus(running, scanPhase, scanCurrent.get(), scanTotal,
                scanStartedAt, running ? null : scanFinishedAt);
    }

    public static List<Path> listImages(Path directory) {
        if (directory == null || !Files.isDirectory(directory)) {
            return Collections.emptyList();
        }
        try (Stream<Path> walk = Files.walk(directory)) {
            return walk.filter(Files::isRegularFile)
                    .filter(ImageFileTypes::isScanFile)
                    .sorted()
                    .collect(Collectors.toList());
        } catch (IOException e) {
            throw new TransientIoException("Cannot list " + directory, e);
        }
    }

    private Map<Path, String> hashAll(List<Path> images) {
        Map<Path, Future<String>> futures = new LinkedHashMap<>();
        for (Path image : images) {
            if (!futures.containsKey(image)) {
                futures.put(image, imageTaskExecutor.submit(() -> {
                    String hash = computeHash(image);
                    scanCurrent.incrementAndGet();
                    return hash;
                }));
            }
        }
        Map<Path, String> hashes = new LinkedHashMap<>();
        for (Map.Entry<Path, Future<String>> entry : futures.entrySet()) {
            String hash = await(entry.getKey(), entry.getValue());
            if (!hash.isEmpty()) {
                hashes.put(entry.getKey(), hash);
            }
        }
        return hashes;
    }

    private String await(Path image, Future<String> future) {
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new PipelineException("DUPLICATE_SCAN_INTERRUPTED", "Interrupted while hashing " + image, e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() == null ? e : e.getCause();
            log.warn("DUPLICATE_HASH_FAILED file={} reason={}", image.getFileName(), cause.getMessage());
            return "";
        }
    }

    private void beginScan(int total) {
        if (!scanLock.tryLock()) {
            throw new PipelineException("DUPLICATE_SCAN_BUSY", "A duplicate scan is already running");
        }
        scanTotal = total;
        scanCurrent.set(0);
        scanPhase = "hashing";
        scanStartedAt = clock.instant();
        scanFinishedAt = null;
    }

    private void endScan() {
        scanPhase = "idle";
        scanFinishedAt = clock.instant();
        scanLock.unlock();
    }
}
