package com.example.filmarchive.application.service;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.example.filmarchive.common.config.AppDuplicateProperties;
import com.example.filmarchive.common.exception.ImageDecodeException;
import com.example.filmarchive.domain.enumtype.DuplicateAction;
import com.example.filmarchive.domain.enumtype.DuplicateType;
import com.example.filmarchive.domain.model.DuplicateGroup;
import com.example.filmarchive.domain.model.InboundDuplicateRecord;
import com.example.filmarchive.domain.model.InboundDuplicateReport;
import com.example.filmarchive.infrastructure.image.PerceptualHasher;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class DuplicateDetectionServiceTest {

    private static final String ZEROS = repeat('0', 64);

    private PerceptualHasher hasher;
    private ExecutorService executor;
    private DuplicateDetectionService service;

    @BeforeEach
    void setUp() {
        hasher = mock(PerceptualHasher.class);
        executor = Executors.newFixedThreadPool(2);
        AppDuplicateProperties properties = new AppDuplicateProperties();
        properties.setThreshold(0.95D);
        service = new DuplicateDetectionService(hasher, properties, executor, Clock.systemUTC());
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void identicalImagesShouldFormOneExactGroup() {
        Path a = Paths.get("out", "a.jpg");
        Path b = Paths.get("out", "b.jpg");
        when(hasher.hash(a)).thenReturn(ZEROS);
        when(hasher.hash(b)).thenReturn(ZEROS);

        List<DuplicateGroup> groups = service.findDuplicates(Arrays.asList(a, b));

        assertEquals(1, groups.size());
        DuplicateGroup group = groups.get(0);
        assertEquals(a.toString(), group.getSeed());
        assertEquals(2, group.getCount());
        assertEquals(1.0D, group.getMeanSimilarity(), 1e-12);
        assertEquals(DuplicateType.EXACT, group.getType());
        assertEquals(DuplicateAction.SKIP, group.getAction());
    }

    @Test
    void groupsShouldFormAroundFirstSeenRepresentative() {
        Path a = Paths.get("a.jpg");
        Path b = Paths.get("b.jpg");
        Path c = Paths.get("c.jpg");
        Path d = Paths.get("d.jpg");
        when(hasher.hash(a)).thenReturn(ZEROS);
        // 8 bits away from a: similarity 0.96875
        when(hasher.hash(b)).thenReturn("ff" + repeat('0', 62));
        // 16 bits away from a, 8 away from b
        when(hasher.hash(c)).thenReturn("ffff" + repeat('0', 60));
        when(hasher.hash(d)).thenReturn(repeat('f', 64));

        List<DuplicateGroup> groups = service.findDuplicates(Arrays.asList(a, b, c, d));

        assertEquals(1, groups.size());
        assertEquals(a.toString(), groups.get(0).getSeed());
        assertEquals(1, groups.get(0).getMatches().size());
        assertEquals(b.toString(), groups.get(0).getMatches().get(0).getPath());
        assertEquals(DuplicateType.NEAR, groups.get(0).getType());
    }

    @Test
    void fewerThanTwoImagesShouldYieldNoGroups() {
        assertTrue(service.findDuplicates(Collections.singletonList(Paths.get("a.jpg"))).isEmpty());
    }

    @Test
    void undecodableImagesShouldBeLeftOut() {
        Path a = Paths.get("a.jpg");
        Path broken = Paths.get("broken.jpg");
        when(hasher.hash(a)).thenReturn(ZEROS);
        when(hasher.hash(broken)).thenThrow(new ImageDecodeException(broken, "truncated"));

        List<DuplicateGroup> groups = service.findDuplicates(Arrays.asList(a, broken));

        assertTrue(groups.isEmpty());
        assertEquals("", service.computeHash(broken));
    }

    @Test
    void inboundMatchAtExactLevelShouldBeSkippedOnce() {
        Path inbound = Paths.get("input", "scan.tif");
        Path first = Paths.get("analysed", "image_1.tif");
        Path second = Paths.get("analysed", "image_2.tif");
        // one bit away: similarity 0.996
        when(hasher.hash(inbound)).thenReturn(repeat('0', 63) + "1");
        when(hasher.hash(first)).thenReturn(ZEROS);
        when(hasher.hash(second)).thenReturn(ZEROS);

        InboundDuplicateReport report = service.scanInbound(
                Collections.singletonList(inbound), Arrays.asList(first, second));

        assertEquals(1, report.getRecords().size());
        InboundDuplicateRecord record = report.getRecords().get(0);
        assertEquals(DuplicateType.EXACT, record.getType());
        assertEquals(DuplicateAction.SKIP, record.getAction());
        assertEquals(first.toString(), record.getMatch());
        assertEquals(1, report.getSkipCount());
        assertEquals(0, report.getAlertCount());
        assertEquals(1, report.getTotalInput());
    }

    @Test
    void inboundNearMatchShouldRaiseAlert() {
        Path inbound = Paths.get("input", "scan.tif");
        Path archived = Paths.get("analysed", "image_1.tif");
        when(hasher.hash(inbound)).thenReturn("ff" + repeat('0', 62));
        when(hasher.hash(archived)).thenReturn(ZEROS);

        InboundDuplicateReport report = service.scanInbound(
                Collections.singletonList(inbound), Collections.singletonList(archived));

        assertEquals(DuplicateType.NEAR, report.getRecords().get(0).getType());
        assertEquals(DuplicateAction.ALERT, report.getRecords().get(0).getAction());
        assertEquals(1, report.getAlertCount());
    }

    @Test
    void similarityShouldStayWithinUnitRange() {
        assertEquals(1.0D, service.similarity(ZEROS, ZEROS), 1e-12);
        assertEquals(0.0D, service.similarity(ZEROS, repeat('f', 64)), 1e-12);
        assertEquals(0.0D, service.similarity("", ZEROS), 1e-12);
        assertEquals(0.0D, service.similarity(ZEROS, "00"), 1e-12);
        assertEquals(0.5D, service.similarity("00", "0f"), 1e-12);
    }

    @Test
    void hashesShouldBeCachedPerPath() {
        Path a = Paths.get("a.jpg");
        when(hasher.hash(any(Path.class))).thenReturn(ZEROS);

        service.computeHash(a);
        service.computeHash(a);

        verify(hasher, times(1)).hash(a);
    }

    @Test
    void scanStatusShouldReturnToIdle() {
        Path a = Paths.get("a.jpg");
        Path b = Paths.get("b.jpg");
        when(hasher.hash(any(Path.class))).thenReturn(ZEROS);

        service.findDuplicates(Arrays.asList(a, b));

        assertFalse(service.getScanStatus().isRunning());
        assertEquals(2, service.getScanStatus().getTotal());
    }

    private static String repeat(char c, int count) {
        char[] chars = new char[count];
        Arrays.fill(chars, c);
        return new String(chars);
    }
}
