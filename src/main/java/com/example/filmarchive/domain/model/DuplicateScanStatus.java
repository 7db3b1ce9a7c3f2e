package com.example.filmarchive.domain.model;

import java.time.Instant;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class DuplicateScanStatus {

    private boolean running;

    /**
     * "hashing" while fingerprints are computed, "comparing" afterwards, "idle" when done.
     */
    private String phase;

    private int current;

    private int total;

    private Instant startedAt;

    private Instant finishedAt;

    public static DuplicateScanStatus idle() {
        return new DuplicateScanStatus(false, "idle", 0, 0, null, null);
    }
}
