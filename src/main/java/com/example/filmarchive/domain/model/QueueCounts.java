package com.example.filmarchive.domain.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class QueueCounts {

    private int inputQueue;

    private int archivedQueue;

    private int completedTotal;

    public int pending() {
        return inputQueue + archivedQueue;
    }
}
