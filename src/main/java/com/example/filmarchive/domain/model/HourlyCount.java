package com.example.filmarchive.domain.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class HourlyCount {

    private String hour;

    /**
     * Bucket key, "yyyy-MM-dd HH:00" in UTC.
     */
    private String timestamp;

    private int count;
}
