package com.example.filmarchive.domain.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class FaceRegion {

    private int x;

    private int y;

    private int width;

    private int height;
}
