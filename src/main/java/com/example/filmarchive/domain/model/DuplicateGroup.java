package com.example.filmarchive.domain.model;

import com.example.filmarchive.domain.enumtype.DuplicateAction;
import com.example.filmarchive.domain.enumtype.DuplicateType;
import java.util.ArrayList;
import java.util.List;
import lombok.Data;

@Data
public class DuplicateGroup {

    /**
     * First-seen image of the group; every match was compared against it.
     */
    private String seed;

    private List<DuplicateMatch> matches = new ArrayList<>();

    private double meanSimilarity;

    private DuplicateType type;

    private DuplicateAction action;

    public int getCount() {
        return matches.size() + 1;
    }
}
