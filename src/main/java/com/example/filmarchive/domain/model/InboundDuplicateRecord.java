package com.example.filmarchive.domain.model;

import com.example.filmarchive.domain.enumtype.DuplicateAction;
import com.example.filmarchive.domain.enumtype.DuplicateType;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class InboundDuplicateRecord {

    private DuplicateType type;

    private String inputFile;

    private String match;

    private double similarity;

    private DuplicateAction action;
}
