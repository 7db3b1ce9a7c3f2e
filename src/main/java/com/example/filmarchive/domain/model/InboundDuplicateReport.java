package com.example.filmarchive.domain.model;

import java.util.ArrayList;
import java.util.List;
import lombok.Data;

@Data
public class InboundDuplicateReport {

    private List<InboundDuplicateRecord> records = new ArrayList<>();

    private int skipCount;

    private int alertCount;

    private int totalInput;
}
