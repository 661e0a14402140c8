package com.eyelevel.pdfcompressor.dto.job;

import lombok.Builder;
import lombok.Getter;

import java.util.List;

@Getter
@Builder
public class JobPageResponse {
    private final List<JobResponse> items;
    private final long total;
    private final int limit;
    private final long offset;
}
