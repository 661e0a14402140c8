package com.eyelevel.pdfcompressor.service.job;

import com.eyelevel.pdfcompressor.model.CompressionJob;

import java.util.List;

public record JobPage(List<CompressionJob> items, long total, int limit, long offset) {
}
