package com.eyelevel.pdfcompressor.dto.system;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Getter;

@Getter
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class VersionResponse {
    private final String version;
    private final String commit;
    private final String buildTime;
}
