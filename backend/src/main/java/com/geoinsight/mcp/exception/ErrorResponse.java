package com.geoinsight.mcp.exception;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ErrorResponse {
    private ErrorCode errorCode;
    private String message;
    private boolean retryable;
    private int status;
    private LocalDateTime timestamp;
    private String path;
    private List<String> details;
}
