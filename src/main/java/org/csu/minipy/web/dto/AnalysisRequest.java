package org.csu.minipy.web.dto;

import jakarta.validation.constraints.NotNull;

public record AnalysisRequest(
        @NotNull(message = "Source code must be provided")
        String code
) {

    /**
     * 统一换行符。不做 trim，前导空白属于缩进的一部分。
     */
    public String normalizedCode() {
        if (code == null) {
            return "";
        }
        return code.replace("\r\n", "\n").replace("\r", "\n");
    }
}
