package org.csu.minipy.config;

import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "minipy.analyzer")
@Validated
public record AnalyzerProperties(
        // 一个制表符折算的缩进宽度
        @Positive
        @DefaultValue("4")
        Integer tabWidth,

        @Positive
        @DefaultValue("100000")
        Integer maxSourceLength
) {
}
