package org.csu.minipy.web.service;

import org.csu.minipy.config.AnalyzerProperties;
import org.csu.minipy.engine.AnalysisResult;
import org.csu.minipy.engine.AstTreeFormatter;
import org.csu.minipy.engine.FrontendProcessor;
import org.csu.minipy.engine.IrListingFormatter;
import org.csu.minipy.web.dto.AnalysisResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
public class AnalysisService {

    private static final Logger logger = LoggerFactory.getLogger(AnalysisService.class);

    private final FrontendProcessor processor;
    private final AnalyzerProperties properties;

    public AnalysisService(FrontendProcessor processor, AnalyzerProperties properties) {
        this.processor = processor;
        this.properties = properties;
    }

    public AnalysisResponse analyze(String sourceCode) {
        if (sourceCode.length() > properties.maxSourceLength()) {
            return AnalysisResponse.requestError(
                    "Source code exceeds maximum length of " + properties.maxSourceLength() + " characters");
        }

        AnalysisResult result = processor.analyze(sourceCode);
        if (!result.isSuccess()) {
            logger.debug("Analysis failed: {}", result.error().message());
            return AnalysisResponse.pipelineError(result.error());
        }

        return AnalysisResponse.success(
                AstTreeFormatter.toLines(result.ast()),
                AstTreeFormatter.toTree(result.ast()),
                IrListingFormatter.toMap(result.ir()));
    }
}
