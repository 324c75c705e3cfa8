package org.csu.minipy.web.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import org.csu.minipy.engine.AstTreeFormatter.AstTree;
import org.csu.minipy.engine.PipelineError;

import java.util.List;
import java.util.Map;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record AnalysisResponse(
        boolean success,
        List<String> astText,
        AstTree astTree,
        Map<String, List<String>> ir,
        ErrorDetail error
) {

    /**
     * @param kind 出错阶段 (LEXICAL / SYNTAX / LOWERING)，请求本身不合法或内部错误时为 null
     * @param line 0 表示位置未知
     */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record ErrorDetail(String kind, String message, int line, int column) {
    }

    public static AnalysisResponse success(List<String> astText, AstTree astTree, Map<String, List<String>> ir) {
        return new AnalysisResponse(true, astText, astTree, ir, null);
    }

    public static AnalysisResponse pipelineError(PipelineError error) {
        return new AnalysisResponse(false, null, null, null,
                new ErrorDetail(error.kind().name(), error.message(), error.line(), error.column()));
    }

    public static AnalysisResponse requestError(String message) {
        return new AnalysisResponse(false, null, null, null, new ErrorDetail(null, message, 0, 0));
    }
}
