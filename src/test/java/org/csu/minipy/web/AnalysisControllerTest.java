package org.csu.minipy.web;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import static org.hamcrest.Matchers.startsWith;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest(properties = "minipy.analyzer.max-source-length=200")
@AutoConfigureMockMvc
public class AnalysisControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @Test
    void testAnalyzeSuccess() throws Exception {
        System.out.println("--- Running test: testAnalyzeSuccess ---");
        String body = "{\"code\": \"def hello(name):\\n    return name\\nx = hello(1)\\n\"}";

        mockMvc.perform(post("/analyze").contentType(MediaType.APPLICATION_JSON).content(body))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.astText[0]").value("Module"))
                .andExpect(jsonPath("$.astText[1]").value("  FunctionDef(hello(name))"))
                .andExpect(jsonPath("$.astTree.id").value(0))
                .andExpect(jsonPath("$.astTree.name").value("Module"))
                .andExpect(jsonPath("$.astTree.children[0].value").value("hello(name)"))
                .andExpect(jsonPath("$.ir['<module>'][0]").value("t1 = call hello(1)"))
                .andExpect(jsonPath("$.ir.hello[0]").value("return name"))
                .andExpect(jsonPath("$.error").doesNotExist());
        System.out.println("Result: Test PASSED.\n");
    }

    @Test
    void testAnalyzeNormalizesLineEndings() throws Exception {
        System.out.println("--- Running test: testAnalyzeNormalizesLineEndings ---");
        String body = "{\"code\": \"if a:\\r\\n    b = 1\\r\\n\"}";

        mockMvc.perform(post("/analyze").contentType(MediaType.APPLICATION_JSON).content(body))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.ir['<module>'][0]").value("if a jump L1"));
        System.out.println("Result: Test PASSED.\n");
    }

    @Test
    void testAnalyzeReportsPipelineError() throws Exception {
        System.out.println("--- Running test: testAnalyzeReportsPipelineError ---");
        String body = "{\"code\": \"x = 1\\nreturn x\\n\"}";

        mockMvc.perform(post("/analyze").contentType(MediaType.APPLICATION_JSON).content(body))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.error.kind").value("SYNTAX"))
                .andExpect(jsonPath("$.error.line").value(2))
                .andExpect(jsonPath("$.error.column").value(1))
                .andExpect(jsonPath("$.error.message").value(startsWith("Syntax Error at line 2, column 1")))
                .andExpect(jsonPath("$.astTree").doesNotExist())
                .andExpect(jsonPath("$.ir").doesNotExist());
        System.out.println("Result: Test PASSED.\n");
    }

    @Test
    void testAnalyzeRejectsOversizedSource() throws Exception {
        System.out.println("--- Running test: testAnalyzeRejectsOversizedSource ---");
        String body = "{\"code\": \"" + "x = 1\\n".repeat(50) + "\"}";

        mockMvc.perform(post("/analyze").contentType(MediaType.APPLICATION_JSON).content(body))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.error.message").value("Source code exceeds maximum length of 200 characters"));
        System.out.println("Result: Test PASSED.\n");
    }

    @Test
    void testAnalyzeRequiresCode() throws Exception {
        System.out.println("--- Running test: testAnalyzeRequiresCode ---");
        mockMvc.perform(post("/analyze").contentType(MediaType.APPLICATION_JSON).content("{}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.error.message").value(startsWith("Validation error: code")));
        System.out.println("Result: Test PASSED.\n");
    }

    @Test
    void testHealth() throws Exception {
        System.out.println("--- Running test: testHealth ---");
        mockMvc.perform(get("/health"))
                .andExpect(status().isOk())
                .andExpect(content().string("MiniPy analyzer is healthy"));
        System.out.println("Result: Test PASSED.\n");
    }
}
