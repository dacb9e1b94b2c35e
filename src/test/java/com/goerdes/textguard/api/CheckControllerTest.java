package com.goerdes.textguard.api;

import com.goerdes.textguard.utils.Setup;
import com.goerdes.textguard.utils.TestUtils;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.test.web.servlet.MockMvc;

import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.hasSize;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.multipart;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@AutoConfigureMockMvc
class CheckControllerTest extends Setup {

    private static final String FOX = "the quick brown fox jumps over the lazy dog";

    @Autowired
    private MockMvc mockMvc;

    @Test
    void testIndexThenCheckText() throws Exception {
        mockMvc.perform(post("/api/index-text").param("text", FOX).param("label", "fox"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.label").value("fox"));

        mockMvc.perform(post("/api/check-text")
                        .param("text", FOX)
                        .param("user_id", "student-7")
                        .param("top_k", "3")
                        .param("web_search", "false"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.plagiarismScore").value(1.0))
                .andExpect(jsonPath("$.matches", hasSize(1)))
                .andExpect(jsonPath("$.matches[0].label").value("fox"))
                .andExpect(jsonPath("$.matches[0].similarityRating").value("high"));
    }

    @Test
    void testUploadAndListDocuments() throws Exception {
        MockMultipartFile file = TestUtils.getMockFile("essay.txt");

        mockMvc.perform(multipart("/api/index-file").file(file))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.label").value("essay.txt"));

        mockMvc.perform(multipart("/api/check-file").file(file).param("web_search", "false"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.matches[0].jaccard").value(1.0));

        mockMvc.perform(get("/api/list-docs"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(1)))
                .andExpect(jsonPath("$[0].url").value("corpus://essay.txt"));
    }

    @Test
    void testClearIndex() throws Exception {
        mockMvc.perform(post("/api/index-text").param("text", FOX).param("label", "fox"))
                .andExpect(status().isOk());

        mockMvc.perform(post("/api/clear-index"))
                .andExpect(status().isNoContent());

        mockMvc.perform(get("/api/list-docs"))
                .andExpect(jsonPath("$", hasSize(0)));
    }

    @Test
    void testInvalidInputIsBadRequest() throws Exception {
        mockMvc.perform(post("/api/check-text").param("text", "   "))
                .andExpect(status().isBadRequest())
                .andExpect(content().string(containsString("No text provided")));

        MockMultipartFile binary = new MockMultipartFile("file", "tool.exe",
                "application/octet-stream", new byte[]{0x4D, 0x5A, 0, 1});
        mockMvc.perform(multipart("/api/check-file").file(binary))
                .andExpect(status().isBadRequest())
                .andExpect(content().string(containsString("UNSUPPORTED_FORMAT")));
    }
}
