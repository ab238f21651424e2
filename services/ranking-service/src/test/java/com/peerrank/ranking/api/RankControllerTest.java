package com.peerrank.ranking.api;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

@SpringBootTest
@AutoConfigureMockMvc
class RankControllerTest {
    private static final String TARGET = "\"target\":{\"title\":\"Title\",\"artist\":\"Artist\",\"length_seconds\":300}";

    @Autowired
    private MockMvc mockMvc;

    @Test
    void healthReturnsOk() throws Exception {
        mockMvc.perform(get("/health"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.status").value("ok"));
    }

    @Test
    void policyShowsActiveConfiguration() throws Exception {
        mockMvc.perform(get("/policy"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.priority").value("quality_first"))
            .andExpect(jsonPath("$.duration_tolerance_seconds").value(4))
            .andExpect(jsonPath("$.significant_bitrate_gap_kbps").value(64));
    }

    @Test
    void rankOrdersByTier() throws Exception {
        String body = "{"
            + TARGET + ","
            + "\"candidates\":["
            + "{\"source_id\":\"bronze\",\"filename\":\"Artist - Title.mp3\",\"bitrate_kbps\":128,\"length_seconds\":300,\"has_free_capacity\":true},"
            + "{\"source_id\":\"diamond\",\"filename\":\"Music/Artist/Title.flac\",\"bitrate_kbps\":1000,\"length_seconds\":301,\"has_free_capacity\":true},"
            + "{\"source_id\":\"gold\",\"filename\":\"Artist - Title.mp3\",\"bitrate_kbps\":320,\"length_seconds\":300,\"has_free_capacity\":false,\"queue_depth\":3}"
            + "]"
            + "}";

        mockMvc.perform(post("/rank")
                .contentType(MediaType.APPLICATION_JSON)
                .content(body))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.priority").value("quality_first"))
            .andExpect(jsonPath("$.hits.length()").value(3))
            .andExpect(jsonPath("$.hits[0].source_id").value("diamond"))
            .andExpect(jsonPath("$.hits[0].tier").value("diamond"))
            .andExpect(jsonPath("$.hits[0].rank").value(1))
            .andExpect(jsonPath("$.hits[0].original_index").value(1))
            .andExpect(jsonPath("$.hits[0].rank_score").value(1.0))
            .andExpect(jsonPath("$.hits[1].source_id").value("gold"))
            .andExpect(jsonPath("$.hits[2].source_id").value("bronze"))
            .andExpect(jsonPath("$.hits[0].debug").doesNotExist());
    }

    @Test
    void rankHonorsSizeAndDjPriority() throws Exception {
        String body = "{"
            + "\"target\":{\"title\":\"Title\",\"artist\":\"Artist\",\"length_seconds\":300,\"bpm\":120},"
            + "\"candidates\":["
            + "{\"source_id\":\"loud\",\"filename\":\"Artist - Title.mp3\",\"bitrate_kbps\":320,\"length_seconds\":300,\"has_free_capacity\":true,\"bpm\":140},"
            + "{\"source_id\":\"tagged\",\"filename\":\"Artist - Title.mp3\",\"bitrate_kbps\":192,\"length_seconds\":300,\"has_free_capacity\":true,\"bpm\":120}"
            + "],"
            + "\"options\":{\"priority\":\"dj_ready\",\"size\":1}"
            + "}";

        mockMvc.perform(post("/rank")
                .contentType(MediaType.APPLICATION_JSON)
                .content(body))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.priority").value("dj_ready"))
            .andExpect(jsonPath("$.hits.length()").value(1))
            .andExpect(jsonPath("$.hits[0].source_id").value("tagged"))
            .andExpect(jsonPath("$.hits[0].tier").value("gold"));
    }

    @Test
    void rankDebugExplainsRejectionsAndTrash() throws Exception {
        String body = "{"
            + "\"query\":{\"text\":\"artist title\"},"
            + TARGET + ","
            + "\"candidates\":["
            + "{\"source_id\":\"stranger\",\"filename\":\"Other - Song.mp3\",\"bitrate_kbps\":320,\"length_seconds\":300,\"has_free_capacity\":true},"
            + "{\"source_id\":\"upscaled\",\"filename\":\"Artist - Title.mp3\",\"bitrate_kbps\":1411,\"length_seconds\":300,\"has_free_capacity\":true},"
            + "{\"source_id\":\"honest\",\"filename\":\"Artist - Title.mp3\",\"bitrate_kbps\":256,\"length_seconds\":300,\"has_free_capacity\":true}"
            + "],"
            + "\"options\":{\"debug\":true}"
            + "}";

        mockMvc.perform(post("/rank")
                .contentType(MediaType.APPLICATION_JSON)
                .content(body))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.rejected_count").value(1))
            .andExpect(jsonPath("$.trash_count").value(1))
            .andExpect(jsonPath("$.hits.length()").value(2))
            .andExpect(jsonPath("$.hits[0].source_id").value("honest"))
            .andExpect(jsonPath("$.hits[1].tier").value("trash"))
            .andExpect(jsonPath("$.hits[1].rank_breakdown").value("Forensic Mismatch (possible fake)"))
            .andExpect(jsonPath("$.hits[1].debug.forensic_reasons[0]").value("lossy_bitrate_out_of_range"))
            .andExpect(jsonPath("$.debug.rejections_by_reason.token_mismatch").value(1))
            .andExpect(jsonPath("$.debug.policy.priority").value("quality_first"));
    }

    @Test
    void rankEchoesRequestIds() throws Exception {
        String body = "{"
            + TARGET + ","
            + "\"candidates\":[{\"source_id\":\"a\",\"filename\":\"Artist - Title.mp3\",\"bitrate_kbps\":320,\"length_seconds\":300}]"
            + "}";

        mockMvc.perform(post("/rank")
                .header("x-trace-id", "trace-123")
                .header("x-request-id", "req-456")
                .contentType(MediaType.APPLICATION_JSON)
                .content(body))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.trace_id").value("trace-123"))
            .andExpect(jsonPath("$.request_id").value("req-456"));
    }

    @Test
    void rankRejectsMissingTarget() throws Exception {
        mockMvc.perform(post("/rank")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error.code").value("bad_request"))
            .andExpect(jsonPath("$.error.message").value("target is required"))
            .andExpect(jsonPath("$.trace_id").isNotEmpty())
            .andExpect(jsonPath("$.request_id").isNotEmpty());
    }

    @Test
    void rankRejectsEmptyCandidates() throws Exception {
        mockMvc.perform(post("/rank")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{" + TARGET + ",\"candidates\":[]}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error.message").value("candidates is required"));
    }

    @Test
    void rankRejectsUnknownPriority() throws Exception {
        String body = "{"
            + TARGET + ","
            + "\"candidates\":[{\"source_id\":\"a\",\"filename\":\"Artist - Title.mp3\"}],"
            + "\"options\":{\"priority\":\"loudest\"}"
            + "}";

        mockMvc.perform(post("/rank")
                .contentType(MediaType.APPLICATION_JSON)
                .content(body))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error.code").value("invalid_policy"))
            .andExpect(jsonPath("$.error.detail").value("unknown ranking preset: loudest"));
    }

    @Test
    void rankRejectsMalformedJson() throws Exception {
        mockMvc.perform(post("/rank")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"target\":"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error.code").value("bad_request"));
    }
}
