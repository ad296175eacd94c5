package com.puzzlehub.puzzleservice;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest(properties = "puzzle.seed=7")
@AutoConfigureMockMvc
class PuzzleServiceApplicationTests {

    @Autowired
    private MockMvc mvc;

    @Autowired
    private ObjectMapper mapper;

    @Test
    void playsThroughTheHttpApi() throws Exception {
        String body = mvc.perform(post("/api/puzzle/new").param("size", "4"))
                .andExpect(status().isOk())
                .andReturn().getResponse().getContentAsString();
        String id = mapper.readTree(body).path("data").asText();

        JsonNode view = mapper.readTree(mvc.perform(get("/api/puzzle/sessions/" + id + "/view"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.size").value(4))
                .andExpect(jsonPath("$.data.phase").value("PLAYING"))
                .andReturn().getResponse().getContentAsString()).path("data");
        JsonNode target = view.path("movable").get(0);

        // 点空格本身：被拒绝，仍是 200
        mvc.perform(post("/api/puzzle/sessions/" + id + "/move")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"row\":" + view.path("blankRow").asInt() + ",\"col\":" + view.path("blankCol").asInt() + "}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.applied").value(false));

        mvc.perform(post("/api/puzzle/sessions/" + id + "/move")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"row\":" + target.path("row").asInt() + ",\"col\":" + target.path("col").asInt() + "}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.applied").value(true))
                .andExpect(jsonPath("$.data.snapshot.moves").value(1))
                .andExpect(jsonPath("$.data.snapshot.blankRow").value(target.path("row").asInt()));

        mvc.perform(post("/api/puzzle/new").param("size", "42"))
                .andExpect(status().isBadRequest());
        mvc.perform(post("/api/puzzle/sessions/" + id + "/resume"))
                .andExpect(status().isConflict());

        assertThat(id).isNotBlank();
    }
}
