package com.structbp.server.controller;

import com.structbp.server.config.InferenceConfig;
import com.structbp.server.service.QueryService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.io.InputStream;
import java.nio.charset.StandardCharsets;

import static org.hamcrest.Matchers.closeTo;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

public class QueryControllerTest {

    private MockMvc mockMvc;
    private String sprinklerJson;

    @BeforeEach
    public void setup() throws Exception {
        QueryController controller = new QueryController(new QueryService(InferenceConfig.defaults()));
        mockMvc = MockMvcBuilders.standaloneSetup(controller).build();
        try (InputStream is = getClass().getResourceAsStream("/models/sprinkler.json")) {
            sprinklerJson = new String(is.readAllBytes(), StandardCharsets.UTF_8);
        }
    }

    @Test
    public void testQuery() throws Exception {
        String body = "{\"model\": " + sprinklerJson + ", \"targets\": [\"sprinkler\"], \"iterations\": 10}";

        mockMvc.perform(post("/query").contentType(MediaType.APPLICATION_JSON).content(body))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.iterations").value(10))
                .andExpect(jsonPath("$.cached").value(false))
                .andExpect(jsonPath("$.marginals.sprinkler[1].value").value(true))
                .andExpect(jsonPath("$.marginals.sprinkler[1].probability").value(closeTo(0.41, 1e-9)));
    }

    @Test
    public void testMissingModelIsBadRequest() throws Exception {
        mockMvc.perform(post("/query").contentType(MediaType.APPLICATION_JSON).content("{\"targets\": [\"a\"]}"))
                .andExpect(status().isBadRequest());
    }

    @Test
    public void testUnknownTargetIsBadRequest() throws Exception {
        String body = "{\"model\": " + sprinklerJson + ", \"targets\": [\"nope\"]}";
        mockMvc.perform(post("/query").contentType(MediaType.APPLICATION_JSON).content(body))
                .andExpect(status().isBadRequest());
    }

    @Test
    public void testNonBooleanOperandIsBadRequest() throws Exception {
        String body = "{\"model\": {\"elements\": ["
                + "{\"id\": \"s\", \"type\": \"Select\", \"outcomes\": {\"a\": 0.5, \"b\": 0.5}},"
                + "{\"id\": \"n\", \"type\": \"Not\", \"args\": [\"s\"]}]}, \"targets\": [\"n\"]}";
        mockMvc.perform(post("/query").contentType(MediaType.APPLICATION_JSON).content(body))
                .andExpect(status().isBadRequest());
    }

    @Test
    public void testImpossibleEvidenceIsUnprocessable() throws Exception {
        String body = "{\"model\": {\"elements\": [{\"id\": \"c\", \"type\": \"Constant\", \"value\": false}],"
                + " \"observations\": {\"c\": true}}, \"targets\": [\"c\"], \"iterations\": 5}";
        mockMvc.perform(post("/query").contentType(MediaType.APPLICATION_JSON).content(body))
                .andExpect(status().isUnprocessableEntity());
    }

    @Test
    public void testHealth() throws Exception {
        mockMvc.perform(get("/health"))
                .andExpect(status().isOk())
                .andExpect(content().string("OK"));
    }
}
