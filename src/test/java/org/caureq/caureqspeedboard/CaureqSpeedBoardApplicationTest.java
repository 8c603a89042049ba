package org.caureq.caureqspeedboard;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import java.net.URI;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

@SpringBootTest(properties = {
        "app.nodes[0].id=lv",
        "app.nodes[0].flag=🇱🇻",
        "app.nodes[0].display-name=Latvia"
})
@AutoConfigureMockMvc
class CaureqSpeedBoardApplicationTest {

    @Autowired
    private MockMvc mvc;

    @Test
    void reportIsVisibleInNodeStatus() throws Exception {
        mvc.perform(post("/api/v1/report")
                        .header("Authorization", "Bearer " + Fixtures.TOKEN)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"node_id\": \"lv\", \"download_mbps\": 1200, \"upload_mbps\": 400, \"ping_ms\": 3}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("ok"));

        mvc.perform(get("/api/v1/nodes").header("X-API-KEY", Fixtures.TOKEN))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.nodes[0].nodeId").value("lv"))
                .andExpect(jsonPath("$.nodes[0].tier").value("GOOD"))
                .andExpect(jsonPath("$.status").value("OK"));
    }

    @Test
    void encodedRoutesStillRequireToken() throws Exception {
        mvc.perform(post(URI.create("/api/v1/%72eport"))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"node_id\": \"intruder\", \"download_mbps\": 1, \"upload_mbps\": 1, \"ping_ms\": 1}"))
                .andExpect(status().isUnauthorized());

        mvc.perform(get(URI.create("/api/v1/%6Eodes")))
                .andExpect(status().isUnauthorized());
    }

    @Test
    void healthNeedsNoToken() throws Exception {
        mvc.perform(get("/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("UP"))
                .andExpect(jsonPath("$.nodesConfigured").value(1));
    }
}
