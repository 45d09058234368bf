package io.pockethive.httpmock.server.controller;

import com.jayway.jsonpath.JsonPath;
import io.pockethive.httpmock.MockServer;
import io.pockethive.httpmock.ServerState;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.annotation.DirtiesContext;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@SpringBootTest(properties = {"http-mock.host=127.0.0.1", "http-mock.port=0"})
@AutoConfigureMockMvc
@DirtiesContext(classMode = DirtiesContext.ClassMode.AFTER_EACH_TEST_METHOD)
class AdminControllerTest {

    @Autowired
    MockMvc mvc;

    @Autowired
    MockServer server;

    private final HttpClient client = HttpClient.newBuilder().version(HttpClient.Version.HTTP_1_1).build();

    @Test
    void mockServerIsStartedWithTheContext() throws Exception {
        assertThat(server.state()).isEqualTo(ServerState.RUNNING);

        mvc.perform(get("/__admin/health"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.status").value("UP"))
            .andExpect(jsonPath("$.address").value(server.baseUrl()));
    }

    @Test
    void createdMappingAnswersMockTraffic() throws Exception {
        String body = """
                {
                  "name": "order lookup",
                  "request": { "method": "GET", "path": "/orders/7", "headers": { "Accept": "application/json" } },
                  "response": { "status": 200, "headers": { "X-Mock": "yes" }, "jsonBody": { "id": 7 } },
                  "expectation": { "min": 1, "max": 1 }
                }
                """;

        MvcResult created = mvc.perform(post("/__admin/mappings").contentType(MediaType.APPLICATION_JSON).content(body))
            .andExpect(status().isCreated())
            .andExpect(jsonPath("$.id").isNotEmpty())
            .andReturn();
        assertThat(created.getResponse().getContentAsString()).contains("rule-");

        HttpResponse<String> response = client.send(HttpRequest.newBuilder(URI.create(server.url("/orders/7")))
            .header("Accept", "application/json")
            .build(), HttpResponse.BodyHandlers.ofString());

        assertThat(response.statusCode()).isEqualTo(200);
        assertThat(response.body()).isEqualTo("{\"id\":7}");
        assertThat(response.headers().firstValue("X-Mock")).contains("yes");

        mvc.perform(get("/__admin/mappings"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.meta.total").value(1))
            .andExpect(jsonPath("$.mappings[0].name").value("order lookup"))
            .andExpect(jsonPath("$.mappings[0].callCount").value(1))
            .andExpect(jsonPath("$.mappings[0].expectation.max").value(1));
    }

    @Test
    void invalidMappingsAreRejected() throws Exception {
        mvc.perform(post("/__admin/mappings").contentType(MediaType.APPLICATION_JSON)
                .content("{\"request\": {\"pathPattern\": \"(unclosed\"}}"))
            .andExpect(status().isBadRequest());

        mvc.perform(post("/__admin/mappings").contentType(MediaType.APPLICATION_JSON)
                .content("{\"expectation\": {\"min\": 3, \"max\": 1}}"))
            .andExpect(status().isBadRequest());

        mvc.perform(post("/__admin/mappings").contentType(MediaType.APPLICATION_JSON)
                .content("{\"response\": {\"status\": 42}}"))
            .andExpect(status().isBadRequest());

        mvc.perform(get("/__admin/mappings"))
            .andExpect(jsonPath("$.meta.total").value(0));
    }

    @Test
    void deleteIsIdempotent() throws Exception {
        MvcResult created = mvc.perform(post("/__admin/mappings").contentType(MediaType.APPLICATION_JSON)
                .content("{\"request\": {\"path\": \"/gone\"}}"))
            .andExpect(status().isCreated())
            .andReturn();
        String id = JsonPath.read(created.getResponse().getContentAsString(), "$.id");

        mvc.perform(delete("/__admin/mappings/{id}", id)).andExpect(status().isNoContent());
        mvc.perform(delete("/__admin/mappings/{id}", id)).andExpect(status().isNoContent());

        assertThat(server.isMounted(id)).isFalse();
    }

    @Test
    void requestLogIsExposed() throws Exception {
        client.send(HttpRequest.newBuilder(URI.create(server.url("/unknown?x=1")))
            .POST(HttpRequest.BodyPublishers.ofString("hello"))
            .build(), HttpResponse.BodyHandlers.discarding());

        mvc.perform(get("/__admin/requests"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.meta.total").value(1))
            .andExpect(jsonPath("$.requests[0].method").value("POST"))
            .andExpect(jsonPath("$.requests[0].path").value("/unknown"))
            .andExpect(jsonPath("$.requests[0].query").value("x=1"))
            .andExpect(jsonPath("$.requests[0].body").value("hello"));

        mvc.perform(get("/__admin/requests/unmatched"))
            .andExpect(jsonPath("$.meta.total").value(1));
    }

    @Test
    void verificationReflectsExpectations() throws Exception {
        mvc.perform(post("/__admin/mappings").contentType(MediaType.APPLICATION_JSON)
                .content("{\"request\": {\"path\": \"/ping\"}, \"expectation\": {\"min\": 1}}"))
            .andExpect(status().isCreated());

        mvc.perform(get("/__admin/verification"))
            .andExpect(status().isExpectationFailed())
            .andExpect(jsonPath("$.satisfied").value(false))
            .andExpect(jsonPath("$.violations[0].observed").value(0));

        client.send(HttpRequest.newBuilder(URI.create(server.url("/ping"))).build(), HttpResponse.BodyHandlers.discarding());

        mvc.perform(get("/__admin/verification"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.satisfied").value(true))
            .andExpect(jsonPath("$.verifiedRules").value(1));
    }
}
