package io.chronoledger.api;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;

import java.util.UUID;

import static org.hamcrest.Matchers.hasSize;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.patch;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("inmem")
class TemporalControllerTest {

    @Autowired MockMvc mvc;
    @Autowired ObjectMapper json;

    private String createWidget(String body) throws Exception {
        var response = mvc.perform(post("/api/entities/widget")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body))
                .andExpect(status().isCreated())
                .andReturn().getResponse().getContentAsString();
        return json.readTree(response).get("id").asText();
    }

    @Test
    void create_startsAtVersionOneWithDefaults() throws Exception {
        var id = UUID.randomUUID().toString();

        mvc.perform(post("/api/entities/widget")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"id\":\"" + id + "\",\"values\":{\"description\":\"first description\"}}"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.id").value(id))
                .andExpect(jsonPath("$.vclock").value(1))
                .andExpect(jsonPath("$.values.description").value("first description"))
                .andExpect(jsonPath("$.values.status").value("draft"));

        mvc.perform(get("/api/entities/widget/{id}/history/status", id))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(1)));
    }

    @Test
    void patch_recordsOneVersionAndClosesThePreviousValue() throws Exception {
        var id = createWidget("{\"values\":{\"description\":\"first description\",\"price\":10}}");

        mvc.perform(patch("/api/entities/widget/{id}", id)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"values\":{\"description\":\"second description\",\"price\":12}}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.vclock").value(2));

        mvc.perform(get("/api/entities/widget/{id}/clock", id))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(2)))
                .andExpect(jsonPath("$[0].vclock").value(1))
                .andExpect(jsonPath("$[1].vclock").value(2))
                .andExpect(jsonPath("$[1].tickEnd").doesNotExist());

        mvc.perform(get("/api/entities/widget/{id}/history/description", id))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(2)))
                .andExpect(jsonPath("$[0].values.description").value("first description"))
                .andExpect(jsonPath("$[0].tickEnd").exists())
                .andExpect(jsonPath("$[1].values.description").value("second description"));
    }

    @Test
    void history_asOfReturnsTheEffectiveRow() throws Exception {
        var id = createWidget("{\"values\":{\"description\":\"only\"}}");

        mvc.perform(get("/api/entities/widget/{id}/history/description", id)
                        .param("asOf", "2999-01-01T00:00:00Z"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(1)))
                .andExpect(jsonPath("$[0].values.description").value("only"));

        mvc.perform(get("/api/entities/widget/{id}/history/description", id)
                        .param("asOf", "2000-01-01T00:00:00Z"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(0)));
    }

    @Test
    void create_withoutRequiredActivityIsRejected() throws Exception {
        mvc.perform(post("/api/entities/contract")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"values\":{\"terms\":\"net 30\"}}"))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.error").value("REJECTED"));
    }

    @Test
    void patch_reusingAnActivityConflicts() throws Exception {
        var response = mvc.perform(post("/api/entities/contract")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"values\":{\"terms\":\"net 30\"},\"activity\":\"signing\"}"))
                .andExpect(status().isCreated())
                .andReturn().getResponse().getContentAsString();
        var id = json.readTree(response).get("id").asText();

        mvc.perform(patch("/api/entities/contract/{id}", id)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"values\":{\"terms\":\"net 60\"},\"activity\":\"signing\"}"))
                .andExpect(status().isConflict());

        mvc.perform(patch("/api/entities/contract/{id}", id)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"values\":{\"terms\":\"net 60\"},\"activity\":\"renegotiation\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.vclock").value(2));
    }

    @Test
    void partialCompositeIsABadRequest() throws Exception {
        mvc.perform(post("/api/entities/widget")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"values\":{\"lat\":1.5}}"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void delete_isAlwaysRefused() throws Exception {
        var id = createWidget("{\"values\":{\"description\":\"keep me\"}}");

        mvc.perform(delete("/api/entities/widget/{id}", id))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.error").value("CONFLICT"));

        mvc.perform(get("/api/entities/widget/{id}", id))
                .andExpect(status().isOk());
    }

    @Test
    void unknownEntityOrTypeIsReported() throws Exception {
        mvc.perform(get("/api/entities/widget/{id}", UUID.randomUUID()))
                .andExpect(status().isNotFound());

        mvc.perform(post("/api/entities/gadget")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"values\":{}}"))
                .andExpect(status().isBadRequest());
    }
}
