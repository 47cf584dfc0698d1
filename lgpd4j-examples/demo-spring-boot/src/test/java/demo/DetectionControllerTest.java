/*
 * Copyright (c) 2025 Lgpd4J Contributors
 * Licensed under the Apache License 2.0
 */
package demo;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import java.nio.charset.StandardCharsets;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

@SpringBootTest
@AutoConfigureMockMvc
class DetectionControllerTest {

    @Autowired
    MockMvc mvc;

    @Test
    void detectsCpfAndPhone() throws Exception {
        mvc.perform(post("/detect")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"text\":\"CPF 529.982.247-25, tel (61) 99999-8888\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.hasPii").value(true))
                .andExpect(jsonPath("$.classification").value("NON_PUBLIC"))
                .andExpect(jsonPath("$.mode").value("balanced"))
                .andExpect(jsonPath("$.entities[0].type").value("CPF"))
                .andExpect(jsonPath("$.entities[0].start").value(4))
                .andExpect(jsonPath("$.entities[1].type").value("PHONE"));
    }

    @Test
    void publicTextHasNoEntities() throws Exception {
        mvc.perform(post("/detect")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"text\":\"O relatório trimestral foi aprovado.\",\"mode\":\"strict\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.hasPii").value(false))
                .andExpect(jsonPath("$.classification").value("PUBLIC"))
                .andExpect(jsonPath("$.mode").value("strict"));
    }

    @Test
    void unknownModeIsBadRequest() throws Exception {
        mvc.perform(post("/detect")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"text\":\"x\",\"mode\":\"paranoid\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("PolicyConfigurationException"));
    }

    @Test
    void malformedUtf8IsBadRequest() throws Exception {
        mvc.perform(post("/detect").contentType(MediaType.TEXT_PLAIN).content(new byte[] {'a', (byte) 0xC3, '('}))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("InvalidTextEncodingException"));
    }

    @Test
    void rawUtf8BodyIsDetected() throws Exception {
        mvc.perform(post("/detect")
                        .contentType(MediaType.TEXT_PLAIN)
                        .content("e-mail: maria@exemplo.com.br".getBytes(StandardCharsets.UTF_8)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.entities[0].type").value("EMAIL"));
    }

    @Test
    void batchKeepsInputOrderAndSummarises() throws Exception {
        mvc.perform(post("/detect/batch")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"texts\":[\"nada aqui\",\"CPF 529.982.247-25\",\"CEP 70000-000\"]}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.results.length()").value(3))
                .andExpect(jsonPath("$.results[0].hasPii").value(false))
                .andExpect(jsonPath("$.results[1].entities[0].type").value("CPF"))
                .andExpect(jsonPath("$.summary.totalProcessed").value(3))
                .andExpect(jsonPath("$.summary.totalWithPii").value(2));
    }

    @Test
    void actuatorEndpointListsRecentFindings() throws Exception {
        mvc.perform(post("/detect")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"text\":\"CEP 70000-000\"}"))
                .andExpect(status().isOk());

        mvc.perform(get("/actuator/lgpd4j"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("OK"))
                .andExpect(jsonPath("$.mode").value("balanced"))
                .andExpect(jsonPath("$.recentFindings").isNotEmpty());
    }
}
