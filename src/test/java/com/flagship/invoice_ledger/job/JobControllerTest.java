package com.flagship.invoice_ledger.job;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.invoice_ledger.support.StubProviderConfig;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.http.HttpHeaders;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;
import org.springframework.test.web.servlet.request.MockMultipartHttpServletRequestBuilder;

import java.nio.charset.StandardCharsets;
import java.util.UUID;

import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.startsWith;
import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.multipart;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
@Import(StubProviderConfig.class)
class JobControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    private static MockMultipartFile invoice(String filename, String invoiceNumber) {
        return new MockMultipartFile("files", filename, "image/png", invoiceNumber.getBytes(StandardCharsets.UTF_8));
    }

    private UUID submit(MockMultipartFile... files) throws Exception {
        MockMultipartHttpServletRequestBuilder request = multipart("/api/jobs");
        for (MockMultipartFile file : files) {
            request.file(file);
        }
        request.param("company_name", "Flagship Pvt Ltd")
                .param("transaction_type", "Sales");
        MvcResult result = mockMvc.perform(request)
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.status").value("PENDING"))
                .andExpect(jsonPath("$.total_files").value(files.length))
                .andReturn();
        return UUID.fromString(objectMapper.readTree(result.getResponse().getContentAsString())
                .get("job_id").asText());
    }

    private JsonNode awaitCompleted(UUID jobId) throws Exception {
        for (int attempt = 0; attempt < 200; attempt++) {
            String body = mockMvc.perform(get("/api/jobs/{id}", jobId))
                    .andExpect(status().isOk())
                    .andReturn().getResponse().getContentAsString();
            JsonNode job = objectMapper.readTree(body);
            String status = job.get("status").asText();
            if (status.equals("COMPLETED") || status.equals("FAILED")) {
                return job;
            }
            Thread.sleep(50);
        }
        return fail("Job " + jobId + " did not finish");
    }

    @Test
    @DisplayName("Should accept files, complete the job and serve the ledger and exports")
    void fullJobLifecycle() throws Exception {
        UUID jobId = submit(invoice("first.png", "INV-1001"), invoice("second.png", "INV-1002"));

        JsonNode job = awaitCompleted(jobId);
        assertEquals("COMPLETED", job.get("status").asText());
        assertEquals(2, job.get("successful_files").asInt());
        assertEquals("first.png", job.get("results").get(0).get("file_id").asText());
        assertEquals("INV-1002", job.get("results").get(1).get("fields").get("invoiceNumber").asText());

        mockMvc.perform(get("/api/jobs/{id}/ledger", jobId))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.company_name").value("Flagship Pvt Ltd"))
                .andExpect(jsonPath("$.vouchers.length()").value(2))
                .andExpect(jsonPath("$.summary.gst_rates[0]").value(18));

        mockMvc.perform(get("/api/jobs/{id}/ledger.xml", jobId))
                .andExpect(status().isOk())
                .andExpect(header().string(HttpHeaders.CONTENT_DISPOSITION,
                        "attachment; filename=\"tally_import_" + jobId + ".xml\""))
                .andExpect(content().string(containsString("<VOUCHERNUMBER>INV-1001</VOUCHERNUMBER>")));

        mockMvc.perform(get("/api/jobs/{id}/export.csv", jobId))
                .andExpect(status().isOk())
                .andExpect(content().string(startsWith("file_id,status,")))
                .andExpect(content().string(containsString("INV-1002")));
    }

    @Test
    @DisplayName("Unknown job ids should return 404")
    void unknownJob() throws Exception {
        UUID unknown = UUID.randomUUID();

        mockMvc.perform(get("/api/jobs/{id}", unknown))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.message").value("Job not found: " + unknown));
        mockMvc.perform(get("/api/jobs/{id}/ledger", unknown))
                .andExpect(status().isNotFound());
        mockMvc.perform(get("/api/jobs/{id}", "not-a-uuid"))
                .andExpect(status().isBadRequest());
    }

    @Test
    @DisplayName("Invalid submissions should return 400")
    void rejectsInvalidSubmissions() throws Exception {
        mockMvc.perform(multipart("/api/jobs")
                        .file(invoice("a.png", "INV-1"))
                        .param("company_name", "Flagship Pvt Ltd")
                        .param("transaction_type", "Journal"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("Invalid transaction type: Journal"));

        mockMvc.perform(multipart("/api/jobs")
                        .file(new MockMultipartFile("files", "notes.txt", "text/plain", "hello".getBytes(StandardCharsets.UTF_8)))
                        .param("company_name", "Flagship Pvt Ltd")
                        .param("transaction_type", "Purchase"))
                .andExpect(status().isBadRequest());

        mockMvc.perform(multipart("/api/jobs")
                        .file(invoice("a.png", "INV-1"))
                        .param("transaction_type", "Sales"))
                .andExpect(status().isBadRequest());
    }

    @Test
    @DisplayName("A single document should be extracted synchronously")
    void extractsSingleDocument() throws Exception {
        MockMultipartFile file = new MockMultipartFile("file", "single.png", "image/png",
                "INV-7001".getBytes(StandardCharsets.UTF_8));

        mockMvc.perform(multipart("/api/extract").file(file))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.file_id").value("single.png"))
                .andExpect(jsonPath("$.status").value("SUCCESS"))
                .andExpect(jsonPath("$.provider_used").value("stub-primary"))
                .andExpect(jsonPath("$.from_cache").value(false))
                .andExpect(jsonPath("$.gst_rate").value(18))
                .andExpect(jsonPath("$.fields.invoiceNumber").value("INV-7001"));

        mockMvc.perform(multipart("/api/extract").file(file))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.from_cache").value(true));

        mockMvc.perform(multipart("/api/extract")
                        .file(new MockMultipartFile("file", "notes.txt", "text/plain", "hello".getBytes(StandardCharsets.UTF_8))))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value(containsString("Unsupported file type text/plain")));

        mockMvc.perform(multipart("/api/extract")
                        .file(new MockMultipartFile("file", "blank.png", "image/png", new byte[0])))
                .andExpect(status().isBadRequest());
    }

    @Test
    @DisplayName("Provider, health and stats endpoints should report state")
    void operationalEndpoints() throws Exception {
        mockMvc.perform(get("/api/providers"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.total").value(1))
                .andExpect(jsonPath("$.providers[0].provider_id").value("stub-primary"));

        mockMvc.perform(post("/api/providers/reset"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.message").value("All providers reset"))
                .andExpect(jsonPath("$.available").value(1));

        mockMvc.perform(get("/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("UP"))
                .andExpect(jsonPath("$.store").value("UP"))
                .andExpect(jsonPath("$.providers_total").value(1));

        mockMvc.perform(get("/api/stats"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.active_jobs").isNumber())
                .andExpect(jsonPath("$.jobs_created").isNumber());
    }
}
