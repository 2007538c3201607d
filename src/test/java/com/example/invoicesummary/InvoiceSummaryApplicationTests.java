package com.example.invoicesummary;

import com.example.invoicesummary.infrastructure.store.InMemoryDocumentStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * Integration tests booting the full context and driving the HTTP endpoints end to end.
 */
@SpringBootTest
@AutoConfigureMockMvc
class InvoiceSummaryApplicationTests {

	@Autowired
	private MockMvc mockMvc;

	@Autowired
	private InMemoryDocumentStore documentStore;

	@BeforeEach
	void clearStore() {
		documentStore.clear();
	}

	/**
	 * Ensures the application context loads without throwing exceptions.
	 */
	@Test
	void contextLoads() {
	}

	/**
	 * Registers a batch and reads back the reconciled product rows, the failure and the document summary.
	 *
	 * @throws Exception when the mock request fails
	 */
	@Test
	void registeredDocumentsAreSummarized() throws Exception {
		mockMvc.perform(post("/api/documents")
						.contentType(MediaType.APPLICATION_JSON)
						.content(fixture("/documents/batch.json")))
				.andExpect(status().isCreated())
				.andExpect(jsonPath("$.registered").value(3));

		mockMvc.perform(get("/api/product-summary"))
				.andExpect(status().isOk())
				.andExpect(jsonPath("$.rows.length()").value(2))
				.andExpect(jsonPath("$.rows[0].product").value("Chair"))
				.andExpect(jsonPath("$.rows[0].finalNet").value(45.0))
				.andExpect(jsonPath("$.rows[1].vatValue").value(15.72))
				.andExpect(jsonPath("$.rows[1].lineTotal").value(90.6))
				.andExpect(jsonPath("$.failures[0].source").value("INV-102"))
				.andExpect(jsonPath("$.failures[0].errorType").value("MALFORMED_LINE"));

		mockMvc.perform(get("/api/product-summary").param("supplierName", "ACME*"))
				.andExpect(status().isOk())
				.andExpect(jsonPath("$.rows.length()").value(1))
				.andExpect(jsonPath("$.rows[0].supplier").value("ACME Corp SRL"));

		mockMvc.perform(get("/api/documents")
						.param("startDate", "2024-03-01")
						.param("endDate", "2024-03-31"))
				.andExpect(status().isOk())
				.andExpect(jsonPath("$.length()").value(2))
				.andExpect(jsonPath("$[1].documentNumber").value("INV-101"));
	}

	private String fixture(String name) throws IOException {
		try (InputStream in = getClass().getResourceAsStream(name)) {
			return new String(in.readAllBytes(), StandardCharsets.UTF_8);
		}
	}
}
