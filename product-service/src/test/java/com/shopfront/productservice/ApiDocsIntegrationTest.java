package com.shopfront.productservice;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.test.web.servlet.MockMvc;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * The OpenAPI document is public and groups operations under the
 * Products, Seller and Login tags.
 */
@AutoConfigureMockMvc
public class ApiDocsIntegrationTest extends AbstractIntegrationTest {

  @Autowired
  private MockMvc mockMvc;

  @Test
  void should_serve_api_docs_with_info_and_contact() throws Exception {
    mockMvc.perform(get("/v3/api-docs"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.info.title").value("Products API"))
        .andExpect(jsonPath("$.info.version").value("1.0.0"))
        .andExpect(jsonPath("$.info.contact.name").value("Patrick Yip"))
        .andExpect(jsonPath("$.info.contact.email").value("support@wisecrackr.com"));
  }

  @Test
  void should_tag_operations_by_area() throws Exception {
    mockMvc.perform(get("/v3/api-docs"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.paths['/products'].get.tags[0]").value("Products"))
        .andExpect(jsonPath("$.paths['/product/{id}'].delete.tags[0]").value("Products"))
        .andExpect(jsonPath("$.paths['/seller'].post.tags[0]").value("Seller"))
        .andExpect(jsonPath("$.paths['/login'].post.tags[0]").value("Login"));
  }
}
