package it.insurapro.crm.controller;

import it.insurapro.common.dto.data.DataFileStatusDto;
import it.insurapro.common.exception.DataPersistenceException;
import it.insurapro.crm.service.DataFileService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.web.servlet.MockMvc;

import java.io.IOException;

import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(DataFileController.class)
class DataFileControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private DataFileService dataFileService;

    @Test
    void save_ShouldReturnCounts() throws Exception {
        when(dataFileService.save()).thenReturn(DataFileStatusDto.builder()
                .success(true)
                .message("Data saved successfully")
                .customerCount(2)
                .interactionCount(5)
                .build());

        mockMvc.perform(post("/api/data/save"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.message").value("Data saved successfully"))
                .andExpect(jsonPath("$.data.customerCount").value(2))
                .andExpect(jsonPath("$.data.interactionCount").value(5));
    }

    @Test
    void save_ShouldReturn500WhenFileCannotBeWritten() throws Exception {
        when(dataFileService.save()).thenThrow(new DataPersistenceException(
                "data/customers.txt", "Permission denied", new IOException("Permission denied")));

        mockMvc.perform(post("/api/data/save"))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.errorCode").value("CRM_ERR_500"));
    }

    @Test
    void load_ShouldReportNoDataAsUnsuccessfulStatus() throws Exception {
        when(dataFileService.load()).thenReturn(DataFileStatusDto.builder()
                .success(false)
                .message("No existing data found")
                .build());

        mockMvc.perform(post("/api/data/load"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.success").value(false))
                .andExpect(jsonPath("$.message").value("No existing data found"));
    }
}
