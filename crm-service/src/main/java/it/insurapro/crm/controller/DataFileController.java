package it.insurapro.crm.controller;

import it.insurapro.common.dto.ApiResponse;
import it.insurapro.common.dto.data.DataFileStatusDto;
import it.insurapro.crm.service.DataFileService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/data")
@RequiredArgsConstructor
@Tag(name = "Data files", description = "Save and reload the customer and interaction files")
public class DataFileController {

    private final DataFileService dataFileService;

    @PostMapping("/save")
    @Operation(summary = "Write all customers and interactions to the data files")
    public ResponseEntity<ApiResponse<DataFileStatusDto>> save() {
        DataFileStatusDto status = dataFileService.save();
        return ResponseEntity.ok(ApiResponse.success(status, status.getMessage()));
    }

    @PostMapping("/load")
    @Operation(summary = "Replace in-memory data with the data files")
    public ResponseEntity<ApiResponse<DataFileStatusDto>> load() {
        DataFileStatusDto status = dataFileService.load();
        return ResponseEntity.ok(ApiResponse.success(status, status.getMessage()));
    }
}
