package com.coopledger.api.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;

import java.time.LocalDate;

@Data
public class CreateSchemeRequest {

    @NotBlank(message = "Scheme name is required")
    private String name;

    private String description;

    private LocalDate effectiveFrom;
}
