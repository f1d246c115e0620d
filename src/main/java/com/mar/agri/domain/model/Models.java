package com.mar.agri.domain.model;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;

@Data
public class Models {
    @NotBlank
    private String dir = "models";
}
