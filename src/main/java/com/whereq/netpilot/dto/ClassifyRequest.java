package com.whereq.netpilot.dto;

import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Commands to check against the dangerous command rules
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ClassifyRequest {

    @NotNull
    private List<String> commands;
}
