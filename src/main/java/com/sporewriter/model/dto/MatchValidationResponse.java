package com.sporewriter.model.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Outcome of a match check. {@code error} holds the failed check when not valid.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MatchValidationResponse {
    private boolean valid;
    private String error;
    private String detail;
}
