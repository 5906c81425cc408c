package com.flagship.split_escrow.milestone.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Optional body for dispute and reject.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class TransitionRequest {
    private String reason;
}
