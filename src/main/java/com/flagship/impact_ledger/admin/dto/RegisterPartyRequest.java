package com.flagship.impact_ledger.admin.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Users register with an email, merchants and partners with a name.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class RegisterPartyRequest {

    @JsonProperty("email")
    private String email;

    @JsonProperty("name")
    private String name;
}
