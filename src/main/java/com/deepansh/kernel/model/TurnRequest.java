package com.deepansh.kernel.model;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;

@Data
public class TurnRequest {

    @NotBlank(message = "input must not be blank")
    private String input;
}
