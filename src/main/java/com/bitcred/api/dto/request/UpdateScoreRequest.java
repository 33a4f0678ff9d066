package com.bitcred.api.dto.request;

import jakarta.validation.constraints.NotNull;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request DTO for replacing a registered score.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UpdateScoreRequest {

    @NotNull
    private Integer score;

    private List<String> proof;
}
