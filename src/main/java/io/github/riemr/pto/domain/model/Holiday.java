package io.github.riemr.pto.domain.model;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Holiday {
    private Long id;

    @NotBlank
    @Size(max = 200)
    private String name;

    @NotNull
    private LocalDate date;

    private boolean repeatsYearly;

    @Builder.Default
    private boolean paid = true;

    // set for holidays imported from the public holiday provider
    private String countryCode;
}
