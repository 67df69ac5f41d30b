package io.github.riemr.pto.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class TakenDay {
    private Long id;
    private LocalDate date;
    @Builder.Default
    private TakenDayStatus status = TakenDayStatus.PLANNED;
    private String description;

    public boolean consumesBudget() {
        return status == null || status.consumesBudget();
    }
}
