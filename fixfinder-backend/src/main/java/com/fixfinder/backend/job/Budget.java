package com.fixfinder.backend.job;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Embeddable
@Data
@NoArgsConstructor
@AllArgsConstructor
public class Budget {

    @Column(name = "budget_min")
    private Integer min;

    @Column(name = "budget_max")
    private Integer max;
}
