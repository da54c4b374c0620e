package com.barthel.spi.adapter.out.db.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDate;

@Entity
@Table(name = "spi_results")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class SpiResultEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private String temporalModel;

    private int unitCount;
    private int dayCount;
    private int shiftDays;

    @Column(nullable = false)
    private LocalDate windowStart;

    @Column(nullable = false)
    private LocalDate windowEnd;

    private LocalDate trueStart;
    private LocalDate trueEnd;
    private int usedCount;

    private String seasonalGroup;
    private int groupSize;
    private boolean lowConfidence;

    private int definedCells;
    private int undefinedCells;

    // null when no cell is defined
    private Double meanIndex;
}
