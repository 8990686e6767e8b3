package org.analisis_llamadas.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.analisis_llamadas.enums.ImpactoOperativo;

/**
 * Fila del ranking de categorías generales.
 */
@AllArgsConstructor
@NoArgsConstructor
@Data
@Builder
public class FilaRankingDTO {
    private int ranking;
    private String categoria;
    private long llamadas;
    private double porcentaje;
    private ImpactoOperativo impactoOperativo;
}
