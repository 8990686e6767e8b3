package org.analisis_llamadas.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@AllArgsConstructor
@NoArgsConstructor
@Data
@Builder
public class FilaInsightDTO {
    private String tipo;
    private String insight;
    private String recomendacion;
    private String impactoPotencial;
}
