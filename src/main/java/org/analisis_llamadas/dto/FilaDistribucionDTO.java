package org.analisis_llamadas.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.analisis_llamadas.enums.SegmentoVolumen;

@AllArgsConstructor
@NoArgsConstructor
@Data
@Builder
public class FilaDistribucionDTO {
    private SegmentoVolumen segmento;
    private int categorias;
    private long llamadas;
    private double porcentaje;

    /** Hasta tres categorías del segmento, en orden de aparición */
    private String ejemplos;
}
