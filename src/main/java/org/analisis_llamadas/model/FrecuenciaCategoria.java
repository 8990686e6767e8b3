package org.analisis_llamadas.model;

import lombok.AllArgsConstructor;
import lombok.Data;

@Data
@AllArgsConstructor
public class FrecuenciaCategoria {
    private String categoria;
    private long frecuencia;
}
