package org.analisis_llamadas.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.analisis_llamadas.enums.PrioridadNegocio;

@AllArgsConstructor
@NoArgsConstructor
@Data
@Builder
public class FilaSubcategoriaDTO {
    /** Nombre legible de la columna de origen, ej. "Categoria Especifica" */
    private String tipo;
    private String subcategoria;
    private long frecuencia;
    private double porcentaje;
    private PrioridadNegocio prioridad;
}
