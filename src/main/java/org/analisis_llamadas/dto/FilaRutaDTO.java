package org.analisis_llamadas.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@AllArgsConstructor
@NoArgsConstructor
@Data
@Builder
public class FilaRutaDTO {
    private String categoriaGeneral;
    private String categoriaEspecifica;
    private String subtipo;
    private String rutaCompleta;
    private long frecuencia;
    private double porcentaje;
}
