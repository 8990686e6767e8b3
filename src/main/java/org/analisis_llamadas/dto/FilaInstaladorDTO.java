package org.analisis_llamadas.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Fila del desglose por agente instalador. El porcentaje es relativo al total
 * de llamadas del agente, no al total general.
 */
@AllArgsConstructor
@NoArgsConstructor
@Data
@Builder
public class FilaInstaladorDTO {
    private String agenteInstalador;
    private String categoriaGeneral;
    private String categoriaEspecifica;
    private String subtipo;
    private String rutaCompleta;
    private long frecuencia;
    private double porcentajeAgente;

    /** Porcentaje del agente con formato "12.50%" */
    private String porcentajeAgenteTexto;
}
