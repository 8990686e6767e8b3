package org.analisis_llamadas.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Total de llamadas de un agente instalador, sumando todas sus rutas.
 */
@AllArgsConstructor
@NoArgsConstructor
@Data
@Builder
public class FilaTotalAgenteDTO {
    private String agenteInstalador;
    private long llamadas;
}
