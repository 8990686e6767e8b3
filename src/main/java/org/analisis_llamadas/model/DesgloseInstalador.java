package org.analisis_llamadas.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Frecuencia de una ruta para un agente instalador y su porcentaje sobre
 * el total de llamadas de ese agente.
 */
@Data
@Builder
@AllArgsConstructor
@NoArgsConstructor
public class DesgloseInstalador {

    private String agenteInstalador;
    private String categoriaGeneral;
    private String categoriaEspecifica;
    private String subtipo;
    private String rutaCompleta;
    private long frecuencia;

    /** Porcentaje sobre el total del agente, en [0, 100] */
    private double porcentajeAgente;
}
