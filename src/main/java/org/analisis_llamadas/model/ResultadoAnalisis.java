package org.analisis_llamadas.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;
import org.analisis_llamadas.dto.FiltroFechasDTO;

import java.util.Collections;
import java.util.List;

/**
 * Resultado de una ejecución del análisis sobre todos los archivos.
 *
 * Es el único insumo de las vistas y reportes; se reemplaza completo en cada
 * ejecución y nunca se modifica después de construido. Los acumuladores se
 * entregan como copias.
 */
@Getter
@ToString
@AllArgsConstructor
public class ResultadoAnalisis {

    @Getter(AccessLevel.NONE)
    private final ContadorFrecuencias frecuenciasGenerales;
    private final long totalFilas;
    @Getter(AccessLevel.NONE)
    private final AnalisisDetallado analisisDetallado;
    private final int archivosProcesados;
    private final FiltroFechasDTO filtroFechas;
    private final List<ResultadoArchivo> resultadosPorArchivo;

    public ResultadoAnalisis(ContadorFrecuencias frecuenciasGenerales, long totalFilas,
                             AnalisisDetallado analisisDetallado, int archivosProcesados) {
        this(frecuenciasGenerales, totalFilas, analisisDetallado, archivosProcesados,
                FiltroFechasDTO.sinFiltro(), Collections.<ResultadoArchivo>emptyList());
    }

    public ContadorFrecuencias getFrecuenciasGenerales() {
        return new ContadorFrecuencias(frecuenciasGenerales);
    }

    public AnalisisDetallado getAnalisisDetallado() {
        return analisisDetallado.copia();
    }

    public boolean tieneCategorias() {
        return !frecuenciasGenerales.estaVacio();
    }

    /**
     * Porcentaje de una frecuencia sobre el total de filas, 0 si no hay filas.
     */
    public double porcentajeDelTotal(long frecuencia) {
        return totalFilas > 0 ? frecuencia * 100.0 / totalFilas : 0.0;
    }
}
