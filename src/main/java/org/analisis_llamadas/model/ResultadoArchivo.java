package org.analisis_llamadas.model;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;
import org.analisis_llamadas.enums.EstadoFiltroFecha;

/**
 * Resultado del análisis de un único archivo.
 */
@Getter
@ToString
@AllArgsConstructor
public class ResultadoArchivo {

    private final String nombreArchivo;
    private final ContadorFrecuencias frecuenciasGenerales;
    private final long filasProcesadas;
    private final AnalisisDetallado analisisDetallado;
    private final EstadoFiltroFecha estadoFiltro;

    /** Indica si el archivo falló y aporta el resultado vacío */
    private final boolean conError;

    public static ResultadoArchivo vacio(String nombreArchivo, EstadoFiltroFecha estadoFiltro) {
        return new ResultadoArchivo(nombreArchivo, new ContadorFrecuencias(), 0L,
                AnalisisDetallado.vacio(), estadoFiltro, false);
    }

    public static ResultadoArchivo sinCategorias(String nombreArchivo, long filas, EstadoFiltroFecha estadoFiltro) {
        return new ResultadoArchivo(nombreArchivo, new ContadorFrecuencias(), filas,
                AnalisisDetallado.vacio(), estadoFiltro, false);
    }

    public static ResultadoArchivo conError(String nombreArchivo) {
        return new ResultadoArchivo(nombreArchivo, new ContadorFrecuencias(), 0L,
                AnalisisDetallado.vacio(), EstadoFiltroFecha.NO_CONFIGURADO, true);
    }
}
