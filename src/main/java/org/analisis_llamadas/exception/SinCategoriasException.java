package org.analisis_llamadas.exception;

import org.analisis_llamadas.enums.EtapaAnalisis;

/**
 * Ningún archivo aportó categorías. Distinto de procesar cero filas.
 */
public class SinCategoriasException extends AnalisisException {

    public SinCategoriasException(int archivosProcesados, long filasProcesadas) {
        super(String.format("No se pudieron extraer categorías de ningún archivo (%d archivos, %d filas)",
                archivosProcesados, filasProcesadas), EtapaAnalisis.AGREGACION);
    }
}
