package org.analisis_llamadas.enums;

/**
 * Forma de una entrada del análisis detallado.
 */
public enum TipoEntrada {
    FRECUENCIAS,
    REGISTROS
}
