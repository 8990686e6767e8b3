package org.analisis_llamadas.enums;

import lombok.Getter;

/**
 * Resultado de aplicar el filtro de fechas a un archivo.
 */
@Getter
public enum EstadoFiltroFecha {
    NO_CONFIGURADO("Sin filtro de fechas"),
    APLICADO("Filtro de fechas aplicado"),
    SIN_COLUMNA_FECHA("Archivo procesado sin filtrar: no se identificó columna de fecha");

    private final String descripcion;

    EstadoFiltroFecha(String descripcion) {
        this.descripcion = descripcion;
    }
}
