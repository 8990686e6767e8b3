package org.analisis_llamadas.enums;

import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Getter;

/**
 * Prioridad de una subcategoría según su porcentaje del total de llamadas.
 */
@Getter
public enum PrioridadNegocio {
    ALTA("Alta", 5.0),
    MEDIA("Media", 2.0),
    BAJA("Baja", 0.0);

    @JsonValue
    private final String etiqueta;
    private final double umbralMinimo;

    PrioridadNegocio(String etiqueta, double umbralMinimo) {
        this.etiqueta = etiqueta;
        this.umbralMinimo = umbralMinimo;
    }

    public static PrioridadNegocio desdePorcentaje(double porcentaje) {
        for (PrioridadNegocio prioridad : values()) {
            if (porcentaje >= prioridad.umbralMinimo) {
                return prioridad;
            }
        }
        return BAJA;
    }
}
