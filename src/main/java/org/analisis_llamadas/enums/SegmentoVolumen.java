package org.analisis_llamadas.enums;

import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Getter;

@Getter
public enum SegmentoVolumen {
    ALTO("ALTO VOLUMEN (>10%)", 10.0),
    MEDIO("MEDIO VOLUMEN (1-10%)", 1.0),
    BAJO("BAJO VOLUMEN (<1%)", 0.0);

    @JsonValue
    private final String etiqueta;
    private final double umbralMinimo;

    SegmentoVolumen(String etiqueta, double umbralMinimo) {
        this.etiqueta = etiqueta;
        this.umbralMinimo = umbralMinimo;
    }

    public static SegmentoVolumen desdePorcentaje(double porcentaje) {
        if (porcentaje >= ALTO.umbralMinimo) {
            return ALTO;
        }
        if (porcentaje >= MEDIO.umbralMinimo) {
            return MEDIO;
        }
        return BAJO;
    }
}
