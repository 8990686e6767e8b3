package org.analisis_llamadas.enums;

import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Getter;

/**
 * Impacto de negocio de una categoría general según su porcentaje del total.
 */
@Getter
public enum ImpactoOperativo {
    CRITICO("Crítico - Alto volumen", 30.0),
    IMPORTANTE("Importante - Optimización", 15.0),
    MODERADO("Moderado - Monitoreo", 5.0),
    BAJO("Bajo - Especializado", 0.0);

    @JsonValue
    private final String etiqueta;
    private final double umbralMinimo;

    ImpactoOperativo(String etiqueta, double umbralMinimo) {
        this.etiqueta = etiqueta;
        this.umbralMinimo = umbralMinimo;
    }

    public static ImpactoOperativo desdePorcentaje(double porcentaje) {
        for (ImpactoOperativo impacto : values()) {
            if (porcentaje >= impacto.umbralMinimo) {
                return impacto;
            }
        }
        return BAJO;
    }
}
