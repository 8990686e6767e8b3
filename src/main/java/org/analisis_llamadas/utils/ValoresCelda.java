package org.analisis_llamadas.utils;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;

public final class ValoresCelda {

    private static final DateTimeFormatter FORMATO_FECHA_HORA = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private ValoresCelda() {}

    /**
     * Texto recortado de un valor de celda no nulo. Las fechas se escriben
     * como "yyyy-MM-dd HH:mm:ss".
     */
    public static String aTexto(Object valor) {
        if (valor instanceof LocalDateTime) {
            return ((LocalDateTime) valor).format(FORMATO_FECHA_HORA);
        }
        return String.valueOf(valor).trim();
    }
}
