package org.analisis_llamadas.utils;

import java.util.regex.Pattern;

public final class RegexUtils {

    private RegexUtils() {}

    // =============== FECHAS ===============

    /** YYYY-MM-DD seguido de HH:MM:SS con separadores flexibles (espacio, _, T, -, :) */
    public static final Pattern FECHA_CON_HORA_PATTERN =
            Pattern.compile("(\\d{4}-\\d{2}-\\d{2})[ _T-](\\d{2})[-:](\\d{2})[-:](\\d{2})");

    public static final Pattern SOLO_FECHA_PATTERN =
            Pattern.compile("(\\d{4}-\\d{2}-\\d{2})");

    /** Fecha de filtro ingresada por el usuario */
    public static final Pattern FECHA_FILTRO_PATTERN =
            Pattern.compile("^\\d{4}-\\d{2}-\\d{2}$");

    // =============== NORMALIZACIÓN ===============

    public static final Pattern MARCAS_DIACRITICAS_PATTERN = Pattern.compile("\\p{M}+");

    /**
     * Verifica si un texto contiene alguna fecha reconocible por los patrones de fecha.
     */
    public static boolean contieneFecha(String texto) {
        if (texto == null) {
            return false;
        }
        return FECHA_CON_HORA_PATTERN.matcher(texto).find() || SOLO_FECHA_PATTERN.matcher(texto).find();
    }
}
