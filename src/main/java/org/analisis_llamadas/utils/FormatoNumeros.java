package org.analisis_llamadas.utils;

import java.util.Locale;

/**
 * Formatos numéricos de los reportes. Siempre con Locale.ROOT: separador de
 * miles "," y decimal ".".
 */
public final class FormatoNumeros {

    private FormatoNumeros() {}

    /** 12345 -> "12,345" */
    public static String miles(long valor) {
        return String.format(Locale.ROOT, "%,d", valor);
    }

    /** 12.345 -> "12.3%" */
    public static String porcentaje(double valor) {
        return String.format(Locale.ROOT, "%.1f%%", valor);
    }

    /** 12.345 -> "12.35%" */
    public static String porcentajeDosDecimales(double valor) {
        return String.format(Locale.ROOT, "%.2f%%", valor);
    }

    public static String entero(double valor) {
        return String.format(Locale.ROOT, "%.0f", valor);
    }

    /**
     * Porcentaje de una parte sobre un total, 0 cuando el total es 0.
     */
    public static double porcentajeDe(long parte, long total) {
        return total > 0 ? parte * 100.0 / total : 0.0;
    }
}
