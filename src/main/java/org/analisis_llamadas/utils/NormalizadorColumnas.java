package org.analisis_llamadas.utils;

import java.text.Normalizer;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;

/**
 * Normalización y búsqueda flexible de nombres de columna.
 *
 * Un nombre normalizado no tiene acentos, está en minúsculas y sólo conserva
 * letras y dígitos: "Categoría Principal" → "categoriaprincipal".
 */
public final class NormalizadorColumnas {

    private NormalizadorColumnas() {}

    public static String normalizar(String nombre) {
        if (nombre == null) {
            return "";
        }

        String descompuesto = Normalizer.normalize(nombre, Normalizer.Form.NFKD);
        String sinAcentos = RegexUtils.MARCAS_DIACRITICAS_PATTERN.matcher(descompuesto).replaceAll("");
        String minusculas = sinAcentos.toLowerCase(Locale.ROOT);

        StringBuilder sb = new StringBuilder(minusculas.length());
        for (int i = 0; i < minusculas.length(); ) {
            int codePoint = minusculas.codePointAt(i);
            if (Character.isLetterOrDigit(codePoint)) {
                sb.appendCodePoint(codePoint);
            }
            i += Character.charCount(codePoint);
        }
        return sb.toString();
    }

    /**
     * Busca las columnas que coinciden con un nombre objetivo.
     * Coinciden si, normalizados, son iguales o uno contiene al otro.
     *
     * @param columnas Nombres originales, en orden
     * @param objetivo Nombre buscado
     * @return Nombres originales coincidentes, en el orden de las columnas
     */
    public static List<String> buscarColumnasCoincidentes(List<String> columnas, String objetivo) {
        if (columnas == null || columnas.isEmpty()) {
            return Collections.emptyList();
        }

        String objetivoNormalizado = normalizar(objetivo);
        List<String> coincidencias = new ArrayList<>();

        for (String columna : columnas) {
            String columnaNormalizada = normalizar(columna);
            if (columnaNormalizada.isEmpty()) {
                continue;
            }

            if (objetivoNormalizado.equals(columnaNormalizada)
                    || columnaNormalizada.contains(objetivoNormalizado)
                    || objetivoNormalizado.contains(columnaNormalizada)) {
                coincidencias.add(columna);
            }
        }

        return coincidencias;
    }

    /**
     * Verifica si el nombre normalizado de la columna contiene alguna de las palabras clave.
     */
    public static boolean contienePalabraClave(String columna, List<String> palabrasClave) {
        String columnaNormalizada = normalizar(columna);
        for (String palabra : palabrasClave) {
            if (columnaNormalizada.contains(palabra)) {
                return true;
            }
        }
        return false;
    }
}
